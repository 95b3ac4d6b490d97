package io.github.samzhu.modelprice.dto.api;

import java.time.Instant;

/**
 * 健康檢查回應。
 */
public record HealthResponse(
    String status,
    int modelsCount,
    Instant lastRefresh
) {}
