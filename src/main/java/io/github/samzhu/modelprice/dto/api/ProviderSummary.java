package io.github.samzhu.modelprice.dto.api;

import java.time.Instant;

/**
 * 提供者摘要。
 *
 * <p>用於 GET /api/v1/providers 端點，每個已註冊的提供者一列。
 *
 * @param name 提供者名稱
 * @param displayName 顯示名稱
 * @param source {@code api} 或 {@code manual}
 * @param modelCount 目前快照中的記錄數
 * @param lastUpdated 子集合最後被取代的時間，尚未刷新為 null
 */
public record ProviderSummary(
    String name,
    String displayName,
    String source,
    long modelCount,
    Instant lastUpdated
) {}
