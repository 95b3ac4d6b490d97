package io.github.samzhu.modelprice.dto.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * 整體統計。
 *
 * <p>用於 GET /api/v1/stats 端點。
 *
 * @param totalModels 記錄總數
 * @param providers 擁有記錄的提供者數
 * @param avgInputPrice 平均輸入單價（僅計入有值者），無資料為 null
 * @param avgOutputPrice 平均輸出單價（僅計入有值者），無資料為 null
 * @param byCapability 能力 → 記錄數
 * @param lastRefresh 最近一次成功刷新時間
 */
public record PricingStats(
    int totalModels,
    int providers,
    BigDecimal avgInputPrice,
    BigDecimal avgOutputPrice,
    Map<String, Long> byCapability,
    Instant lastRefresh
) {}
