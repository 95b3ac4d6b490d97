package io.github.samzhu.modelprice.provider.manual;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import io.github.samzhu.modelprice.document.BillingMode;
import io.github.samzhu.modelprice.document.Capability;
import io.github.samzhu.modelprice.document.Pricing;

/**
 * 人工維護的定價資料檔格式（{@code <provider>.json}）。
 *
 * <pre>
 * {
 *   "provider": "openai",
 *   "source_url": "https://openai.com/api/pricing/",
 *   "last_verified": "2025-01-15",
 *   "models": [
 *     { "model_id": "gpt-4o", "model_name": "GPT-4o",
 *       "pricing": { "input": 0.0025, "output": 0.01 },
 *       "capabilities": ["text", "vision"], "context_length": 128000 }
 *   ]
 * }
 * </pre>
 *
 * <p>{@code models} 不在此綁定：{@link ManualPricingProvider} 逐筆轉換為 {@link ManualModel}，
 * 單一模型格式錯誤時只略過該模型。
 *
 * @param provider 提供者識別碼
 * @param sourceUrl 官方定價頁面
 * @param lastVerified 最後人工確認日期
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManualDataFile(
    String provider,
    String sourceUrl,
    String lastVerified
) {

    /**
     * 資料檔中的單一模型。
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ManualModel(
        String modelId,
        String modelName,
        Pricing pricing,
        Pricing batchPricing,
        BillingMode billingMode,
        List<Capability> capabilities,
        Integer contextLength,
        Integer maxOutputTokens,
        String notes
    ) {}
}
