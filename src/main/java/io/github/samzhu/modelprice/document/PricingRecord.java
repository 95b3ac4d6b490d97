package io.github.samzhu.modelprice.document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 正規化後的模型定價記錄，所有提供者共用的統一 schema。
 *
 * <p>設計原則：
 * <ul>
 *   <li>ID 格式：{@code provider:modelId}，在統一儲存區內唯一</li>
 *   <li>{@code modelId} 由顯示名稱推導（見 {@link io.github.samzhu.modelprice.util.ModelIdSlugs}），
 *       同一名稱永遠得到同一 slug</li>
 *   <li>{@code capabilities} 永不為空，預設 {@code {text}}</li>
 *   <li>記錄建立後不可變，只會在下一次刷新時整批被取代</li>
 * </ul>
 *
 * <p>Mongo 集合：{@code model_pricing}（僅在啟用持久化時使用）
 */
@Document(collection = "model_pricing")
public record PricingRecord(
    @Id String id,

    // ========== 識別 ==========
    /** 提供者 */
    @Indexed ProviderType provider,
    /** 正規化後的模型 slug */
    String modelId,
    /** 原始顯示名稱 */
    String modelName,

    // ========== 定價 ==========
    /** 即時（on-demand）定價 */
    Pricing pricing,
    /** 批次（非同步）定價，無批次價格時為 null */
    Pricing batchPricing,
    BillingMode billingMode,
    String currency,

    // ========== 模型屬性 ==========
    Set<Capability> capabilities,
    Integer contextLength,
    Integer maxOutputTokens,

    // ========== 來源 ==========
    RecordSource source,
    String sourceUrl,
    /** 正規化時間 */
    Instant lastUpdated,
    /** 人工資料最後確認日期 */
    String lastVerified,
    String notes
) {

    public static final String CURRENCY_USD = "USD";

    public PricingRecord {
        if (pricing == null) {
            pricing = Pricing.empty();
        }
        if (billingMode == null) {
            billingMode = BillingMode.PER_TOKEN;
        }
        if (currency == null || currency.isBlank()) {
            currency = CURRENCY_USD;
        }
        capabilities = normalizeCapabilities(capabilities);
    }

    /**
     * 組合記錄 ID。
     *
     * @param provider 提供者
     * @param modelId 模型 slug
     * @return {@code provider:modelId}，例如 {@code aws_bedrock:claude-3.5-sonnet}
     */
    public static String createId(ProviderType provider, String modelId) {
        return provider.value() + ":" + modelId;
    }

    /**
     * 取得指定定價欄位的值，供排序與統計使用。
     */
    public BigDecimal price(Pricing.Component component) {
        return component.of(pricing);
    }

    /**
     * 能力集合正規化：空集合回到 {@code {text}}，只要含 embedding 就收斂為 {@code {embedding}}。
     */
    static Set<Capability> normalizeCapabilities(Set<Capability> capabilities) {
        if (capabilities == null || capabilities.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.of(Capability.TEXT));
        }
        if (capabilities.contains(Capability.EMBEDDING)) {
            return Collections.unmodifiableSet(EnumSet.of(Capability.EMBEDDING));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 正規化期間使用的可變 Builder。
     *
     * <p>同一模型可能由多筆 line-item 組成，Builder 會在整個抓取週期內被重複取用，
     * 價格寫入透過 {@link #offer(boolean, Pricing.Component, BigDecimal)} 採先寫入者優先。
     */
    public static class Builder {
        private ProviderType provider;
        private String modelId;
        private String modelName;
        private final Pricing.Builder pricing = Pricing.builder();
        private final Pricing.Builder batchPricing = Pricing.builder();
        private BillingMode billingMode = BillingMode.PER_TOKEN;
        private Set<Capability> capabilities = EnumSet.of(Capability.TEXT);
        private Integer contextLength;
        private Integer maxOutputTokens;
        private RecordSource source = RecordSource.API;
        private String sourceUrl;
        private Instant lastUpdated;
        private String lastVerified;
        private String notes;

        public Builder provider(ProviderType provider) { this.provider = provider; return this; }
        public Builder modelId(String modelId) { this.modelId = modelId; return this; }
        public Builder modelName(String modelName) { this.modelName = modelName; return this; }
        public Builder billingMode(BillingMode billingMode) { this.billingMode = billingMode; return this; }
        public Builder capabilities(Set<Capability> capabilities) { this.capabilities = capabilities; return this; }
        public Builder contextLength(Integer contextLength) { this.contextLength = contextLength; return this; }
        public Builder maxOutputTokens(Integer maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; return this; }
        public Builder source(RecordSource source) { this.source = source; return this; }
        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder lastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; return this; }
        public Builder lastVerified(String lastVerified) { this.lastVerified = lastVerified; return this; }
        public Builder notes(String notes) { this.notes = notes; return this; }

        /**
         * 以完整定價物件填入（人工資料檔使用）。
         */
        public Builder pricing(Pricing source) {
            copy(source, pricing);
            return this;
        }

        public Builder batchPricing(Pricing source) {
            copy(source, batchPricing);
            return this;
        }

        /**
         * 嘗試寫入單一價格欄位，欄位已有值時捨棄。
         *
         * @param batch 是否為批次定價
         * @param component 欄位
         * @param price 價格
         * @return 是否實際寫入
         */
        public boolean offer(boolean batch, Pricing.Component component, BigDecimal price) {
            return (batch ? batchPricing : pricing).offer(component, price);
        }

        public String id() {
            return createId(provider, modelId);
        }

        public PricingRecord build() {
            return new PricingRecord(
                id(), provider, modelId, modelName,
                pricing.build(), batchPricing.isEmpty() ? null : batchPricing.build(),
                billingMode, CURRENCY_USD,
                capabilities, contextLength, maxOutputTokens,
                source, sourceUrl, lastUpdated, lastVerified, notes
            );
        }

        private static void copy(Pricing source, Pricing.Builder target) {
            if (source == null) {
                return;
            }
            for (Pricing.Component component : Pricing.Component.values()) {
                target.set(component, component.of(source));
            }
        }
    }
}
