package io.github.samzhu.modelprice.provider;

import io.github.samzhu.modelprice.document.Pricing;

/**
 * Line-item 分類結果，對應到 {@link io.github.samzhu.modelprice.document.PricingRecord} 的價格欄位。
 */
public enum PriceField {

    INPUT(false, Pricing.Component.INPUT),
    OUTPUT(false, Pricing.Component.OUTPUT),
    BATCH_INPUT(true, Pricing.Component.INPUT),
    BATCH_OUTPUT(true, Pricing.Component.OUTPUT),
    CACHE_READ(false, Pricing.Component.CACHED_INPUT),
    CACHE_WRITE(false, Pricing.Component.CACHED_WRITE),
    /** 無法歸類，整筆忽略 */
    UNCLASSIFIED(false, null);

    private final boolean batch;
    private final Pricing.Component component;

    PriceField(boolean batch, Pricing.Component component) {
        this.batch = batch;
        this.component = component;
    }

    public boolean isBatch() {
        return batch;
    }

    public Pricing.Component component() {
        return component;
    }

    public boolean isClassified() {
        return component != null;
    }
}
