package io.github.samzhu.modelprice.provider;

import java.util.function.Predicate;

/**
 * 單條分類規則：符合條件的 line-item 歸入 {@code target} 欄位。
 *
 * @param name 規則名稱，用於 debug log
 * @param matches 判斷條件
 * @param target 目標欄位；{@link PriceField#UNCLASSIFIED} 表示命中即停止且忽略此項目
 */
public record ClassificationRule(
    String name,
    Predicate<CatalogLineItem> matches,
    PriceField target
) {

    public static ClassificationRule of(String name, Predicate<CatalogLineItem> matches, PriceField target) {
        return new ClassificationRule(name, matches, target);
    }

    /**
     * 用量類型或描述任一包含標記。
     */
    public static Predicate<CatalogLineItem> anywhere(String... markers) {
        return item -> item.usageTypeContains(markers) || item.descriptionContains(markers);
    }

    public static Predicate<CatalogLineItem> inUsageType(String... markers) {
        return item -> item.usageTypeContains(markers);
    }

    public static Predicate<CatalogLineItem> inDescription(String... markers) {
        return item -> item.descriptionContains(markers);
    }
}
