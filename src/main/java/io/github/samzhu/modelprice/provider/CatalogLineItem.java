package io.github.samzhu.modelprice.provider;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * 價目表中單一 SKU 的即時定價項目。
 *
 * @param sku SKU 代碼
 * @param label 原始模型標籤（例如 {@code model} 或 {@code servicename} 屬性）
 * @param usageType 用量類型代碼，例如 {@code USE1-Claude3.5Sonnet-input-tokens}
 * @param description 價格維度的自由文字描述
 * @param price 單價（USD），第一個 term 的第一個價格維度
 */
public record CatalogLineItem(
    String sku,
    String label,
    String usageType,
    String description,
    BigDecimal price
) {

    public CatalogLineItem {
        usageType = usageType == null ? "" : usageType;
        description = description == null ? "" : description;
    }

    /**
     * 用量類型是否包含任一標記（不分大小寫）。
     */
    public boolean usageTypeContains(String... markers) {
        return containsAny(usageType, markers);
    }

    /**
     * 描述是否包含任一標記（不分大小寫）。
     */
    public boolean descriptionContains(String... markers) {
        return containsAny(description, markers);
    }

    private static boolean containsAny(String text, String... markers) {
        String folded = text.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (folded.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
