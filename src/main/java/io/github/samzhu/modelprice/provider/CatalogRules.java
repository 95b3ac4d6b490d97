package io.github.samzhu.modelprice.provider;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import io.github.samzhu.modelprice.document.Capability;

/**
 * 單一價目表的正規化規則組合。
 *
 * <p>同一提供者的多個價目表各自擁有一組規則，由 {@link CatalogNormalizer} 依序套用到共用的記錄表上。
 *
 * @param catalogName 價目表名稱，用於 log
 * @param sourceUrl 價目表 URL，寫入記錄的 {@code sourceUrl}
 * @param classifier 分類規則表，排除規則（如 Guardrail、Provisioned Throughput）應置於最前並指向
 *                   {@link PriceField#UNCLASSIFIED}
 * @param labelNormalizer 標籤在 slug 之前的二次正規化，例如移除版本後綴
 * @param capabilityDefaults 新建記錄時依模型名稱推導的能力集合
 */
public record CatalogRules(
    String catalogName,
    String sourceUrl,
    LineItemClassifier classifier,
    UnaryOperator<String> labelNormalizer,
    Function<String, Set<Capability>> capabilityDefaults
) {

    public CatalogRules {
        if (labelNormalizer == null) {
            labelNormalizer = UnaryOperator.identity();
        }
        if (capabilityDefaults == null) {
            capabilityDefaults = name -> EnumSet.of(Capability.TEXT);
        }
    }
}
