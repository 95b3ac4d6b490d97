package io.github.samzhu.modelprice.provider;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;
import io.github.samzhu.modelprice.document.RecordSource;
import io.github.samzhu.modelprice.util.ModelIdSlugs;

/**
 * 將 SKU 價目表的 line-item 合併為以模型 ID 為鍵的記錄。
 *
 * <p>處理流程（每筆 line-item）：
 * <ol>
 *   <li>依 {@link CatalogRules#classifier()} 分類；未分類（含排除規則）者忽略</li>
 *   <li>標籤經二次正規化後 slug 化，組成 {@code provider:modelId}</li>
 *   <li>記錄不存在時建立（能力集合只在建立時推導），存在時沿用</li>
 *   <li>寫入價格欄位，先寫入者優先，後到的同欄位價格被捨棄</li>
 * </ol>
 *
 * <p>多個價目表共用同一個 {@code models} 表依序呼叫，處理順序即優先順序。
 */
public class CatalogNormalizer {

    private static final Logger log = LoggerFactory.getLogger(CatalogNormalizer.class);

    private final ProviderType provider;

    public CatalogNormalizer(ProviderType provider) {
        this.provider = provider;
    }

    /**
     * 套用一個價目表。
     *
     * @param items 價目表 line-items，依價目表順序
     * @param rules 此價目表的規則
     * @param models 累積中的記錄表（id → builder），呼叫端應使用保序的 Map
     * @param normalizedAt 本次正規化時間
     * @return 實際寫入的價格筆數
     */
    public int apply(List<CatalogLineItem> items, CatalogRules rules,
                     Map<String, PricingRecord.Builder> models, Instant normalizedAt) {
        int written = 0;
        int ignored = 0;
        int discarded = 0;

        for (CatalogLineItem item : items) {
            PriceField field = rules.classifier().classify(item);
            if (!field.isClassified()) {
                ignored++;
                continue;
            }

            String label = item.label() == null ? "" : rules.labelNormalizer().apply(item.label());
            if (label.isBlank()) {
                log.debug("Skipping line item without model label: catalog={}, sku={}", rules.catalogName(), item.sku());
                ignored++;
                continue;
            }
            String modelId = ModelIdSlugs.slugify(label);
            if (modelId.isEmpty()) {
                log.debug("Skipping line item with unusable label: catalog={}, sku={}, label='{}'",
                    rules.catalogName(), item.sku(), label);
                ignored++;
                continue;
            }

            PricingRecord.Builder model = models.computeIfAbsent(
                PricingRecord.createId(provider, modelId),
                id -> PricingRecord.builder()
                    .provider(provider)
                    .modelId(modelId)
                    .modelName(label)
                    .capabilities(rules.capabilityDefaults().apply(label))
                    .source(RecordSource.API)
                    .sourceUrl(rules.sourceUrl())
                    .lastUpdated(normalizedAt));

            if (model.offer(field.isBatch(), field.component(), item.price())) {
                written++;
            } else {
                discarded++;
                log.debug("Discarding later price for populated field: id={}, field={}, sku={}, price={}",
                    model.id(), field, item.sku(), item.price());
            }
        }

        log.debug("Catalog applied: catalog={}, items={}, written={}, ignored={}, discarded={}",
            rules.catalogName(), items.size(), written, ignored, discarded);
        return written;
    }
}
