package io.github.samzhu.modelprice.provider.aws;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.modelprice.provider.CatalogLineItem;

/**
 * AWS Price List (offer file) 解析器。
 *
 * <p>價目表結構：
 * <pre>
 * {
 *   "products": { "&lt;sku&gt;": { "attributes": { "model": ..., "usagetype": ... } } },
 *   "terms": { "OnDemand": { "&lt;sku&gt;": { "&lt;term&gt;": {
 *       "priceDimensions": { "&lt;dim&gt;": { "description": ..., "pricePerUnit": { "USD": "0.003" } } }
 *   } } } }
 * }
 * </pre>
 *
 * <p>即時定價視為單一級距：只取第一個 term 的第一個價格維度。
 * 只讀取 {@code OnDemand} terms，Reserved 等其他計費方式不會出現在結果中。
 * 格式錯誤、缺少價格或價格為負的 SKU 會被略過（best-effort），不拋出例外。
 */
public final class AwsPriceListParser {

    private static final Logger log = LoggerFactory.getLogger(AwsPriceListParser.class);

    private AwsPriceListParser() {
        // 工具類不允許實例化
    }

    /**
     * 解析價目表為 line-items，保留價目表中的 SKU 順序。
     *
     * @param root 價目表 JSON 根節點
     * @param labelAttribute 模型標籤所在的屬性名稱（{@code model} 或 {@code servicename}）
     * @return 可用的 line-items
     */
    public static List<CatalogLineItem> parse(JsonNode root, String labelAttribute) {
        JsonNode products = root.path("products");
        JsonNode onDemand = root.path("terms").path("OnDemand");
        List<CatalogLineItem> items = new ArrayList<>();
        int skipped = 0;

        Iterator<Map.Entry<String, JsonNode>> it = products.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            CatalogLineItem item = parseProduct(entry.getKey(), entry.getValue(), onDemand, labelAttribute);
            if (item == null) {
                skipped++;
            } else {
                items.add(item);
            }
        }

        log.debug("Price list parsed: labelAttribute={}, items={}, skipped={}", labelAttribute, items.size(), skipped);
        return items;
    }

    private static CatalogLineItem parseProduct(String sku, JsonNode product, JsonNode onDemand, String labelAttribute) {
        try {
            JsonNode attributes = product.path("attributes");
            String label = attributes.path(labelAttribute).asText("");
            if (label.isBlank()) {
                return null;
            }

            JsonNode term = first(onDemand.path(sku));
            if (term == null) {
                log.debug("Skipping SKU without on-demand term: sku={}", sku);
                return null;
            }
            JsonNode dimension = first(term.path("priceDimensions"));
            if (dimension == null) {
                log.debug("Skipping SKU without price dimension: sku={}", sku);
                return null;
            }

            JsonNode usd = dimension.path("pricePerUnit").path("USD");
            if (!usd.isTextual() && !usd.isNumber()) {
                log.debug("Skipping SKU without USD price: sku={}", sku);
                return null;
            }
            BigDecimal price = new BigDecimal(usd.asText().trim());
            if (price.signum() < 0) {
                log.debug("Skipping SKU with negative price: sku={}, price={}", sku, price);
                return null;
            }

            return new CatalogLineItem(
                sku,
                label,
                attributes.path("usagetype").asText(""),
                dimension.path("description").asText(""),
                price
            );
        } catch (NumberFormatException e) {
            log.debug("Skipping SKU with malformed price: sku={}, error={}", sku, e.getMessage());
            return null;
        }
    }

    private static JsonNode first(JsonNode container) {
        if (container == null || !container.isObject() || container.isEmpty()) {
            return null;
        }
        return container.elements().next();
    }
}
