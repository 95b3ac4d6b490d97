package io.github.samzhu.modelprice.provider;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 以有序規則表將 line-item 分類為價格欄位。
 *
 * <p>規則依序評估，第一條命中者決定結果；沒有規則命中時為 {@link PriceField#UNCLASSIFIED}。
 * 優先順序以資料（規則表）表達而非巢狀條件，新的提供者只需組合自己的規則表。
 */
public class LineItemClassifier {

    private static final Logger log = LoggerFactory.getLogger(LineItemClassifier.class);

    private final List<ClassificationRule> rules;

    public LineItemClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * 分類單筆 line-item。
     *
     * @param item line-item
     * @return 命中的欄位，未命中時為 {@link PriceField#UNCLASSIFIED}
     */
    public PriceField classify(CatalogLineItem item) {
        for (ClassificationRule rule : rules) {
            if (rule.matches().test(item)) {
                log.trace("Line item classified: sku={}, rule={}, field={}", item.sku(), rule.name(), rule.target());
                return rule.target();
            }
        }
        return PriceField.UNCLASSIFIED;
    }

    public List<ClassificationRule> rules() {
        return rules;
    }
}
