package io.github.samzhu.modelprice.provider;

import static io.github.samzhu.modelprice.provider.ClassificationRule.inUsageType;
import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.samzhu.modelprice.document.Capability;
import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;

class CatalogNormalizerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final CatalogNormalizer normalizer = new CatalogNormalizer(ProviderType.AWS_BEDROCK);

    private final LineItemClassifier classifier = new LineItemClassifier(List.of(
        ClassificationRule.of("input", inUsageType("input"), PriceField.INPUT),
        ClassificationRule.of("output", inUsageType("output"), PriceField.OUTPUT)
    ));

    @Test
    void shouldMergeItemsWithTheSameDerivedIdAcrossCatalogs() {
        // Given: 兩份價目表以不同寫法的標籤指向同一模型
        Map<String, PricingRecord.Builder> models = new LinkedHashMap<>();
        CatalogRules first = new CatalogRules("first", "https://first", classifier, null, null);
        CatalogRules second = new CatalogRules("second", "https://second", classifier,
            label -> label.replace(" [edition]", ""), label -> EnumSet.of(Capability.VISION));

        // When
        normalizer.apply(List.of(item("a", "Claude Model", "Input", "0.003")), first, models, NOW);
        normalizer.apply(List.of(item("b", "Claude Model [edition]", "Output", "0.015")), second, models, NOW);

        // Then: 第二份價目表不會改寫既有記錄的能力與來源
        assertThat(models).containsOnlyKeys("aws_bedrock:claude-model");
        PricingRecord record = models.get("aws_bedrock:claude-model").build();
        assertThat(record.pricing().input()).isEqualByComparingTo("0.003");
        assertThat(record.pricing().output()).isEqualByComparingTo("0.015");
        assertThat(record.capabilities()).containsExactly(Capability.TEXT);
        assertThat(record.sourceUrl()).isEqualTo("https://first");
    }

    @Test
    void shouldIgnoreUnclassifiedItemsWithoutCreatingRecords() {
        Map<String, PricingRecord.Builder> models = new LinkedHashMap<>();
        CatalogRules rules = new CatalogRules("catalog", "https://catalog", classifier, null, null);

        int written = normalizer.apply(List.of(item("s", "Storage Only", "Storage", "1.0")), rules, models, NOW);

        assertThat(written).isZero();
        assertThat(models).isEmpty();
    }

    @Test
    void shouldDiscardLaterPriceForPopulatedField() {
        Map<String, PricingRecord.Builder> models = new LinkedHashMap<>();
        CatalogRules rules = new CatalogRules("catalog", "https://catalog", classifier, null, null);

        int written = normalizer.apply(List.of(
            item("standard", "Claude Model", "Input", "0.003"),
            item("latency", "Claude Model", "LatencyOptimized-Input", "0.0036")), rules, models, NOW);

        assertThat(written).isEqualTo(1);
        assertThat(models.get("aws_bedrock:claude-model").build().pricing().input()).isEqualByComparingTo("0.003");
    }

    @Test
    void shouldSkipLabelsThatNormalizeToNothing() {
        Map<String, PricingRecord.Builder> models = new LinkedHashMap<>();
        CatalogRules rules = new CatalogRules("catalog", "https://catalog", classifier, label -> "", null);

        normalizer.apply(List.of(item("x", "Claude Model", "Input", "0.003")), rules, models, NOW);

        assertThat(models).isEmpty();
    }

    private static CatalogLineItem item(String sku, String label, String usageType, String price) {
        return new CatalogLineItem(sku, label, usageType, "", new BigDecimal(price));
    }
}
