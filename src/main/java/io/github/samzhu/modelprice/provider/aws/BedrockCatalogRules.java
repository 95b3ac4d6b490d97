package io.github.samzhu.modelprice.provider.aws;

import static io.github.samzhu.modelprice.provider.ClassificationRule.anywhere;
import static io.github.samzhu.modelprice.provider.ClassificationRule.inDescription;
import static io.github.samzhu.modelprice.provider.ClassificationRule.inUsageType;
import static io.github.samzhu.modelprice.provider.ClassificationRule.of;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import io.github.samzhu.modelprice.document.Capability;
import io.github.samzhu.modelprice.provider.CatalogLineItem;
import io.github.samzhu.modelprice.provider.CatalogRules;
import io.github.samzhu.modelprice.provider.LineItemClassifier;
import io.github.samzhu.modelprice.provider.PriceField;

/**
 * AWS Bedrock 兩份價目表的規則表。
 *
 * <p>分類優先順序（兩份價目表相同）：
 * <ol>
 *   <li>排除：非定價產品（Guardrail、Custom Model）與非即時計費（Provisioned Throughput）</li>
 *   <li>批次：先於其他標記判斷，同時比對用量類型與描述</li>
 *   <li>快取讀取 / 快取寫入</li>
 *   <li>輸入 / 輸出</li>
 * </ol>
 *
 * <p>兩者差異：
 * <ul>
 *   <li>{@code AmazonBedrock}：標籤取 {@code model} 屬性，輸入/輸出標記同時比對用量類型與描述</li>
 *   <li>{@code AmazonBedrockFoundationModels}：標籤取 {@code servicename} 並移除
 *       {@code (Amazon Bedrock Edition)} 後綴；輸入只看用量類型，輸出另接受描述中的 {@code Response}；
 *       新建記錄時依名稱關鍵字推導能力</li>
 * </ul>
 */
public final class BedrockCatalogRules {

    public static final String GENERAL_LABEL_ATTRIBUTE = "model";
    public static final String FOUNDATION_MODEL_LABEL_ATTRIBUTE = "servicename";

    static final List<String> VISION_KEYWORDS = List.of("vision", "vl", "image", "stable");
    static final List<String> AUDIO_KEYWORDS = List.of("audio", "sonic", "voxtral");
    static final String EMBEDDING_KEYWORD = "embed";

    private static final Pattern EDITION_SUFFIX = Pattern.compile("\\s*\\(Amazon Bedrock Edition\\)\\s*$");

    private static final Predicate<CatalogLineItem> NON_PRICING_PRODUCT = inUsageType("Guardrail", "CustomModel");
    private static final Predicate<CatalogLineItem> PROVISIONED = inUsageType("ProvisionedThroughput", "Provisioned");
    private static final Predicate<CatalogLineItem> BATCH = anywhere("batch");

    private BedrockCatalogRules() {
        // 工具類不允許實例化
    }

    /**
     * {@code AmazonBedrock} 一般價目表規則。
     */
    public static CatalogRules general(String sourceUrl) {
        Predicate<CatalogLineItem> input = anywhere("input");
        Predicate<CatalogLineItem> output = anywhere("output");
        return new CatalogRules(
            "AmazonBedrock",
            sourceUrl,
            new LineItemClassifier(List.of(
                of("non-pricing-product", NON_PRICING_PRODUCT, PriceField.UNCLASSIFIED),
                of("provisioned-throughput", PROVISIONED, PriceField.UNCLASSIFIED),
                of("batch-input", BATCH.and(input), PriceField.BATCH_INPUT),
                of("batch-output", BATCH.and(output), PriceField.BATCH_OUTPUT),
                of("batch-other", BATCH, PriceField.UNCLASSIFIED),
                of("cache-read", inUsageType("CacheRead").or(inDescription("cache read")), PriceField.CACHE_READ),
                of("cache-write", inUsageType("CacheWrite").or(inDescription("cache write")), PriceField.CACHE_WRITE),
                of("input", input, PriceField.INPUT),
                of("output", output, PriceField.OUTPUT)
            )),
            null,
            null
        );
    }

    /**
     * {@code AmazonBedrockFoundationModels} 價目表規則。
     */
    public static CatalogRules foundationModels(String sourceUrl) {
        Predicate<CatalogLineItem> input = inUsageType("input");
        Predicate<CatalogLineItem> output = inUsageType("output").or(inDescription("response"));
        return new CatalogRules(
            "AmazonBedrockFoundationModels",
            sourceUrl,
            new LineItemClassifier(List.of(
                of("non-pricing-product", NON_PRICING_PRODUCT, PriceField.UNCLASSIFIED),
                of("provisioned-throughput", PROVISIONED, PriceField.UNCLASSIFIED),
                of("batch-input", BATCH.and(input), PriceField.BATCH_INPUT),
                of("batch-output", BATCH.and(output), PriceField.BATCH_OUTPUT),
                of("batch-other", BATCH, PriceField.UNCLASSIFIED),
                of("cache-read", inUsageType("CacheRead").or(inDescription("cache read")), PriceField.CACHE_READ),
                of("cache-write", inUsageType("CacheWrite").or(inDescription("cache write")), PriceField.CACHE_WRITE),
                of("input", input, PriceField.INPUT),
                of("output", output, PriceField.OUTPUT)
            )),
            BedrockCatalogRules::stripEditionSuffix,
            BedrockCatalogRules::inferCapabilities
        );
    }

    /**
     * 移除 Foundation Model 服務名稱的版本後綴。
     *
     * <p>{@code "Claude 3.5 Sonnet (Amazon Bedrock Edition)"} → {@code "Claude 3.5 Sonnet"}
     */
    static String stripEditionSuffix(String serviceName) {
        return EDITION_SUFFIX.matcher(serviceName).replaceFirst("");
    }

    /**
     * 依模型名稱關鍵字推導能力；含 embed 的模型只有 embedding 能力。
     */
    static Set<Capability> inferCapabilities(String modelName) {
        String name = modelName.toLowerCase(Locale.ROOT);
        if (name.contains(EMBEDDING_KEYWORD)) {
            return EnumSet.of(Capability.EMBEDDING);
        }
        Set<Capability> capabilities = EnumSet.of(Capability.TEXT);
        if (VISION_KEYWORDS.stream().anyMatch(name::contains)) {
            capabilities.add(Capability.VISION);
        }
        if (AUDIO_KEYWORDS.stream().anyMatch(name::contains)) {
            capabilities.add(Capability.AUDIO);
        }
        return capabilities;
    }
}
