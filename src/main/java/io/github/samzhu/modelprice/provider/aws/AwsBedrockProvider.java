package io.github.samzhu.modelprice.provider.aws;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;
import io.github.samzhu.modelprice.exception.ProviderFetchException;
import io.github.samzhu.modelprice.provider.CatalogNormalizer;
import io.github.samzhu.modelprice.provider.CatalogRules;
import io.github.samzhu.modelprice.provider.PricingProvider;
import io.github.samzhu.modelprice.provider.UpstreamCatalogClient;

/**
 * AWS Bedrock 定價提供者。
 *
 * <p>資料來源為兩份公開的 AWS Price List（無需認證）：
 * <ul>
 *   <li>{@code AmazonBedrock} - 一般 Bedrock 價目表，標籤在 {@code model} 屬性</li>
 *   <li>{@code AmazonBedrockFoundationModels} - 第三方基礎模型價目表，標籤在 {@code servicename}</li>
 * </ul>
 *
 * <p>兩份價目表並行下載，之後依序套用（一般價目表在前），以推導出的模型 ID 合併為一組記錄。
 * 任一份下載失敗即視為整個提供者失敗。
 *
 * @see BedrockCatalogRules
 * @see <a href="https://docs.aws.amazon.com/awsaccountbilling/latest/aboutv2/using-ppslong.html">AWS Price List</a>
 */
public class AwsBedrockProvider implements PricingProvider {

    private static final Logger log = LoggerFactory.getLogger(AwsBedrockProvider.class);

    private final UpstreamCatalogClient client;
    private final Executor executor;
    private final Clock clock;
    private final String catalogUrl;
    private final String foundationModelCatalogUrl;
    private final CatalogNormalizer normalizer = new CatalogNormalizer(ProviderType.AWS_BEDROCK);

    public AwsBedrockProvider(UpstreamCatalogClient client, Executor executor, Clock clock,
                              String catalogUrl, String foundationModelCatalogUrl) {
        this.client = client;
        this.executor = executor;
        this.clock = clock;
        this.catalogUrl = catalogUrl;
        this.foundationModelCatalogUrl = foundationModelCatalogUrl;
    }

    @Override
    public ProviderType type() {
        return ProviderType.AWS_BEDROCK;
    }

    @Override
    public List<PricingRecord> fetch() {
        CompletableFuture<JsonNode> foundationModels = CompletableFuture.supplyAsync(
            () -> client.getJson(name(), foundationModelCatalogUrl), executor);

        JsonNode general;
        try {
            general = client.getJson(name(), catalogUrl);
        } catch (RuntimeException e) {
            foundationModels.cancel(true);
            throw e;
        }

        return normalize(general, await(foundationModels));
    }

    /**
     * 將兩份價目表正規化為記錄。
     *
     * <p>純函式：相同的兩份輸入（與相同的時鐘）永遠得到相同結果。
     *
     * @param general {@code AmazonBedrock} 價目表
     * @param foundationModels {@code AmazonBedrockFoundationModels} 價目表
     * @return 以 ID 去重的記錄，依首次出現順序
     */
    public List<PricingRecord> normalize(JsonNode general, JsonNode foundationModels) {
        Instant now = clock.instant();
        Map<String, PricingRecord.Builder> models = new LinkedHashMap<>();

        CatalogRules generalRules = BedrockCatalogRules.general(catalogUrl);
        normalizer.apply(
            AwsPriceListParser.parse(general, BedrockCatalogRules.GENERAL_LABEL_ATTRIBUTE),
            generalRules, models, now);

        CatalogRules fmRules = BedrockCatalogRules.foundationModels(foundationModelCatalogUrl);
        normalizer.apply(
            AwsPriceListParser.parse(foundationModels, BedrockCatalogRules.FOUNDATION_MODEL_LABEL_ATTRIBUTE),
            fmRules, models, now);

        List<PricingRecord> records = models.values().stream()
            .map(PricingRecord.Builder::build)
            .toList();
        log.info("AWS Bedrock catalogs normalized: {} models", records.size());
        return records;
    }

    private JsonNode await(CompletableFuture<JsonNode> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new ProviderFetchException(name(), String.valueOf(e.getCause()), e.getCause());
        } catch (CancellationException e) {
            throw new ProviderFetchException(name(), "Foundation model catalog download cancelled", e);
        }
    }
}
