package io.github.samzhu.modelprice.provider.aws;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.modelprice.document.Capability;
import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;
import io.github.samzhu.modelprice.document.RecordSource;
import io.github.samzhu.modelprice.exception.ProviderFetchException;
import io.github.samzhu.modelprice.provider.UpstreamCatalogClient;

/**
 * AWS Bedrock 提供者測試，以 {@link MockRestServiceServer} 模擬兩份價目表。
 *
 * <p>價目表固定資料位於 {@code src/test/resources/catalog/}。
 */
class AwsBedrockProviderTest {

    private static final String CATALOG_URL = "https://pricing.test/AmazonBedrock/index.json";
    private static final String FM_CATALOG_URL = "https://pricing.test/AmazonBedrockFoundationModels/index.json";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private MockRestServiceServer server;
    private AwsBedrockProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).ignoreExpectOrder(true).build();
        UpstreamCatalogClient client = new UpstreamCatalogClient(builder.build());
        provider = new AwsBedrockProvider(client, Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC),
            CATALOG_URL, FM_CATALOG_URL);
    }

    @Test
    void shouldMergeBothCatalogsIntoOneRecordPerModel() {
        // Given
        expectCatalogs();

        // When
        List<PricingRecord> records = provider.fetch();

        // Then
        server.verify();
        assertThat(records).extracting(PricingRecord::id).containsExactly(
            "aws_bedrock:claude-model",
            "aws_bedrock:titan-text-embeddings-v2",
            "aws_bedrock:pixtral-large-vision",
            "aws_bedrock:cohere-embed-english",
            "aws_bedrock:nova-sonic");
    }

    @Test
    void shouldCombineInputFromGeneralCatalogWithOutputFromFoundationModelCatalog() {
        expectCatalogs();

        PricingRecord claude = byId(provider.fetch()).get("aws_bedrock:claude-model");

        assertThat(claude.provider()).isEqualTo(ProviderType.AWS_BEDROCK);
        assertThat(claude.modelId()).isEqualTo("claude-model");
        assertThat(claude.modelName()).isEqualTo("Claude Model");
        assertThat(claude.pricing().input()).isEqualByComparingTo("0.003");
        assertThat(claude.pricing().output()).isEqualByComparingTo("0.015");
        assertThat(claude.capabilities()).containsExactly(Capability.TEXT);
        assertThat(claude.source()).isEqualTo(RecordSource.API);
        assertThat(claude.sourceUrl()).isEqualTo(CATALOG_URL);
        assertThat(claude.lastUpdated()).isEqualTo(NOW);
    }

    @Test
    void shouldKeepStandardPriceOverLaterLatencyOptimizedAndFoundationModelPrices() {
        expectCatalogs();

        PricingRecord claude = byId(provider.fetch()).get("aws_bedrock:claude-model");

        // 標準 0.003 先出現；延遲最佳化 0.0036 與 FM 價目表的 0.004 都被捨棄
        assertThat(claude.pricing().input()).isEqualByComparingTo("0.003");
    }

    @Test
    void shouldPopulateBatchAndCachePricesAndIgnoreProvisionedAndGuardrailItems() {
        expectCatalogs();

        PricingRecord claude = byId(provider.fetch()).get("aws_bedrock:claude-model");

        assertThat(claude.pricing().cachedInput()).isEqualByComparingTo("0.0003");
        assertThat(claude.pricing().cachedWrite()).isEqualByComparingTo("0.00375");
        assertThat(claude.batchPricing().input()).isEqualByComparingTo("0.0015");
        assertThat(claude.batchPricing().output()).isEqualByComparingTo("0.0075");
        // Provisioned 39.60 不會成為輸出價格，Guardrail 0.75 不會成為輸入價格
        assertThat(claude.pricing().output()).isEqualByComparingTo("0.015");
    }

    @Test
    void shouldInferCapabilitiesOnlyForModelsCreatedByFoundationModelCatalog() {
        expectCatalogs();

        Map<String, PricingRecord> records = byId(provider.fetch());

        assertThat(records.get("aws_bedrock:pixtral-large-vision").capabilities())
            .containsExactlyInAnyOrder(Capability.TEXT, Capability.VISION);
        assertThat(records.get("aws_bedrock:pixtral-large-vision").pricing().output()).isEqualByComparingTo("0.006");
        assertThat(records.get("aws_bedrock:cohere-embed-english").capabilities())
            .containsExactly(Capability.EMBEDDING);
        assertThat(records.get("aws_bedrock:nova-sonic").capabilities())
            .containsExactlyInAnyOrder(Capability.TEXT, Capability.AUDIO);
        assertThat(records.get("aws_bedrock:nova-sonic").sourceUrl()).isEqualTo(FM_CATALOG_URL);
        // 一般價目表不推導能力
        assertThat(records.get("aws_bedrock:titan-text-embeddings-v2").capabilities())
            .containsExactly(Capability.TEXT);
    }

    @Test
    void shouldNotCreateRecordsForUnclassifiedOrUnparsableItems() {
        expectCatalogs();

        Map<String, PricingRecord> records = byId(provider.fetch());

        assertThat(records).doesNotContainKeys(
            "aws_bedrock:broken-model", "aws_bedrock:missing-term-model");
    }

    @Test
    void shouldProduceIdenticalRecordsForIdenticalCatalogs() throws IOException {
        // Given
        JsonNode general = read("catalog/bedrock-general.json");
        JsonNode foundationModels = read("catalog/bedrock-foundation-models.json");

        // When
        List<PricingRecord> first = provider.normalize(general, foundationModels);
        List<PricingRecord> second = provider.normalize(general, foundationModels);

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldFailWhenGeneralCatalogReturnsServerError() {
        server.expect(requestTo(FM_CATALOG_URL))
            .andRespond(withSuccess(new ClassPathResource("catalog/bedrock-foundation-models.json"),
                MediaType.APPLICATION_JSON));
        server.expect(requestTo(CATALOG_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> provider.fetch())
            .isInstanceOf(ProviderFetchException.class)
            .hasMessageContaining("aws_bedrock")
            .hasMessageContaining("HTTP 500");
    }

    @Test
    void shouldFailWhenFoundationModelCatalogReturnsServerError() {
        server.expect(requestTo(FM_CATALOG_URL)).andRespond(withServerError());
        server.expect(requestTo(CATALOG_URL))
            .andRespond(withSuccess(new ClassPathResource("catalog/bedrock-general.json"),
                MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.fetch())
            .isInstanceOf(ProviderFetchException.class)
            .satisfies(e -> assertThat(((ProviderFetchException) e).getProviderName()).isEqualTo("aws_bedrock"));
    }

    @Test
    void shouldFailOnNonObjectBody() {
        server.expect(requestTo(FM_CATALOG_URL))
            .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(CATALOG_URL))
            .andRespond(withSuccess(new ClassPathResource("catalog/bedrock-general.json"),
                MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.fetch()).isInstanceOf(ProviderFetchException.class);
    }

    private void expectCatalogs() {
        server.expect(requestTo(CATALOG_URL))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess(new ClassPathResource("catalog/bedrock-general.json"),
                MediaType.APPLICATION_JSON));
        server.expect(requestTo(FM_CATALOG_URL))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess(new ClassPathResource("catalog/bedrock-foundation-models.json"),
                MediaType.APPLICATION_JSON));
    }

    private static Map<String, PricingRecord> byId(List<PricingRecord> records) {
        return records.stream().collect(Collectors.toMap(PricingRecord::id, Function.identity()));
    }

    private static JsonNode read(String path) throws IOException {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return new ObjectMapper().readTree(in);
        }
    }
}
