package io.github.samzhu.modelprice.provider.aws;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.modelprice.provider.CatalogLineItem;

class AwsPriceListParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldExtractLabelUsageTypeDescriptionAndPrice() throws IOException {
        // Given
        JsonNode root = read("catalog/bedrock-general.json");

        // When
        var items = AwsPriceListParser.parse(root, BedrockCatalogRules.GENERAL_LABEL_ATTRIBUTE);

        // Then: 第一筆保留價目表順序
        CatalogLineItem first = items.get(0);
        assertThat(first.sku()).isEqualTo("s1");
        assertThat(first.label()).isEqualTo("Claude Model");
        assertThat(first.usageType()).isEqualTo("USE1-Input-Bytes");
        assertThat(first.description()).isEqualTo("Claude Model input tokens");
        assertThat(first.price()).isEqualByComparingTo("0.003");
    }

    @Test
    void shouldSkipItemsWithoutLabelTermOrParsablePrice() throws IOException {
        JsonNode root = read("catalog/bedrock-general.json");

        var items = AwsPriceListParser.parse(root, BedrockCatalogRules.GENERAL_LABEL_ATTRIBUTE);

        // s10 無標籤、s11 價格格式錯誤、s12 無 OnDemand term
        assertThat(items).extracting(CatalogLineItem::sku)
            .doesNotContain("s10", "s11", "s12")
            .hasSize(10);
    }

    @Test
    void shouldReadLabelFromRequestedAttribute() throws IOException {
        JsonNode root = read("catalog/bedrock-foundation-models.json");

        var items = AwsPriceListParser.parse(root, BedrockCatalogRules.FOUNDATION_MODEL_LABEL_ATTRIBUTE);

        assertThat(items).extracting(CatalogLineItem::label)
            .contains("Claude Model (Amazon Bedrock Edition)", "Nova Sonic (Amazon Bedrock Edition)");
    }

    @Test
    void shouldReturnNothingForCatalogWithoutProducts() throws IOException {
        JsonNode root = objectMapper.readTree("{\"terms\": {}}");

        assertThat(AwsPriceListParser.parse(root, "model")).isEmpty();
    }

    @Test
    void shouldSkipNegativePrices() throws IOException {
        JsonNode root = objectMapper.readTree(
            "{\"products\": {\"n1\": {\"attributes\": {\"model\": \"Odd Model\", \"usagetype\": \"USE1-Input\"}}},"
            + " \"terms\": {\"OnDemand\": {\"n1\": {\"t\": {\"priceDimensions\": {"
            + "\"d\": {\"description\": \"input\", \"pricePerUnit\": {\"USD\": \"-0.5\"}}}}}}}}");

        assertThat(AwsPriceListParser.parse(root, "model")).isEmpty();
    }

    private JsonNode read(String path) throws IOException {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(in);
        }
    }
}
