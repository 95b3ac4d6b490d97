package io.github.samzhu.modelprice.document;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 已知的定價資料提供者識別碼。
 *
 * <p>JSON 與 API 查詢參數使用小寫的 wire value（例如 {@code aws_bedrock}），
 * 新增提供者時只需在此加入一個常數並註冊對應的 {@code PricingProvider}。
 */
public enum ProviderType {

    OPENROUTER("openrouter", "OpenRouter"),
    AZURE_OPENAI("azure_openai", "Azure OpenAI"),
    AWS_BEDROCK("aws_bedrock", "AWS Bedrock"),
    OPENAI("openai", "OpenAI"),
    XAI("xai", "xAI"),
    GOOGLE_VERTEX("google_vertex", "Google Vertex AI");

    private final String value;
    private final String displayName;

    ProviderType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * 依 wire value 解析提供者（不分大小寫）。
     *
     * @param value 提供者識別碼，例如 {@code aws_bedrock}
     * @return 對應的提供者
     * @throws IllegalArgumentException 若識別碼未知
     */
    @JsonCreator
    public static ProviderType fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + value));
    }
}
