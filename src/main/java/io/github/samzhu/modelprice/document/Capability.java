package io.github.samzhu.modelprice.document;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 模型能力（模態）標籤。
 */
public enum Capability {

    TEXT("text"),
    VISION("vision"),
    AUDIO("audio"),
    EMBEDDING("embedding"),
    IMAGE_GENERATION("image_generation");

    private final String value;

    Capability(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Capability fromValue(String value) {
        return Arrays.stream(values())
            .filter(capability -> capability.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + value));
    }
}
