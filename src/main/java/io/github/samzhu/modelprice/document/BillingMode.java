package io.github.samzhu.modelprice.document;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 計費方式。
 */
public enum BillingMode {

    PER_TOKEN("per_token"),
    PER_IMAGE("per_image"),
    PER_REQUEST("per_request");

    private final String value;

    BillingMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static BillingMode fromValue(String value) {
        return Arrays.stream(values())
            .filter(mode -> mode.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown billing mode: " + value));
    }
}
