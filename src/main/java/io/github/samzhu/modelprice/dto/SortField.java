package io.github.samzhu.modelprice.dto;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import io.github.samzhu.modelprice.document.Pricing;
import io.github.samzhu.modelprice.document.PricingRecord;

/**
 * 可排序的欄位。
 *
 * <p>每個欄位有一個主要名稱與若干別名（別名沿用前端既有的 {@code cost_*} 命名）。
 */
public enum SortField {

    MODEL_NAME(by(record -> record.modelName() == null ? null : record.modelName().toLowerCase(Locale.ROOT)),
        "model_name", "name"),
    INPUT(price(Pricing.Component.INPUT), "input", "cost_input"),
    OUTPUT(price(Pricing.Component.OUTPUT), "output", "cost_output"),
    CACHED_INPUT(price(Pricing.Component.CACHED_INPUT), "cached_input", "cost_cache_read"),
    CACHED_WRITE(price(Pricing.Component.CACHED_WRITE), "cached_write", "cost_cache_write"),
    REASONING(price(Pricing.Component.REASONING), "reasoning", "cost_reasoning"),
    IMAGE_INPUT(price(Pricing.Component.IMAGE_INPUT), "image_input", "cost_image_input"),
    AUDIO_INPUT(price(Pricing.Component.AUDIO_INPUT), "audio_input", "cost_audio_input"),
    AUDIO_OUTPUT(price(Pricing.Component.AUDIO_OUTPUT), "audio_output", "cost_audio_output"),
    EMBEDDING(price(Pricing.Component.EMBEDDING), "embedding", "cost_embedding"),
    CONTEXT_LENGTH(by(PricingRecord::contextLength), "context_length", "context_limit");

    private final KeyOrder order;
    private final List<String> names;

    SortField(KeyOrder order, String... names) {
        this.order = order;
        this.names = List.of(names);
    }

    /**
     * 依此欄位排序的比較器；值未知（null）的記錄不論方向一律排最後。
     *
     * @param descending 是否遞減
     */
    public Comparator<PricingRecord> comparator(boolean descending) {
        return order.comparator(descending);
    }

    public String value() {
        return names.get(0);
    }

    /**
     * 依名稱或別名解析（不分大小寫）。
     *
     * @throws IllegalArgumentException 名稱未知
     */
    public static SortField fromValue(String value) {
        return Arrays.stream(values())
            .filter(field -> field.names.stream().anyMatch(name -> name.equalsIgnoreCase(value)))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown sort field: " + value));
    }

    private static KeyOrder price(Pricing.Component component) {
        return by(record -> record.price(component));
    }

    private static <T extends Comparable<? super T>> KeyOrder by(Function<PricingRecord, T> key) {
        return descending -> Comparator.comparing(key,
            Comparator.nullsLast(descending ? Comparator.<T>reverseOrder() : Comparator.<T>naturalOrder()));
    }

    @FunctionalInterface
    private interface KeyOrder {
        Comparator<PricingRecord> comparator(boolean descending);
    }
}
