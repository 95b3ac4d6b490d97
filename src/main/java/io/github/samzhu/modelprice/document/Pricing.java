package io.github.samzhu.modelprice.document;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * 模型的各項單價（USD）。
 *
 * <p>每個欄位獨立可為 {@code null}，{@code null} 表示「未知」，絕不代表免費。
 * 單位沿用上游資料的發佈單位（AWS 價目表為每 1K tokens），人工資料檔使用相同單位。
 *
 * <p>不變條件：所有非 null 的價格都必須 &gt;= 0，違反時建構子拋出
 * {@link IllegalArgumentException}，由呼叫端視為單筆資料解析失敗而略過。
 *
 * @param input 輸入 token 單價
 * @param output 輸出 token 單價
 * @param cachedInput 快取讀取 token 單價
 * @param cachedWrite 快取寫入 token 單價
 * @param reasoning 推理 token 單價
 * @param imageInput 圖片輸入單價
 * @param audioInput 音訊輸入單價
 * @param audioOutput 音訊輸出單價
 * @param embedding Embedding 單價
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Pricing(
    BigDecimal input,
    BigDecimal output,
    BigDecimal cachedInput,
    BigDecimal cachedWrite,
    BigDecimal reasoning,
    BigDecimal imageInput,
    BigDecimal audioInput,
    BigDecimal audioOutput,
    BigDecimal embedding
) {

    public Pricing {
        Stream.of(input, output, cachedInput, cachedWrite, reasoning, imageInput, audioInput, audioOutput, embedding)
            .filter(price -> price != null && price.signum() < 0)
            .findFirst()
            .ifPresent(price -> {
                throw new IllegalArgumentException("Price must not be negative: " + price);
            });
    }

    /**
     * 空白定價（所有欄位皆未知）。
     */
    public static Pricing empty() {
        return new Pricing(null, null, null, null, null, null, null, null, null);
    }

    /**
     * 是否所有欄位皆未知。
     */
    @JsonIgnore
    public boolean isEmpty() {
        return Stream.of(Component.values()).allMatch(component -> component.of(this) == null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 定價欄位列舉，同時作為欄位的存取器，供排序與分類規則共用。
     */
    public enum Component {
        INPUT(Pricing::input),
        OUTPUT(Pricing::output),
        CACHED_INPUT(Pricing::cachedInput),
        CACHED_WRITE(Pricing::cachedWrite),
        REASONING(Pricing::reasoning),
        IMAGE_INPUT(Pricing::imageInput),
        AUDIO_INPUT(Pricing::audioInput),
        AUDIO_OUTPUT(Pricing::audioOutput),
        EMBEDDING(Pricing::embedding);

        private final Function<Pricing, BigDecimal> accessor;

        Component(Function<Pricing, BigDecimal> accessor) {
            this.accessor = accessor;
        }

        /**
         * 取得指定定價中此欄位的值；定價本身為 null 時回傳 null。
         */
        public BigDecimal of(Pricing pricing) {
            return pricing == null ? null : accessor.apply(pricing);
        }
    }

    /**
     * 正規化過程中逐筆累積價格的 Builder。
     *
     * <p>{@link #offer(Component, BigDecimal)} 採「先寫入者優先」：欄位一旦有值，
     * 後續同欄位的價格會被捨棄。
     */
    public static class Builder {
        private final Map<Component, BigDecimal> prices = new EnumMap<>(Component.class);

        /**
         * 嘗試寫入欄位價格。
         *
         * @param component 欄位
         * @param price 價格，必須 &gt;= 0
         * @return 是否實際寫入；欄位已有值時回傳 false
         * @throws IllegalArgumentException 若價格為負數
         */
        public boolean offer(Component component, BigDecimal price) {
            if (price.signum() < 0) {
                throw new IllegalArgumentException("Price must not be negative: " + price);
            }
            return prices.putIfAbsent(component, price) == null;
        }

        public Builder set(Component component, BigDecimal price) {
            if (price != null) {
                offer(component, price);
            }
            return this;
        }

        public boolean isEmpty() {
            return prices.isEmpty();
        }

        public Pricing build() {
            return new Pricing(
                prices.get(Component.INPUT),
                prices.get(Component.OUTPUT),
                prices.get(Component.CACHED_INPUT),
                prices.get(Component.CACHED_WRITE),
                prices.get(Component.REASONING),
                prices.get(Component.IMAGE_INPUT),
                prices.get(Component.AUDIO_INPUT),
                prices.get(Component.AUDIO_OUTPUT),
                prices.get(Component.EMBEDDING)
            );
        }
    }
}
