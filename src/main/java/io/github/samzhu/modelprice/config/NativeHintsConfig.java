package io.github.samzhu.modelprice.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.modelprice.document.Pricing;
import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.dto.api.ErrorResponse;
import io.github.samzhu.modelprice.dto.api.HealthResponse;
import io.github.samzhu.modelprice.dto.api.PricingStats;
import io.github.samzhu.modelprice.dto.api.ProviderSummary;
import io.github.samzhu.modelprice.dto.api.RefreshResult;
import io.github.samzhu.modelprice.provider.manual.ManualDataFile;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>Native Image 在編譯時期進行靜態分析，無法偵測 Jackson 透過反射存取的 record。
 * 需要註冊的類別：
 * <ul>
 *   <li>{@link ManualDataFile} - 人工資料檔，經 {@code treeToValue} 反序列化</li>
 *   <li>{@link PricingRecord}、{@link Pricing} - API 回應與 MongoDB 鏡像文件</li>
 *   <li>{@code dto.api} 下的回應記錄</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 * @see <a href="https://www.graalvm.org/latest/reference-manual/native-image/metadata/">GraalVM Reachability Metadata</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.ModelPriceRuntimeHints.class)
public class NativeHintsConfig {

    static class ModelPriceRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // 人工資料檔
            hints.reflection()
                .registerType(ManualDataFile.class, MemberCategory.values())
                .registerType(ManualDataFile.ManualModel.class, MemberCategory.values());

            // 統一記錄
            hints.reflection()
                .registerType(PricingRecord.class, MemberCategory.values())
                .registerType(Pricing.class, MemberCategory.values());

            // API 回應
            hints.reflection()
                .registerType(RefreshResult.class, MemberCategory.values())
                .registerType(RefreshResult.ProviderSyncResult.class, MemberCategory.values())
                .registerType(ProviderSummary.class, MemberCategory.values())
                .registerType(PricingStats.class, MemberCategory.values())
                .registerType(HealthResponse.class, MemberCategory.values())
                .registerType(ErrorResponse.class, MemberCategory.values());

            // 內建資料檔
            hints.resources().registerPattern("data/manual/*.json");
        }
    }
}
