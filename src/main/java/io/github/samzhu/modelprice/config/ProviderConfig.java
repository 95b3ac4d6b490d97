package io.github.samzhu.modelprice.config;

import java.time.Clock;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.modelprice.document.ProviderType;
import io.github.samzhu.modelprice.provider.PricingProvider;
import io.github.samzhu.modelprice.provider.ProviderRegistry;
import io.github.samzhu.modelprice.provider.UpstreamCatalogClient;
import io.github.samzhu.modelprice.provider.aws.AwsBedrockProvider;
import io.github.samzhu.modelprice.provider.manual.ManualPricingProvider;

/**
 * 定價提供者註冊配置。
 *
 * <p>提供者以明確的程式碼註冊，不使用 classpath 掃描，註冊順序即
 * {@code GET /providers} 與刷新結果的列舉順序：
 * <ol>
 *   <li>AWS Bedrock（{@code model-price.aws-bedrock.enabled}）</li>
 *   <li>{@code model-price.manual.providers} 列出的人工資料提供者，依設定順序</li>
 * </ol>
 *
 * <p>名稱重複或未知的提供者識別碼會讓應用程式啟動失敗。
 */
@Configuration
public class ProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

    @Bean
    public ProviderRegistry providerRegistry(ModelPriceProperties properties,
                                             UpstreamCatalogClient upstreamCatalogClient,
                                             @Qualifier("catalogFetchExecutor") Executor catalogFetchExecutor,
                                             ResourceLoader resourceLoader,
                                             ObjectMapper objectMapper,
                                             Clock clock) {
        ProviderRegistry registry = new ProviderRegistry();

        ModelPriceProperties.AwsBedrockConfig aws = properties.awsBedrock();
        if (aws.enabled()) {
            registry.register(new AwsBedrockProvider(upstreamCatalogClient, catalogFetchExecutor, clock,
                aws.catalogUrl(), aws.foundationModelCatalogUrl()));
        }

        ModelPriceProperties.ManualConfig manual = properties.manual();
        for (String name : manual.providers()) {
            PricingProvider provider = new ManualPricingProvider(ProviderType.fromValue(name.trim()),
                resourceLoader, manual.location(), objectMapper, clock);
            registry.register(provider);
        }

        log.info("Provider registry ready: providers={}",
            registry.all().stream().map(PricingProvider::name).toList());
        return registry;
    }
}
