package io.github.samzhu.modelprice.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import io.github.samzhu.modelprice.provider.UpstreamCatalogClient;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link ModelPriceProperties} 的型別安全配置綁定，並提供：
 * <ul>
 *   <li>{@link Clock} - 正規化時間來源，測試時可替換為固定時鐘</li>
 *   <li>{@link UpstreamCatalogClient} - 套用 {@code model-price.http} 逾時的上游客戶端</li>
 *   <li>{@code providerFetchExecutor} - 刷新時每個提供者一個任務</li>
 *   <li>{@code catalogFetchExecutor} - 提供者內部並行下載多份價目表</li>
 * </ul>
 *
 * <p>兩個執行緒池分開配置：提供者任務會等待自己送出的價目表下載，
 * 共用同一個池在池滿時會互相等待。
 *
 * @see ModelPriceProperties
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html#features.external-config.typesafe-configuration-properties.enabling-annotated-types">Enabling @ConfigurationProperties</a>
 */
@Configuration
@EnableConfigurationProperties(ModelPriceProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public UpstreamCatalogClient upstreamCatalogClient(RestClient.Builder restClientBuilder,
                                                       ModelPriceProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.http().connectTimeout());
        requestFactory.setReadTimeout(properties.http().readTimeout());
        return new UpstreamCatalogClient(restClientBuilder.requestFactory(requestFactory).build());
    }

    @Bean
    public ThreadPoolTaskExecutor providerFetchExecutor(ModelPriceProperties properties) {
        return executor("provider-fetch-", properties.refresh().poolSize());
    }

    @Bean
    public ThreadPoolTaskExecutor catalogFetchExecutor(ModelPriceProperties properties) {
        return executor("catalog-fetch-", properties.refresh().poolSize());
    }

    private static ThreadPoolTaskExecutor executor(String threadNamePrefix, int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
