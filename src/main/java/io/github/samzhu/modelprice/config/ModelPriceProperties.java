package io.github.samzhu.modelprice.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Model Price 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link HttpConfig} - 上游價目表的連線與讀取逾時</li>
 *   <li>{@link RefreshConfig} - 啟動刷新、定時刷新與並行度</li>
 *   <li>{@link AwsBedrockConfig} - AWS Bedrock 兩份價目表的 URL</li>
 *   <li>{@link ManualConfig} - 人工資料檔的提供者與位置</li>
 *   <li>{@link StoreConfig} - 快照持久化方式</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * model-price:
 *   http:
 *     connect-timeout: 10s
 *     read-timeout: 60s
 *   refresh:
 *     on-startup: true
 *     cron: "0 0 * * * *"
 *     pool-size: 4
 *   aws-bedrock:
 *     enabled: true
 *   manual:
 *     providers: [openai, xai]
 *     location: classpath:data/manual/
 *   store:
 *     persistence: none
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@Validated
@ConfigurationProperties(prefix = "model-price")
public record ModelPriceProperties(
    HttpConfig http,
    RefreshConfig refresh,
    AwsBedrockConfig awsBedrock,
    ManualConfig manual,
    StoreConfig store
) {

    public ModelPriceProperties {
        if (http == null) {
            http = HttpConfig.defaults();
        }
        if (refresh == null) {
            refresh = RefreshConfig.defaults();
        }
        if (awsBedrock == null) {
            awsBedrock = AwsBedrockConfig.defaults();
        }
        if (manual == null) {
            manual = ManualConfig.defaults();
        }
        if (store == null) {
            store = StoreConfig.defaults();
        }
    }

    /**
     * 上游 HTTP 逾時設定，是整個系統唯一的逾時預算。
     *
     * @param connectTimeout 連線逾時，預設 10 秒
     * @param readTimeout 讀取逾時，預設 60 秒（AWS 價目表約數十 MB）
     */
    public record HttpConfig(
        Duration connectTimeout,
        Duration readTimeout
    ) {
        public HttpConfig {
            if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
                connectTimeout = Duration.ofSeconds(10);
            }
            if (readTimeout == null || readTimeout.isNegative() || readTimeout.isZero()) {
                readTimeout = Duration.ofSeconds(60);
            }
        }

        public static HttpConfig defaults() {
            return new HttpConfig(null, null);
        }
    }

    /**
     * 刷新設定。
     *
     * @param onStartup 應用程式就緒後是否執行一次全系統刷新，預設 true
     * @param cron 定時全系統刷新的 Cron 表達式，預設 {@code -}（停用）
     * @param poolSize 並行抓取的執行緒數，預設 4
     */
    public record RefreshConfig(
        Boolean onStartup,
        String cron,
        int poolSize
    ) {
        public RefreshConfig {
            if (onStartup == null) {
                onStartup = Boolean.TRUE;
            }
            if (cron == null || cron.isBlank()) {
                cron = "-";
            }
            if (poolSize <= 0) {
                poolSize = 4;
            }
        }

        public static RefreshConfig defaults() {
            return new RefreshConfig(null, null, 0);
        }
    }

    /**
     * AWS Bedrock 價目表設定。
     *
     * @param enabled 是否註冊此提供者，預設 true
     * @param catalogUrl {@code AmazonBedrock} 價目表
     * @param foundationModelCatalogUrl {@code AmazonBedrockFoundationModels} 價目表
     */
    public record AwsBedrockConfig(
        Boolean enabled,
        @NotBlank String catalogUrl,
        @NotBlank String foundationModelCatalogUrl
    ) {
        public static final String DEFAULT_CATALOG_URL =
            "https://pricing.us-east-1.amazonaws.com/offers/v1.0/aws/AmazonBedrock/current/us-east-1/index.json";
        public static final String DEFAULT_FOUNDATION_MODEL_CATALOG_URL =
            "https://pricing.us-east-1.amazonaws.com/offers/v1.0/aws/AmazonBedrockFoundationModels/current/us-east-1/index.json";

        public AwsBedrockConfig {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (catalogUrl == null || catalogUrl.isBlank()) {
                catalogUrl = DEFAULT_CATALOG_URL;
            }
            if (foundationModelCatalogUrl == null || foundationModelCatalogUrl.isBlank()) {
                foundationModelCatalogUrl = DEFAULT_FOUNDATION_MODEL_CATALOG_URL;
            }
        }

        public static AwsBedrockConfig defaults() {
            return new AwsBedrockConfig(null, null, null);
        }
    }

    /**
     * 人工資料檔設定。
     *
     * @param providers 以資料檔提供的提供者識別碼，依此順序註冊
     * @param location 資料檔目錄（Spring resource 位置），檔名為 {@code <provider>.json}
     */
    public record ManualConfig(
        List<String> providers,
        String location
    ) {
        public ManualConfig {
            if (providers == null) {
                providers = List.of();
            }
            if (location == null || location.isBlank()) {
                location = "classpath:data/manual/";
            }
        }

        public static ManualConfig defaults() {
            return new ManualConfig(null, null);
        }
    }

    /**
     * 儲存設定。
     *
     * @param persistence {@code none}（僅記憶體）或 {@code mongo}（鏡像到 MongoDB 並於啟動時還原）
     */
    public record StoreConfig(
        String persistence
    ) {
        public StoreConfig {
            if (persistence == null || persistence.isBlank()) {
                persistence = "none";
            }
        }

        public boolean isMongo() {
            return "mongo".equalsIgnoreCase(persistence);
        }

        public static StoreConfig defaults() {
            return new StoreConfig(null);
        }
    }
}
