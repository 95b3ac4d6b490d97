package io.github.samzhu.modelprice.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置，僅在 {@code model-price.store.persistence=mongo} 時啟用。
 *
 * <p>預設情況下定價快照只存在記憶體中，重新啟動後由啟動刷新重建。啟用後：
 * <ul>
 *   <li>每次提供者刷新成功，將該提供者的記錄鏡像到 {@code model_pricing} 集合</li>
 *   <li>啟動時先從集合還原快照，再執行啟動刷新</li>
 * </ul>
 *
 * <p>連線設定由 {@code application-mongo.yaml} 提供（{@code spring.data.mongodb.uri}）。
 *
 * @see io.github.samzhu.modelprice.repository.MongoPricingArchive
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@ConditionalOnProperty(prefix = "model-price.store", name = "persistence", havingValue = "mongo")
@EnableMongoRepositories(basePackages = "io.github.samzhu.modelprice.repository")
public class MongoConfig {
}
