package io.github.samzhu.modelprice.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;

/**
 * 定價記錄資料存取介面。
 *
 * <p>提供對 {@code model_pricing} 集合的 CRUD 操作，只在
 * {@code model-price.store.persistence=mongo} 時啟用，寫入由 {@link MongoPricingArchive} 執行。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface PricingRecordRepository extends MongoRepository<PricingRecord, String> {

    /**
     * 刪除某提供者的所有記錄。
     *
     * @return 刪除筆數
     */
    long deleteByProvider(ProviderType provider);
}
