package io.github.samzhu.modelprice.repository;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;

/**
 * MongoDB 鏡像實作。
 *
 * <p>寫入方式為 delete-by-provider 後 insert，確保上游已下架的模型不會殘留。
 * 同一提供者的呼叫已由 {@link PricingStore} 依提供者序列化。
 */
@Component
@ConditionalOnProperty(prefix = "model-price.store", name = "persistence", havingValue = "mongo")
public class MongoPricingArchive implements PricingArchive {

    private static final Logger log = LoggerFactory.getLogger(MongoPricingArchive.class);

    private final PricingRecordRepository repository;

    public MongoPricingArchive(PricingRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public void mirror(ProviderType provider, List<PricingRecord> records) {
        long startTime = System.currentTimeMillis();
        long deleted = repository.deleteByProvider(provider);
        repository.saveAll(records);
        log.info("Pricing mirrored to MongoDB: provider={}, deleted={}, inserted={}, {}ms",
            provider.value(), deleted, records.size(), System.currentTimeMillis() - startTime);
    }

    @Override
    public List<PricingRecord> loadAll() {
        List<PricingRecord> records = repository.findAll();
        log.info("Loaded {} pricing records from MongoDB", records.size());
        return records;
    }
}
