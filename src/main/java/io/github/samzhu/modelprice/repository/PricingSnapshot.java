package io.github.samzhu.modelprice.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;

/**
 * 統一儲存區的不可變快照。
 *
 * <p>讀取端永遠拿到某一次完整發佈的快照，不會看到寫到一半的記錄集合。
 *
 * @param records 記錄，ID → 記錄
 * @param providerUpdatedAt 各提供者子集合最後被取代的時間
 * @param lastRefresh 最近一次成功刷新的時間，尚未刷新過為 null
 */
public record PricingSnapshot(
    Map<String, PricingRecord> records,
    Map<ProviderType, Instant> providerUpdatedAt,
    Instant lastRefresh
) {

    public PricingSnapshot {
        records = Map.copyOf(records);
        providerUpdatedAt = Map.copyOf(providerUpdatedAt);
    }

    public static PricingSnapshot empty() {
        return new PricingSnapshot(Map.of(), Map.of(), null);
    }

    public Optional<PricingRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public Collection<PricingRecord> all() {
        return records.values();
    }

    public int size() {
        return records.size();
    }

    public long countByProvider(ProviderType provider) {
        return records.values().stream()
            .filter(record -> record.provider() == provider)
            .count();
    }

    public Instant updatedAt(ProviderType provider) {
        return providerUpdatedAt.get(provider);
    }
}
