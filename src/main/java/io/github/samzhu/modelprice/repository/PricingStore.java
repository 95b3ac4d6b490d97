package io.github.samzhu.modelprice.repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Repository;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;

/**
 * 統一定價儲存區（記憶體）。
 *
 * <p>以不可變的 {@link PricingSnapshot} 保存所有記錄，寫入採 copy-on-write：
 * <ol>
 *   <li>取得受影響提供者的寫入鎖（依列舉順序，避免死結）</li>
 *   <li>以目前快照為基礎，移除這些提供者的舊記錄，加入新記錄</li>
 *   <li>以單一 reference 交換發佈新快照</li>
 *   <li>（選用）鏡像到 {@link PricingArchive}</li>
 * </ol>
 *
 * <p>讀取端只讀 {@link #snapshot()}，不需任何鎖。提供者子集合是整批取代，
 * 上游已不存在的舊記錄會在下次成功刷新時被移除。
 */
@Repository
public class PricingStore {

    private static final Logger log = LoggerFactory.getLogger(PricingStore.class);

    private final AtomicReference<PricingSnapshot> current = new AtomicReference<>(PricingSnapshot.empty());
    private final Map<ProviderType, ReentrantLock> writeLocks = new EnumMap<>(ProviderType.class);
    private final Object publishLock = new Object();
    private final PricingArchive archive;

    public PricingStore(@Nullable PricingArchive archive) {
        this.archive = archive;
        for (ProviderType type : ProviderType.values()) {
            writeLocks.put(type, new ReentrantLock());
        }
        log.info("PricingStore initialized: archive={}", archive != null ? archive.getClass().getSimpleName() : "none");
    }

    /**
     * 取得目前發佈中的快照。
     */
    public PricingSnapshot snapshot() {
        return current.get();
    }

    /**
     * 以新記錄整批取代單一提供者的子集合。
     *
     * @param provider 提供者
     * @param records 該提供者本次的全部記錄
     * @param refreshedAt 刷新時間
     * @throws IllegalArgumentException 若有記錄不屬於此提供者
     */
    public void replaceProvider(ProviderType provider, List<PricingRecord> records, Instant refreshedAt) {
        replaceProviders(Map.of(provider, records), refreshedAt);
    }

    /**
     * 以單次發佈取代多個提供者的子集合。
     *
     * <p>全部驗證通過才會發佈；任一批次不合法時整個呼叫失敗，快照不變。
     *
     * @param batches 提供者 → 該提供者本次的全部記錄
     * @param refreshedAt 刷新時間
     * @throws IllegalArgumentException 若有記錄不屬於其所在批次的提供者
     */
    public void replaceProviders(Map<ProviderType, List<PricingRecord>> batches, Instant refreshedAt) {
        if (batches.isEmpty()) {
            return;
        }
        Map<ProviderType, Map<String, PricingRecord>> validated = validate(batches);
        List<ReentrantLock> locks = lockInOrder(validated.keySet());
        try {
            publish(validated, refreshedAt, true);
            mirror(validated);
        } finally {
            locks.forEach(ReentrantLock::unlock);
        }
    }

    /**
     * 由持久層還原記錄，不觸發鏡像，也不更新最近刷新時間。
     *
     * @param records 已持久化的記錄
     */
    public void restore(List<PricingRecord> records) {
        Map<ProviderType, List<PricingRecord>> grouped = records.stream()
            .collect(Collectors.groupingBy(PricingRecord::provider, LinkedHashMap::new, Collectors.toList()));
        if (grouped.isEmpty()) {
            return;
        }
        Map<ProviderType, Map<String, PricingRecord>> validated = validate(grouped);
        List<ReentrantLock> locks = lockInOrder(validated.keySet());
        try {
            publish(validated, null, false);
        } finally {
            locks.forEach(ReentrantLock::unlock);
        }
        log.info("Pricing store restored: {} records from {} providers", records.size(), grouped.size());
    }

    private Map<ProviderType, Map<String, PricingRecord>> validate(Map<ProviderType, List<PricingRecord>> batches) {
        Map<ProviderType, Map<String, PricingRecord>> validated = new EnumMap<>(ProviderType.class);
        for (Map.Entry<ProviderType, List<PricingRecord>> entry : batches.entrySet()) {
            Map<String, PricingRecord> byId = new LinkedHashMap<>();
            for (PricingRecord record : entry.getValue()) {
                if (record.provider() != entry.getKey()) {
                    throw new IllegalArgumentException(String.format(
                        "Record %s does not belong to provider %s", record.id(), entry.getKey().value()));
                }
                // 同一批次內重複 ID：後者取代前者
                byId.put(record.id(), record);
            }
            validated.put(entry.getKey(), byId);
        }
        return validated;
    }

    private List<ReentrantLock> lockInOrder(Set<ProviderType> providers) {
        List<ReentrantLock> acquired = new ArrayList<>();
        // EnumMap 依列舉順序迭代
        for (Map.Entry<ProviderType, ReentrantLock> entry : writeLocks.entrySet()) {
            if (providers.contains(entry.getKey())) {
                entry.getValue().lock();
                acquired.add(entry.getValue());
            }
        }
        return acquired;
    }

    private void publish(Map<ProviderType, Map<String, PricingRecord>> batches, Instant refreshedAt, boolean refresh) {
        synchronized (publishLock) {
            PricingSnapshot previous = current.get();

            Map<String, PricingRecord> next = new HashMap<>();
            for (PricingRecord record : previous.all()) {
                if (!batches.containsKey(record.provider())) {
                    next.put(record.id(), record);
                }
            }
            batches.values().forEach(next::putAll);

            Map<ProviderType, Instant> updatedAt = new HashMap<>(previous.providerUpdatedAt());
            for (ProviderType provider : batches.keySet()) {
                Instant providerTime = refresh ? refreshedAt : latestUpdate(batches.get(provider));
                if (providerTime != null) {
                    updatedAt.put(provider, providerTime);
                }
            }

            Instant lastRefresh = refresh ? refreshedAt : previous.lastRefresh();
            current.set(new PricingSnapshot(next, updatedAt, lastRefresh));

            log.info("Pricing snapshot published: providers={}, records {} -> {}",
                batches.keySet().stream().map(ProviderType::value).toList(), previous.size(), next.size());
        }
    }

    private void mirror(Map<ProviderType, Map<String, PricingRecord>> batches) {
        if (archive == null) {
            return;
        }
        for (Map.Entry<ProviderType, Map<String, PricingRecord>> entry : batches.entrySet()) {
            try {
                archive.mirror(entry.getKey(), List.copyOf(entry.getValue().values()));
            } catch (RuntimeException e) {
                // 鏡像失敗不回滾記憶體快照
                log.error("Failed to mirror pricing for provider {}: {}", entry.getKey().value(), e.getMessage(), e);
            }
        }
    }

    private static Instant latestUpdate(Map<String, PricingRecord> records) {
        return records.values().stream()
            .map(PricingRecord::lastUpdated)
            .filter(Objects::nonNull)
            .max(Instant::compareTo)
            .orElse(null);
    }
}
