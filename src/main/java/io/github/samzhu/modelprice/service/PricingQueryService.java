package io.github.samzhu.modelprice.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Service;

import io.github.samzhu.modelprice.document.Capability;
import io.github.samzhu.modelprice.document.Pricing;
import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.dto.PricingQuery;
import io.github.samzhu.modelprice.dto.SortField;
import io.github.samzhu.modelprice.dto.api.HealthResponse;
import io.github.samzhu.modelprice.dto.api.PricingStats;
import io.github.samzhu.modelprice.dto.api.ProviderSummary;
import io.github.samzhu.modelprice.exception.ModelNotFoundException;
import io.github.samzhu.modelprice.provider.ProviderRegistry;
import io.github.samzhu.modelprice.repository.PricingSnapshot;
import io.github.samzhu.modelprice.repository.PricingStore;

/**
 * 定價查詢服務（讀取路徑）。
 *
 * <p>每次查詢只讀取一次 {@link PricingStore#snapshot()}，整個查詢都基於同一份快照，
 * 不會看到刷新進行中的半成品。
 *
 * <p>排序規則：
 * <ul>
 *   <li>依 {@link SortField} 取得排序鍵，升冪或降冪</li>
 *   <li>值未知（null）的記錄在兩種方向都排在最後</li>
 *   <li>同值時依 {@code id} 升冪，確保結果順序穩定</li>
 * </ul>
 */
@Service
public class PricingQueryService {

    static final int AVERAGE_SCALE = 6;
    static final String STATUS_HEALTHY = "healthy";

    private final PricingStore store;
    private final ProviderRegistry registry;

    public PricingQueryService(PricingStore store, ProviderRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    /**
     * 依條件查詢記錄。
     *
     * @param query 篩選與排序條件
     * @return 排序後的記錄
     */
    public List<PricingRecord> getAll(PricingQuery query) {
        String search = query.search() == null ? null : query.search().toLowerCase(Locale.ROOT);
        return store.snapshot().all().stream()
            .filter(record -> query.provider() == null || record.provider() == query.provider())
            .filter(record -> query.capability() == null || record.capabilities().contains(query.capability()))
            .filter(record -> search == null || matchesName(record, search))
            .sorted(comparator(query.sortBy(), query.descending()))
            .toList();
    }

    /**
     * 依 ID 取得單一記錄。
     *
     * @param id 記錄 ID，格式 {@code provider:modelId}
     * @throws ModelNotFoundException 記錄不存在
     */
    public PricingRecord getById(String id) {
        return store.snapshot().findById(id)
            .orElseThrow(() -> new ModelNotFoundException(id));
    }

    /**
     * 每個已註冊提供者一列摘要，依註冊順序；尚未刷新的提供者記錄數為 0。
     */
    public List<ProviderSummary> getProviders() {
        PricingSnapshot snapshot = store.snapshot();
        return registry.all().stream()
            .map(provider -> new ProviderSummary(
                provider.name(),
                provider.displayName(),
                provider.source().value(),
                snapshot.countByProvider(provider.type()),
                snapshot.updatedAt(provider.type())))
            .toList();
    }

    /**
     * 整體統計；平均單價只計入該欄位有值的記錄。
     */
    public PricingStats getStats() {
        PricingSnapshot snapshot = store.snapshot();
        Collection<PricingRecord> records = snapshot.all();

        Map<String, Long> byCapability = new LinkedHashMap<>();
        for (Capability capability : Capability.values()) {
            long count = records.stream().filter(record -> record.capabilities().contains(capability)).count();
            if (count > 0) {
                byCapability.put(capability.value(), count);
            }
        }

        int providers = (int) records.stream().map(PricingRecord::provider).distinct().count();
        return new PricingStats(
            records.size(),
            providers,
            average(records, Pricing.Component.INPUT),
            average(records, Pricing.Component.OUTPUT),
            byCapability,
            snapshot.lastRefresh()
        );
    }

    public HealthResponse getHealth() {
        PricingSnapshot snapshot = store.snapshot();
        return new HealthResponse(STATUS_HEALTHY, snapshot.size(), snapshot.lastRefresh());
    }

    private static boolean matchesName(PricingRecord record, String search) {
        return record.modelName() != null && record.modelName().toLowerCase(Locale.ROOT).contains(search);
    }

    static Comparator<PricingRecord> comparator(SortField field, boolean descending) {
        return field.comparator(descending).thenComparing(PricingRecord::id);
    }

    private static BigDecimal average(Collection<PricingRecord> records, Pricing.Component component) {
        List<BigDecimal> prices = records.stream()
            .map(record -> record.price(component))
            .filter(Objects::nonNull)
            .toList();
        if (prices.isEmpty()) {
            return null;
        }
        BigDecimal total = prices.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(prices.size()), AVERAGE_SCALE, RoundingMode.HALF_UP);
    }
}
