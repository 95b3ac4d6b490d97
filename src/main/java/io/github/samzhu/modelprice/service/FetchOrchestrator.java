package io.github.samzhu.modelprice.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.dto.api.RefreshResult;
import io.github.samzhu.modelprice.dto.api.RefreshResult.ProviderSyncResult;
import io.github.samzhu.modelprice.exception.ProviderFetchException;
import io.github.samzhu.modelprice.provider.PricingProvider;
import io.github.samzhu.modelprice.provider.ProviderRegistry;
import io.github.samzhu.modelprice.repository.PricingStore;

/**
 * 抓取協調服務，負責刷新週期（抓取 → 正規化 → 寫入儲存區）。
 *
 * <p>全系統刷新流程：
 * <ol>
 *   <li>每個已註冊的提供者送出一個抓取任務到 {@code providerFetchExecutor}，並行執行</li>
 *   <li>提供者抓取完成後立即以整批取代的方式寫入 {@link PricingStore}</li>
 *   <li>等待全部完成；失敗的提供者記錄 WARN 並列入結果，不影響其他提供者</li>
 * </ol>
 *
 * <p>提供者的貢獻是全有或全無：抓取失敗時整批捨棄，既有子集合保持不變。
 * 本服務不做自動重試，逾時完全由上游 HTTP 客戶端控制。
 *
 * @see PricingStore
 * @see ProviderRegistry
 */
@Service
public class FetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final ProviderRegistry registry;
    private final PricingStore store;
    private final Executor executor;
    private final Clock clock;

    public FetchOrchestrator(
            ProviderRegistry registry,
            PricingStore store,
            @Qualifier("providerFetchExecutor") Executor executor,
            Clock clock) {
        this.registry = registry;
        this.store = store;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * 並行刷新所有提供者。
     *
     * <p>即使部分或全部提供者失敗也會正常回傳，失敗細節在 {@link RefreshResult#providers()}。
     *
     * @return 刷新結果
     */
    public RefreshResult refreshAll() {
        long startTime = System.nanoTime();
        List<PricingProvider> providers = registry.all();
        log.info("Starting full refresh: providers={}", providers.size());

        // 每個提供者抓取完成即發佈自己的子集合，慢的提供者不會拖住其他提供者
        Map<PricingProvider, CompletableFuture<Integer>> pending = new LinkedHashMap<>();
        for (PricingProvider provider : providers) {
            pending.put(provider, CompletableFuture
                .supplyAsync(provider::fetch, executor)
                .thenApply(records -> publish(provider, records)));
        }

        List<ProviderSyncResult> results = new ArrayList<>();
        int succeeded = 0;
        int modelsCount = 0;
        for (Map.Entry<PricingProvider, CompletableFuture<Integer>> entry : pending.entrySet()) {
            PricingProvider provider = entry.getKey();
            try {
                int count = entry.getValue().join();
                results.add(ProviderSyncResult.success(provider.name(), count));
                succeeded++;
                modelsCount += count;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Provider refresh failed: provider={}, error={}", provider.name(), cause.getMessage());
                results.add(ProviderSyncResult.failure(provider.name(), cause.getMessage()));
            }
        }

        String status = status(succeeded, providers.size());
        double elapsed = elapsedSeconds(startTime);
        log.info("Full refresh completed: status={}, providers={}/{}, models={}, {}s",
            status, succeeded, providers.size(), modelsCount, elapsed);
        return new RefreshResult(status, null, modelsCount, elapsed, clock.instant(), List.copyOf(results));
    }

    /**
     * 刷新單一提供者，只取代該提供者的子集合。
     *
     * @param name 提供者名稱
     * @return 刷新結果
     * @throws io.github.samzhu.modelprice.exception.UnknownProviderException 名稱未註冊
     * @throws ProviderFetchException 抓取失敗，儲存區不變
     */
    public RefreshResult refreshProvider(String name) {
        PricingProvider provider = registry.get(name);
        long startTime = System.nanoTime();
        log.info("Starting provider refresh: provider={}", provider.name());

        List<PricingRecord> records;
        try {
            records = provider.fetch();
        } catch (ProviderFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderFetchException(provider.name(), "Unexpected failure: " + e.getMessage(), e);
        }
        int count = publish(provider, records);

        double elapsed = elapsedSeconds(startTime);
        log.info("Provider refresh completed: provider={}, models={}, {}s", provider.name(), count, elapsed);
        return RefreshResult.forProvider(provider.name(), count, elapsed, clock.instant());
    }

    /**
     * 定時全系統刷新，{@code model-price.refresh.cron} 為 {@code -} 時停用。
     */
    @Scheduled(cron = "${model-price.refresh.cron:-}")
    public void scheduledRefresh() {
        try {
            refreshAll();
        } catch (RuntimeException e) {
            log.error("Scheduled refresh failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 以提供者本次的全部記錄取代其子集合。
     *
     * @return 發佈的記錄數
     * @throws ProviderFetchException 提供者回傳了不屬於自己的記錄，儲存區不變
     */
    private int publish(PricingProvider provider, List<PricingRecord> records) {
        for (PricingRecord record : records) {
            if (record.provider() != provider.type()) {
                throw new ProviderFetchException(provider.name(),
                    "Provider returned record " + record.id() + " for another provider");
            }
        }
        store.replaceProvider(provider.type(), records, clock.instant());
        // 同批次重複 ID 在儲存區只留一筆
        return (int) records.stream().map(PricingRecord::id).distinct().count();
    }

    private static String status(int succeeded, int total) {
        if (succeeded == total) {
            return RefreshResult.STATUS_OK;
        }
        return succeeded == 0 ? RefreshResult.STATUS_FAILED : RefreshResult.STATUS_PARTIAL;
    }

    private static double elapsedSeconds(long startNanos) {
        return Math.round((System.nanoTime() - startNanos) / 1e7) / 100.0;
    }
}
