package io.github.samzhu.modelprice.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import io.github.samzhu.modelprice.config.ModelPriceProperties;
import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.repository.PricingArchive;
import io.github.samzhu.modelprice.repository.PricingStore;

/**
 * 應用程式啟動後的資料準備。
 *
 * <p>執行順序：
 * <ol>
 *   <li>若啟用持久化，從 {@link PricingArchive} 還原上次的快照（同步執行）</li>
 *   <li>若 {@code model-price.refresh.on-startup=true}，在背景 daemon 執行緒執行一次全系統刷新</li>
 * </ol>
 *
 * <p>刷新不阻塞啟動，查詢端在刷新完成前讀到的是還原的（或空的）快照。
 * 刷新失敗只記錄錯誤，不會讓應用程式啟動失敗；應用程式關閉時不等待進行中的刷新。
 */
@Component
public class StartupRefreshRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupRefreshRunner.class);

    private final FetchOrchestrator orchestrator;
    private final PricingStore store;
    private final PricingArchive archive;
    private final ModelPriceProperties properties;

    public StartupRefreshRunner(
            FetchOrchestrator orchestrator,
            PricingStore store,
            @Nullable PricingArchive archive,
            ModelPriceProperties properties) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.archive = archive;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        restore();
        if (properties.refresh().onStartup()) {
            Thread thread = new Thread(this::refresh, "startup-refresh");
            thread.setDaemon(true);
            thread.start();
        } else {
            log.info("Startup refresh disabled");
        }
    }

    void restore() {
        if (archive == null) {
            return;
        }
        try {
            List<PricingRecord> records = archive.loadAll();
            store.restore(records);
        } catch (RuntimeException e) {
            log.error("Failed to restore pricing snapshot: {}", e.getMessage(), e);
        }
    }

    void refresh() {
        try {
            orchestrator.refreshAll();
        } catch (RuntimeException e) {
            log.error("Startup refresh failed: {}", e.getMessage(), e);
        }
    }
}
