package io.github.samzhu.modelprice.repository;

import java.util.List;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;

/**
 * 已發佈快照的持久化鏡像。
 *
 * <p>由 {@link PricingStore} 在每次發佈提供者子集合後呼叫；查詢永遠讀記憶體快照，
 * 鏡像只用於重新啟動後還原。
 */
public interface PricingArchive {

    /**
     * 以新的記錄取代某提供者在持久層的全部記錄。
     */
    void mirror(ProviderType provider, List<PricingRecord> records);

    /**
     * 讀回所有已持久化的記錄。
     */
    List<PricingRecord> loadAll();
}
