package io.github.samzhu.modelprice.provider;

import java.util.List;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;
import io.github.samzhu.modelprice.document.RecordSource;

/**
 * 定價資料提供者。
 *
 * <p>每個外部來源一個實作，負責所有來源特定的抓取、解析與正規化邏輯。
 * 實作可以自行並行呼叫多個上游端點，但回傳前必須依推導出的模型 ID 合併為單一記錄集合。
 *
 * <p>錯誤處理約定：
 * <ul>
 *   <li>單筆 line-item 格式錯誤：略過並繼續（best-effort），不拋出例外</li>
 *   <li>上游逾時、非 2xx、回應無法讀取：拋出
 *       {@link io.github.samzhu.modelprice.exception.ProviderFetchException}</li>
 * </ul>
 */
public interface PricingProvider {

    /**
     * 提供者識別碼。
     */
    ProviderType type();

    /**
     * 註冊名稱，預設為識別碼的 wire value。
     */
    default String name() {
        return type().value();
    }

    default String displayName() {
        return type().displayName();
    }

    /**
     * 資料來源類型。
     */
    default RecordSource source() {
        return RecordSource.API;
    }

    /**
     * 抓取並正規化此提供者的所有定價記錄。
     *
     * <p>此方法會阻塞直到上游回應；回傳的記錄 ID 不重複，且都屬於 {@link #type()}。
     *
     * @return 正規化後的記錄
     * @throws io.github.samzhu.modelprice.exception.ProviderFetchException 上游抓取失敗
     */
    List<PricingRecord> fetch();
}
