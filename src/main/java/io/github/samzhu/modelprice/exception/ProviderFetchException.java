package io.github.samzhu.modelprice.exception;

/**
 * 上游抓取失敗（TransportFailure）。
 *
 * <p>當上游端點無法連線、逾時、回應非 2xx 或回應內容無法讀取時拋出。
 * 與單筆 line-item 解析失敗不同，後者只會被略過，不會升級為例外。
 *
 * <p>處理方式：
 * <ul>
 *   <li>{@code refreshAll} 會記錄此提供者失敗並繼續其他提供者，該提供者本次結果整批捨棄</li>
 *   <li>{@code refreshProvider} 直接拋給呼叫端</li>
 *   <li>不自動重試</li>
 * </ul>
 */
public class ProviderFetchException extends RuntimeException {

    private final String providerName;

    public ProviderFetchException(String providerName, String message) {
        super(String.format("Fetch failed for provider '%s': %s", providerName, message));
        this.providerName = providerName;
    }

    public ProviderFetchException(String providerName, String message, Throwable cause) {
        super(String.format("Fetch failed for provider '%s': %s", providerName, message), cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
