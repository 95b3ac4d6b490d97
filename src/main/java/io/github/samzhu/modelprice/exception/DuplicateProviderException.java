package io.github.samzhu.modelprice.exception;

/**
 * 同一名稱的提供者重複註冊。
 *
 * <p>這是程式設計錯誤而非執行期狀況，會讓應用程式啟動失敗。
 */
public class DuplicateProviderException extends IllegalStateException {

    public DuplicateProviderException(String providerName) {
        super(String.format("Provider already registered: '%s'", providerName));
    }
}
