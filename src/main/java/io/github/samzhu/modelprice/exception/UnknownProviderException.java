package io.github.samzhu.modelprice.exception;

/**
 * 指定的提供者名稱未註冊。
 *
 * <p>屬於呼叫端錯誤，API 層對應為 400 回應。
 */
public class UnknownProviderException extends RuntimeException {

    private final String providerName;

    public UnknownProviderException(String providerName) {
        super(String.format("Unknown provider: '%s'", providerName));
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
