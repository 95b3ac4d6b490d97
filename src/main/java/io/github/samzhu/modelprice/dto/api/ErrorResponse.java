package io.github.samzhu.modelprice.dto.api;

import java.time.Instant;

/**
 * API 錯誤回應。
 *
 * @param error 錯誤類型代碼，例如 {@code unknown_provider}
 * @param message 錯誤說明
 * @param timestamp 發生時間
 */
public record ErrorResponse(
    String error,
    String message,
    Instant timestamp
) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, Instant.now());
    }
}
