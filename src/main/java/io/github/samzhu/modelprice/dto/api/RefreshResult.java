package io.github.samzhu.modelprice.dto.api;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 刷新結果。
 *
 * <p>用於 POST /api/v1/refresh 端點；全系統刷新時 {@code provider} 為 null，
 * 單一提供者刷新時 {@code providers} 為 null。
 *
 * @param status {@code ok}、{@code partial}（部分提供者失敗）或 {@code failed}（全部失敗）
 * @param provider 單一提供者刷新時的提供者名稱
 * @param modelsCount 本次成功提交的記錄數
 * @param elapsedSeconds 耗時（秒）
 * @param timestamp 完成時間
 * @param providers 全系統刷新時各提供者的結果
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefreshResult(
    String status,
    String provider,
    int modelsCount,
    double elapsedSeconds,
    Instant timestamp,
    List<ProviderSyncResult> providers
) {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_PARTIAL = "partial";
    public static final String STATUS_FAILED = "failed";

    public static RefreshResult forProvider(String provider, int modelsCount, double elapsedSeconds, Instant timestamp) {
        return new RefreshResult(STATUS_OK, provider, modelsCount, elapsedSeconds, timestamp, null);
    }

    /**
     * 單一提供者在全系統刷新中的結果。
     *
     * @param provider 提供者名稱
     * @param success 是否成功
     * @param modelsCount 成功時的記錄數
     * @param error 失敗訊息
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProviderSyncResult(
        String provider,
        boolean success,
        int modelsCount,
        String error
    ) {

        public static ProviderSyncResult success(String provider, int modelsCount) {
            return new ProviderSyncResult(provider, true, modelsCount, null);
        }

        public static ProviderSyncResult failure(String provider, String error) {
            return new ProviderSyncResult(provider, false, 0, error);
        }
    }
}
