package io.github.samzhu.modelprice.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.modelprice.exception.ProviderFetchException;

/**
 * 上游價目表的 HTTP 客戶端。
 *
 * <p>純 HTTPS GET、無認證，回應為 JSON。所有傳輸層錯誤（連線失敗、逾時、非 2xx、
 * 回應無法解析）都轉為 {@link ProviderFetchException}，逾時由
 * {@link io.github.samzhu.modelprice.config.AppConfig} 設定的 request factory 控制。
 */
public class UpstreamCatalogClient {

    private static final Logger log = LoggerFactory.getLogger(UpstreamCatalogClient.class);

    private final RestClient restClient;

    public UpstreamCatalogClient(RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * 下載並解析 JSON 價目表。
     *
     * @param providerName 提供者名稱，用於錯誤訊息
     * @param url 價目表 URL
     * @return JSON 根節點
     * @throws ProviderFetchException 傳輸或解析失敗
     */
    public JsonNode getJson(String providerName, String url) {
        long startTime = System.currentTimeMillis();
        JsonNode body;
        try {
            body = restClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw new ProviderFetchException(providerName,
                "HTTP " + e.getStatusCode().value() + " from " + url, e);
        } catch (RestClientException e) {
            throw new ProviderFetchException(providerName, e.getMessage(), e);
        }

        if (body == null || !body.isObject()) {
            throw new ProviderFetchException(providerName, "Empty or non-object JSON body from " + url);
        }
        log.debug("Catalog downloaded: provider={}, url={}, {}ms",
            providerName, url, System.currentTimeMillis() - startTime);
        return body;
    }
}
