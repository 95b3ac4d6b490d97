package io.github.samzhu.modelprice.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.dto.PricingQuery;
import io.github.samzhu.modelprice.dto.api.HealthResponse;
import io.github.samzhu.modelprice.dto.api.PricingStats;
import io.github.samzhu.modelprice.dto.api.ProviderSummary;
import io.github.samzhu.modelprice.dto.api.RefreshResult;
import io.github.samzhu.modelprice.service.FetchOrchestrator;
import io.github.samzhu.modelprice.service.PricingQueryService;

/**
 * 模型定價 API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>GET /api/v1/models - 模型列表（篩選、搜尋、排序）</li>
 *   <li>GET /api/v1/models/{id} - 單一模型</li>
 *   <li>GET /api/v1/providers - 提供者摘要</li>
 *   <li>GET /api/v1/stats - 整體統計</li>
 *   <li>GET /api/v1/health - 健康檢查</li>
 *   <li>POST /api/v1/refresh - 手動刷新（可指定單一提供者）</li>
 * </ul>
 *
 * <p>錯誤回應由 {@link ApiExceptionHandler} 統一轉換。
 */
@RestController
@RequestMapping("/api/v1")
public class PricingApiController {

    private static final Logger log = LoggerFactory.getLogger(PricingApiController.class);

    private final PricingQueryService queryService;
    private final FetchOrchestrator orchestrator;

    public PricingApiController(PricingQueryService queryService, FetchOrchestrator orchestrator) {
        this.queryService = queryService;
        this.orchestrator = orchestrator;
    }

    /**
     * 查詢模型列表。
     *
     * @param provider 提供者識別碼，例如 {@code aws_bedrock}
     * @param capability 能力，例如 {@code vision}
     * @param search 模型名稱關鍵字（不分大小寫）
     * @param sortBy 排序欄位，例如 {@code model_name}、{@code cost_input}
     * @param sortOrder {@code asc} 或 {@code desc}
     * @return 排序後的模型列表
     */
    @GetMapping("/models")
    public ResponseEntity<List<PricingRecord>> listModels(
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String capability,
            @RequestParam(required = false) String search,
            @RequestParam(name = "sort_by", defaultValue = "model_name") String sortBy,
            @RequestParam(name = "sort_order", defaultValue = "asc") String sortOrder) {

        log.debug("Listing models: provider={}, capability={}, search={}, sortBy={}, sortOrder={}",
            provider, capability, search, sortBy, sortOrder);

        PricingQuery query = PricingQuery.parse(provider, capability, search, sortBy, sortOrder);
        return ResponseEntity.ok(queryService.getAll(query));
    }

    /**
     * 取得單一模型。
     *
     * @param id 記錄 ID，例如 {@code aws_bedrock:claude-3.5-sonnet}
     */
    @GetMapping("/models/{id}")
    public ResponseEntity<PricingRecord> getModel(@PathVariable String id) {
        return ResponseEntity.ok(queryService.getById(id));
    }

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderSummary>> listProviders() {
        return ResponseEntity.ok(queryService.getProviders());
    }

    @GetMapping("/stats")
    public ResponseEntity<PricingStats> getStats() {
        return ResponseEntity.ok(queryService.getStats());
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(queryService.getHealth());
    }

    /**
     * 手動刷新定價資料。
     *
     * <p>指定 {@code provider} 時只刷新該提供者，抓取失敗回傳 502；
     * 未指定時刷新全部，部分失敗仍回傳 200 並在結果中列出。
     *
     * @param provider 提供者名稱（選填）
     * @return 刷新結果
     */
    @PostMapping("/refresh")
    public ResponseEntity<RefreshResult> refresh(@RequestParam(required = false) String provider) {
        log.info("Manual refresh triggered: provider={}", provider == null ? "all" : provider);

        RefreshResult result = provider == null || provider.isBlank()
            ? orchestrator.refreshAll()
            : orchestrator.refreshProvider(provider.trim());
        return ResponseEntity.ok(result);
    }
}
