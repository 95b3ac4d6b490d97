package io.github.samzhu.modelprice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Model Price Service - AI 模型定價彙整服務。
 *
 * <p>此服務從各家提供者的公開價目表或人工維護資料檔彙整模型單價，負責：
 * <ul>
 *   <li>並行抓取各提供者的價目表（AWS Bedrock Price List、人工資料檔）</li>
 *   <li>將 SKU 層級的 line-item 正規化為統一的 {@code PricingRecord}</li>
 *   <li>以 copy-on-write 快照提供一致的查詢結果</li>
 *   <li>提供 REST API 查詢、比較與手動刷新</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * AWS Price List (AmazonBedrock + AmazonBedrockFoundationModels) ─┐
 * data/manual/*.json ─────────────────────────────────────────────┼→ FetchOrchestrator → PricingStore
 *                                                                  │                         ↓
 *                                                                  │                  PricingQueryService → /api/v1
 *                                                                  └ (選用) MongoDB model_pricing 鏡像
 * </pre>
 *
 * @see <a href="https://docs.aws.amazon.com/awsaccountbilling/latest/aboutv2/price-changes.html">AWS Price List</a>
 */
@SpringBootApplication
@EnableScheduling
public class ModelPriceApplication {

    private static final Logger log = LoggerFactory.getLogger(ModelPriceApplication.class);

    public static void main(String[] args) {
        log.info("Starting Model Price Service - AI Model Pricing Aggregation");
        SpringApplication.run(ModelPriceApplication.class, args);
    }
}
