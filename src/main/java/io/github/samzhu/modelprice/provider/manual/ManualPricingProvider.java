package io.github.samzhu.modelprice.provider.manual;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.modelprice.document.Capability;
import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;
import io.github.samzhu.modelprice.document.RecordSource;
import io.github.samzhu.modelprice.exception.ProviderFetchException;
import io.github.samzhu.modelprice.provider.PricingProvider;
import io.github.samzhu.modelprice.util.ModelIdSlugs;

/**
 * 人工維護資料檔的定價提供者。
 *
 * <p>讀取 {@code <location><provider>.json}（格式見 {@link ManualDataFile}），
 * 作為沒有公開價目表 API 的提供者之資料來源。
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>檔案不存在或不是合法 JSON：{@link ProviderFetchException}</li>
 *   <li>單一模型格式錯誤、缺少名稱或價格為負：略過該模型</li>
 * </ul>
 */
public class ManualPricingProvider implements PricingProvider {

    private static final Logger log = LoggerFactory.getLogger(ManualPricingProvider.class);

    private final ProviderType type;
    private final ResourceLoader resourceLoader;
    private final String location;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ManualPricingProvider(ProviderType type, ResourceLoader resourceLoader, String location,
                                 ObjectMapper objectMapper, Clock clock) {
        this.type = type;
        this.resourceLoader = resourceLoader;
        this.location = location.endsWith("/") ? location : location + "/";
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ProviderType type() {
        return type;
    }

    @Override
    public RecordSource source() {
        return RecordSource.MANUAL;
    }

    @Override
    public List<PricingRecord> fetch() {
        String path = location + type.value() + ".json";
        JsonNode root = read(path);

        ManualDataFile file;
        try {
            file = objectMapper.treeToValue(root, ManualDataFile.class);
        } catch (JsonProcessingException e) {
            throw new ProviderFetchException(name(), "Malformed manual data file " + path, e);
        }
        if (file.provider() != null && !type.value().equalsIgnoreCase(file.provider())) {
            log.warn("Manual data file provider mismatch: expected={}, file={}, path={}",
                type.value(), file.provider(), path);
        }

        Instant now = clock.instant();
        Map<String, PricingRecord> records = new LinkedHashMap<>();
        int skipped = 0;
        for (JsonNode node : root.path("models")) {
            PricingRecord record = toRecord(node, file, now);
            if (record == null) {
                skipped++;
                continue;
            }
            if (records.putIfAbsent(record.id(), record) != null) {
                log.debug("Duplicate manual model ignored: id={}", record.id());
            }
        }

        log.info("Manual data loaded: provider={}, models={}, skipped={}", type.value(), records.size(), skipped);
        return List.copyOf(records.values());
    }

    private JsonNode read(String path) {
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new ProviderFetchException(name(), "Manual data file not found: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || !root.isObject()) {
                throw new ProviderFetchException(name(), "Manual data file is not a JSON object: " + path);
            }
            return root;
        } catch (IOException e) {
            throw new ProviderFetchException(name(), "Unable to read manual data file " + path, e);
        }
    }

    private PricingRecord toRecord(JsonNode node, ManualDataFile file, Instant now) {
        if (!node.isObject()) {
            log.debug("Skipping non-object manual model: provider={}, node={}", type.value(), node.getNodeType());
            return null;
        }
        ManualDataFile.ManualModel model;
        try {
            model = objectMapper.treeToValue(node, ManualDataFile.ManualModel.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Skipping malformed manual model: provider={}, error={}", type.value(), e.getMessage());
            return null;
        }

        if (model == null) {
            return null;
        }
        if (model.capabilities() != null && model.capabilities().contains(null)) {
            log.debug("Skipping manual model with null capability: provider={}, model={}", type.value(), model.modelId());
            return null;
        }

        String name = model.modelName() != null && !model.modelName().isBlank() ? model.modelName() : model.modelId();
        String rawId = model.modelId() != null && !model.modelId().isBlank() ? model.modelId() : name;
        if (rawId == null || rawId.isBlank()) {
            log.debug("Skipping manual model without id or name: provider={}", type.value());
            return null;
        }
        String modelId = ModelIdSlugs.slugify(rawId);
        if (modelId.isEmpty()) {
            return null;
        }

        return PricingRecord.builder()
            .provider(type)
            .modelId(modelId)
            .modelName(name)
            .pricing(model.pricing())
            .batchPricing(model.batchPricing())
            .billingMode(model.billingMode())
            .capabilities(model.capabilities() == null || model.capabilities().isEmpty()
                ? EnumSet.of(Capability.TEXT)
                : EnumSet.copyOf(model.capabilities()))
            .contextLength(model.contextLength())
            .maxOutputTokens(model.maxOutputTokens())
            .source(RecordSource.MANUAL)
            .sourceUrl(file.sourceUrl())
            .lastUpdated(now)
            .lastVerified(file.lastVerified())
            .notes(model.notes())
            .build();
    }
}
