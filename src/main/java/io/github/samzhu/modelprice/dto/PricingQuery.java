package io.github.samzhu.modelprice.dto;

import io.github.samzhu.modelprice.document.Capability;
import io.github.samzhu.modelprice.document.ProviderType;
import io.github.samzhu.modelprice.exception.InvalidQueryException;

/**
 * 模型列表查詢條件。
 *
 * <p>所有篩選條件彼此獨立且皆為選用（null 表示不篩選）。
 *
 * @param provider 提供者
 * @param capability 須具備的能力
 * @param search 模型名稱子字串（不分大小寫，前後空白忽略）
 * @param sortBy 排序欄位
 * @param descending 是否遞減排序；相同值以 ID 遞增排序
 */
public record PricingQuery(
    ProviderType provider,
    Capability capability,
    String search,
    SortField sortBy,
    boolean descending
) {

    public PricingQuery {
        if (sortBy == null) {
            sortBy = SortField.MODEL_NAME;
        }
        if (search != null) {
            search = search.isBlank() ? null : search.strip();
        }
    }

    /**
     * 不篩選、依名稱遞增排序。
     */
    public static PricingQuery all() {
        return new PricingQuery(null, null, null, SortField.MODEL_NAME, false);
    }

    /**
     * 由 API 查詢參數建立查詢條件。
     *
     * @param provider 提供者識別碼，例如 {@code aws_bedrock}
     * @param capability 能力，例如 {@code vision}
     * @param search 名稱子字串
     * @param sortBy 排序欄位名稱或別名，預設 {@code model_name}
     * @param sortOrder {@code asc} 或 {@code desc}，預設 {@code asc}
     * @return 查詢條件
     * @throws InvalidQueryException 任一參數無法解析
     */
    public static PricingQuery parse(String provider, String capability, String search,
                                     String sortBy, String sortOrder) {
        try {
            return new PricingQuery(
                isBlank(provider) ? null : ProviderType.fromValue(provider.trim()),
                isBlank(capability) ? null : Capability.fromValue(capability.trim()),
                search,
                isBlank(sortBy) ? SortField.MODEL_NAME : SortField.fromValue(sortBy.trim()),
                parseDescending(sortOrder)
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException(e.getMessage(), e);
        }
    }

    private static boolean parseDescending(String sortOrder) {
        if (isBlank(sortOrder) || "asc".equalsIgnoreCase(sortOrder.trim())) {
            return false;
        }
        if ("desc".equalsIgnoreCase(sortOrder.trim())) {
            return true;
        }
        throw new IllegalArgumentException("Unknown sort order: " + sortOrder + " (expected asc or desc)");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
