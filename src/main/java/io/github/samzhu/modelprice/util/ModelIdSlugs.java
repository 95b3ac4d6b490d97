package io.github.samzhu.modelprice.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 模型 ID slug 工具。
 *
 * <p>由顯示名稱推導穩定的模型 ID：
 * <pre>
 * "Claude 3.5 Sonnet v2"  → "claude-3.5-sonnet-v2"
 * "Llama 3.1 (405B) Instruct" → "llama-3.1-405b-instruct"
 * </pre>
 *
 * <p>規則（依序）：去除前後空白 → 小寫（{@link Locale#ROOT}）→ 移除 {@code [a-z0-9 .-]} 以外的字元
 * → 連續空白轉為單一連字號。此函式為純函式，相同輸入永遠得到相同輸出。
 */
public final class ModelIdSlugs {

    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9\\s.\\-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ModelIdSlugs() {
        // 工具類不允許實例化
    }

    /**
     * 將顯示名稱轉為 slug。
     *
     * @param displayName 原始顯示名稱
     * @return slug
     * @throws IllegalArgumentException 若名稱為 null 或空白
     */
    public static String slugify(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Model name must not be blank");
        }
        String slug = displayName.strip().toLowerCase(Locale.ROOT);
        slug = DISALLOWED.matcher(slug).replaceAll("");
        return WHITESPACE.matcher(slug.strip()).replaceAll("-");
    }
}
