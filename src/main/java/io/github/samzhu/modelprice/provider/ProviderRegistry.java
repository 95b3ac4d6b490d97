package io.github.samzhu.modelprice.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.modelprice.exception.DuplicateProviderException;
import io.github.samzhu.modelprice.exception.UnknownProviderException;

/**
 * 提供者註冊表，名稱 → {@link PricingProvider}。
 *
 * <p>於啟動時由 {@link io.github.samzhu.modelprice.config.ProviderConfig} 明確註冊，
 * 列舉順序即註冊順序。註冊完成後只有讀取操作，讀寫皆以 {@code synchronized} 保護。
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, PricingProvider> providers = new LinkedHashMap<>();

    /**
     * 註冊提供者。
     *
     * @param provider 提供者
     * @throws DuplicateProviderException 若名稱已被註冊
     */
    public synchronized void register(PricingProvider provider) {
        String name = provider.name();
        if (providers.containsKey(name)) {
            throw new DuplicateProviderException(name);
        }
        providers.put(name, provider);
        log.info("Provider registered: name={}, source={}", name, provider.source().value());
    }

    /**
     * 依名稱取得提供者。
     *
     * @param name 提供者名稱
     * @return 提供者
     * @throws UnknownProviderException 若名稱未註冊
     */
    public synchronized PricingProvider get(String name) {
        PricingProvider provider = providers.get(name);
        if (provider == null) {
            throw new UnknownProviderException(name);
        }
        return provider;
    }

    public synchronized boolean contains(String name) {
        return providers.containsKey(name);
    }

    /**
     * 取得所有提供者，依註冊順序。
     */
    public synchronized List<PricingProvider> all() {
        return List.copyOf(providers.values());
    }

    public synchronized int size() {
        return providers.size();
    }
}
