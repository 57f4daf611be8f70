package com.comiccomp.collector.config;

import com.comiccomp.collector.model.Marketplace;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds marketplace-specific configuration from <code>application.yml</code>
 * under the <code>marketplaces</code> prefix. Each entry in the bound map
 * corresponds to a {@link MarketplaceCfg} keyed by the marketplace identifier.
 * <p>
 * Example YAML:
 * <pre>{@code
 * marketplaces:
 *   configs:
 *     ebay:
 *       timeout: 30s
 *       rate-limit:
 *         requests-per-second: 3
 *         requests-per-minute: 120
 *     heritage:
 *       # ...
 * }</pre>
 */
@ConfigurationProperties(prefix = "marketplaces")
@Getter
@Setter
public class MarketplaceProperties {

    /**
     * Map of marketplace identifiers to their {@link MarketplaceCfg},
     * preserving insertion order.
     */
    private final Map<String, MarketplaceCfg> configs = new LinkedHashMap<>();

    /**
     * Retrieves the {@link MarketplaceCfg} for the given marketplace identifier.
     *
     * @param name the marketplace identifier
     * @return the associated {@link MarketplaceCfg}, or {@code null}
     * if no such marketplace is configured
     */
    public MarketplaceCfg forName(final String name) {
        return configs.get(name);
    }

    /**
     * The rate limits of every configured, known marketplace.
     *
     * @return limits keyed by marketplace
     */
    public Map<Marketplace, MarketplaceCfg.RateLimit> rateLimits() {
        Map<Marketplace, MarketplaceCfg.RateLimit> limits = new EnumMap<>(Marketplace.class);
        configs.forEach((id, cfg) -> Marketplace.fromId(id)
                .ifPresent(m -> limits.put(m, cfg.getRateLimit())));
        return limits;
    }
}
