package com.comiccomp.collector.config;

import com.comiccomp.collector.model.Marketplace;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Factory producing {@link MarketplaceCfg} instances for a given marketplace.
 * It delegates to {@link MarketplaceProperties} to look up the configuration
 * section for each marketplace as defined in <code>application.yml</code>.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * MarketplaceCfg ebay = configFactory.forMarketplace(Marketplace.EBAY);
 * }</pre>
 */
@RequiredArgsConstructor
public class MarketplaceConfigFactory {

    private final MarketplaceProperties marketplaceProps;

    /**
     * Retrieves the {@link MarketplaceCfg} for the specified marketplace.
     *
     * @param marketplace the marketplace (its id must match a key under
     *                    <code>marketplaces.configs.{id}</code>)
     * @return the corresponding {@link MarketplaceCfg} instance
     * @throws IllegalArgumentException if no configuration section is found
     */
    public MarketplaceCfg forMarketplace(final Marketplace marketplace) {
        return find(marketplace)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No <marketplaces.configs." + marketplace.id() + "> section found in application.yml"));
    }

    public Optional<MarketplaceCfg> find(final Marketplace marketplace) {
        return Optional.ofNullable(marketplaceProps.forName(marketplace.id()));
    }

    /**
     * @return every known marketplace whose section is present and enabled
     */
    public List<Marketplace> enabledMarketplaces() {
        return marketplaceProps.getConfigs().entrySet().stream()
                .filter(e -> e.getValue().isEnabled())
                .map(e -> Marketplace.fromId(e.getKey()))
                .flatMap(Optional::stream)
                .toList();
    }
}
