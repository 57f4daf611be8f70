package com.comiccomp.collector.source;

import com.comiccomp.collector.model.Marketplace;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of every {@link ListingSource} bean, keyed by marketplace.
 * Inject this where a marketplace-specific source is needed.
 */
@Slf4j
public class ListingSourceRegistry {

    private final Map<Marketplace, ListingSource> byMarketplace;

    public ListingSourceRegistry(final List<ListingSource> sources) {
        Map<Marketplace, ListingSource> map = new EnumMap<>(Marketplace.class);
        for (ListingSource source : sources) {
            ListingSource previous = map.put(source.marketplace(), source);
            if (previous != null) {
                throw new IllegalStateException("Two listing sources registered for " + source.marketplace()
                        + ": " + previous.getClass().getSimpleName() + " and " + source.getClass().getSimpleName());
            }
        }
        this.byMarketplace = Collections.unmodifiableMap(map);
        log.info("Registered listing sources: {}", byMarketplace.keySet());
    }

    public Optional<ListingSource> find(final Marketplace marketplace) {
        return Optional.ofNullable(byMarketplace.get(marketplace));
    }

    /**
     * @return all sources in marketplace declaration order
     */
    public Collection<ListingSource> all() {
        return byMarketplace.values();
    }
}
