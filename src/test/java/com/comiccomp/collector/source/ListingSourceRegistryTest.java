package com.comiccomp.collector.source;

import com.comiccomp.collector.model.Marketplace;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ListingSourceRegistryTest {

    @Test
    void keysSourcesByMarketplaceInDeclarationOrder() {
        ListingSource heritage = source(Marketplace.HERITAGE);
        ListingSource ebay = source(Marketplace.EBAY);

        ListingSourceRegistry registry = new ListingSourceRegistry(List.of(heritage, ebay));

        assertThat(registry.all()).containsExactly(ebay, heritage);
        assertThat(registry.find(Marketplace.HERITAGE)).contains(heritage);
        assertThat(registry.find(Marketplace.AMAZON)).isEmpty();
    }

    @Test
    void refusesTwoSourcesForOneMarketplace() {
        List<ListingSource> sources = List.of(source(Marketplace.EBAY), source(Marketplace.EBAY));

        assertThatThrownBy(() -> new ListingSourceRegistry(sources))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Two listing sources registered for ebay");
    }

    private static ListingSource source(final Marketplace marketplace) {
        ListingSource source = mock(ListingSource.class);
        when(source.marketplace()).thenReturn(marketplace);
        return source;
    }
}
