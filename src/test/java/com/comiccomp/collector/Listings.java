package com.comiccomp.collector;

import com.comiccomp.collector.model.Marketplace;
import com.comiccomp.collector.model.RawListing;
import com.comiccomp.collector.model.SellerInfo;

/**
 * Raw listing fixtures that pass every structural check for their marketplace.
 */
public final class Listings {

    private Listings() {
    }

    public static RawListing.RawListingBuilder ebay(final String id, final String price) {
        return RawListing.builder()
                .externalId(id)
                .title("Amazing Spider-Man #300 (1988) first Venom")
                .price(price)
                .marketplace(Marketplace.EBAY)
                .sourceUrl("https://www.ebay.com/itm/" + id)
                .condition("Very Good")
                .saleType("auction")
                .sellerInfo(SellerInfo.builder().name("silverage_vault").build())
                .listingPhoto("https://img.example.com/" + id + ".jpg");
    }

    public static RawListing.RawListingBuilder whatnot(final String id, final String price) {
        return RawListing.builder()
                .externalId(id)
                .title("X-Men #1 (1991) Jim Lee cover")
                .price(price)
                .marketplace(Marketplace.WHATNOT)
                .sourceUrl("https://www.whatnot.com/listing/" + id)
                .condition("Near Mint")
                .saleType("live_auction");
    }

    public static RawListing.RawListingBuilder heritage(final String id, final String price) {
        return RawListing.builder()
                .externalId(id)
                .title("Incredible Hulk #181 (1974) CGC 9.4")
                .price(price)
                .marketplace(Marketplace.HERITAGE)
                .sourceUrl("https://comics.ha.com/itm/" + id)
                .condition("CGC")
                .grade("CGC 9.4")
                .lotNumber("91234")
                .saleType("auction");
    }

    public static RawListing.RawListingBuilder comicconnect(final String id, final String price) {
        return RawListing.builder()
                .externalId(id)
                .title("Giant-Size X-Men #1 (1975) CGC 9.6")
                .price(price)
                .marketplace(Marketplace.COMICCONNECT)
                .sourceUrl("https://www.comicconnect.com/item/" + id)
                .condition("Near Mint")
                .grade("CGC 9.6")
                .saleType("auction");
    }

    public static RawListing.RawListingBuilder mycomicshop(final String id, final String price) {
        return RawListing.builder()
                .externalId(id)
                .title("Saga #1 (2012) first printing")
                .price(price)
                .marketplace(Marketplace.MYCOMICSHOP)
                .sourceUrl("https://www.mycomicshop.com/search?TID=" + id)
                .condition("NM")
                .grade("9.4")
                .saleType("buy_now");
    }
}
