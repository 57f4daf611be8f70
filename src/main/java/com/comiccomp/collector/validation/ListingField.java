package com.comiccomp.collector.validation;

import com.comiccomp.collector.model.RawListing;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Listing fields addressable by name from the validation rules, with how to tell
 * whether a raw listing carries them.
 */
public enum ListingField {

    ID("id", l -> StringUtils.isNotBlank(l.getExternalId())),
    TITLE("title", l -> StringUtils.isNotBlank(l.getTitle())),
    PRICE("price", l -> StringUtils.isNotBlank(l.getPrice())),
    MARKETPLACE("marketplace", l -> l.getMarketplace() != null),
    SOURCE_URL("source_url", l -> StringUtils.isNotBlank(l.getSourceUrl())),
    CONDITION("condition", l -> StringUtils.isNotBlank(l.getCondition())),
    GRADE("grade", l -> StringUtils.isNotBlank(l.getGrade())),
    SALE_TYPE("sale_type", l -> StringUtils.isNotBlank(l.getSaleType())),
    DESCRIPTION("description", l -> StringUtils.isNotBlank(l.getDescription())),
    SELLER_INFO("seller_info", l -> l.getSellerInfo() != null && !l.getSellerInfo().isEmpty()),
    LISTING_PHOTOS("listing_photos", l -> l.getListingPhotos() != null && !l.getListingPhotos().isEmpty()),
    SHIPPING_COST("shipping_cost", l -> StringUtils.isNotBlank(l.getShippingCost())),
    SALE_DATE("sale_date", l -> StringUtils.isNotBlank(l.getSaleDate())),
    END_DATE("end_date", l -> StringUtils.isNotBlank(l.getEndDate())),
    VIEW_COUNT("view_count", l -> StringUtils.isNotBlank(l.getViewCount())),
    WATCHER_COUNT("watcher_count", l -> StringUtils.isNotBlank(l.getWatcherCount())),
    BID_COUNT("bid_count", l -> StringUtils.isNotBlank(l.getBidCount())),
    LOT_NUMBER("lot_number", l -> StringUtils.isNotBlank(l.getLotNumber()));

    private final String id;

    private final Predicate<RawListing> presence;

    ListingField(final String id, final Predicate<RawListing> presence) {
        this.id = id;
        this.presence = presence;
    }

    public String id() {
        return id;
    }

    public boolean isPresent(final RawListing listing) {
        return presence.test(listing);
    }

    /**
     * Maps configured field names onto fields.
     *
     * @param ids names such as {@code "source_url"} or {@code "sourceUrl"}
     * @return the fields, in order
     * @throws IllegalArgumentException on an unknown name
     */
    public static List<ListingField> fromIds(final Collection<String> ids) {
        List<ListingField> fields = new ArrayList<>(ids.size());
        for (String id : ids) {
            fields.add(fromId(id));
        }
        return List.copyOf(fields);
    }

    public static ListingField fromId(final String id) {
        String key = StringUtils.trimToEmpty(id)
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.id.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown listing field '" + id + "'"));
    }
}
