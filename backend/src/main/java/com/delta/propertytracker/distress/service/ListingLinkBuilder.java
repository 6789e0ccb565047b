package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.http.AssessorLookupClient;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.util.AddressUtils;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Component
public class ListingLinkBuilder {
    private static final String MAPS_SEARCH = "https://www.google.com/maps/search/?api=1&query=";
    private static final String ZILLOW_SEARCH = "https://www.zillow.com/homes/%s_rb/";

    private final AssessorLookupClient lookupClient;

    public ListingLinkBuilder(AssessorLookupClient lookupClient) {
        this.lookupClient = lookupClient;
    }

    /**
     * Map search for the resolved situs, then for a street-number address, then the parcel lookup page.
     * {@code null} when the record offers none of these.
     */
    public String mapsUrl(PropertyRecord record) {
        String street = AddressUtils.streetAddressOf(record);
        if (street != null) {
            return MAPS_SEARCH + encode(street);
        }
        if (record.assessorUrl() != null && !record.assessorUrl().isBlank()) {
            return record.assessorUrl();
        }
        return record.hasApn() ? lookupClient.lookupUrl(record.apn()) : null;
    }

    /**
     * Listing-site search, only when a genuine street address exists.
     */
    public Optional<String> listingUrl(PropertyRecord record) {
        String street = AddressUtils.streetAddressOf(record);
        if (street == null) {
            return Optional.empty();
        }
        return Optional.of(String.format(ZILLOW_SEARCH, encode(street)));
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
