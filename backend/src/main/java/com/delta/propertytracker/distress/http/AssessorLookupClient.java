package com.delta.propertytracker.distress.http;

import com.delta.propertytracker.config.TrackerProperties;
import com.delta.propertytracker.distress.model.HttpFetchResult;
import com.delta.propertytracker.distress.model.LookupFailure;
import com.delta.propertytracker.distress.model.ParcelLookupResult;
import com.delta.propertytracker.distress.util.AddressUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-parcel lookup against the county assessor. The lookup URL is a pure function of the parcel
 * number's digits, so the same parcel always links to the same page.
 */
@Service
public class AssessorLookupClient {
    private static final Logger log = LoggerFactory.getLogger(AssessorLookupClient.class);
    private static final String APN_PLACEHOLDER = "{apn}";
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,text/plain;q=0.9,*/*;q=0.8";

    private final TrackerProperties properties;
    private final PoliteHttpClient httpClient;

    public AssessorLookupClient(TrackerProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    /**
     * Returns {@code null} when the parcel number has no digits.
     */
    public String lookupUrl(String apn) {
        String digits = AddressUtils.digitsOnly(apn);
        if (digits.isEmpty()) {
            return null;
        }
        String template = properties.getResolver().getLookupUrlTemplate();
        if (template == null || !template.contains(APN_PLACEHOLDER)) {
            throw new IllegalStateException("tracker.resolver.lookup-url-template must contain " + APN_PLACEHOLDER);
        }
        return template.replace(APN_PLACEHOLDER, digits);
    }

    public ParcelLookupResult lookup(String apn) {
        String url = lookupUrl(apn);
        if (url == null) {
            return ParcelLookupResult.failed(null, LookupFailure.INVALID_PARCEL, "parcel number has no digits: " + apn);
        }
        HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT, properties.getResolver().getLookupTimeoutSeconds());
        if (fetch.errorCode() != null) {
            log.debug("Lookup for {} failed: {} {}", apn, fetch.errorCode(), fetch.errorMessage());
            return ParcelLookupResult.failed(url, failureFor(fetch.errorCode()), fetch.errorCode() + ": " + fetch.errorMessage());
        }
        if (!fetch.isSuccessful()) {
            return ParcelLookupResult.failed(url, LookupFailure.HTTP_STATUS, "http_" + fetch.statusCode());
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            return ParcelLookupResult.failed(url, LookupFailure.EMPTY_BODY, "empty response body");
        }
        return ParcelLookupResult.ok(url, fetch.body());
    }

    private LookupFailure failureFor(String errorCode) {
        switch (errorCode) {
            case "timeout":
                return LookupFailure.TIMEOUT;
            case "interrupted":
                return LookupFailure.INTERRUPTED;
            default:
                return LookupFailure.IO_ERROR;
        }
    }
}
