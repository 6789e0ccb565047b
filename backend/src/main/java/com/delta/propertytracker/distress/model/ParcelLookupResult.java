package com.delta.propertytracker.distress.model;

public record ParcelLookupResult(
    String lookupUrl,
    String body,
    LookupFailure failure,
    String detail
) {
    public static ParcelLookupResult ok(String lookupUrl, String body) {
        return new ParcelLookupResult(lookupUrl, body, null, null);
    }

    public static ParcelLookupResult failed(String lookupUrl, LookupFailure failure, String detail) {
        return new ParcelLookupResult(lookupUrl, null, failure, detail);
    }

    public boolean isOk() {
        return failure == null;
    }
}
