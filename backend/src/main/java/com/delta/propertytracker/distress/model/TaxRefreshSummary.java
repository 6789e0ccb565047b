package com.delta.propertytracker.distress.model;

public record TaxRefreshSummary(
    String status,
    String documentUrl,
    int parcelsLoaded,
    String message
) {
    public static final String COMPLETED = "COMPLETED";
    public static final String FAILED = "FAILED";

    public static TaxRefreshSummary failed(String documentUrl, String message) {
        return new TaxRefreshSummary(FAILED, documentUrl, 0, message);
    }

    public boolean isCompleted() {
        return COMPLETED.equals(status);
    }
}
