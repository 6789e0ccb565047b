package com.delta.propertytracker.distress.model;

import java.time.Instant;

public record PropertyRecord(
    long id,
    Stage stage,
    String apn,
    String address,
    String city,
    String state,
    String zip,
    String recordDate,
    String docType,
    String sourceUrl,
    String assessorUrl,
    String resolvedSitus,
    Instant resolvedAt
) {
    public static final String UNKNOWN_ADDRESS = "Unknown address";

    public boolean hasApn() {
        return apn != null && !apn.isBlank();
    }

    public boolean hasResolvedSitus() {
        return resolvedSitus != null && !resolvedSitus.isBlank();
    }

    public ResolutionStatus resolutionStatus() {
        if (hasResolvedSitus()) {
            return ResolutionStatus.RESOLVED;
        }
        if (resolvedAt != null || (assessorUrl != null && !assessorUrl.isBlank())) {
            return ResolutionStatus.UNRESOLVED;
        }
        return ResolutionStatus.UNATTEMPTED;
    }
}
