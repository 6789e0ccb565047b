package com.delta.propertytracker.distress.model;

public record TrackedItemView(
    PropertyRecord record,
    ChangeType change,
    ResolutionStatus resolutionStatus,
    String mapsUrl,
    String listingUrl
) {
}
