package com.delta.propertytracker.distress.model;

import java.util.List;

public record ResolveBatchResult(
    int processed,
    int resolvedCount,
    int unresolvedCount,
    List<String> sampleErrors
) {
}
