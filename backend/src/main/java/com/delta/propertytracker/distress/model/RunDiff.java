package com.delta.propertytracker.distress.model;

import java.util.List;
import java.util.Map;

/**
 * Classification of one run against its predecessor. {@code classifications} is keyed by item id;
 * live items captured after {@code newRunId} have no entry.
 */
public record RunDiff(
    long newRunId,
    Long oldRunId,
    List<PropertyRecord> items,
    Map<Long, ChangeType> classifications,
    List<RemovedEntry> removed,
    Map<ChangeType, Integer> summary,
    List<String> duplicateKeys
) {
    public ChangeType classificationOf(long itemId) {
        return classifications.get(itemId);
    }

    public int total() {
        return summary.values().stream().mapToInt(Integer::intValue).sum();
    }
}
