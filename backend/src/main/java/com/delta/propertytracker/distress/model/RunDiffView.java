package com.delta.propertytracker.distress.model;

import java.util.List;
import java.util.Map;

public record RunDiffView(
    RunMeta latest,
    RunMeta previous,
    List<TrackedItemView> items,
    List<RemovedEntry> removed,
    Map<ChangeType, Integer> summary,
    List<String> duplicateKeys
) {
}
