package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.ChangeType;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.RemovedEntry;
import com.delta.propertytracker.distress.model.RunDiff;
import com.delta.propertytracker.distress.model.RunDiffView;
import com.delta.propertytracker.distress.model.RunMeta;
import com.delta.propertytracker.distress.model.SnapshotEntry;
import com.delta.propertytracker.distress.model.TrackedItemView;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares two runs key by key.
 *
 * <p>Both snapshots are read before anything is classified, so the result depends only on the two
 * stored runs and the live items used for presentation. When two entries of one run share a key the
 * entry with the higher item id wins; every such collision is reported in
 * {@link RunDiff#duplicateKeys()}.
 */
@Service
public class RunDiffService {
    private static final Logger log = LoggerFactory.getLogger(RunDiffService.class);

    private final DistressJdbcRepository repository;
    private final ListingLinkBuilder linkBuilder;

    public RunDiffService(DistressJdbcRepository repository, ListingLinkBuilder linkBuilder) {
        this.repository = repository;
        this.linkBuilder = linkBuilder;
    }

    @Transactional(readOnly = true)
    public RunDiff diff(long newRunId, Long oldRunId) {
        if (repository.findRunById(newRunId) == null) {
            throw new RunNotFoundException(newRunId);
        }
        if (oldRunId != null && repository.findRunById(oldRunId) == null) {
            throw new RunNotFoundException(oldRunId);
        }

        List<String> duplicateKeys = new ArrayList<>();
        Map<String, SnapshotEntry> newMap = keyMap(repository.findSnapshotEntries(newRunId), duplicateKeys);
        Map<String, SnapshotEntry> oldMap = oldRunId == null
            ? Map.of()
            : keyMap(repository.findSnapshotEntries(oldRunId), duplicateKeys);

        Map<ChangeType, Integer> summary = emptySummary();
        Map<Long, ChangeType> current = new HashMap<>();
        Map<Long, ChangeType> removedById = new HashMap<>();
        List<RemovedEntry> removed = new ArrayList<>();

        for (Map.Entry<String, SnapshotEntry> entry : newMap.entrySet()) {
            SnapshotEntry previous = oldMap.get(entry.getKey());
            ChangeType change;
            if (previous == null) {
                change = ChangeType.NEW;
            } else if (previous.hash().equals(entry.getValue().hash())) {
                change = ChangeType.UNCHANGED;
            } else {
                change = ChangeType.UPDATED;
            }
            current.put(entry.getValue().itemId(), change);
            summary.merge(change, 1, Integer::sum);
        }
        for (Map.Entry<String, SnapshotEntry> entry : oldMap.entrySet()) {
            if (newMap.containsKey(entry.getKey())) {
                continue;
            }
            long oldItemId = entry.getValue().itemId();
            removed.add(new RemovedEntry(oldItemId, entry.getKey()));
            removedById.put(oldItemId, ChangeType.REMOVED);
            summary.merge(ChangeType.REMOVED, 1, Integer::sum);
        }

        // An item whose key changed is REMOVED under its old key and NEW under its new one; show NEW.
        Map<Long, ChangeType> classifications = new HashMap<>(removedById);
        classifications.putAll(current);

        if (!duplicateKeys.isEmpty()) {
            log.warn(
                "Runs {} / {} contain {} duplicate identity keys; later items replaced earlier ones: {}",
                newRunId,
                oldRunId,
                duplicateKeys.size(),
                duplicateKeys.size() > 10 ? duplicateKeys.subList(0, 10) : duplicateKeys
            );
        }
        log.debug("Diff {} vs {}: {}", newRunId, oldRunId, summary);

        return new RunDiff(
            newRunId,
            oldRunId,
            repository.findAllRecordsOrdered(),
            Collections.unmodifiableMap(classifications),
            List.copyOf(removed),
            Collections.unmodifiableMap(summary),
            List.copyOf(duplicateKeys)
        );
    }

    /**
     * Diff of the most recent run against the one before it. With no runs at all the view is empty
     * and every summary count is zero.
     */
    @Transactional(readOnly = true)
    public RunDiffView latestDiff() {
        List<RunMeta> runs = repository.findRecentRuns(2);
        if (runs.isEmpty()) {
            List<TrackedItemView> items = new ArrayList<>();
            for (PropertyRecord record : repository.findAllRecordsOrdered()) {
                items.add(toView(record, null));
            }
            return new RunDiffView(null, null, items, List.of(), emptySummary(), List.of());
        }
        RunMeta latest = runs.get(0);
        RunMeta previous = runs.size() > 1 ? runs.get(1) : null;
        RunDiff diff = diff(latest.runId(), previous == null ? null : previous.runId());

        List<TrackedItemView> items = new ArrayList<>(diff.items().size());
        for (PropertyRecord record : diff.items()) {
            items.add(toView(record, diff.classificationOf(record.id())));
        }
        return new RunDiffView(latest, previous, items, diff.removed(), diff.summary(), diff.duplicateKeys());
    }

    private TrackedItemView toView(PropertyRecord record, ChangeType change) {
        return new TrackedItemView(
            record,
            change,
            record.resolutionStatus(),
            linkBuilder.mapsUrl(record),
            linkBuilder.listingUrl(record).orElse(null)
        );
    }

    private Map<String, SnapshotEntry> keyMap(List<SnapshotEntry> entries, List<String> duplicateKeys) {
        Map<String, SnapshotEntry> byKey = new LinkedHashMap<>();
        for (SnapshotEntry entry : entries) {
            SnapshotEntry replaced = byKey.put(entry.key(), entry);
            if (replaced != null) {
                duplicateKeys.add("run " + entry.runId() + ": " + entry.key()
                    + " (item " + replaced.itemId() + " replaced by " + entry.itemId() + ")");
            }
        }
        return byKey;
    }

    private static Map<ChangeType, Integer> emptySummary() {
        Map<ChangeType, Integer> summary = new EnumMap<>(ChangeType.class);
        for (ChangeType type : ChangeType.values()) {
            summary.put(type, 0);
        }
        return summary;
    }
}
