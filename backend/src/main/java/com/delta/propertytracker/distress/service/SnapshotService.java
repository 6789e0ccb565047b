package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.SnapshotEntry;
import com.delta.propertytracker.distress.model.SnapshotResult;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import com.delta.propertytracker.distress.util.RecordIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class SnapshotService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private final DistressJdbcRepository repository;

    public SnapshotService(DistressJdbcRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public SnapshotResult createRun() {
        Instant createdAt = Instant.now();
        long runId = repository.insertRun(createdAt);

        List<PropertyRecord> records = repository.findAllRecordsById();
        List<SnapshotEntry> entries = new ArrayList<>(records.size());
        for (PropertyRecord record : records) {
            entries.add(new SnapshotEntry(
                runId,
                record.id(),
                RecordIdentity.deriveKey(record),
                RecordIdentity.deriveFingerprint(record)
            ));
        }
        repository.insertSnapshotEntries(entries);

        log.info("Created run {} with {} snapshot entries", runId, entries.size());
        return new SnapshotResult(runId, createdAt, entries.size());
    }
}
