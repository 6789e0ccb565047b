package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.ChangeType;
import com.delta.propertytracker.distress.model.NewPropertyRecord;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.RemovedEntry;
import com.delta.propertytracker.distress.model.RunDiff;
import com.delta.propertytracker.distress.model.RunDiffView;
import com.delta.propertytracker.distress.model.SnapshotResult;
import com.delta.propertytracker.distress.model.Stage;
import com.delta.propertytracker.distress.model.TrackedItemView;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class RunDiffServiceTest {

    @Autowired
    private DistressJdbcRepository repository;
    @Autowired
    private SnapshotService snapshotService;
    @Autowired
    private RunDiffService runDiffService;

    @BeforeEach
    void clearStore() {
        repository.deleteAll();
    }

    @Test
    void firstRunClassifiesEverythingNew() {
        repository.insertRecord(tax("16-0241-11"));
        repository.insertRecord(tax("16-0385-04"));
        repository.insertRecord(tax("08-0117-22"));
        SnapshotResult run = snapshotService.createRun();

        RunDiff diff = runDiffService.diff(run.runId(), null);

        assertThat(run.entryCount()).isEqualTo(3);
        assertThat(diff.summary())
            .containsEntry(ChangeType.NEW, 3)
            .containsEntry(ChangeType.REMOVED, 0)
            .containsEntry(ChangeType.UPDATED, 0)
            .containsEntry(ChangeType.UNCHANGED, 0);
        assertThat(diff.items()).allSatisfy(item -> assertThat(diff.classificationOf(item.id())).isEqualTo(ChangeType.NEW));
    }

    @Test
    void emptyStoreStillProducesRun() {
        SnapshotResult run = snapshotService.createRun();

        RunDiff diff = runDiffService.diff(run.runId(), null);

        assertThat(run.entryCount()).isZero();
        assertThat(repository.findRunById(run.runId())).isNotNull();
        assertThat(repository.countSnapshotEntries(run.runId())).isZero();
        assertThat(diff.summary())
            .containsEntry(ChangeType.NEW, 0)
            .containsEntry(ChangeType.REMOVED, 0)
            .containsEntry(ChangeType.UPDATED, 0)
            .containsEntry(ChangeType.UNCHANGED, 0);
        assertThat(diff.items()).isEmpty();
        assertThat(diff.removed()).isEmpty();
    }

    @Test
    void resolvedSitusMakesItemUpdated() {
        long id = repository.insertRecord(tax("12-3456-78"));
        SnapshotResult runA = snapshotService.createRun();
        repository.updateResolvedSitus(id, "https://assessor.example/12345678", "100 MAIN ST", Instant.now());
        SnapshotResult runB = snapshotService.createRun();

        RunDiff diff = runDiffService.diff(runB.runId(), runA.runId());

        assertThat(diff.classificationOf(id)).isEqualTo(ChangeType.UPDATED);
        assertThat(diff.summary()).containsEntry(ChangeType.UPDATED, 1).containsEntry(ChangeType.NEW, 0);
    }

    @Test
    void removedKeptAndNewKeysAreClassifiedAndCountedOnce() {
        long k1 = repository.insertRecord(tax("11-1111-11"));
        repository.insertRecord(tax("22-2222-22"));
        SnapshotResult runA = snapshotService.createRun();

        repository.replaceRecordsByStage(Stage.TAX_DELINQUENCY, List.of(tax("22-2222-22"), tax("33-3333-33")));
        SnapshotResult runB = snapshotService.createRun();

        RunDiff diff = runDiffService.diff(runB.runId(), runA.runId());

        assertThat(diff.removed()).containsExactly(new RemovedEntry(k1, "tax_delinquency|apn:11-1111-11"));
        assertThat(diff.classificationOf(k1)).isEqualTo(ChangeType.REMOVED);
        PropertyRecord kept = find(diff, "22-2222-22");
        PropertyRecord added = find(diff, "33-3333-33");
        assertThat(diff.classificationOf(kept.id())).isEqualTo(ChangeType.UNCHANGED);
        assertThat(diff.classificationOf(added.id())).isEqualTo(ChangeType.NEW);
        assertThat(diff.summary())
            .containsEntry(ChangeType.NEW, 1)
            .containsEntry(ChangeType.REMOVED, 1)
            .containsEntry(ChangeType.UNCHANGED, 1)
            .containsEntry(ChangeType.UPDATED, 0);
        assertThat(diff.total()).isEqualTo(3);
    }

    @Test
    void diffIsRepeatable() {
        repository.insertRecord(tax("11-1111-11"));
        SnapshotResult runA = snapshotService.createRun();
        repository.insertRecord(tax("22-2222-22"));
        SnapshotResult runB = snapshotService.createRun();

        RunDiff first = runDiffService.diff(runB.runId(), runA.runId());
        RunDiff second = runDiffService.diff(runB.runId(), runA.runId());

        assertThat(second.summary()).isEqualTo(first.summary());
        assertThat(second.classifications()).isEqualTo(first.classifications());
    }

    @Test
    void duplicateKeysKeepHigherItemIdAndAreReported() {
        long lower = repository.insertRecord(tax("16-0241-11"));
        long higher = repository.insertRecord(new NewPropertyRecord(
            Stage.TAX_DELINQUENCY, "16-0241-11", "455 W Fourth St", "Winnemucca", "NV", "89445", null, null, null
        ));
        SnapshotResult run = snapshotService.createRun();

        RunDiff diff = runDiffService.diff(run.runId(), null);

        assertThat(diff.duplicateKeys()).hasSize(1);
        assertThat(diff.duplicateKeys().get(0)).contains("tax_delinquency|apn:16-0241-11");
        assertThat(diff.classificationOf(higher)).isEqualTo(ChangeType.NEW);
        assertThat(diff.classificationOf(lower)).isNull();
        assertThat(diff.summary()).containsEntry(ChangeType.NEW, 1);
    }

    @Test
    void unknownRunIsRejected() {
        assertThatThrownBy(() -> runDiffService.diff(Long.MAX_VALUE, null))
            .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void latestDiffWithoutRunsIsEmpty() {
        repository.insertRecord(tax("16-0241-11"));

        RunDiffView view = runDiffService.latestDiff();

        assertThat(view.latest()).isNull();
        assertThat(view.summary().values()).containsOnly(0);
        assertThat(view.items()).hasSize(1);
        assertThat(view.items().get(0).change()).isNull();
    }

    @Test
    void latestDiffComparesTwoNewestRuns() {
        repository.insertRecord(tax("16-0241-11"));
        snapshotService.createRun();
        repository.insertRecord(tax("16-0385-04"));
        SnapshotResult latest = snapshotService.createRun();

        RunDiffView view = runDiffService.latestDiff();

        assertThat(view.latest().runId()).isEqualTo(latest.runId());
        assertThat(view.previous()).isNotNull();
        assertThat(view.summary()).containsEntry(ChangeType.NEW, 1).containsEntry(ChangeType.UNCHANGED, 1);
        assertThat(view.items()).extracting(TrackedItemView::mapsUrl).doesNotContainNull();
    }

    private PropertyRecord find(RunDiff diff, String apn) {
        return diff.items().stream().filter(item -> apn.equals(item.apn())).findFirst().orElseThrow();
    }

    private NewPropertyRecord tax(String apn) {
        return new NewPropertyRecord(
            Stage.TAX_DELINQUENCY,
            apn,
            PropertyRecord.UNKNOWN_ADDRESS,
            "Winnemucca",
            "NV",
            "89445",
            null,
            "Delinquent Tax Sale Parcel List",
            "https://county.example/list.pdf"
        );
    }
}
