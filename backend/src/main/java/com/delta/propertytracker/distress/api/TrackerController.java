package com.delta.propertytracker.distress.api;

import com.delta.propertytracker.distress.model.ImportSummary;
import com.delta.propertytracker.distress.model.NoticeImportSummary;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.ResolveBatchResult;
import com.delta.propertytracker.distress.model.RunDiff;
import com.delta.propertytracker.distress.model.RunDiffView;
import com.delta.propertytracker.distress.model.RunMeta;
import com.delta.propertytracker.distress.model.SeedLoadResult;
import com.delta.propertytracker.distress.model.SnapshotResult;
import com.delta.propertytracker.distress.model.StatusResponse;
import com.delta.propertytracker.distress.model.TaxRefreshSummary;
import com.delta.propertytracker.distress.service.CsvImportService;
import com.delta.propertytracker.distress.service.NoticeImportService;
import com.delta.propertytracker.distress.service.RunDiffService;
import com.delta.propertytracker.distress.service.SitusResolverService;
import com.delta.propertytracker.distress.service.SnapshotService;
import com.delta.propertytracker.distress.service.StoreResetService;
import com.delta.propertytracker.distress.service.TaxListRefreshService;
import com.delta.propertytracker.distress.service.TrackerStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class TrackerController {
    private final TrackerStatusService statusService;
    private final SnapshotService snapshotService;
    private final RunDiffService runDiffService;
    private final CsvImportService csvImportService;
    private final NoticeImportService noticeImportService;
    private final TaxListRefreshService taxListRefreshService;
    private final SitusResolverService situsResolverService;
    private final StoreResetService storeResetService;

    public TrackerController(
        TrackerStatusService statusService,
        SnapshotService snapshotService,
        RunDiffService runDiffService,
        CsvImportService csvImportService,
        NoticeImportService noticeImportService,
        TaxListRefreshService taxListRefreshService,
        SitusResolverService situsResolverService,
        StoreResetService storeResetService
    ) {
        this.statusService = statusService;
        this.snapshotService = snapshotService;
        this.runDiffService = runDiffService;
        this.csvImportService = csvImportService;
        this.noticeImportService = noticeImportService;
        this.taxListRefreshService = taxListRefreshService;
        this.situsResolverService = situsResolverService;
        this.storeResetService = storeResetService;
    }

    @GetMapping("/health")
    public Map<String, Boolean> health() {
        return Map.of("ok", true);
    }

    @GetMapping("/status")
    public StatusResponse getStatus() {
        return statusService.getStatus();
    }

    @GetMapping("/items")
    public List<PropertyRecord> getItems() {
        return statusService.listItems();
    }

    @PostMapping("/runs")
    public SnapshotResult createRun() {
        return snapshotService.createRun();
    }

    @GetMapping("/runs")
    public List<RunMeta> getRuns(@RequestParam(name = "limit", required = false, defaultValue = "20") int limit) {
        return statusService.recentRuns(limit);
    }

    @GetMapping("/diff/latest")
    public RunDiffView getLatestDiff() {
        return runDiffService.latestDiff();
    }

    @GetMapping("/diff")
    public RunDiff getDiff(
        @RequestParam(name = "newRunId") long newRunId,
        @RequestParam(name = "oldRunId", required = false) Long oldRunId
    ) {
        return runDiffService.diff(newRunId, oldRunId);
    }

    @PostMapping("/import")
    public ImportSummary importCsv(@RequestPart(name = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "file is required");
        }
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return csvImportService.importCsv(reader);
        } catch (IOException e) {
            throw new ResponseStatusException(BAD_REQUEST, "file could not be read", e);
        }
    }

    @PostMapping("/notices/import")
    public NoticeImportSummary importNotices(@RequestPart(name = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "file is required");
        }
        try (InputStream input = file.getInputStream()) {
            return noticeImportService.importNotices(input);
        } catch (IOException e) {
            throw new ResponseStatusException(BAD_REQUEST, "file could not be read", e);
        }
    }

    @PostMapping("/tax/refresh")
    public TaxRefreshSummary refreshTaxList() {
        return taxListRefreshService.refresh();
    }

    @PostMapping("/resolve")
    public ResolveBatchResult resolveSitus(@RequestParam(name = "limit", required = false) Integer limit) {
        if (limit != null && limit < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be positive");
        }
        return situsResolverService.resolveBatch(limit);
    }

    @PostMapping("/reset")
    public SeedLoadResult reset() {
        return storeResetService.reset();
    }
}
