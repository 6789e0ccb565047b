package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.config.TrackerProperties;
import com.delta.propertytracker.distress.http.AssessorLookupClient;
import com.delta.propertytracker.distress.model.ParcelLookupResult;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.ResolveBatchResult;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Enriches parcel-numbered records that have no situs yet with the street address shown on the
 * assessor's parcel page.
 *
 * <p>Selection excludes records that already have a situs, so a resolved record is never looked up
 * again and a failed attempt can never clear earlier data. Lookups may run in parallel on the
 * resolver executor; results are written back one record at a time on the calling thread, each in
 * its own statement, so a batch can stop between items without leaving partial state.
 */
@Service
public class SitusResolverService {
    private static final Logger log = LoggerFactory.getLogger(SitusResolverService.class);
    private static final int MAX_ERROR_SAMPLES = 10;

    private final TrackerProperties properties;
    private final DistressJdbcRepository repository;
    private final AssessorLookupClient lookupClient;
    private final SitusExtractor extractor;
    private final StoreMaintenanceGuard maintenanceGuard;
    private final ExecutorService resolverExecutor;

    public SitusResolverService(
        TrackerProperties properties,
        DistressJdbcRepository repository,
        AssessorLookupClient lookupClient,
        SitusExtractor extractor,
        StoreMaintenanceGuard maintenanceGuard,
        @Qualifier("resolverExecutor") ExecutorService resolverExecutor
    ) {
        this.properties = properties;
        this.repository = repository;
        this.lookupClient = lookupClient;
        this.extractor = extractor;
        this.maintenanceGuard = maintenanceGuard;
        this.resolverExecutor = resolverExecutor;
    }

    public ResolveBatchResult resolveBatch(Integer maxItems) {
        TrackerProperties.Resolver settings = properties.getResolver();
        int limit = maxItems == null
            ? settings.getDefaultBatchSize()
            : Math.max(1, Math.min(maxItems, settings.getMaxBatchSize()));
        return maintenanceGuard.runExclusive("resolve batch", () -> resolvePending(limit));
    }

    private ResolveBatchResult resolvePending(int limit) {
        List<PropertyRecord> pending = repository.findRecordsAwaitingSitus(limit);
        if (pending.isEmpty()) {
            log.info("Resolver found nothing to resolve");
            return new ResolveBatchResult(0, 0, 0, List.of());
        }

        List<Future<ParcelLookupResult>> lookups = new ArrayList<>(pending.size());
        for (PropertyRecord record : pending) {
            lookups.add(resolverExecutor.submit(() -> lookupClient.lookup(record.apn())));
        }

        Counts counts = new Counts();
        ErrorCollector errors = new ErrorCollector();
        for (int i = 0; i < pending.size(); i++) {
            PropertyRecord record = pending.get(i);
            ParcelLookupResult lookup;
            try {
                lookup = lookups.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelFrom(lookups, i);
                log.warn("Resolver interrupted after {} of {} items", counts.processed, pending.size());
                break;
            } catch (ExecutionException e) {
                String cause = e.getCause() == null ? e.toString() : e.getCause().toString();
                log.warn("Lookup for item {} (apn {}) failed unexpectedly: {}", record.id(), record.apn(), cause);
                lookup = null;
                errors.add(record, "lookup_error " + cause);
            }

            counts.processed++;
            try {
                if (lookup != null && apply(record, lookup, errors)) {
                    counts.resolved++;
                } else {
                    if (lookup == null) {
                        repository.recordResolutionAttempt(record.id(), safeLookupUrl(record.apn()), Instant.now());
                    }
                    counts.unresolved++;
                }
            } catch (RuntimeException e) {
                log.warn("Write-back for item {} (apn {}) failed", record.id(), record.apn(), e);
                errors.add(record, "write_error " + e.getMessage());
                counts.unresolved++;
            }
        }

        log.info(
            "Resolver finished. processed={} resolved={} unresolved={}",
            counts.processed,
            counts.resolved,
            counts.unresolved
        );
        return new ResolveBatchResult(counts.processed, counts.resolved, counts.unresolved, errors.sampleErrors());
    }

    private boolean apply(PropertyRecord record, ParcelLookupResult lookup, ErrorCollector errors) {
        Instant now = Instant.now();
        if (!lookup.isOk()) {
            repository.recordResolutionAttempt(record.id(), lookup.lookupUrl(), now);
            errors.add(record, lookup.failure().name().toLowerCase(Locale.ROOT) + " " + lookup.detail());
            return false;
        }

        Optional<String> location = extractor.extractLocation(lookup.body());
        if (location.isEmpty() || !extractor.isValidSitus(location.get())) {
            repository.recordResolutionAttempt(record.id(), lookup.lookupUrl(), now);
            errors.add(record, location.map(value -> "no_street_number '" + value + "'").orElse("no_location"));
            return false;
        }

        TrackerProperties.Defaults defaults = properties.getDefaults();
        String situs = extractor.toPostalString(
            location.get(),
            firstNonBlank(record.city(), defaults.getCity()),
            firstNonBlank(record.state(), defaults.getState()),
            firstNonBlank(record.zip(), defaults.getZip())
        );
        boolean stored = repository.updateResolvedSitus(record.id(), lookup.lookupUrl(), situs, now);
        if (stored) {
            log.debug("Resolved item {} (apn {}) to {}", record.id(), record.apn(), situs);
        }
        return stored;
    }

    private String safeLookupUrl(String apn) {
        try {
            return lookupClient.lookupUrl(apn);
        } catch (IllegalStateException e) {
            return null;
        }
    }

    private void cancelFrom(List<Future<ParcelLookupResult>> lookups, int from) {
        for (int i = from; i < lookups.size(); i++) {
            lookups.get(i).cancel(true);
        }
    }

    private static String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static class Counts {
        private int processed;
        private int resolved;
        private int unresolved;
    }

    private static class ErrorCollector {
        private final List<String> sampleErrors = new ArrayList<>();

        private void add(PropertyRecord record, String message) {
            if (sampleErrors.size() < MAX_ERROR_SAMPLES) {
                sampleErrors.add(record.apn() + ": " + message);
            }
        }

        private List<String> sampleErrors() {
            return List.copyOf(sampleErrors);
        }
    }
}
