package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.config.TrackerProperties;
import com.delta.propertytracker.distress.http.PoliteHttpClient;
import com.delta.propertytracker.distress.model.HttpFetchResult;
import com.delta.propertytracker.distress.model.NewPropertyRecord;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.Stage;
import com.delta.propertytracker.distress.model.TaxListEntry;
import com.delta.propertytracker.distress.model.TaxRefreshSummary;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

@Service
public class TaxListRefreshService {
    private static final Logger log = LoggerFactory.getLogger(TaxListRefreshService.class);
    private static final String PDF_ACCEPT = "application/pdf,*/*;q=0.8";

    private final TrackerProperties properties;
    private final DistressJdbcRepository repository;
    private final PoliteHttpClient httpClient;
    private final TaxListLocator locator;
    private final DocumentTextExtractor textExtractor;
    private final ParcelNumberParser parcelParser;
    private final StoreMaintenanceGuard maintenanceGuard;

    public TaxListRefreshService(
        TrackerProperties properties,
        DistressJdbcRepository repository,
        PoliteHttpClient httpClient,
        TaxListLocator locator,
        DocumentTextExtractor textExtractor,
        ParcelNumberParser parcelParser,
        StoreMaintenanceGuard maintenanceGuard
    ) {
        this.properties = properties;
        this.repository = repository;
        this.httpClient = httpClient;
        this.locator = locator;
        this.textExtractor = textExtractor;
        this.parcelParser = parcelParser;
        this.maintenanceGuard = maintenanceGuard;
    }

    public TaxRefreshSummary refresh() {
        return maintenanceGuard.runExclusive("tax list refresh", this::refreshExclusive);
    }

    private TaxRefreshSummary refreshExclusive() {
        String documentUrl = locator.locateDocumentUrl();
        if (documentUrl == null || documentUrl.isBlank()) {
            return logged(TaxRefreshSummary.failed(null, "no tax list document configured"));
        }

        HttpFetchResult fetch = httpClient.get(documentUrl, PDF_ACCEPT);
        if (!fetch.isSuccessful() || fetch.bodyBytes() == null) {
            return logged(TaxRefreshSummary.failed(documentUrl, "document fetch failed: " + fetch.statusLabel()));
        }

        String text;
        try {
            text = textExtractor.extractText(fetch.bodyBytes());
        } catch (IOException | RuntimeException e) {
            return logged(TaxRefreshSummary.failed(documentUrl, "document text extraction failed: " + e.getMessage()));
        }

        List<TaxListEntry> entries = parcelParser.parse(text);
        if (entries.isEmpty()) {
            return logged(TaxRefreshSummary.failed(documentUrl, "no parcel numbers found in document"));
        }

        int loaded = replaceTaxDelinquencyRecords(entries, documentUrl);
        return logged(new TaxRefreshSummary(
            TaxRefreshSummary.COMPLETED,
            documentUrl,
            loaded,
            "Loaded " + loaded + " parcels from county list"
        ));
    }

    int replaceTaxDelinquencyRecords(List<TaxListEntry> entries, String sourceUrl) {
        TrackerProperties.Defaults defaults = properties.getDefaults();
        String docType = properties.getTaxList().getDocType();
        List<NewPropertyRecord> records = entries.stream()
            .map(entry -> new NewPropertyRecord(
                Stage.TAX_DELINQUENCY,
                entry.apn(),
                entry.addressGuess() == null ? PropertyRecord.UNKNOWN_ADDRESS : entry.addressGuess(),
                defaults.getCity(),
                defaults.getState(),
                defaults.getZip(),
                null,
                docType,
                sourceUrl
            ))
            .toList();
        return repository.replaceRecordsByStage(Stage.TAX_DELINQUENCY, records);
    }

    private TaxRefreshSummary logged(TaxRefreshSummary summary) {
        if (summary.isCompleted()) {
            log.info("Tax list refresh complete. document={} parcels={}", summary.documentUrl(), summary.parcelsLoaded());
        } else {
            log.warn("Tax list refresh failed. document={} reason={}", summary.documentUrl(), summary.message());
        }
        return summary;
    }
}
