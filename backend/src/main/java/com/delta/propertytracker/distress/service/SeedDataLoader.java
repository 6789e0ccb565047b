package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.config.TrackerProperties;
import com.delta.propertytracker.distress.model.NewPropertyRecord;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.SeedLoadResult;
import com.delta.propertytracker.distress.model.Stage;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

@Component
@Order(0)
public class SeedDataLoader implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SeedDataLoader.class);

    private final TrackerProperties properties;
    private final DistressJdbcRepository repository;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public SeedDataLoader(
        TrackerProperties properties,
        DistressJdbcRepository repository,
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.repository = repository;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        loadIfEmpty();
    }

    public SeedLoadResult loadIfEmpty() {
        TrackerProperties.Seed seed = properties.getSeed();
        if (!seed.isEnabled()) {
            return new SeedLoadResult(false, 0, "seeding disabled");
        }
        try {
            if (repository.countRecordsByStage(Stage.TAX_DELINQUENCY) > 0) {
                log.debug("Seed skipped; tax-delinquency records already present");
                return new SeedLoadResult(false, 0, "tax-delinquency records already present");
            }
            List<NewPropertyRecord> records = readSeed(seed.getLocation());
            int inserted = repository.insertRecords(records);
            log.info("Seeded {} example records from {}", inserted, seed.getLocation());
            return new SeedLoadResult(true, inserted, "seeded " + inserted + " records");
        } catch (Exception e) {
            log.warn("Seed load from {} failed: {}", seed.getLocation(), e.getMessage());
            return new SeedLoadResult(false, 0, "seed failed: " + e.getMessage());
        }
    }

    List<NewPropertyRecord> readSeed(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        }
        if (root == null || !root.isArray()) {
            throw new IOException("seed file must hold a JSON array");
        }

        TrackerProperties.Defaults defaults = properties.getDefaults();
        List<NewPropertyRecord> records = new ArrayList<>();
        for (JsonNode row : root) {
            String stage = text(row, "stage");
            records.add(new NewPropertyRecord(
                stage == null ? Stage.TAX_DELINQUENCY : Stage.fromRaw(stage),
                text(row, "apn"),
                orDefault(text(row, "address"), PropertyRecord.UNKNOWN_ADDRESS),
                orDefault(text(row, "city"), defaults.getCity()),
                orDefault(text(row, "state"), defaults.getState()),
                orDefault(text(row, "zip"), defaults.getZip()),
                text(row, "record_date"),
                text(row, "doc_type"),
                text(row, "source_url")
            ));
        }
        return records;
    }

    private String text(JsonNode row, String field) {
        JsonNode value = row.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
