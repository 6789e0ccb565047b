package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.ImportSummary;
import com.delta.propertytracker.distress.model.NewPropertyRecord;
import com.delta.propertytracker.distress.model.Stage;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class CsvImportService {
    private static final Logger log = LoggerFactory.getLogger(CsvImportService.class);
    private static final List<String> REQUIRED_COLUMNS = List.of("stage", "address", "city", "state");
    private static final int MAX_REPORTED_PROBLEMS = 10;
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final DistressJdbcRepository repository;

    public CsvImportService(DistressJdbcRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public ImportSummary importCsv(Reader reader) {
        List<NewPropertyRecord> records = parse(reader);
        int inserted = repository.insertRecords(records);

        Map<Stage, Integer> stageCounts = new EnumMap<>(Stage.class);
        for (NewPropertyRecord record : records) {
            stageCounts.merge(record.stage(), 1, Integer::sum);
        }
        log.info("CSV import complete. inserted={} stages={}", inserted, stageCounts);
        return new ImportSummary(inserted, stageCounts);
    }

    List<NewPropertyRecord> parse(Reader reader) {
        try (CSVParser parser = csvParser(reader)) {
            Map<String, String> headers = headerIndex(parser.getHeaderNames());
            List<String> missing = new ArrayList<>();
            for (String column : REQUIRED_COLUMNS) {
                if (!headers.containsKey(column)) {
                    missing.add(column);
                }
            }
            if (!missing.isEmpty()) {
                throw new ImportValidationException("CSV is missing required columns " + missing);
            }

            List<NewPropertyRecord> records = new ArrayList<>();
            List<String> problems = new ArrayList<>();
            int problemCount = 0;
            int rowNumber = 0;
            for (CSVRecord row : parser) {
                rowNumber++;
                List<String> blank = new ArrayList<>();
                for (String column : REQUIRED_COLUMNS) {
                    if (getColumn(row, headers, column) == null) {
                        blank.add(column);
                    }
                }
                if (!blank.isEmpty()) {
                    problemCount++;
                    if (problems.size() < MAX_REPORTED_PROBLEMS) {
                        problems.add("row " + rowNumber + " missing " + String.join(",", blank));
                    }
                    continue;
                }
                records.add(new NewPropertyRecord(
                    Stage.fromRaw(getColumn(row, headers, "stage")),
                    getColumn(row, headers, "apn"),
                    getColumn(row, headers, "address"),
                    getColumn(row, headers, "city"),
                    getColumn(row, headers, "state"),
                    getColumn(row, headers, "zip"),
                    getColumn(row, headers, "record_date"),
                    getColumn(row, headers, "doc_type"),
                    getColumn(row, headers, "source_url")
                ));
            }
            if (problemCount > 0) {
                log.warn("CSV import rejected. invalidRows={}", problemCount);
                throw new ImportValidationException(problemCount + " invalid row(s)", problems);
            }
            return records;
        } catch (IOException | UncheckedIOException e) {
            throw new ImportValidationException("CSV could not be read: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            // duplicate or empty header names
            throw new ImportValidationException("CSV header is malformed: " + e.getMessage());
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private Map<String, String> headerIndex(List<String> headerNames) {
        Map<String, String> index = new HashMap<>();
        for (String header : headerNames) {
            if (header == null) {
                continue;
            }
            String name = header.startsWith(BYTE_ORDER_MARK) ? header.substring(1) : header;
            if (!name.isBlank()) {
                index.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), header);
            }
        }
        return index;
    }

    private String getColumn(CSVRecord row, Map<String, String> headers, String name) {
        String header = headers.get(name);
        if (header == null || !row.isSet(header)) {
            return null;
        }
        String value = row.get(header).trim();
        return value.isEmpty() ? null : value;
    }
}
