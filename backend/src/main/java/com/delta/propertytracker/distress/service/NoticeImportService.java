package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.config.TrackerProperties;
import com.delta.propertytracker.distress.model.NewPropertyRecord;
import com.delta.propertytracker.distress.model.NoticeImportSummary;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.Stage;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Adds pre-foreclosure records from a trustee-sale notice feed: a JSON document whose {@code items}
 * carry {@code title}, {@code detail_url}, {@code address_guess} and optionally the notice
 * {@code text}. Notices are keyed by detail URL, so importing the same feed twice adds nothing.
 */
@Service
public class NoticeImportService {
    private static final Logger log = LoggerFactory.getLogger(NoticeImportService.class);

    private final TrackerProperties properties;
    private final DistressJdbcRepository repository;
    private final NoticeAddressGuesser addressGuesser;
    private final ObjectMapper objectMapper;

    public NoticeImportService(
        TrackerProperties properties,
        DistressJdbcRepository repository,
        NoticeAddressGuesser addressGuesser,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.repository = repository;
        this.addressGuesser = addressGuesser;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public NoticeImportSummary importNotices(InputStream input) {
        JsonNode items = readItems(input);
        TrackerProperties.Defaults defaults = properties.getDefaults();
        String docType = properties.getNotices().getDocType();
        Set<String> known = new HashSet<>(repository.findSourceUrlsByStage(Stage.PRE_FORECLOSURE));

        List<NewPropertyRecord> records = new ArrayList<>();
        int alreadyKnown = 0;
        int skipped = 0;
        int guessed = 0;
        for (JsonNode item : items) {
            String detailUrl = text(item, "detail_url");
            if (detailUrl == null) {
                skipped++;
                continue;
            }
            if (!known.add(detailUrl)) {
                alreadyKnown++;
                continue;
            }
            String address = text(item, "address_guess");
            if (address == null) {
                Optional<String> guess = addressGuesser.guess(text(item, "text"))
                    .or(() -> addressGuesser.guess(text(item, "title")));
                if (guess.isPresent()) {
                    address = guess.get();
                    guessed++;
                }
            }
            records.add(new NewPropertyRecord(
                Stage.PRE_FORECLOSURE,
                null,
                address == null ? PropertyRecord.UNKNOWN_ADDRESS : address,
                defaults.getCity(),
                defaults.getState(),
                defaults.getZip(),
                text(item, "record_date"),
                docType,
                detailUrl
            ));
        }

        int inserted = repository.insertRecords(records);
        if (skipped > 0) {
            log.warn("Notice import skipped {} item(s) without a detail url", skipped);
        }
        log.info(
            "Notice import complete. received={} inserted={} alreadyKnown={} guessed={}",
            items.size(),
            inserted,
            alreadyKnown,
            guessed
        );
        return new NoticeImportSummary(items.size(), inserted, alreadyKnown, skipped, guessed);
    }

    private JsonNode readItems(InputStream input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new ImportValidationException("notice feed is not valid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new ImportValidationException("notice feed could not be read: " + e.getMessage());
        }
        if (root == null || root.isMissingNode()) {
            throw new ImportValidationException("notice feed is empty");
        }
        JsonNode items = root.isArray() ? root : root.get("items");
        if (items == null || !items.isArray()) {
            throw new ImportValidationException("notice feed must hold an items array");
        }
        return items;
    }

    private String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
