package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.TaxListEntry;
import com.delta.propertytracker.distress.util.AddressUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

@Component
public class ParcelNumberParser {
    private static final int ADDRESS_LOOKAHEAD_LINES = 3;
    private static final int MIN_ADDRESS_LENGTH = 8;

    public List<TaxListEntry> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }

        // later sightings of a parcel replace the address guess but keep the first position
        Map<String, TaxListEntry> entries = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher matcher = AddressUtils.PARCEL_NUMBER.matcher(line);
            while (matcher.find()) {
                String apn = matcher.group();
                entries.put(apn, new TaxListEntry(apn, guessAddress(line.replace(apn, ""), lines, i)));
            }
        }
        return List.copyOf(entries.values());
    }

    private String guessAddress(String remainder, List<String> lines, int index) {
        List<String> candidates = new ArrayList<>();
        candidates.add(stripSeparators(remainder));
        for (int i = index + 1; i < lines.size() && i <= index + ADDRESS_LOOKAHEAD_LINES; i++) {
            candidates.add(lines.get(i));
        }
        for (String candidate : candidates) {
            if (candidate.length() >= MIN_ADDRESS_LENGTH
                && AddressUtils.hasStreetNumber(candidate)
                && !AddressUtils.PARCEL_NUMBER.matcher(candidate).find()) {
                return AddressUtils.collapse(candidate);
            }
        }
        return null;
    }

    private String stripSeparators(String value) {
        return value.replaceAll("^[\\s\\-:]+|[\\s\\-:]+$", "");
    }
}
