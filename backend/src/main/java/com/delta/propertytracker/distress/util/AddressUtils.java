package com.delta.propertytracker.distress.util;

import com.delta.propertytracker.distress.model.PropertyRecord;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class AddressUtils {
    public static final Pattern PARCEL_NUMBER = Pattern.compile("\\b\\d{2}-\\d{4}-\\d{2}\\b");
    private static final Pattern STREET_NUMBER = Pattern.compile("\\b\\d{1,6}\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AddressUtils() {
    }

    public static boolean hasStreetNumber(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return STREET_NUMBER.matcher(text).find();
    }

    public static String streetAddressOf(PropertyRecord record) {
        if (record.hasResolvedSitus()) {
            return record.resolvedSitus().trim();
        }
        String address = record.address();
        if (address != null && !isPlaceholder(address) && hasStreetNumber(address)) {
            return joinPostal(address, record.city(), record.state(), record.zip());
        }
        return null;
    }

    public static boolean isPlaceholder(String address) {
        if (address == null || address.isBlank()) {
            return true;
        }
        String lower = address.trim().toLowerCase(Locale.ROOT);
        return lower.equals(PropertyRecord.UNKNOWN_ADDRESS.toLowerCase(Locale.ROOT)) || lower.equals("unresolved");
    }

    public static String digitsOnly(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                out.append(c);
            }
        }
        return out.toString();
    }

    public static String joinPostal(String address, String city, String state, String zip) {
        StringBuilder out = new StringBuilder(collapse(address));
        if (city != null && !city.isBlank()) {
            out.append(", ").append(collapse(city));
        }
        if (state != null && !state.isBlank()) {
            out.append(", ").append(collapse(state));
        }
        if (zip != null && !zip.isBlank()) {
            out.append(' ').append(collapse(zip));
        }
        return out.toString();
    }

    public static boolean containsWord(String text, String word) {
        if (text == null || word == null || word.isBlank()) {
            return false;
        }
        Matcher matcher = Pattern.compile("\\b" + Pattern.quote(word.trim()) + "\\b", Pattern.CASE_INSENSITIVE)
            .matcher(text);
        return matcher.find();
    }

    public static String collapse(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
