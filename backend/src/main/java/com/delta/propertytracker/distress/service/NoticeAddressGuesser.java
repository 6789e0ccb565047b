package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.config.TrackerProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class NoticeAddressGuesser {
    private static final List<Pattern> LABELLED = List.of(
        Pattern.compile("property\\s+address\\s*:[ \\t]*(.+?)[ \\t]*(?:\\R|$)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("site\\s+address\\s*:[ \\t]*(.+?)[ \\t]*(?:\\R|$)", Pattern.CASE_INSENSITIVE)
    );
    private static final String EDGE_PUNCTUATION = " .";

    private final Pattern localAddress;

    public NoticeAddressGuesser(TrackerProperties properties) {
        TrackerProperties.Defaults defaults = properties.getDefaults();
        this.localAddress = Pattern.compile(
            "\\b(\\d{2,6}\\s+[A-Za-z0-9.\\-'\\s]+,\\s*" + Pattern.quote(defaults.getCity())
                + ",\\s*" + Pattern.quote(defaults.getState()) + "\\s*\\d{5})\\b",
            Pattern.CASE_INSENSITIVE
        );
    }

    public Optional<String> guess(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : LABELLED) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String value = trimEdges(matcher.group(1));
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        Matcher matcher = localAddress.matcher(text);
        if (matcher.find()) {
            return Optional.of(trimEdges(matcher.group(1)));
        }
        return Optional.empty();
    }

    private static String trimEdges(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && EDGE_PUNCTUATION.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_PUNCTUATION.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
