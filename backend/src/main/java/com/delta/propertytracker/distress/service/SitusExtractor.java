package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.util.AddressUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class SitusExtractor {
    private static final Pattern LOCATION_LABEL = Pattern.compile(
        "^(?:property\\s+|situs\\s+|physical\\s+)?location\\b(?:\\s+address)?\\s*([:#\\-])?\\s*(.*)$",
        Pattern.CASE_INSENSITIVE
    );
    // "Location of Property: ..." style labels
    private static final Pattern LABEL_CONTINUATION = Pattern.compile(
        "^(?:of|for)\\b[^:]*(?::\\s*(.*))?$",
        Pattern.CASE_INSENSITIVE
    );
    private static final String TRAILING_PUNCTUATION = ",;.:- ";

    /**
     * First labelled location that carries a street number, else the first labelled location at all.
     * A label whose value is empty takes the next non-empty line (label and value in separate cells).
     */
    public Optional<String> extractLocation(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        List<String> lines = textLines(body);
        List<String> candidates = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = LOCATION_LABEL.matcher(lines.get(i));
            if (!matcher.matches()) {
                continue;
            }
            String value = labelValue(matcher.group(1), matcher.group(2));
            if (value == null) {
                continue;
            }
            if (value.isEmpty() && i + 1 < lines.size()) {
                value = stripTrailing(lines.get(i + 1));
            }
            if (!value.isEmpty()) {
                candidates.add(value);
            }
        }
        for (String candidate : candidates) {
            if (AddressUtils.hasStreetNumber(candidate)) {
                return Optional.of(candidate);
            }
        }
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    // null when the line mentions a location without labelling one
    private String labelValue(String separator, String rest) {
        if (separator == null) {
            Matcher continuation = LABEL_CONTINUATION.matcher(rest);
            if (continuation.matches()) {
                String value = continuation.group(1);
                return value == null ? null : stripTrailing(value);
            }
        }
        return stripTrailing(rest);
    }

    public boolean isValidSitus(String location) {
        return AddressUtils.hasStreetNumber(location);
    }

    public String toPostalString(String location, String city, String state, String zip) {
        StringBuilder out = new StringBuilder(stripTrailing(location));
        if (city != null && !city.isBlank() && !AddressUtils.containsWord(out.toString(), city)) {
            out.append(", ").append(AddressUtils.collapse(city));
        }
        if (state != null && !state.isBlank() && !AddressUtils.containsWord(out.toString(), state)) {
            out.append(", ").append(AddressUtils.collapse(state));
        }
        if (zip != null && !zip.isBlank() && !AddressUtils.containsWord(out.toString(), zip)) {
            out.append(' ').append(zip.trim());
        }
        return out.toString();
    }

    List<String> textLines(String body) {
        String text = looksLikeHtml(body) ? htmlToText(body) : body;
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String collapsed = AddressUtils.collapse(line.replace('\u00A0', ' '));
            if (!collapsed.isEmpty()) {
                lines.add(collapsed);
            }
        }
        return lines;
    }

    private String htmlToText(String html) {
        Document document = Jsoup.parse(html);
        document.select("script, style, noscript").remove();
        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    out.append(((TextNode) node).text());
                } else if (node instanceof Element) {
                    Element element = (Element) node;
                    if (element.isBlock() || "br".equals(element.normalName())) {
                        out.append('\n');
                    } else {
                        // adjacent inline cells must not run together
                        out.append(' ');
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element) {
                    out.append(((Element) node).isBlock() ? '\n' : ' ');
                }
            }
        }, document.body());
        return out.toString();
    }

    private boolean looksLikeHtml(String body) {
        String head = body.length() > 512 ? body.substring(0, 512) : body;
        return head.contains("<") && head.contains(">");
    }

    private String stripTrailing(String value) {
        String trimmed = AddressUtils.collapse(value);
        while (!trimmed.isEmpty() && TRAILING_PUNCTUATION.indexOf(trimmed.charAt(trimmed.length() - 1)) >= 0) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
