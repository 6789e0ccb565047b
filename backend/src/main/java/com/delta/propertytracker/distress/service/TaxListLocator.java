package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.config.TrackerProperties;
import com.delta.propertytracker.distress.http.PoliteHttpClient;
import com.delta.propertytracker.distress.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class TaxListLocator {
    private static final Logger log = LoggerFactory.getLogger(TaxListLocator.class);
    private static final int MIN_SCORE = 2;

    private final TrackerProperties properties;
    private final PoliteHttpClient httpClient;

    public TaxListLocator(TrackerProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    public String locateDocumentUrl() {
        String fallback = properties.getTaxList().getFallbackDocumentUrl();
        String pageUrl = properties.getTaxList().getListPageUrl();
        if (pageUrl == null || pageUrl.isBlank()) {
            return fallback;
        }

        HttpFetchResult page = httpClient.get(pageUrl, "text/html,application/xhtml+xml");
        if (!page.isSuccessful() || page.body() == null) {
            log.warn("Tax list page {} unavailable ({}); using fallback document", pageUrl, page.statusLabel());
            return fallback;
        }

        Document document = Jsoup.parse(page.body(), page.finalUrlOrRequested());
        for (Element link : document.select("a[href]")) {
            String href = link.attr("href").trim();
            if (!href.toLowerCase(Locale.ROOT).contains(".pdf")) {
                continue;
            }
            if (score(link.text(), href) >= MIN_SCORE) {
                String absolute = link.absUrl("href");
                String resolved = absolute.isBlank() ? href : absolute;
                log.info("Located tax list document {}", resolved);
                return resolved;
            }
        }
        log.warn("No tax list document linked from {}; using fallback document", pageUrl);
        return fallback;
    }

    static int score(String linkText, String href) {
        String text = linkText == null ? "" : linkText.toLowerCase(Locale.ROOT);
        String target = href == null ? "" : href.toLowerCase(Locale.ROOT);
        int score = 0;
        if (text.contains("parcel") || target.contains("parcel")) {
            score += 2;
        }
        if (text.contains("delinquent") || target.contains("delinquent")) {
            score += 2;
        }
        if (text.contains("sale") || target.contains("sale")) {
            score += 1;
        }
        return score;
    }
}
