package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.config.TrackerProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NoticeAddressGuesserTest {
    private final NoticeAddressGuesser guesser = new NoticeAddressGuesser(new TrackerProperties());

    @Test
    void readsLabelledPropertyAddress() {
        String text = "NOTICE OF TRUSTEE'S SALE\nAPN: 16-0241-11\nProperty Address: 455 W Fourth St.\nSale date: May 1";
        assertThat(guesser.guess(text)).contains("455 W Fourth St");
    }

    @Test
    void siteAddressLabelIsCaseInsensitive() {
        assertThat(guesser.guess("SITE ADDRESS:  12 Bridge St\nTrustee: Someone")).contains("12 Bridge St");
    }

    @Test
    void fallsBackToLocalStreetAddress() {
        String text = "The real property commonly known as 1020 Grass Valley Rd, Winnemucca, NV 89445 will be sold.";
        assertThat(guesser.guess(text)).contains("1020 Grass Valley Rd, Winnemucca, NV 89445");
    }

    @Test
    void emptyLabelFallsThroughToLaterPatterns() {
        String text = "Property Address:\nSite Address: 7 Hanson St";
        assertThat(guesser.guess(text)).contains("7 Hanson St");
    }

    @Test
    void textWithoutAddressYieldsNothing() {
        assertThat(guesser.guess("Notice of Trustee Sale")).isEmpty();
        assertThat(guesser.guess(null)).isEmpty();
    }
}
