package com.delta.propertytracker.distress.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SitusExtractorTest {
    private final SitusExtractor extractor = new SitusExtractor();

    @Test
    void readsLocationFromPlainText() {
        assertThat(extractor.extractLocation("Parcel 12-3456-78\nLocation: 100 Main St\nOwner: Someone"))
            .contains("100 Main St");
    }

    @Test
    void readsLocationFromTableCells() {
        String html = """
            <html><body>
              <table>
                <tr><th>Parcel</th><td>16-0241-11</td></tr>
                <tr><th>Property Location</th><td>455&nbsp;W Fourth St</td></tr>
              </table>
            </body></html>
            """;
        assertThat(extractor.extractLocation(html)).contains("455 W Fourth St");
    }

    @Test
    void prefersCandidateWithStreetNumber() {
        String text = "Location: WINNEMUCCA\nSitus Location: 12 Bridge St";
        assertThat(extractor.extractLocation(text)).contains("12 Bridge St");
    }

    @Test
    void numberlessLocationIsReturnedButInvalid() {
        assertThat(extractor.extractLocation("Location ANYTOWN")).contains("ANYTOWN");
        assertThat(extractor.isValidSitus("ANYTOWN")).isFalse();
    }

    @Test
    void labelPhraseIsNotTakenAsTheValue() {
        assertThat(extractor.extractLocation("Location of Property: 100 Main St")).contains("100 Main St");
        assertThat(extractor.extractLocation("Location for Tax Purposes:\n22 River Rd")).contains("22 River Rd");
        assertThat(extractor.extractLocation("Location of parcel is shown on the map")).isEmpty();
    }

    @Test
    void inlineLabelFollowedDirectlyByValue() {
        String html = "<html><body><div><b>Location</b><span>100 Main St</span></div></body></html>";
        assertThat(extractor.extractLocation(html)).contains("100 Main St");
    }

    @Test
    void missingLabelYieldsNothing() {
        assertThat(extractor.extractLocation("<p>No records found</p>")).isEmpty();
        assertThat(extractor.extractLocation("")).isEmpty();
    }

    @Test
    void postalStringAddsOnlyMissingParts() {
        assertThat(extractor.toPostalString("100 Main St", "Winnemucca", "NV", "89445"))
            .isEqualTo("100 Main St, Winnemucca, NV 89445");
        assertThat(extractor.toPostalString("100 Main St, WINNEMUCCA NV", "Winnemucca", "NV", "89445"))
            .isEqualTo("100 Main St, WINNEMUCCA NV 89445");
        assertThat(extractor.toPostalString("100 Main St Winnemucca NV 89445,", "Winnemucca", "NV", "89445"))
            .isEqualTo("100 Main St Winnemucca NV 89445");
    }
}
