package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.TaxListEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ParcelNumberParserTest {
    private final ParcelNumberParser parser = new ParcelNumberParser();

    @Test
    void returnsDistinctParcelsInFirstSeenOrder() {
        String text = """
            DELINQUENT TAX SALE PARCEL LIST
            16-0385-04 SMITH JOHN
            08-0117-22 DOE JANE
            16-0385-04 SMITH JOHN (continued)
            123-45-678 not a parcel
            """;
        List<TaxListEntry> entries = parser.parse(text);
        assertThat(entries).extracting(TaxListEntry::apn).containsExactly("16-0385-04", "08-0117-22");
    }

    @Test
    void guessesAddressFromSameOrFollowingLines() {
        String text = """
            16-0241-11 - 455 W Fourth St
            08-0117-22 OWNER UNKNOWN
            Mailing c/o estate
            780 Bridge Street
            """;
        List<TaxListEntry> entries = parser.parse(text);
        assertThat(entries).containsExactly(
            new TaxListEntry("16-0241-11", "455 W Fourth St"),
            new TaxListEntry("08-0117-22", "780 Bridge Street")
        );
    }

    @Test
    void noAddressGuessWhenNothingLooksLikeAStreet() {
        List<TaxListEntry> entries = parser.parse("Parcel 16-0241-11\nOwner: ACME LLC");
        assertThat(entries).containsExactly(new TaxListEntry("16-0241-11", null));
    }

    @Test
    void blankTextHasNoParcels() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("Page 1 of 3")).isEmpty();
    }
}
