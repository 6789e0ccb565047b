package com.delta.propertytracker.distress.util;

import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.Stage;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RecordIdentityTest {

    @Test
    void keyUsesParcelNumberWhenPresent() {
        PropertyRecord record = record(1L, "12-3456-78", "Unknown address", "Winnemucca");
        assertThat(RecordIdentity.deriveKey(record)).isEqualTo("tax_delinquency|apn:12-3456-78");
    }

    @Test
    void keyFallsBackToAddressAndCity() {
        PropertyRecord record = record(1L, "  ", "100 Main St", "Winnemucca");
        assertThat(RecordIdentity.deriveKey(record)).isEqualTo("tax_delinquency|addr:100 main st|winnemucca");
    }

    @Test
    void keyIgnoresWhitespaceAndCase() {
        PropertyRecord a = record(1L, null, "100 Main St", "Winnemucca");
        PropertyRecord b = record(2L, null, "  100   MAIN\tst ", "WINNEMUCCA ");
        assertThat(RecordIdentity.deriveKey(a)).isEqualTo(RecordIdentity.deriveKey(b));

        PropertyRecord c = record(3L, "12-3456-78", "x", "y");
        PropertyRecord d = record(4L, " 12-3456-78 ", "other", "place");
        assertThat(RecordIdentity.deriveKey(c)).isEqualTo(RecordIdentity.deriveKey(d));
    }

    @Test
    void fingerprintIgnoresIdAndResolvedAt() {
        PropertyRecord a = record(1L, "12-3456-78", "Unknown address", "Winnemucca");
        PropertyRecord b = new PropertyRecord(
            99L, a.stage(), a.apn(), a.address(), a.city(), a.state(), a.zip(), a.recordDate(),
            a.docType(), a.sourceUrl(), a.assessorUrl(), a.resolvedSitus(), Instant.now()
        );
        assertThat(RecordIdentity.deriveFingerprint(a)).isEqualTo(RecordIdentity.deriveFingerprint(b));
    }

    @Test
    void fingerprintChangesWithTrackedFields() {
        PropertyRecord base = record(1L, "12-3456-78", "Unknown address", "Winnemucca");
        String fingerprint = RecordIdentity.deriveFingerprint(base);

        PropertyRecord resolved = new PropertyRecord(
            1L, base.stage(), base.apn(), base.address(), base.city(), base.state(), base.zip(),
            base.recordDate(), base.docType(), base.sourceUrl(), base.assessorUrl(), "100 MAIN ST", null
        );
        PropertyRecord zipChanged = new PropertyRecord(
            1L, base.stage(), base.apn(), base.address(), base.city(), base.state(), "89446",
            base.recordDate(), base.docType(), base.sourceUrl(), base.assessorUrl(), null, null
        );
        PropertyRecord looked = new PropertyRecord(
            1L, base.stage(), base.apn(), base.address(), base.city(), base.state(), base.zip(),
            base.recordDate(), base.docType(), base.sourceUrl(), "https://assessor.example/12345678", null, null
        );

        assertThat(RecordIdentity.deriveFingerprint(resolved)).isNotEqualTo(fingerprint);
        assertThat(RecordIdentity.deriveFingerprint(zipChanged)).isNotEqualTo(fingerprint);
        assertThat(RecordIdentity.deriveFingerprint(looked)).isNotEqualTo(fingerprint);
    }

    @Test
    void fieldBoundariesAreNotAmbiguous() {
        PropertyRecord a = new PropertyRecord(1L, Stage.OTHER, null, "1 A", "B", "NV", null, null, null, null, null, null, null);
        PropertyRecord b = new PropertyRecord(1L, Stage.OTHER, null, "1", "A B", "NV", null, null, null, null, null, null, null);
        assertThat(RecordIdentity.deriveFingerprint(a)).isNotEqualTo(RecordIdentity.deriveFingerprint(b));
    }

    @Test
    void fingerprintIsLowercaseSha256Hex() {
        String fingerprint = RecordIdentity.deriveFingerprint(record(1L, "12-3456-78", "Unknown address", "Winnemucca"));
        assertThat(fingerprint).hasSize(64).matches("[0-9a-f]+");
        assertThat(RecordIdentity.sha256Hex("")).isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    private PropertyRecord record(long id, String apn, String address, String city) {
        return new PropertyRecord(
            id,
            Stage.TAX_DELINQUENCY,
            apn,
            address,
            city,
            "NV",
            "89445",
            null,
            "Delinquent Tax Sale Parcel List",
            "https://county.example/list.pdf",
            null,
            null,
            null
        );
    }
}
