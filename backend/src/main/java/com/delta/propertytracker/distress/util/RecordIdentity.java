package com.delta.propertytracker.distress.util;

import com.delta.propertytracker.distress.model.PropertyRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity key and change fingerprint of a property record.
 *
 * <p>The key names the logical entity a record describes: stage plus parcel number when one is known,
 * otherwise stage plus address and city. The fingerprint covers every change-tracked field, so two
 * snapshots of the same key with different fingerprints mean the record was modified. Record id and
 * {@code resolvedAt} are not tracked.
 */
public final class RecordIdentity {
    // Control characters collapse to a space in normalize(), so the separator never occurs in content.
    private static final String FIELD_SEPARATOR = "\u001F";
    private static final Pattern WHITESPACE_OR_CONTROL = Pattern.compile("[\\s\\p{Cntrl}]+");

    private RecordIdentity() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String collapsed = WHITESPACE_OR_CONTROL.matcher(value).replaceAll(" ");
        return collapsed.trim().toLowerCase(Locale.ROOT);
    }

    public static String deriveKey(PropertyRecord record) {
        String stage = normalize(record.stage() == null ? null : record.stage().name());
        String apn = normalize(record.apn());
        if (!apn.isEmpty()) {
            return stage + "|apn:" + apn;
        }
        return stage + "|addr:" + normalize(record.address()) + "|" + normalize(record.city());
    }

    public static String deriveFingerprint(PropertyRecord record) {
        String[] tracked = {
            record.stage() == null ? null : record.stage().name(),
            record.apn(),
            record.address(),
            record.city(),
            record.state(),
            record.zip(),
            record.recordDate(),
            record.docType(),
            record.sourceUrl(),
            record.assessorUrl(),
            record.resolvedSitus()
        };
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < tracked.length; i++) {
            if (i > 0) {
                joined.append(FIELD_SEPARATOR);
            }
            joined.append(normalize(tracked[i]));
        }
        return sha256Hex(joined.toString());
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
