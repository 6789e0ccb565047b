package com.delta.propertytracker.distress.model;

import java.util.Locale;

public enum Stage {
    PRE_FORECLOSURE("Pre-Foreclosure"),
    FORECLOSURE_SALE("Foreclosure / Sale"),
    REO("REO / Bank-Owned"),
    TAX_DELINQUENCY("Tax Delinquency"),
    OTHER("Other");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Stage fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-/]+", "_");
        try {
            return Stage.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
