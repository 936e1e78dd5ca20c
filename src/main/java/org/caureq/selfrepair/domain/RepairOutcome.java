package org.caureq.selfrepair.domain;

import java.util.Locale;

public enum RepairOutcome {
    SUCCESS, FAILURE, PARTIAL;

    public String dbValue() { return name().toLowerCase(Locale.ROOT); }

    public static RepairOutcome fromDb(String value) {
        if (value == null || value.isBlank()) return null;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
