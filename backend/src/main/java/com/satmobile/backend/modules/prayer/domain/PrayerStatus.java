package com.satmobile.backend.modules.prayer.domain;

public enum PrayerStatus {
    PRAYED("Prayed"),
    MISSED("Missed");

    private final String value;

    PrayerStatus(String value) {
        this.value = value;
    }

    /** Stored representation. */
    public String value() {
        return value;
    }

    public static boolean isPrayed(String stored) {
        return PRAYED.value.equals(stored);
    }
}
