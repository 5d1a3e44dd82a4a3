package com.satmobile.backend.modules.prayer.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.satmobile.backend.modules.store.domain.DocumentFields;
import com.satmobile.backend.modules.store.domain.StoredDocument;

/**
 * Custom session times of a tenant. Either permanent (id {@code default}) or bound to the
 * week starting on {@code weekStart}, a Tuesday. Days are keyed by lower case English day name.
 *
 * @param endTimes     session end per day
 * @param disabledDays date from which a day has no session
 */
public record PrayerSchedule(
        String id,
        boolean permanent,
        LocalDate weekStart,
        Map<String, LocalTime> endTimes,
        Map<String, LocalDate> disabledDays
) {

    public static final String DEFAULT_ID = "default";

    public static PrayerSchedule from(StoredDocument document) {
        Map<String, LocalTime> endTimes = new LinkedHashMap<>();
        document.getMap("times").forEach((day, value) -> {
            if (value instanceof Map<?, ?>) {
                parseTime(DocumentFields.string(document.getMap("times"), day + ".end"))
                        .ifPresent(end -> endTimes.put(day, end));
            }
        });
        Map<String, LocalDate> disabledDays = new LinkedHashMap<>();
        document.getMap("disabledDays").forEach((day, value) -> {
            if (value instanceof String text) {
                parseDate(text).ifPresent(from -> disabledDays.put(day, from));
            }
        });
        return new PrayerSchedule(
                document.id(),
                document.isTrue("isPermanent"),
                parseDate(document.getString("weekStart")).orElse(null),
                endTimes,
                disabledDays
        );
    }

    public boolean isDefault() {
        return permanent && DEFAULT_ID.equals(id);
    }

    public boolean isForWeek(LocalDate tuesday) {
        return !permanent && tuesday.equals(weekStart);
    }

    public boolean disables(String day, LocalDate date) {
        LocalDate from = disabledDays.get(day);
        return from != null && !date.isBefore(from);
    }

    private static Optional<LocalTime> parseTime(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalTime.parse(value.trim()));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> parseDate(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.trim()));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
