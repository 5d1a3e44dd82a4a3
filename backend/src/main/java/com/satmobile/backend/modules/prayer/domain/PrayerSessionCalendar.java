package com.satmobile.backend.modules.prayer.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Morning prayer sessions in tenant local time. There is no session on Monday. Custom
 * schedules override the default end times: a schedule for the current week wins over the
 * permanent one, and either can disable a day from a given date on.
 */
public final class PrayerSessionCalendar {

    private static final Map<DayOfWeek, LocalTime> DEFAULT_END_TIMES = Map.of(
            DayOfWeek.TUESDAY, LocalTime.of(6, 30),
            DayOfWeek.WEDNESDAY, LocalTime.of(6, 0),
            DayOfWeek.THURSDAY, LocalTime.of(6, 0),
            DayOfWeek.FRIDAY, LocalTime.of(6, 30),
            DayOfWeek.SATURDAY, LocalTime.of(7, 0),
            DayOfWeek.SUNDAY, LocalTime.of(7, 0)
    );

    private PrayerSessionCalendar() {
    }

    /** End of the session held on {@code date}, empty when the day has none. */
    public static Optional<LocalTime> sessionEnd(LocalDate date, List<PrayerSchedule> schedules) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        LocalTime fallback = DEFAULT_END_TIMES.get(dayOfWeek);
        if (fallback == null) {
            return Optional.empty();
        }
        String day = dayOfWeek.name().toLowerCase(Locale.ROOT);
        LocalDate tuesday = weekStart(date);
        Optional<PrayerSchedule> weekSchedule = schedules.stream().filter(s -> s.isForWeek(tuesday)).findFirst();
        Optional<PrayerSchedule> defaultSchedule = schedules.stream().filter(PrayerSchedule::isDefault).findFirst();

        boolean disabled = weekSchedule.map(s -> s.disables(day, date)).orElse(false)
                || defaultSchedule.map(s -> s.disables(day, date)).orElse(false);
        if (disabled) {
            return Optional.empty();
        }
        return weekSchedule.map(s -> s.endTimes().get(day))
                .or(() -> defaultSchedule.map(s -> s.endTimes().get(day)))
                .or(() -> Optional.of(fallback));
    }

    /** Tuesday on or before {@code date}; prayer weeks run Tuesday to Monday. */
    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.TUESDAY));
    }

    /**
     * Whether {@code localNow} falls in the marking window of a session ending at
     * {@code sessionEnd} on {@code date}: from one minute after the end, for
     * {@code windowMinutes}, start inclusive and end exclusive.
     */
    public static boolean isInMarkingWindow(LocalDateTime localNow, LocalDate date, LocalTime sessionEnd, int windowMinutes) {
        LocalDateTime opens = date.atTime(sessionEnd).plusMinutes(1);
        LocalDateTime closes = opens.plusMinutes(windowMinutes);
        return !localNow.isBefore(opens) && localNow.isBefore(closes);
    }
}
