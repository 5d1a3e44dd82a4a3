package com.satmobile.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings of the job that marks undecided prayer records as missed.
 *
 * @param enabled          registers the scheduler when true
 * @param defaultTimezone  zone used for tenants without a valid {@code settings.timezone}
 * @param windowMinutes    length of the marking window that opens one minute after session end
 */
@ConfigurationProperties(prefix = "satmobile.prayer")
public record PrayerMarkingProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("America/New_York") String defaultTimezone,
        @DefaultValue("5") int windowMinutes
) {
}
