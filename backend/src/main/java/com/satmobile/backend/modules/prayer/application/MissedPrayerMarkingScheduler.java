package com.satmobile.backend.modules.prayer.application;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "satmobile.prayer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MissedPrayerMarkingScheduler {

    private final MissedPrayerMarkingService markingService;
    private final Clock clock;

    public MissedPrayerMarkingScheduler(MissedPrayerMarkingService markingService, Clock clock) {
        this.markingService = markingService;
        this.clock = clock;
    }

    @Scheduled(cron = "${satmobile.prayer.marking-cron:0 * * * * *}", zone = "UTC")
    public void tick() {
        markingService.markMissedPrayers(clock.instant());
    }
}
