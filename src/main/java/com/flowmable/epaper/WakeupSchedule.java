package com.flowmable.epaper;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Tells the panel how long to deep-sleep before polling again.
 * <p>
 * Inside the daytime window the panel wakes on a fixed interval. Outside it, the
 * panel sleeps straight through to the start of the next window.
 */
public class WakeupSchedule {

    private final LocalTime dayStart;
    private final int dayEndHour;
    private final int dayIntervalSeconds;

    public WakeupSchedule(int dayStartHour, int dayEndHour, int dayIntervalSeconds) {
        if (dayStartHour < 0 || dayStartHour > 23 || dayEndHour <= dayStartHour || dayEndHour > 24) {
            throw new IllegalArgumentException("Invalid daytime window: " + dayStartHour + "-" + dayEndHour);
        }
        if (dayIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Day interval must be positive: " + dayIntervalSeconds);
        }
        this.dayStart = LocalTime.of(dayStartHour, 0);
        this.dayEndHour = dayEndHour;
        this.dayIntervalSeconds = dayIntervalSeconds;
    }

    public static WakeupSchedule from(FrameSettings settings) {
        return new WakeupSchedule(settings.dayStartHour(), settings.dayEndHour(), settings.dayIntervalSeconds());
    }

    public long secondsUntilNextWakeup(LocalDateTime now) {
        LocalDateTime todayStart = now.toLocalDate().atTime(dayStart);
        LocalDateTime todayEnd = now.toLocalDate().atStartOfDay().plusHours(dayEndHour);

        if (!now.isBefore(todayStart) && now.isBefore(todayEnd)) {
            return dayIntervalSeconds;
        }
        LocalDateTime nextStart = now.isBefore(todayStart) ? todayStart : todayStart.plusDays(1);
        return Duration.between(now, nextStart).getSeconds();
    }
}
