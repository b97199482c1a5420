package com.flowmable.epaper;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class WakeupScheduleTest {

    private final WakeupSchedule schedule = WakeupSchedule.from(FrameSettings.DEFAULT);

    private static LocalDateTime at(int hour, int minute) {
        return LocalDateTime.of(2026, 10, 18, hour, minute);
    }

    @Test
    void daytime_usesFixedInterval() {
        assertEquals(3600, schedule.secondsUntilNextWakeup(at(8, 0)));
        assertEquals(3600, schedule.secondsUntilNextWakeup(at(13, 45)));
        assertEquals(3600, schedule.secondsUntilNextWakeup(at(19, 59)));
    }

    @Test
    void evening_sleepsUntilTomorrowMorning() {
        assertEquals(12 * 3600, schedule.secondsUntilNextWakeup(at(20, 0)));
        assertEquals(8 * 3600 + 30 * 60, schedule.secondsUntilNextWakeup(at(23, 30)));
    }

    @Test
    void earlyMorning_sleepsUntilThisMorning() {
        assertEquals(3600, schedule.secondsUntilNextWakeup(at(7, 0)));
        assertEquals(8 * 3600, schedule.secondsUntilNextWakeup(at(0, 0)));
    }

    @Test
    void customWindow() {
        WakeupSchedule custom = new WakeupSchedule(6, 24, 900);
        assertEquals(900, custom.secondsUntilNextWakeup(at(23, 59)));
        assertEquals(6 * 3600, custom.secondsUntilNextWakeup(at(0, 0)));
    }

    @Test
    void invalidWindow_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new WakeupSchedule(20, 8, 3600));
        assertThrows(IllegalArgumentException.class, () -> new WakeupSchedule(8, 20, 0));
    }
}
