package io.caretaker.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.caretaker.core.config.ConfigException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TriggerTest {

    @Test
    void dailyTriggerShouldRollToTomorrowWhenTimeHasPassed() {
        Trigger trigger = Trigger.dailyAt("00:00");

        Instant next = trigger.nextRun(Instant.parse("2026-03-10T23:00:00Z"), ZoneOffset.UTC);

        assertThat(next).isEqualTo(Instant.parse("2026-03-11T00:00:00Z"));
    }

    @Test
    void dailyTriggerShouldFireLaterTodayWhenStillAhead() {
        Trigger trigger = Trigger.dailyAt("14:30");

        Instant next = trigger.nextRun(Instant.parse("2026-03-10T09:15:00Z"), ZoneOffset.UTC);

        assertThat(next).isEqualTo(Instant.parse("2026-03-10T14:30:00Z"));
    }

    @Test
    void dailyTriggerShouldNotFireTwiceAtTheSameInstant() {
        Trigger trigger = Trigger.dailyAt("02:00");

        Instant next = trigger.nextRun(Instant.parse("2026-03-10T02:00:00Z"), ZoneOffset.UTC);

        assertThat(next).isEqualTo(Instant.parse("2026-03-11T02:00:00Z"));
    }

    @Test
    void dailyTriggerShouldUseTheGivenZone() {
        Trigger trigger = Trigger.dailyAt("00:00");
        ZoneId johannesburg = ZoneId.of("Africa/Johannesburg");

        Instant next = trigger.nextRun(Instant.parse("2026-03-10T21:00:00Z"), johannesburg);

        assertThat(next).isEqualTo(Instant.parse("2026-03-10T22:00:00Z"));
    }

    @Test
    void intervalTriggerShouldAddThePeriod() {
        Trigger trigger = Trigger.everyMinutes(30);

        Instant next = trigger.nextRun(Instant.parse("2026-03-10T10:00:00Z"), ZoneOffset.UTC);

        assertThat(next).isEqualTo(Instant.parse("2026-03-10T10:30:00Z"));
        assertThat(trigger.describe()).isEqualTo("every 30 minutes");
    }

    @Test
    void shouldRejectMalformedTriggers() {
        assertThatThrownBy(() -> Trigger.dailyAt("24:00")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> Trigger.dailyAt("7:00")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> Trigger.dailyAt("07:60")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> Trigger.dailyAt(null)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> Trigger.everyMinutes(0)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> Trigger.everyMinutes(-5)).isInstanceOf(ConfigException.class);
    }
}
