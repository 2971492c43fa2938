package com.nosota.msale.model;

import com.nosota.msale.error.UnauthorizedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("2. Vesting schedule")
class VestingScheduleTest {

    private static final Instant UNLOCK = Instant.parse("2030-06-01T00:00:00Z");
    private static final Duration DAY = Duration.ofDays(1);

    private VestingSchedule schedule(int numIntervals) {
        return new VestingSchedule("admin", UNLOCK, DAY, numIntervals, UNLOCK.minus(DAY));
    }

    @Test
    @DisplayName("VST-001: allocations are accepted strictly before the unlock date")
    void openForAllocations() {
        VestingSchedule schedule = schedule(4);

        assertThat(schedule.isOpenForAllocations(UNLOCK.minusSeconds(1))).isTrue();
        assertThat(schedule.isOpenForAllocations(UNLOCK)).isFalse();
        assertThat(schedule.isOpenForAllocations(UNLOCK.plusSeconds(1))).isFalse();
    }

    @Test
    @DisplayName("VST-002: the first interval starts right after the unlock date")
    void firstInterval() {
        VestingSchedule schedule = schedule(4);

        assertThat(schedule.canAdvance(UNLOCK.minusSeconds(1))).isFalse();
        assertThat(schedule.canAdvance(UNLOCK)).isFalse();
        assertThat(schedule.canAdvance(UNLOCK.plusSeconds(1))).isTrue();
    }

    @Test
    @DisplayName("VST-003: later intervals need strictly more than k interval lengths to have elapsed")
    void intervalBoundaries() {
        VestingSchedule schedule = schedule(4);
        schedule.advance();

        assertThat(schedule.canAdvance(UNLOCK.plus(DAY))).isFalse();
        assertThat(schedule.canAdvance(UNLOCK.plus(DAY).plusSeconds(1))).isTrue();
    }

    @Test
    @DisplayName("VST-004: one advance per check, even when several boundaries have passed")
    void oneStepAtATime() {
        VestingSchedule schedule = schedule(4);
        Instant late = UNLOCK.plus(DAY.multipliedBy(10));

        assertThat(schedule.canAdvance(late)).isTrue();
        assertThat(schedule.advance()).isEqualTo(1);
        assertThat(schedule.canAdvance(late)).isTrue();
        assertThat(schedule.advance()).isEqualTo(2);
    }

    @Test
    @DisplayName("VST-005: the counter stops at the final interval")
    void stopsAtFinalInterval() {
        VestingSchedule schedule = schedule(2);
        Instant late = UNLOCK.plus(DAY.multipliedBy(10));
        schedule.advance();
        schedule.advance();

        assertThat(schedule.isFinalInterval()).isTrue();
        assertThat(schedule.canAdvance(late)).isFalse();
        assertThatThrownBy(schedule::advance).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("VST-006: invalid interval configuration is rejected")
    void invalidConfiguration() {
        assertThatThrownBy(() -> new VestingSchedule("admin", UNLOCK, Duration.ZERO, 4, UNLOCK))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VestingSchedule("admin", UNLOCK, DAY, 0, UNLOCK))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VestingSchedule("admin", UNLOCK, Duration.ofMillis(500), 4, UNLOCK))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VestingSchedule("admin", UNLOCK, Duration.ofMillis(1500), 4, UNLOCK))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VestingSchedule("admin", UNLOCK, Duration.ofSeconds(-1), 4, UNLOCK))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(new VestingSchedule("admin", UNLOCK, Duration.ofSeconds(1), 4, UNLOCK).getIntervalDuration())
                .isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("VST-007: only the administrator passes the capability check")
    void administratorCheck() {
        VestingSchedule schedule = schedule(4);

        schedule.requireAdministrator("admin");
        assertThatThrownBy(() -> schedule.requireAdministrator("mallory"))
                .isInstanceOf(UnauthorizedException.class);
    }
}
