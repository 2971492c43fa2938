package com.nosota.msale.model;

import com.nosota.msale.error.UnauthorizedException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * Global state of one vesting ledger: the unlock date, the interval grid and the interval counter.
 *
 * <p>Interval {@code k} (1-based) becomes reachable once more than {@code (k - 1) * intervalDuration}
 * has elapsed since {@code unlockDate}. The counter advances by at most one per check, never
 * decreases and never exceeds {@code numIntervals}.
 */
@Entity
@Table(name = "vesting_schedule")
@Getter
@Setter
@NoArgsConstructor
public class VestingSchedule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Account holding the administrator capability of this ledger.
     * For schedules created with a sale this is the sale's treasury account.
     */
    @Column(name = "administrator", nullable = false)
    private String administrator;

    @Column(name = "unlock_date", nullable = false)
    private Instant unlockDate;

    @Column(name = "interval_seconds", nullable = false)
    private Long intervalSeconds;

    @Column(name = "num_intervals", nullable = false)
    private Integer numIntervals;

    @Column(name = "current_interval", nullable = false)
    private Integer currentInterval;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public VestingSchedule(String administrator, Instant unlockDate, Duration intervalDuration,
                           int numIntervals, Instant createdAt) {
        if (intervalDuration.getSeconds() < 1 || intervalDuration.getNano() != 0) {
            throw new IllegalArgumentException("Interval duration must be a positive number of whole seconds: "
                    + intervalDuration);
        }
        if (numIntervals < 1) {
            throw new IllegalArgumentException("Number of intervals must be at least 1: " + numIntervals);
        }
        this.administrator = administrator;
        this.unlockDate = unlockDate;
        this.intervalSeconds = intervalDuration.getSeconds();
        this.numIntervals = numIntervals;
        this.currentInterval = 0;
        this.createdAt = createdAt;
    }

    public Duration getIntervalDuration() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public void requireAdministrator(String caller) {
        if (!administrator.equals(caller)) {
            throw new UnauthorizedException("Account " + caller + " is not the administrator of vesting schedule " + id);
        }
    }

    /**
     * Allocations may only be registered strictly before the unlock date.
     */
    public boolean isOpenForAllocations(Instant now) {
        return now.isBefore(unlockDate);
    }

    /**
     * Whether the next interval boundary has been passed.
     *
     * @param now Current time snapshot
     * @return true if {@link #advance()} may be called
     */
    public boolean canAdvance(Instant now) {
        if (currentInterval >= numIntervals) {
            return false;
        }
        Duration elapsed = Duration.between(unlockDate, now);
        if (elapsed.isNegative() || elapsed.isZero()) {
            return false;
        }
        return elapsed.compareTo(getIntervalDuration().multipliedBy(currentInterval)) > 0;
    }

    /**
     * Moves to the next interval.
     *
     * @return the new current interval
     * @throws IllegalStateException if the final interval was already reached
     */
    public int advance() {
        if (currentInterval >= numIntervals) {
            throw new IllegalStateException("Vesting schedule " + id + " already reached its final interval " + numIntervals);
        }
        currentInterval = currentInterval + 1;
        return currentInterval;
    }

    public boolean isFinalInterval() {
        return currentInterval.equals(numIntervals);
    }
}
