package com.nosota.msale.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Time window in which a sale admits contributions. Both bounds are inclusive.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class SaleWindow {

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    public boolean hasStarted(Instant now) {
        return !now.isBefore(startTime);
    }

    public boolean isOpen(Instant now) {
        return hasStarted(now) && !now.isAfter(endTime);
    }

    public boolean hasExpired(Instant now) {
        return now.isAfter(endTime);
    }
}
