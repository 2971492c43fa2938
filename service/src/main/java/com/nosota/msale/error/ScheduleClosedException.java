package com.nosota.msale.error;

/**
 * Allocation attempted at or after the schedule's unlock date.
 */
public class ScheduleClosedException extends RuntimeException {
    public ScheduleClosedException(String message) {
        super(message);
    }

    public ScheduleClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
