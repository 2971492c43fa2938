package com.nosota.msale.error;

public class VestingScheduleNotFoundException extends RuntimeException {
    public VestingScheduleNotFoundException(String message) {
        super(message);
    }

    public VestingScheduleNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
