package com.nosota.msale.error;

/**
 * Allocation index does not reference an existing allocation of the schedule.
 */
public class AllocationIndexOutOfRangeException extends RuntimeException {
    private final Long scheduleId;
    private final int index;

    public AllocationIndexOutOfRangeException(Long scheduleId, int index, long count) {
        super("Allocation index " + index + " out of range for schedule " + scheduleId + " with " + count + " allocations");
        this.scheduleId = scheduleId;
        this.index = index;
    }

    public Long getScheduleId() {
        return scheduleId;
    }

    public int getIndex() {
        return index;
    }
}
