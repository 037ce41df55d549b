package io.jobhive.job.error;

public class ScheduleStoreCorruptedException extends JobHiveException {

    private final String scheduleId;

    public ScheduleStoreCorruptedException(String scheduleId, String message, Throwable cause) {
        super(ErrorCode.SCHEDULE_STORE_CORRUPTED, "Schedule '%s': %s".formatted(scheduleId, message), cause);
        this.scheduleId = scheduleId;
    }

    public String scheduleId() {
        return scheduleId;
    }
}
