package io.jobhive.job;

public enum JobStatus {
    PENDING,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED,
    DEAD_LETTERED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == DEAD_LETTERED;
    }

    public boolean canTransitionTo(JobStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            // PENDING -> PENDING covers a retry report whose preceding IN_FLIGHT report was lost
            case PENDING -> true;
            // IN_FLIGHT -> IN_FLIGHT is a broker redelivery; IN_FLIGHT -> PENDING is a scheduled retry
            case IN_FLIGHT -> true;
            case SUCCEEDED, FAILED, DEAD_LETTERED -> false;
        };
    }
}
