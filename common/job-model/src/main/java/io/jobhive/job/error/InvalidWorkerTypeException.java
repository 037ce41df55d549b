package io.jobhive.job.error;

public class InvalidWorkerTypeException extends JobHiveException {

    private final String workerType;

    public InvalidWorkerTypeException(String workerType) {
        super(ErrorCode.INVALID_WORKER_TYPE, "Worker type '%s' is not registered".formatted(workerType));
        this.workerType = workerType;
    }

    public String workerType() {
        return workerType;
    }
}
