package io.jobhive.job.error;

/**
 * A subscriber asked to resume from a sequence that is no longer retained. The client has to
 * fetch full state and subscribe again without a cursor.
 */
public class ResumeGapException extends JobHiveException {

    private final String channel;
    private final long requestedSequence;
    private final long oldestRetained;

    public ResumeGapException(String channel, long requestedSequence, long oldestRetained) {
        super(ErrorCode.RESUME_GAP,
            "Cannot resume channel '%s' from sequence %d; oldest retained event is %d"
                .formatted(channel, requestedSequence, oldestRetained));
        this.channel = channel;
        this.requestedSequence = requestedSequence;
        this.oldestRetained = oldestRetained;
    }

    public String channel() {
        return channel;
    }

    public long requestedSequence() {
        return requestedSequence;
    }

    public long oldestRetained() {
        return oldestRetained;
    }
}
