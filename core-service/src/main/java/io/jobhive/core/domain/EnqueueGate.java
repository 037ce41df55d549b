package io.jobhive.core.domain;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Admission switch for new submissions. Closed while a required part of the broker topology is
 * missing, so no job is accepted that could not be dead-lettered.
 */
public class EnqueueGate {
    private final AtomicReference<String> closedReason = new AtomicReference<>();

    public boolean isOpen() {
        return closedReason.get() == null;
    }

    public String closedReason() {
        return closedReason.get();
    }

    /**
     * @return true if this call changed the state
     */
    public boolean close(String reason) {
        return closedReason.getAndSet(reason == null ? "closed" : reason) == null;
    }

    /**
     * @return true if this call changed the state
     */
    public boolean open() {
        return closedReason.getAndSet(null) != null;
    }
}
