package io.jobhive.core.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobhive.core.notify.NotificationBroker;
import io.jobhive.job.ChangeEvent;
import io.jobhive.job.Job;
import org.springframework.stereotype.Component;

/**
 * Emits job state changes on the {@value #CHANNEL} channel. Besides the job statuses, a
 * reservation withdrawn because its publish failed is announced with status {@value #DISCARDED}.
 */
@Component
public class JobEvents {
    public static final String CHANNEL = "jobs";
    public static final String DISCARDED = "DISCARDED";

    private final NotificationBroker broker;
    private final ObjectMapper mapper;

    public JobEvents(NotificationBroker broker, ObjectMapper mapper) {
        this.broker = broker;
        this.mapper = mapper;
    }

    public ChangeEvent jobChanged(Job job) {
        return publish(job, job.status().name());
    }

    public ChangeEvent jobDiscarded(Job job) {
        return publish(job, DISCARDED);
    }

    private ChangeEvent publish(Job job, String status) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("jobId", job.id().toString());
        payload.put("workerType", job.workerType().name());
        payload.put("status", status);
        payload.put("attemptCount", job.attemptCount());
        if (job.lastError() != null) {
            payload.put("lastError", job.lastError());
        }
        return broker.publish(CHANNEL, payload);
    }
}
