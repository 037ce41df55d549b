package io.jobhive.core.app;

import io.jobhive.broker.JobTopology;
import io.jobhive.core.domain.EnqueueGate;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Closes the enqueue gate while any worker type's dead-letter queue is missing on the broker, and
 * reopens it once every queue is back.
 */
@Component
public class DeadLetterPathMonitor {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterPathMonitor.class);

    private final AmqpAdmin admin;
    private final JobTopology topology;
    private final WorkerTypeRegistry registry;
    private final EnqueueGate gate;

    public DeadLetterPathMonitor(AmqpAdmin admin, JobTopology topology, WorkerTypeRegistry registry, EnqueueGate gate) {
        this.admin = admin;
        this.topology = topology;
        this.registry = registry;
        this.gate = gate;
    }

    @Scheduled(fixedDelayString = "${jobhive.dispatch.dead-letter-check-interval-ms:30000}")
    public void check() {
        List<String> missing = new ArrayList<>();
        try {
            for (WorkerTypeRegistration registration : registry.all()) {
                String queue = topology.deadLetterQueue(registration.type());
                if (admin.getQueueProperties(queue) == null) {
                    missing.add(queue);
                }
            }
        } catch (AmqpException e) {
            log.warn("Dead-letter path check skipped, broker unreachable: {}", e.getMessage());
            return;
        }
        if (!missing.isEmpty()) {
            if (gate.close("dead-letter queue missing: " + String.join(", ", missing))) {
                log.error("Dead-letter queue(s) {} missing; job submission suspended", missing);
            }
        } else if (gate.open()) {
            log.info("Dead-letter queues present again; job submission resumed");
        }
    }
}
