package io.jobhive.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.jobhive.broker.ExponentialBackoff;
import io.jobhive.broker.JobMessage;
import io.jobhive.broker.JobMessageCodec;
import io.jobhive.broker.JobPublisher;
import io.jobhive.client.CoreApi;
import io.jobhive.core.app.Dispatcher;
import io.jobhive.core.app.JobEvents;
import io.jobhive.core.app.JobResultService;
import io.jobhive.core.config.DispatchProperties;
import io.jobhive.core.config.NotificationProperties;
import io.jobhive.core.domain.EnqueueGate;
import io.jobhive.core.infra.InMemoryJobStore;
import io.jobhive.core.notify.NotificationBroker;
import io.jobhive.core.notify.RecordingSink;
import io.jobhive.job.Job;
import io.jobhive.job.JobReceipt;
import io.jobhive.job.JobRequest;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.JobStatus;
import io.jobhive.job.WorkerType;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import io.jobhive.worker.JobContext;
import io.jobhive.worker.JobDelivery;
import io.jobhive.worker.JobHandler;
import io.jobhive.worker.JobWorkerRuntime;
import io.jobhive.worker.RuntimeSettings;
import io.jobhive.worker.WorkerPool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Submission through the dispatcher, execution in the worker runtime and result callback, wired
 * in-process with a queue standing in for the broker.
 */
class JobLifecycleFlowTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.systemUTC();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final WorkerTypeRegistration collectors =
        new WorkerTypeRegistration(WorkerType.COLLECTOR, 2, "jobhive.jobs.collector");
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final NotificationBroker broker = new NotificationBroker(
        new NotificationProperties(100, 100, 10, Duration.ofSeconds(30), Duration.ZERO), clock, meters);
    private final JobEvents events = new JobEvents(broker, mapper);
    private final QueuePublisher queue = new QueuePublisher();
    private final Dispatcher dispatcher = new Dispatcher(new EnqueueGate(),
        new WorkerTypeRegistry(List.of(collectors)), store, queue, events, clock,
        new DispatchProperties(Duration.ofMinutes(2), 100, 500), meters);
    private final JobResultService results = new JobResultService(store, events, clock, meters);
    private final JobMessageCodec codec = new JobMessageCodec(mapper);
    private JobWorkerRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
        broker.close();
    }

    @Test
    void jobRetriesOnceThenSucceedsAndEveryTransitionIsNotified() {
        AtomicInteger calls = new AtomicInteger();
        runtime = runtime(3, context -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("upstream 502");
            }
            return TextNode.valueOf("collected " + context.payload().get("source").asText());
        });
        RecordingSink ui = new RecordingSink();
        broker.subscribe("ui", Set.of(JobEvents.CHANNEL), Map.of(), ui);

        JobReceipt receipt = dispatcher.submit(new JobRequest("collector",
            mapper.createObjectNode().put("source", "crm"), null, "crm-2026-03-01"));
        List<String> settlements = drain();

        Job job = store.find(receipt.jobId()).orElseThrow();
        assertThat(job.status()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.attemptCount()).isEqualTo(1);
        assertThat(job.lastError()).isEqualTo("upstream 502");
        assertThat(job.result().asText()).isEqualTo("collected crm");
        assertThat(settlements).containsExactly("ack", "ack");
        await().atMost(Duration.ofSeconds(5)).until(() -> ui.events.size() == 5);
        assertThat(ui.events).extracting(e -> e.payload().get("status").asText())
            .containsExactly("PENDING", "IN_FLIGHT", "PENDING", "IN_FLIGHT", "SUCCEEDED");
        assertThat(ui.sequences()).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(ui.events).extracting(e -> e.payload().get("jobId").asText())
            .containsOnly(receipt.jobId().toString());
        assertThat(ui.events.get(ui.events.size() - 1).payload().get("status").asText())
            .isEqualTo(job.status().name());
    }

    @Test
    void alwaysFailingJobIsDeadLetteredAfterMaxAttempts() {
        runtime = runtime(3, context -> {
            throw new IllegalStateException("source offline");
        });

        JobReceipt receipt = dispatcher.submit(new JobRequest("Collectors", mapper.createObjectNode(), 9, null));
        List<String> settlements = drain();

        Job job = store.find(receipt.jobId()).orElseThrow();
        assertThat(job.status()).isEqualTo(JobStatus.DEAD_LETTERED);
        assertThat(job.attemptCount()).isEqualTo(3);
        assertThat(settlements).containsExactly("ack", "ack", "dead-letter");

        JobReceipt replay = dispatcher.replay(receipt.jobId());
        assertThat(store.find(replay.jobId()).orElseThrow().status()).isEqualTo(JobStatus.PENDING);
        assertThat(store.find(receipt.jobId()).orElseThrow().status()).isEqualTo(JobStatus.DEAD_LETTERED);
    }

    private List<String> drain() {
        List<String> settlements = new ArrayList<>();
        JobMessage next;
        while ((next = queue.poll()) != null) {
            String[] outcome = new String[1];
            runtime.process(codec.encode(next), new JobDelivery() {
                @Override
                public void ack() {
                    outcome[0] = "ack";
                }

                @Override
                public void reject(boolean requeue) {
                    outcome[0] = requeue ? "requeue" : "dead-letter";
                }
            });
            settlements.add(outcome[0]);
        }
        return settlements;
    }

    private JobWorkerRuntime runtime(int maxAttempts, Handler handler) {
        JobHandler collector = new JobHandler() {
            @Override
            public WorkerType workerType() {
                return WorkerType.COLLECTOR;
            }

            @Override
            public JsonNode handle(JobContext context) throws Exception {
                return handler.handle(context);
            }
        };
        CoreApi inProcess = new CoreApi() {
            @Override
            public JobReceipt submit(JobRequest request) {
                return dispatcher.submit(request);
            }

            @Override
            public void reportResult(UUID jobId, JobResultReport report) {
                results.report(jobId, report);
            }
        };
        RuntimeSettings settings = new RuntimeSettings(maxAttempts, Duration.ofSeconds(5),
            new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0));
        return new JobWorkerRuntime(List.of(new WorkerPool(collectors, collector)), codec, queue, inProcess,
            settings, meters, clock);
    }

    @FunctionalInterface
    private interface Handler {
        JsonNode handle(JobContext context) throws Exception;
    }

    /**
     * Retry parking goes straight back onto the work queue; the delay is the broker's business.
     */
    private static final class QueuePublisher implements JobPublisher {
        private final Deque<JobMessage> messages = new ArrayDeque<>();

        @Override
        public synchronized void publish(JobMessage job) {
            messages.addLast(job);
        }

        @Override
        public synchronized void publishRetry(JobMessage job, Duration delay) {
            messages.addLast(job);
        }

        synchronized JobMessage poll() {
            return messages.pollFirst();
        }
    }
}
