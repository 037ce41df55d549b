package io.jobhive.core.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.jobhive.core.config.NotificationProperties;
import io.jobhive.core.infra.InMemoryJobStore;
import io.jobhive.core.notify.NotificationBroker;
import io.jobhive.core.notify.RecordingSink;
import io.jobhive.job.Job;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.JobStatus;
import io.jobhive.job.WorkerType;
import io.jobhive.job.error.JobNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class JobResultServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final NotificationBroker broker = new NotificationBroker(
        new NotificationProperties(100, 100, 10, Duration.ofSeconds(30), Duration.ZERO), clock, meters);
    private final JobResultService service = new JobResultService(store, new JobEvents(broker, mapper), clock, meters);

    @AfterEach
    void tearDown() {
        broker.close();
    }

    @Test
    void appliesTheLifecycleAndEmitsOneEventPerChange() {
        Job job = reserved();
        RecordingSink sink = new RecordingSink();
        broker.subscribe("ui", Set.of(JobEvents.CHANNEL), Map.of(), sink);

        service.report(job.id(), JobResultReport.inFlight(0));
        service.report(job.id(), JobResultReport.retrying(1, "timeout"));
        service.report(job.id(), JobResultReport.inFlight(1));
        Job done = service.report(job.id(), JobResultReport.succeeded(1, TextNode.valueOf("42 rows")));

        assertThat(done.status()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(done.attemptCount()).isEqualTo(1);
        assertThat(done.lastAttemptAt()).isEqualTo(NOW);
        assertThat(done.lastError()).isEqualTo("timeout");
        assertThat(done.result().asText()).isEqualTo("42 rows");
        await().atMost(Duration.ofSeconds(5)).until(() -> sink.events.size() == 4);
        assertThat(sink.events).extracting(e -> e.payload().get("status").asText())
            .containsExactly("IN_FLIGHT", "PENDING", "IN_FLIGHT", "SUCCEEDED");
    }

    @Test
    void reportsAfterATerminalStateAreIgnored() {
        Job job = reserved();
        service.report(job.id(), JobResultReport.deadLettered(3, "gave up"));

        Job after = service.report(job.id(), JobResultReport.succeeded(3, TextNode.valueOf("late")));

        assertThat(after.status()).isEqualTo(JobStatus.DEAD_LETTERED);
        assertThat(after.result()).isNull();
        assertThat(broker.latestSequence(JobEvents.CHANNEL)).isEqualTo(1);
        assertThat(meters.counter("jobhive.jobs.completed", "type", "COLLECTOR", "status", "DEAD_LETTERED").count())
            .isEqualTo(1.0);
    }

    @Test
    void unknownJobIsNotFound() {
        assertThatThrownBy(() -> service.report(UUID.randomUUID(), JobResultReport.inFlight(0)))
            .isInstanceOf(JobNotFoundException.class);
    }

    private Job reserved() {
        Job job = Job.pending(WorkerType.COLLECTOR, mapper.createObjectNode(), 5, null, NOW);
        store.reserve(job);
        store.markPublished(job.id(), NOW);
        return job;
    }
}
