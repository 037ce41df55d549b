package io.jobhive.core.app;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.core.config.DispatchProperties;
import io.jobhive.core.config.NotificationProperties;
import io.jobhive.core.domain.EnqueueGate;
import io.jobhive.core.infra.InMemoryJobStore;
import io.jobhive.core.notify.NotificationBroker;
import io.jobhive.job.Job;
import io.jobhive.job.WorkerType;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import io.jobhive.job.error.DispatchUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class UnpublishedJobSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final RecordingPublisher publisher = new RecordingPublisher();
    private final EnqueueGate gate = new EnqueueGate();
    private final DispatchProperties properties = new DispatchProperties(Duration.ofMinutes(2), 100, 500);
    private final NotificationBroker broker = new NotificationBroker(
        new NotificationProperties(10, 10, 10, Duration.ofSeconds(30), Duration.ZERO), clock, meters);
    private final Dispatcher dispatcher = new Dispatcher(gate,
        new WorkerTypeRegistry(List.of(new WorkerTypeRegistration(WorkerType.PUBLISHER, 1, "jobhive.jobs.publisher"))),
        store, publisher, new JobEvents(broker, mapper), clock, properties, meters);
    private final UnpublishedJobSweeper sweeper = new UnpublishedJobSweeper(store, dispatcher, gate, clock, properties);

    @AfterEach
    void tearDown() {
        broker.close();
    }

    @Test
    void republishesOnlyReservationsOlderThanTheGrace() {
        Job stale = reserve(NOW.minus(Duration.ofMinutes(10)));
        Job fresh = reserve(NOW.minus(Duration.ofSeconds(30)));

        sweeper.sweep();

        assertThat(publisher.published).extracting(m -> m.jobId()).containsExactly(stale.id());
        assertThat(store.find(stale.id()).orElseThrow().isPublished()).isTrue();
        assertThat(store.find(fresh.id()).orElseThrow().isPublished()).isFalse();
    }

    @Test
    void keepsReservationsWhenTheBrokerIsDown() {
        Job stale = reserve(NOW.minus(Duration.ofMinutes(10)));
        publisher.failure = new DispatchUnavailableException("Broker unavailable after 5 publish attempts");

        sweeper.sweep();

        assertThat(store.find(stale.id())).isPresent();
        assertThat(store.find(stale.id()).orElseThrow().isPublished()).isFalse();
    }

    @Test
    void skipsWhileTheGateIsClosed() {
        reserve(NOW.minus(Duration.ofMinutes(10)));
        gate.close("dead-letter queue missing");

        sweeper.sweep();

        assertThat(publisher.published).isEmpty();
    }

    private Job reserve(Instant createdAt) {
        Job job = Job.pending(WorkerType.PUBLISHER, mapper.createObjectNode(), 5, null, createdAt);
        store.reserve(job);
        return job;
    }
}
