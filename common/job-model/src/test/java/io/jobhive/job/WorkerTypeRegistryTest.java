package io.jobhive.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jobhive.job.error.ErrorCode;
import io.jobhive.job.error.InvalidWorkerTypeException;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkerTypeRegistryTest {

    private final WorkerTypeRegistry registry = new WorkerTypeRegistry(List.of(
        new WorkerTypeRegistration(WorkerType.COLLECTOR, 4, "jobhive.jobs.collector"),
        new WorkerTypeRegistration(WorkerType.BOT, 2, "jobhive.jobs.bot")));

    @Test
    void resolvesConstantAndPoolLabelNames() {
        assertThat(registry.require("COLLECTOR").concurrencyLimit()).isEqualTo(4);
        assertThat(registry.require("collector").type()).isEqualTo(WorkerType.COLLECTOR);
        assertThat(registry.require("Bots").type()).isEqualTo(WorkerType.BOT);
    }

    @Test
    void rejectsUnknownTypeNames() {
        assertThatThrownBy(() -> registry.require("Miners"))
            .isInstanceOf(InvalidWorkerTypeException.class)
            .satisfies(ex -> assertThat(((InvalidWorkerTypeException) ex).code()).isEqualTo(ErrorCode.INVALID_WORKER_TYPE))
            .hasMessageContaining("Miners");
    }

    @Test
    void rejectsKnownTypeThatIsNotRegistered() {
        assertThatThrownBy(() -> registry.require("Publishers"))
            .isInstanceOf(InvalidWorkerTypeException.class);
        assertThat(registry.isRegistered(WorkerType.PUBLISHER)).isFalse();
    }

    @Test
    void rejectsDuplicateRegistrations() {
        assertThatThrownBy(() -> new WorkerTypeRegistry(List.of(
            new WorkerTypeRegistration(WorkerType.BOT, 1, "a"),
            new WorkerTypeRegistration(WorkerType.BOT, 2, "b"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("registered twice");
    }

    @Test
    void rejectsEmptyRegistryAndNonPositiveLimits() {
        assertThatThrownBy(() -> new WorkerTypeRegistry(List.of()))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new WorkerTypeRegistration(WorkerType.BOT, 0, "q"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrencyLimit");
    }
}
