package io.jobhive.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobhive.job.WorkerType;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkerPoolsTest {

  private final WorkerTypeRegistry registry = new WorkerTypeRegistry(List.of(
      new WorkerTypeRegistration(WorkerType.COLLECTOR, 4, "jobhive.jobs.collector"),
      new WorkerTypeRegistration(WorkerType.BOT, 2, "jobhive.jobs.bot"),
      new WorkerTypeRegistration(WorkerType.PUBLISHER, 1, "jobhive.jobs.publisher")));

  private final JobHandlerRegistry handlers = new JobHandlerRegistry(List.of(
      handler(WorkerType.COLLECTOR), handler(WorkerType.BOT)));

  @Test
  void resolvesPoolLabelsFromWorkerTypesSetting() {
    List<WorkerPool> pools = WorkerPools.resolve(List.of("Collectors", "Bots"), registry, handlers);

    assertThat(pools).extracting(pool -> pool.registration().type())
        .containsExactly(WorkerType.COLLECTOR, WorkerType.BOT);
    assertThat(pools.get(0).concurrencyLimit()).isEqualTo(4);
  }

  @Test
  void emptySettingServesEveryRegisteredTypeWithHandler() {
    assertThat(WorkerPools.resolve(List.of(), registry, handlers)).hasSize(2);
  }

  @Test
  void failsStartupOnUnknownOrUnhandledTypes() {
    assertThatThrownBy(() -> WorkerPools.resolve(List.of("Miners"), registry, handlers))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Miners");
    assertThatThrownBy(() -> WorkerPools.resolve(List.of("Publishers"), registry, handlers))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("no handler");
    assertThatThrownBy(() -> WorkerPools.resolve(List.of("Presenters"), registry, handlers))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("no registration");
  }

  @Test
  void rejectsTwoHandlersForOneType() {
    assertThatThrownBy(() -> new JobHandlerRegistry(List.of(handler(WorkerType.BOT), handler(WorkerType.BOT))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate handlers for BOT");
  }

  private static JobHandler handler(WorkerType type) {
    return new JobHandler() {
      @Override
      public WorkerType workerType() {
        return type;
      }

      @Override
      public JsonNode handle(JobContext context) {
        return null;
      }
    };
  }
}
