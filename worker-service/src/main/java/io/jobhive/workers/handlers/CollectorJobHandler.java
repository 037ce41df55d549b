package io.jobhive.workers.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobhive.job.WorkerType;
import io.jobhive.worker.JobContext;
import io.jobhive.worker.JobHandler;
import io.jobhive.worker.NonRetryableJobException;
import java.time.Clock;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates a collection request for one source, or for every source when the payload says
 * {@code "sources": "all"}, and answers with the result document describing it. Fetching the
 * source is left to the collector plugins behind this worker.
 *
 * <pre>{@code
 * {"sourceId": "feeds-42", "collector": "rss", "manual": true}
 * {"sources": "all"}
 * }</pre>
 */
@Component
public class CollectorJobHandler implements JobHandler {

  static final Set<String> COLLECTORS = Set.of("rss", "simple_web", "rt");

  private static final Logger log = LoggerFactory.getLogger(CollectorJobHandler.class);

  private final Clock clock;

  public CollectorJobHandler(Clock clock) {
    this.clock = clock;
  }

  @Override
  public WorkerType workerType() {
    return WorkerType.COLLECTOR;
  }

  @Override
  public JsonNode handle(JobContext context) {
    JsonNode payload = Payloads.requireObject(context.payload());
    ObjectNode result = JsonNodeFactory.instance.objectNode();
    if (payload.has("sources")) {
      String scope = Payloads.requireText(payload, "sources");
      if (!"all".equals(scope)) {
        throw new NonRetryableJobException("payload.sources only supports 'all'");
      }
      result.put("scope", "all");
    } else {
      String sourceId = Payloads.requireText(payload, "sourceId");
      result.put("scope", "source");
      result.put("sourceId", sourceId);
      result.put("collector", Payloads.oneOf(payload, "collector", COLLECTORS, "rss"));
    }
    context.checkDeadline();
    result.put("manual", Payloads.flag(payload, "manual"));
    result.put("collectedAt", clock.instant().toString());
    log.info("Accepted collection of {} (attempt {})", result.path("sourceId").asText("all sources"), context.attemptCount() + 1);
    return result;
  }
}
