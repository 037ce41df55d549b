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
import org.springframework.stereotype.Component;

/**
 * Validates a presenter request and answers with the result document describing the rendering.
 * Either a {@code productId} or a reporting {@code period} selects the product; no template is
 * rendered here.
 */
@Component
public class PresenterJobHandler implements JobHandler {

  static final Set<String> PERIODS = Set.of("previous-day", "previous-week");
  static final Set<String> FORMATS = Set.of("pdf", "html", "text");

  private final Clock clock;

  public PresenterJobHandler(Clock clock) {
    this.clock = clock;
  }

  @Override
  public WorkerType workerType() {
    return WorkerType.PRESENTER;
  }

  @Override
  public JsonNode handle(JobContext context) {
    JsonNode payload = Payloads.requireObject(context.payload());
    ObjectNode result = JsonNodeFactory.instance.objectNode();
    if (payload.hasNonNull("productId")) {
      result.put("productId", Payloads.requireText(payload, "productId"));
    } else if (payload.hasNonNull("period")) {
      result.put("period", Payloads.oneOf(payload, "period", PERIODS, null));
    } else {
      throw new NonRetryableJobException("payload needs a productId or a period");
    }
    result.put("format", Payloads.oneOf(payload, "format", FORMATS, "pdf"));
    context.checkDeadline();
    result.put("renderedAt", clock.instant().toString());
    return result;
  }
}
