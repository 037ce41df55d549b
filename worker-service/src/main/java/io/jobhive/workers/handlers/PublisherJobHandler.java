package io.jobhive.workers.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobhive.job.WorkerType;
import io.jobhive.worker.JobContext;
import io.jobhive.worker.JobHandler;
import io.jobhive.worker.NonRetryableJobException;
import java.time.Clock;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Validates a publishing request and answers with the result document describing it. An empty
 * payload stands for everything that is due; a {@code productId} must come with the
 * {@code publisherId} to send it to. Nothing is pushed to a publisher here.
 */
@Component
public class PublisherJobHandler implements JobHandler {

  private final Clock clock;

  public PublisherJobHandler(Clock clock) {
    this.clock = clock;
  }

  @Override
  public WorkerType workerType() {
    return WorkerType.PUBLISHER;
  }

  @Override
  public JsonNode handle(JobContext context) {
    JsonNode payload = Payloads.requireObject(context.payload());
    ObjectNode result = JsonNodeFactory.instance.objectNode();
    Optional<String> productId = Payloads.optionalText(payload, "productId");
    Optional<String> publisherId = Payloads.optionalText(payload, "publisherId");
    if (productId.isPresent() != publisherId.isPresent()) {
      throw new NonRetryableJobException("payload.productId and payload.publisherId go together");
    }
    if (productId.isPresent()) {
      result.put("productId", productId.get()).put("publisherId", publisherId.get());
    } else {
      result.put("scope", "due");
    }
    context.checkDeadline();
    result.put("publishedAt", clock.instant().toString());
    return result;
  }
}
