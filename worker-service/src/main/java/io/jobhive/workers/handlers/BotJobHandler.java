package io.jobhive.workers.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobhive.job.WorkerType;
import io.jobhive.worker.JobContext;
import io.jobhive.worker.JobHandler;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Validates a post-collection bot request, optionally scoped to a single source, and answers with
 * the result document naming the bot. The bot itself is not run here.
 */
@Component
public class BotJobHandler implements JobHandler {

  private final Clock clock;

  public BotJobHandler(Clock clock) {
    this.clock = clock;
  }

  @Override
  public WorkerType workerType() {
    return WorkerType.BOT;
  }

  @Override
  public JsonNode handle(JobContext context) {
    JsonNode payload = Payloads.requireObject(context.payload());
    String botId = Payloads.requireText(payload, "botId");
    ObjectNode result = JsonNodeFactory.instance.objectNode().put("botId", botId);
    Payloads.optionalText(payload, "sourceId").ifPresent(source -> result.put("sourceId", source));
    context.checkDeadline();
    result.put("finishedAt", clock.instant().toString());
    return result;
  }
}
