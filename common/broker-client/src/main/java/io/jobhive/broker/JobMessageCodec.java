package io.jobhive.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobhive.job.Job;
import io.jobhive.job.WorkerType;
import io.jobhive.job.error.InvalidWorkerTypeException;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;

/**
 * Encodes {@link JobMessage} instances as persistent AMQP messages. The body is
 * {@code {"payload": ..., "priority": n}}; identity and attempt bookkeeping live in headers so
 * they can be read without parsing the payload.
 */
public final class JobMessageCodec {

  private final ObjectMapper mapper;

  public JobMessageCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public Message encode(JobMessage job) {
    Objects.requireNonNull(job, "job");
    ObjectNode body = mapper.createObjectNode();
    body.set("payload", job.payload());
    body.put("priority", job.priority());
    byte[] bytes;
    try {
      bytes = mapper.writeValueAsBytes(body);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to serialise job " + job.jobId(), ex);
    }
    return MessageBuilder.withBody(bytes)
        .setContentType(MessageProperties.CONTENT_TYPE_JSON)
        .setContentEncoding("UTF-8")
        .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
        .setMessageId(job.jobId().toString())
        .setPriority(job.priority())
        .setHeader(JobHeaders.JOB_ID, job.jobId().toString())
        .setHeader(JobHeaders.ATTEMPT_COUNT, job.attemptCount())
        .setHeader(JobHeaders.ENQUEUED_AT, job.enqueuedAt().toString())
        .setHeader(JobHeaders.WORKER_TYPE, job.workerType().name())
        .build();
  }

  public JobMessage decode(Message message) {
    Objects.requireNonNull(message, "message");
    Map<String, Object> headers = message.getMessageProperties().getHeaders();
    UUID jobId = parseJobId(requireHeader(headers, JobHeaders.JOB_ID));
    WorkerType workerType = parseWorkerType(requireHeader(headers, JobHeaders.WORKER_TYPE));
    int attemptCount = parseAttempt(headers.get(JobHeaders.ATTEMPT_COUNT));
    Instant enqueuedAt = parseInstant(requireHeader(headers, JobHeaders.ENQUEUED_AT));
    JsonNode body;
    try {
      body = mapper.readTree(message.getBody());
    } catch (IOException ex) {
      throw new MalformedJobMessageException("Job " + jobId + " body is not valid JSON", ex);
    }
    if (body == null || !body.isObject()) {
      throw new MalformedJobMessageException("Job " + jobId + " body must be a JSON object");
    }
    int priority = body.path("priority").asInt(Job.DEFAULT_PRIORITY);
    return new JobMessage(jobId, workerType, body.get("payload"), priority, attemptCount, enqueuedAt);
  }

  private static String requireHeader(Map<String, Object> headers, String name) {
    Object value = headers.get(name);
    if (value == null || value.toString().isBlank()) {
      throw new MalformedJobMessageException("Missing header " + name);
    }
    return value.toString();
  }

  private static UUID parseJobId(String value) {
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException ex) {
      throw new MalformedJobMessageException("Header " + JobHeaders.JOB_ID + " is not a UUID: " + value, ex);
    }
  }

  private static WorkerType parseWorkerType(String value) {
    try {
      return WorkerType.fromName(value);
    } catch (InvalidWorkerTypeException ex) {
      throw new MalformedJobMessageException("Header " + JobHeaders.WORKER_TYPE + " is unknown: " + value, ex);
    }
  }

  private static int parseAttempt(Object value) {
    if (value == null) {
      return 0;
    }
    if (value instanceof Number number) {
      return Math.max(0, number.intValue());
    }
    try {
      return Math.max(0, Integer.parseInt(value.toString().trim()));
    } catch (NumberFormatException ex) {
      throw new MalformedJobMessageException("Header " + JobHeaders.ATTEMPT_COUNT + " is not a number: " + value, ex);
    }
  }

  private static Instant parseInstant(String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      throw new MalformedJobMessageException("Header " + JobHeaders.ENQUEUED_AT + " must be an ISO-8601 instant", ex);
    }
  }
}
