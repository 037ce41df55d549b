package io.jobhive.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobhive.job.WorkerType;

/**
 * Type-specific job logic. Invocations of one handler run concurrently and must not share mutable
 * state; the only outputs are the returned result document and a thrown exception.
 */
public interface JobHandler {

  WorkerType workerType();

  /**
   * Executes one delivery of a job.
   *
   * @return result document reported to the central service, or {@code null}
   * @throws NonRetryableJobException when the payload can never succeed
   * @throws Exception any other failure; the runtime retries the job
   */
  JsonNode handle(JobContext context) throws Exception;
}
