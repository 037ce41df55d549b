package io.jobhive.beat.app;

import io.jobhive.client.CoreApi;
import io.jobhive.job.JobReceipt;
import io.jobhive.job.JobRequest;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.JobStatus;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Resolves idempotency keys the way the central service does.
 */
class RecordingCore implements CoreApi {
  final List<JobRequest> submissions = new CopyOnWriteArrayList<>();
  final Map<String, UUID> jobsByKey = new ConcurrentHashMap<>();
  volatile RuntimeException failAfterAccepting;
  volatile RuntimeException failBeforeAccepting;

  @Override
  public JobReceipt submit(JobRequest request) {
    if (failBeforeAccepting != null) {
      throw failBeforeAccepting;
    }
    submissions.add(request);
    UUID fresh = UUID.randomUUID();
    UUID id = jobsByKey.computeIfAbsent(request.idempotencyKey(), ignored -> fresh);
    if (failAfterAccepting != null) {
      throw failAfterAccepting;
    }
    return new JobReceipt(id, JobStatus.PENDING, !id.equals(fresh));
  }

  @Override
  public void reportResult(UUID jobId, JobResultReport report) {
    throw new UnsupportedOperationException();
  }

  int distinctJobs() {
    return jobsByKey.size();
  }
}
