package io.jobhive.client;

import io.jobhive.job.JobReceipt;
import io.jobhive.job.JobRequest;
import io.jobhive.job.JobResultReport;
import java.util.UUID;

/**
 * The narrow surface other processes use to talk to the central service. Workers never read or
 * write job records directly; they only report results through this interface.
 */
public interface CoreApi {

    JobReceipt submit(JobRequest request);

    void reportResult(UUID jobId, JobResultReport report);
}
