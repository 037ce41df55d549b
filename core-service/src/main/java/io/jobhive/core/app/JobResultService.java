package io.jobhive.core.app;

import io.jobhive.core.domain.JobStore;
import io.jobhive.job.Job;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.JobStatus;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Applies worker reports to job records. Reports against terminal jobs are accepted but ignored.
 */
@Service
public class JobResultService {
    private static final Logger log = LoggerFactory.getLogger(JobResultService.class);

    private final JobStore store;
    private final JobEvents events;
    private final Clock clock;
    private final MeterRegistry meters;

    public JobResultService(JobStore store, JobEvents events, Clock clock, MeterRegistry meters) {
        this.store = store;
        this.events = events;
        this.clock = clock;
        this.meters = meters;
    }

    public Job report(UUID jobId, JobResultReport report) {
        MDC.put("job_id", jobId.toString());
        try {
            JobStore.ReportOutcome outcome = store.applyReport(jobId, report, clock.instant());
            Job job = outcome.job();
            if (!outcome.applied()) {
                log.info("Ignoring {} report for job {} already {}", report.status(), jobId, job.status());
                return job;
            }
            if (job.status().isTerminal()) {
                meters.counter("jobhive.jobs.completed",
                    "type", job.workerType().name(), "status", job.status().name()).increment();
            }
            if (job.status() == JobStatus.DEAD_LETTERED) {
                log.warn("Job {} dead-lettered after {} attempts: {}", jobId, job.attemptCount(), job.lastError());
            } else {
                log.debug("Job {} is now {} (attempt {})", jobId, job.status(), job.attemptCount());
            }
            events.jobChanged(job);
            return job;
        } finally {
            MDC.remove("job_id");
        }
    }
}
