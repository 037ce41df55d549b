package io.jobhive.core.api;

import io.jobhive.core.app.Dispatcher;
import io.jobhive.core.app.JobResultService;
import io.jobhive.core.config.DispatchProperties;
import io.jobhive.core.domain.JobStore;
import io.jobhive.job.Job;
import io.jobhive.job.JobReceipt;
import io.jobhive.job.JobRequest;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.JobStatus;
import io.jobhive.job.WorkerType;
import io.jobhive.job.error.InvalidRequestException;
import io.jobhive.job.error.JobNotFoundException;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/jobs")
public class JobController {
    private static final int DEFAULT_LIMIT = 50;

    private final Dispatcher dispatcher;
    private final JobResultService results;
    private final JobStore store;
    private final int maxLimit;

    public JobController(Dispatcher dispatcher, JobResultService results, JobStore store, DispatchProperties properties) {
        this.dispatcher = dispatcher;
        this.results = results;
        this.store = store;
        this.maxLimit = properties.getMaxListLimit();
    }

    @PostMapping
    public ResponseEntity<JobReceipt> submit(@Valid @RequestBody JobRequest request) {
        JobReceipt receipt = dispatcher.submit(request);
        return ResponseEntity.status(receipt.duplicate() ? HttpStatus.OK : HttpStatus.ACCEPTED).body(receipt);
    }

    @GetMapping("/{id}")
    public Job get(@PathVariable UUID id) {
        return store.find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @GetMapping
    public List<Job> list(@RequestParam(required = false) String status,
                          @RequestParam(required = false) String workerType,
                          @RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit) {
        if (limit < 1 || limit > maxLimit) {
            throw new InvalidRequestException("limit must be between 1 and " + maxLimit);
        }
        WorkerType type = workerType == null || workerType.isBlank() ? null : WorkerType.fromName(workerType);
        return store.findByStatusAndType(parseStatus(status), type, limit);
    }

    /**
     * Worker callback.
     */
    @PostMapping("/{id}/result")
    public Job report(@PathVariable UUID id, @Valid @RequestBody JobResultReport report) {
        return results.report(id, report);
    }

    @PostMapping("/{id}/replay")
    public ResponseEntity<JobReceipt> replay(@PathVariable UUID id) {
        JobReceipt receipt = dispatcher.replay(id);
        return ResponseEntity.status(receipt.duplicate() ? HttpStatus.OK : HttpStatus.ACCEPTED).body(receipt);
    }

    private static JobStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown job status '" + status + "'");
        }
    }
}
