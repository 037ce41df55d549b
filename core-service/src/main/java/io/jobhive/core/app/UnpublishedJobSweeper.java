package io.jobhive.core.app;

import io.jobhive.core.config.DispatchProperties;
import io.jobhive.core.domain.EnqueueGate;
import io.jobhive.core.domain.JobStore;
import io.jobhive.job.Job;
import io.jobhive.job.error.JobHiveException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Publishes reservations left behind by a crash between reserve and publish.
 */
@Component
public class UnpublishedJobSweeper {
    private static final Logger log = LoggerFactory.getLogger(UnpublishedJobSweeper.class);

    private final JobStore store;
    private final Dispatcher dispatcher;
    private final EnqueueGate gate;
    private final Clock clock;
    private final DispatchProperties properties;

    public UnpublishedJobSweeper(JobStore store, Dispatcher dispatcher, EnqueueGate gate, Clock clock,
                                 DispatchProperties properties) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.gate = gate;
        this.clock = clock;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${jobhive.dispatch.sweep-interval-ms:30000}",
        initialDelayString = "${jobhive.dispatch.sweep-interval-ms:30000}")
    public void sweep() {
        if (!gate.isOpen()) {
            return;
        }
        Instant cutoff = clock.instant().minus(properties.getRepublishGrace());
        List<Job> stale = store.findUnpublished(cutoff, properties.getSweepBatchSize());
        int republished = 0;
        for (Job job : stale) {
            try {
                dispatcher.republish(job);
                republished++;
            } catch (JobHiveException e) {
                log.warn("Sweep stopped after {} of {} jobs; broker unavailable: {}",
                    republished, stale.size(), e.getMessage());
                return;
            }
        }
        if (republished > 0) {
            log.info("Republished {} unpublished job(s) older than {}", republished, cutoff);
        }
    }
}
