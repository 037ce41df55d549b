package io.jobhive.core.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobhive.dispatch")
public class DispatchProperties {

    private final Duration republishGrace;
    private final int sweepBatchSize;
    private final int maxListLimit;

    public DispatchProperties(@DefaultValue("2m") @NotNull Duration republishGrace,
                              @DefaultValue("100") @Min(1) int sweepBatchSize,
                              @DefaultValue("500") @Min(1) int maxListLimit) {
        this.republishGrace = republishGrace;
        this.sweepBatchSize = sweepBatchSize;
        this.maxListLimit = maxListLimit;
    }

    /**
     * Age after which an unpublished reservation is assumed abandoned and published again.
     */
    public Duration getRepublishGrace() {
        return republishGrace;
    }

    public int getSweepBatchSize() {
        return sweepBatchSize;
    }

    public int getMaxListLimit() {
        return maxListLimit;
    }
}
