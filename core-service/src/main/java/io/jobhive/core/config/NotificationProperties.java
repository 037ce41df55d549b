package io.jobhive.core.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobhive.notifications")
public class NotificationProperties {

    private final int replayWindow;
    private final int subscriberBuffer;
    private final int maxSubscribers;
    private final Duration heartbeatInterval;
    private final Duration streamTimeout;

    public NotificationProperties(@DefaultValue("1000") @Min(1) int replayWindow,
                                  @DefaultValue("256") @Min(1) int subscriberBuffer,
                                  @DefaultValue("1000") @Min(1) int maxSubscribers,
                                  @DefaultValue("15s") @NotNull Duration heartbeatInterval,
                                  @DefaultValue("0s") @NotNull Duration streamTimeout) {
        this.replayWindow = replayWindow;
        this.subscriberBuffer = subscriberBuffer;
        this.maxSubscribers = maxSubscribers;
        this.heartbeatInterval = heartbeatInterval;
        this.streamTimeout = streamTimeout;
    }

    /**
     * Events retained per channel for resume.
     */
    public int getReplayWindow() {
        return replayWindow;
    }

    /**
     * Queued live events at which a subscriber counts as slow and is disconnected.
     */
    public int getSubscriberBuffer() {
        return subscriberBuffer;
    }

    public int getMaxSubscribers() {
        return maxSubscribers;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * Server-side lifetime of one stream; zero keeps it open until the client leaves.
     */
    public Duration getStreamTimeout() {
        return streamTimeout;
    }
}
