package io.jobhive.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.core.auth.Caller;
import io.jobhive.core.config.NotificationProperties;
import io.jobhive.core.notify.NotificationBroker;
import io.jobhive.core.notify.Subscription;
import io.jobhive.core.notify.SubscriptionCursor;
import io.jobhive.job.ChangeEvent;
import io.jobhive.job.error.InvalidRequestException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/events")
public class EventController {
    private final NotificationBroker broker;
    private final ObjectMapper mapper;
    private final long streamTimeoutMillis;

    public EventController(NotificationBroker broker, ObjectMapper mapper, NotificationProperties properties) {
        this.broker = broker;
        this.mapper = mapper;
        long timeout = properties.getStreamTimeout().toMillis();
        this.streamTimeoutMillis = timeout <= 0 ? -1L : timeout;
    }

    /**
     * Opens an event stream. The resume cursor comes from {@code Last-Event-ID} (sent by browsers on
     * reconnect) or the {@code lastEventId} parameter.
     */
    @GetMapping(path = "/subscribe", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@RequestParam String channels,
                                @RequestHeader(name = "Last-Event-ID", required = false) String lastEventIdHeader,
                                @RequestParam(name = "lastEventId", required = false) String lastEventIdParam,
                                HttpServletRequest request) {
        Set<String> requested = Arrays.stream(channels.split(","))
            .map(String::trim)
            .filter(c -> !c.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
        String cursorText = lastEventIdHeader != null && !lastEventIdHeader.isBlank() ? lastEventIdHeader : lastEventIdParam;
        Map<String, Long> cursor = SubscriptionCursor.parse(cursorText);

        SseEmitter emitter = new SseEmitter(streamTimeoutMillis);
        Subscription subscription = broker.subscribe(clientId(request), requested, cursor,
            new SseSubscriptionSink(emitter, mapper));
        emitter.onCompletion(() -> broker.unsubscribe(subscription));
        emitter.onTimeout(() -> broker.unsubscribe(subscription));
        emitter.onError(error -> broker.unsubscribe(subscription));
        return emitter;
    }

    @PostMapping(path = "/{channel}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> publish(@PathVariable String channel, @RequestBody JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new InvalidRequestException("Event payload is required");
        }
        ChangeEvent event = broker.publish(channel, payload);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(Map.of("channel", event.channel(), "sequence", event.sequence()));
    }

    private static String clientId(HttpServletRequest request) {
        Object caller = request.getAttribute(Caller.REQUEST_ATTRIBUTE);
        return caller instanceof Caller c ? c.id() : request.getRemoteAddr();
    }
}
