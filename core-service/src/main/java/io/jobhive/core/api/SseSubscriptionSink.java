package io.jobhive.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.core.notify.SubscriptionSink;
import io.jobhive.job.ChangeEvent;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Writes change events as SSE frames. The event name is the channel and the id is the cursor
 * covering every subscribed channel.
 */
class SseSubscriptionSink implements SubscriptionSink {
    private final SseEmitter emitter;
    private final ObjectMapper mapper;

    SseSubscriptionSink(SseEmitter emitter, ObjectMapper mapper) {
        this.emitter = emitter;
        this.mapper = mapper;
    }

    @Override
    public void send(ChangeEvent event, String cursor) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", event.channel());
        body.put("sequence", event.sequence());
        body.put("emittedAt", event.emittedAt().toString());
        body.put("payload", event.payload());
        emitter.send(SseEmitter.event()
            .id(cursor)
            .name(event.channel())
            .data(mapper.writeValueAsString(body), MediaType.APPLICATION_JSON));
    }

    @Override
    public void heartbeat() throws IOException {
        emitter.send(SseEmitter.event().comment("heartbeat"));
    }

    @Override
    public void close(String reason) {
        emitter.complete();
    }
}
