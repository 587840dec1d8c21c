package com.dharmil.catalogcrawl.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;

/**
 * Renders envelopes to the JSON shape consumers see:
 * {@code {seq, backend_ts, event_name, [variant,] ...event fields}}.
 */
public class EventWireFormat {

    public static final String GENERALIZED_EVENT_NAME = "actor-event";

    public enum Mode {
        /** One event name for everything, the variant travels in a field. */
        GENERALIZED,
        /** One event name per variant. */
        LEGACY
    }

    private final ObjectMapper mapper;
    private final Mode mode;

    public EventWireFormat(ObjectMapper baseMapper, Mode mode) {
        this.mapper = baseMapper.copy()
                .findAndRegisterModules()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mode = mode;
    }

    public ObjectNode render(EventEnvelope envelope) {
        CrawlEvent event = envelope.event();
        ObjectNode node = mapper.createObjectNode();
        node.put("seq", envelope.seq());
        node.put("backend_ts", envelope.backendTs().toString());
        if (mode == Mode.GENERALIZED) {
            node.put("event_name", GENERALIZED_EVENT_NAME);
            node.put("variant", event.variant());
        } else {
            node.put("event_name", event.legacyName());
        }
        ObjectNode fields = mapper.valueToTree(event);
        node.setAll(fields);
        return node;
    }

    public String toJson(EventEnvelope envelope) {
        try {
            return mapper.writeValueAsString(render(envelope));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not render event #" + envelope.seq(), e);
        }
    }

    public Mode mode() {
        return mode;
    }
}
