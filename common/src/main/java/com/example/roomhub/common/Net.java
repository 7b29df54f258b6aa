package com.example.roomhub.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON helpers shared by server and client (Jackson).
 * <p>
 * Every frame on the wire carries one {@link Messages.Envelope}: {@code {"type": ..., "payload": ...}}.
 */
public final class Net {
    private Net() {}

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static String toJson(Object o) throws JsonProcessingException {
        return MAPPER.writeValueAsString(o);
    }

    /** Decodes one frame body. Anything that is not a JSON object fails. */
    public static Messages.Envelope readEnvelope(byte[] frame) throws IOException {
        Messages.Envelope env = MAPPER.readValue(frame, Messages.Envelope.class);
        if (env == null) throw new JsonMappingException(null, "empty envelope");
        return env;
    }

    /** Encodes {@code {"type": type, "payload": payload}} as UTF-8 JSON bytes. */
    public static byte[] envelope(String type, Object payload) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(new Outbound(type, payload));
    }

    /**
     * Maps the envelope payload onto a DTO. A missing payload maps to a DTO with default fields.
     */
    public static <T> T payload(Messages.Envelope env, Class<T> type) throws JsonProcessingException {
        JsonNode p = env.payload;
        if (p == null || p.isNull() || p.isMissingNode()) p = MAPPER.createObjectNode();
        return MAPPER.treeToValue(p, type);
    }

    private static final class Outbound {
        public final String type;
        public final Object payload;
        Outbound(String type, Object payload) { this.type = type; this.payload = payload; }
    }
}
