package com.example.roomhub.server.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ActionDescriptor(String playerId, String actionName, Map<String, Object> params) {
    public ActionDescriptor {
        // JSON params may carry null values, so no Map.copyOf
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
