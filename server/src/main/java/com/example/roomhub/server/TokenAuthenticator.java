package com.example.roomhub.server;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static token table from the server configuration. Every entry is compared in constant time,
 * so response timing does not reveal how much of a token matched or which entry it was.
 */
final class TokenAuthenticator implements Authenticator {
    private final Map<String, String> tokens;

    TokenAuthenticator(Map<String, String> tokens) {
        this.tokens = new LinkedHashMap<>(tokens);
    }

    int size() { return tokens.size(); }

    @Override
    public Optional<String> authenticate(String token) {
        if (token == null || token.isEmpty()) return Optional.empty();
        String match = null;
        for (Map.Entry<String, String> e : tokens.entrySet()) {
            if (slowEquals(e.getKey(), token) && match == null) match = e.getValue();
        }
        return Optional.ofNullable(match);
    }

    static boolean slowEquals(String a, String b) {
        if (a == null || b == null) return false;
        byte[] x = a.getBytes(StandardCharsets.UTF_8);
        byte[] y = b.getBytes(StandardCharsets.UTF_8);
        int diff = x.length ^ y.length;
        int n = Math.min(x.length, y.length);
        for (int i = 0; i < n; i++) diff |= (x[i] ^ y[i]);
        return diff == 0;
    }
}
