package com.example.roomhub.server.store;

import java.time.Instant;

/** Persistent per-player document, loaded on authentication and saved on disconnect. */
public record PlayerData(String playerId, String displayName, int level, long experience,
                         Instant firstSeen, Instant lastSeen, int sessions) {

    public static PlayerData fresh(String playerId, Instant now) {
        return new PlayerData(playerId, playerId, 1, 0, now, now, 1);
    }

    public PlayerData withSessionStarted(Instant now) {
        return new PlayerData(playerId, displayName, level, experience, firstSeen, now, sessions + 1);
    }

    public PlayerData withLastSeen(Instant now) {
        return new PlayerData(playerId, displayName, level, experience, firstSeen, now, sessions);
    }
}
