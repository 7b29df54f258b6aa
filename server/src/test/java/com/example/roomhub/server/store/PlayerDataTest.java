package com.example.roomhub.server.store;

import com.example.roomhub.common.Net;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class PlayerDataTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2026-01-02T10:00:00Z");

    @Test
    public void testLifecycle() {
        PlayerData d = PlayerData.fresh("alice", T0);
        assertEquals(1, d.sessions());
        assertEquals(1, d.level());

        PlayerData again = d.withSessionStarted(T1);
        assertEquals(2, again.sessions());
        assertEquals(T0, again.firstSeen());
        assertEquals(T1, again.lastSeen());
        assertEquals(2, again.withLastSeen(T1.plusSeconds(60)).sessions());
    }

    /** The stored document is the JSON form used by the database column. */
    @Test
    public void testJsonDocument() throws Exception {
        String json = Net.MAPPER.writeValueAsString(PlayerData.fresh("alice", T0));
        assertTrue(json.contains("\"firstSeen\":\"2026-01-01T10:00:00Z\""), json);
        assertEquals(PlayerData.fresh("alice", T0), Net.MAPPER.readValue(json, PlayerData.class));
    }

    @Test
    public void testInMemoryStore() {
        var store = new InMemoryPlayerStore();
        assertTrue(store.load("alice").isEmpty());
        store.save(PlayerData.fresh("alice", T0));
        store.save(PlayerData.fresh("alice", T0).withSessionStarted(T1));
        assertEquals(1, store.size());
        assertEquals(2, store.load("alice").orElseThrow().sessions());
    }
}
