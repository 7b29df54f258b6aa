package com.example.roomhub.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ServerConfigTest {

    @TempDir
    Path dir;

    private static String none(String key) { return null; }

    @Test
    public void testDefaults() throws Exception {
        ServerConfig c = ServerConfig.load(null, ServerConfigTest::none);
        assertEquals(7777, c.port);
        assertEquals(60_000, c.authTimeoutMillis);
        assertEquals(90_000, c.activityTimeoutMillis);
        assertEquals("lobby", c.defaultRoom.id);
        assertTrue(c.auth.tokens.isEmpty());
        assertFalse(c.hasDatabase());
    }

    /** A partial file overrides what it names and keeps every other default. */
    @Test
    public void testPartialFile() throws Exception {
        Path file = dir.resolve("roomhub.json");
        Files.writeString(file, "{\"port\": 9000, \"chatMaxLength\": 50, \"unknownKey\": true,"
                + " \"auth\": {\"tokens\": {\"abc\": \"carol\"}}, \"defaultRoom\": {\"name\": \"Hall\"}}",
                StandardCharsets.UTF_8);

        ServerConfig c = ServerConfig.load(file.toString(), ServerConfigTest::none);
        assertEquals(9000, c.port);
        assertEquals(50, c.chatMaxLength);
        assertEquals(250, c.chatCooldownMillis);
        assertEquals(Map.of("abc", "carol"), c.auth.tokens);
        assertEquals("Hall", c.defaultRoom.name);
        assertEquals("lobby", c.defaultRoom.id);
        assertEquals("player_actions", c.ledger.module);
    }

    @Test
    public void testEnvironmentOverrides() throws Exception {
        Map<String, String> env = Map.of("PORT", "8100", "HOST", " 127.0.0.1 ", "DB_URL", "jdbc:postgresql://db/roomhub");
        ServerConfig c = ServerConfig.load(null, env::get);
        assertEquals(8100, c.port);
        assertEquals("127.0.0.1", c.host);
        assertTrue(c.hasDatabase());
    }

    @Test
    public void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.load(null, Map.of("PORT", "70000")::get));
        assertThrows(NumberFormatException.class,
                () -> ServerConfig.load(null, Map.of("PORT", "seven")::get));

        ServerConfig c = new ServerConfig();
        c.maxRoomCapacity = 5;
        assertThrows(IllegalArgumentException.class, c::validate);
    }

    @Test
    public void testNullSectionsFilled() throws Exception {
        Path file = dir.resolve("nulls.json");
        Files.writeString(file, "{\"auth\": null, \"db\": null}", StandardCharsets.UTF_8);
        ServerConfig c = ServerConfig.load(file.toString(), ServerConfigTest::none);
        assertNotNull(c.auth.tokens);
        assertFalse(c.hasDatabase());
    }
}
