package com.example.roomhub.server;

import com.example.roomhub.common.Frames;
import com.example.roomhub.common.Net;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Server settings. Read once at startup from JSON (missing fields keep these defaults), then
 * overridden from the environment and passed to every component that needs it.
 */
final class ServerConfig {
    public String host = "0.0.0.0";
    public int port = 7777;

    public long authTimeoutMillis = 60_000;
    public long activityTimeoutMillis = 90_000;
    public long shutdownTimeoutMillis = 10_000;

    public int maxFrameBytes = Frames.MAX_FRAME_BYTES;
    public int maxAuthAttempts = 5; // 0 = unlimited

    public int chatMaxLength = 300;
    public long chatCooldownMillis = 250;

    public int defaultRoomCapacity = 20;
    public int maxRoomCapacity = 200;
    public boolean evictEmptyRooms = true;

    public int dispatcherThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    public DefaultRoom defaultRoom = new DefaultRoom();
    public Auth auth = new Auth();
    public Db db = new Db();
    public Ledger ledger = new Ledger();

    static final class DefaultRoom {
        public String id = "lobby";
        public String name = "General Lobby";
        public int capacity = 50;
    }

    static final class Auth {
        /** token -> player id */
        public Map<String, String> tokens = new LinkedHashMap<>();
    }

    static final class Db {
        public String url;
        public String user;
        public String pass;
    }

    static final class Ledger {
        public String module = "player_actions";
        public String function = "execute_game_action";
        public long gasBudget = 10_000_000;
    }

    Duration authTimeout() { return Duration.ofMillis(authTimeoutMillis); }
    Duration activityTimeout() { return Duration.ofMillis(activityTimeoutMillis); }
    Duration shutdownTimeout() { return Duration.ofMillis(shutdownTimeoutMillis); }

    boolean hasDatabase() { return db.url != null && !db.url.isBlank(); }

    /**
     * @param path JSON file, or {@code null} for the built-in defaults
     */
    static ServerConfig load(String path, Function<String, String> env) throws IOException {
        ServerConfig c = path == null ? new ServerConfig() : Net.MAPPER.readValue(new File(path), ServerConfig.class);
        c.applyEnv(env);
        c.validate();
        return c;
    }

    void applyEnv(Function<String, String> env) {
        if (db == null) db = new Db();
        host = envOr(env, "HOST", host);
        port = Integer.parseInt(envOr(env, "PORT", Integer.toString(port)));
        db.url = envOr(env, "DB_URL", db.url);
        db.user = envOr(env, "DB_USER", db.user);
        db.pass = envOr(env, "DB_PASS", db.pass);
    }

    void validate() {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (authTimeoutMillis <= 0) throw new IllegalArgumentException("authTimeoutMillis must be > 0");
        if (activityTimeoutMillis <= 0) throw new IllegalArgumentException("activityTimeoutMillis must be > 0");
        if (maxFrameBytes <= 0) throw new IllegalArgumentException("maxFrameBytes must be > 0");
        if (defaultRoomCapacity <= 0) throw new IllegalArgumentException("defaultRoomCapacity must be > 0");
        if (maxRoomCapacity < defaultRoomCapacity) throw new IllegalArgumentException("maxRoomCapacity < defaultRoomCapacity");
        if (defaultRoom == null || defaultRoom.id == null || defaultRoom.id.isBlank()) throw new IllegalArgumentException("defaultRoom.id is required");
        if (dispatcherThreads < 1) throw new IllegalArgumentException("dispatcherThreads must be >= 1");
        if (auth == null) auth = new Auth();
        if (auth.tokens == null) auth.tokens = new LinkedHashMap<>();
        if (db == null) db = new Db();
        if (ledger == null) ledger = new Ledger();
    }

    static String envOr(Function<String, String> env, String k, String def) {
        String v = env.apply(k);
        return (v == null || v.isBlank()) ? def : v.trim();
    }
}
