package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;
import com.example.roomhub.server.actor.ActorSystem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class WorldRegistryTest {

    private ActorSystem system;
    private ActorRef<WorldMessage> world;

    @BeforeEach
    public void setup() {
        system = new ActorSystem("world-test", 2);
        world = system.spawn("world-registry", WorldRegistry::new);
    }

    @AfterEach
    public void teardown() throws InterruptedException {
        system.shutdown(Duration.ofSeconds(2));
    }

    private Set<String> online() throws Exception {
        var f = new CompletableFuture<Set<String>>();
        world.tell(new WorldMessage.OnlinePlayers(f));
        return f.get(3, TimeUnit.SECONDS);
    }

    @Test
    public void testEnteredTwiceYieldsOneEntry() throws Exception {
        var s = new TestProbe<SessionMessage>("s");
        world.tell(new WorldMessage.PlayerEntered("alice", s));
        world.tell(new WorldMessage.PlayerEntered("alice", s));

        assertEquals(Set.of("alice"), online());
    }

    @Test
    public void testLeftForUnknownPlayerIsNoOp() throws Exception {
        var s = new TestProbe<SessionMessage>("s");
        world.tell(new WorldMessage.PlayerEntered("alice", s));
        world.tell(new WorldMessage.PlayerLeft("bob", s));

        assertEquals(Set.of("alice"), online());
        assertFalse(system.isTerminated(world));
    }

    /**
     * A second session for the same player is not registered, so its leave must not evict the
     * first session.
     */
    @Test
    public void testLeaveFromDuplicateSessionKeepsOriginal() throws Exception {
        var first = new TestProbe<SessionMessage>("first");
        var second = new TestProbe<SessionMessage>("second");

        world.tell(new WorldMessage.PlayerEntered("alice", first));
        world.tell(new WorldMessage.PlayerEntered("alice", second));
        world.tell(new WorldMessage.PlayerLeft("alice", second));
        assertEquals(Set.of("alice"), online());

        world.tell(new WorldMessage.PlayerLeft("alice", first));
        assertEquals(Set.of(), online());
    }

    @Test
    public void testIndependentPlayers() throws Exception {
        world.tell(new WorldMessage.PlayerEntered("alice", new TestProbe<>("a")));
        world.tell(new WorldMessage.PlayerEntered("bob", new TestProbe<>("b")));

        assertEquals(Set.of("alice", "bob"), online());
    }
}
