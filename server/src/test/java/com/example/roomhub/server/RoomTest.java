package com.example.roomhub.server;

import com.example.roomhub.server.actor.Actor;
import com.example.roomhub.server.actor.ActorRef;
import com.example.roomhub.server.actor.ActorSystem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Room membership, capacity, fan-out and closing.
 */
public class RoomTest {

    private static final Duration QUIET = Duration.ofMillis(200);

    private ActorSystem system;
    private TestProbe<RegistryMessage> registry;

    @BeforeEach
    public void setup() {
        system = new ActorSystem("room-test", 4);
        registry = new TestProbe<>("registry");
    }

    @AfterEach
    public void teardown() throws InterruptedException {
        system.shutdown(Duration.ofSeconds(2));
    }

    private ActorRef<RoomMessage> room(String id, int capacity) throws InterruptedException {
        ActorRef<RoomMessage> ref = system.spawn("room-" + id, () -> new Room(id, "Room " + id, capacity, registry));
        assertEquals(0, registry.expect(RegistryMessage.PopulationChanged.class).members(), "room reports 0 on start");
        return ref;
    }

    private static RoomSnapshot describe(ActorRef<RoomMessage> room) throws Exception {
        var f = new CompletableFuture<RoomSnapshot>();
        assertTrue(room.tell(new RoomMessage.Describe(f)));
        return f.get(3, TimeUnit.SECONDS);
    }

    private static SessionMessage.JoinReply join(ActorRef<RoomMessage> room, String playerId, TestProbe<SessionMessage> session)
            throws InterruptedException {
        room.tell(new RoomMessage.Join(playerId, session));
        return session.expect(SessionMessage.JoinReply.class);
    }

    /**
     * Capacity 2, three simultaneous joins: exactly two succeed and the third is refused as full.
     */
    @Test
    public void testConcurrentJoinsRespectCapacity() throws Exception {
        ActorRef<RoomMessage> room = room("cap", 2);
        List<TestProbe<SessionMessage>> sessions = List.of(new TestProbe<>("s1"), new TestProbe<>("s2"), new TestProbe<>("s3"));

        var start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < sessions.size(); i++) {
            TestProbe<SessionMessage> s = sessions.get(i);
            String pid = "p" + i;
            Thread t = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                room.tell(new RoomMessage.Join(pid, s));
            });
            threads.add(t);
            t.start();
        }
        start.countDown();
        for (Thread t : threads) t.join();

        int joined = 0;
        int full = 0;
        for (TestProbe<SessionMessage> s : sessions) {
            SessionMessage.JoinReply r = s.fishFor(SessionMessage.JoinReply.class);
            if (r.outcome() == JoinOutcome.JOINED) joined++;
            else if (r.outcome() == JoinOutcome.ROOM_FULL) full++;
        }
        assertEquals(2, joined, "exactly capacity joins succeed");
        assertEquals(1, full, "the rest is refused as full");
        assertEquals(2, describe(room).members().size());
    }

    @Test
    public void testDuplicatePlayerRejected() throws Exception {
        ActorRef<RoomMessage> room = room("dup", 5);
        var a = new TestProbe<SessionMessage>("a");
        var b = new TestProbe<SessionMessage>("b");

        assertEquals(JoinOutcome.JOINED, join(room, "p1", a).outcome());
        assertEquals(JoinOutcome.ALREADY_MEMBER, join(room, "p1", b).outcome());
        assertEquals(Set.of("p1"), describe(room).members());
    }

    /**
     * Leave then rejoin: one membership at the end, and an observer present throughout sees
     * exactly the leave and the rejoin.
     */
    @Test
    public void testLeaveRejoinRoundTrip() throws Exception {
        ActorRef<RoomMessage> room = room("rt", 5);
        var p1 = new TestProbe<SessionMessage>("p1");
        var observer = new TestProbe<SessionMessage>("observer");

        assertEquals(JoinOutcome.JOINED, join(room, "p1", p1).outcome());
        assertEquals(JoinOutcome.JOINED, join(room, "obs", observer).outcome());
        p1.expect(SessionMessage.FromRoom.class); // obs joined

        room.tell(new RoomMessage.Leave("p1", p1));
        assertEquals(JoinOutcome.JOINED, join(room, "p1", p1).outcome());

        var left = observer.expect(SessionMessage.FromRoom.class);
        assertInstanceOf(RoomEvent.MemberLeft.class, left.event());
        assertEquals("p1", ((RoomEvent.MemberLeft) left.event()).playerId());
        var rejoined = observer.expect(SessionMessage.FromRoom.class);
        assertInstanceOf(RoomEvent.MemberJoined.class, rejoined.event());
        observer.expectNoMessage(QUIET);

        RoomSnapshot snap = describe(room);
        assertEquals(Set.of("p1", "obs"), snap.members());
    }

    @Test
    public void testStaleLeaveIgnored() throws Exception {
        ActorRef<RoomMessage> room = room("stale", 5);
        var current = new TestProbe<SessionMessage>("current");
        var old = new TestProbe<SessionMessage>("old");
        var observer = new TestProbe<SessionMessage>("observer");

        join(room, "p1", current);
        join(room, "obs", observer);

        room.tell(new RoomMessage.Leave("p1", old));
        room.tell(new RoomMessage.Leave("nobody", old));

        assertEquals(Set.of("p1", "obs"), describe(room).members());
        observer.expectNoMessage(QUIET);
    }

    @Test
    public void testPopulationReportedOnEveryChange() throws Exception {
        ActorRef<RoomMessage> room = room("pop", 5);
        var a = new TestProbe<SessionMessage>("a");
        var b = new TestProbe<SessionMessage>("b");

        join(room, "a", a);
        join(room, "b", b);
        room.tell(new RoomMessage.Leave("a", a));

        assertEquals(1, registry.expect(RegistryMessage.PopulationChanged.class).members());
        assertEquals(2, registry.expect(RegistryMessage.PopulationChanged.class).members());
        var last = registry.expect(RegistryMessage.PopulationChanged.class);
        assertEquals(1, last.members());
        assertEquals("pop", last.roomId());
        assertSame(room, last.room());
    }

    @Test
    public void testBroadcastDeliversOneCopyPerMember() throws Exception {
        ActorRef<RoomMessage> room = room("fan", 5);
        var a = new TestProbe<SessionMessage>("a");
        var b = new TestProbe<SessionMessage>("b");
        var c = new TestProbe<SessionMessage>("c");
        join(room, "a", a);
        join(room, "b", b);
        join(room, "c", c);
        // drain join notices
        a.expect(SessionMessage.FromRoom.class);
        a.expect(SessionMessage.FromRoom.class);
        b.expect(SessionMessage.FromRoom.class);

        var chat = new RoomEvent.Chat("fan", "a", "hello", 1L);
        room.tell(new RoomMessage.Broadcast(chat, a, true));

        assertEquals(chat, b.expect(SessionMessage.FromRoom.class).event());
        assertEquals(chat, c.expect(SessionMessage.FromRoom.class).event());
        a.expectNoMessage(QUIET);
        b.expectNoMessage(Duration.ofMillis(50));

        room.tell(new RoomMessage.Broadcast(chat, a, false));
        assertEquals(chat, a.expect(SessionMessage.FromRoom.class).event());
        assertEquals(chat, b.expect(SessionMessage.FromRoom.class).event());
        assertEquals(chat, c.expect(SessionMessage.FromRoom.class).event());
    }

    @Test
    public void testCloseNotifiesMembersAndRefusesJoins() throws Exception {
        ActorRef<RoomMessage> room = room("closing", 5);
        var a = new TestProbe<SessionMessage>("a");
        join(room, "a", a);

        var late = new TestProbe<SessionMessage>("late");
        room.tell(new RoomMessage.Close("maintenance"));
        boolean queued = room.tell(new RoomMessage.Join("late", late));

        var notice = a.expect(SessionMessage.FromRoom.class);
        var closing = assertInstanceOf(RoomEvent.Closing.class, notice.event());
        assertEquals("maintenance", closing.reason());
        assertEquals("Room closing", closing.name());

        system.terminationFuture(room).get(3, TimeUnit.SECONDS);
        if (queued) {
            assertEquals(JoinOutcome.ROOM_CLOSED, late.expect(SessionMessage.JoinReply.class).outcome(),
                         "a join queued behind close is answered, not dropped");
        }
        assertFalse(room.tell(new RoomMessage.Join("later", late)));
    }

    /**
     * A member session that ends without sending Leave is removed through the watch.
     */
    @Test
    public void testMemberTerminationActsAsLeave() throws Exception {
        ActorRef<RoomMessage> room = room("gone", 5);
        ActorRef<SessionMessage> session = system.spawn("session-x", () -> new Actor<SessionMessage>() {
            @Override
            protected void receive(SessionMessage message) {}
        });
        var observer = new TestProbe<SessionMessage>("observer");

        room.tell(new RoomMessage.Join("x", session));
        join(room, "obs", observer);
        assertEquals(Set.of("x", "obs"), describe(room).members());

        system.stop(session);

        var left = observer.expect(SessionMessage.FromRoom.class);
        assertEquals("x", assertInstanceOf(RoomEvent.MemberLeft.class, left.event()).playerId());
        assertEquals(Set.of("obs"), describe(room).members());
    }
}
