package com.example.roomhub.server;

import com.example.roomhub.server.actor.Actor;
import com.example.roomhub.server.actor.ActorRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * One game room: the authoritative member map and the fan-out of room events.
 * <p>
 * Only this component mutates {@link #members}. Every change is reported to the registry with the
 * map size at that moment.
 */
final class Room extends Actor<RoomMessage> {
    private static final Logger log = LoggerFactory.getLogger(Room.class);

    static final String DEFAULT_CLOSE_REASON = "Room closed";

    final String roomId;
    final String name;
    final int capacity;

    private final ActorRef<RegistryMessage> registry;
    private final Map<String, ActorRef<SessionMessage>> members = new HashMap<>();
    private String closeReason = DEFAULT_CLOSE_REASON;

    Room(String roomId, String name, int capacity, ActorRef<RegistryMessage> registry) {
        this.roomId = roomId;
        this.name = name;
        this.capacity = capacity;
        this.registry = registry;
    }

    @Override
    protected void preStart() {
        log.info("Room {} ('{}') started, capacity {}", roomId, name, capacity);
        reportPopulation();
    }

    @Override
    protected void receive(RoomMessage message) {
        if (message instanceof RoomMessage.Join m) onJoin(m.playerId(), m.session());
        else if (message instanceof RoomMessage.Leave m) onLeave(m.playerId(), m.session());
        else if (message instanceof RoomMessage.MemberGone m) onMemberGone(m.session());
        else if (message instanceof RoomMessage.Broadcast m) broadcast(m.event(), m.sender(), m.excludeSender());
        else if (message instanceof RoomMessage.Describe m) m.reply().complete(snapshot());
        else if (message instanceof RoomMessage.Close m) onClose(m.reason());
        else throw new IllegalStateException("unhandled message " + message.getClass().getName());
    }

    private void onJoin(String playerId, ActorRef<SessionMessage> session) {
        if (members.size() >= capacity) {
            log.debug("Room {}: {} rejected, full ({}/{})", roomId, playerId, members.size(), capacity);
            reply(session, JoinOutcome.ROOM_FULL);
            return;
        }
        if (members.containsKey(playerId)) {
            reply(session, JoinOutcome.ALREADY_MEMBER);
            return;
        }

        members.put(playerId, session);
        context().watch(session, () -> new RoomMessage.MemberGone(session));
        reportPopulation();
        broadcast(new RoomEvent.MemberJoined(roomId, playerId, members.size()), session, true);
        reply(session, JoinOutcome.JOINED);
        log.info("Room {}: {} joined ({}/{})", roomId, playerId, members.size(), capacity);
    }

    private void onLeave(String playerId, ActorRef<SessionMessage> session) {
        ActorRef<SessionMessage> stored = members.get(playerId);
        if (stored == null || !stored.equals(session)) {
            log.debug("Room {}: ignoring stale leave for {}", roomId, playerId);
            return;
        }
        removeMember(playerId, session);
    }

    private void onMemberGone(ActorRef<SessionMessage> session) {
        for (Map.Entry<String, ActorRef<SessionMessage>> e : members.entrySet()) {
            if (e.getValue().equals(session)) {
                log.info("Room {}: session of {} ended without leaving", roomId, e.getKey());
                removeMember(e.getKey(), session);
                return;
            }
        }
    }

    private void removeMember(String playerId, ActorRef<SessionMessage> session) {
        members.remove(playerId);
        context().unwatch(session);
        reportPopulation();
        broadcast(new RoomEvent.MemberLeft(roomId, playerId, members.size()), session, true);
        log.info("Room {}: {} left ({}/{})", roomId, playerId, members.size(), capacity);
    }

    private void broadcast(RoomEvent event, ActorRef<SessionMessage> sender, boolean excludeSender) {
        SessionMessage.FromRoom msg = new SessionMessage.FromRoom(self(), event);
        for (ActorRef<SessionMessage> member : members.values()) {
            if (excludeSender && member.equals(sender)) continue;
            member.tell(msg);
        }
    }

    private void onClose(String reason) {
        if (reason != null && !reason.isBlank()) closeReason = reason;
        log.info("Room {} closing: {}", roomId, closeReason);
        context().stop();
    }

    private void reply(ActorRef<SessionMessage> session, JoinOutcome outcome) {
        session.tell(new SessionMessage.JoinReply(self(), roomId, outcome, members.size()));
    }

    private void reportPopulation() {
        registry.tell(new RegistryMessage.PopulationChanged(roomId, self(), members.size()));
    }

    private RoomSnapshot snapshot() {
        return new RoomSnapshot(roomId, name, capacity, Set.copyOf(members.keySet()));
    }

    static String closingNotice(String name) {
        return "Room '" + name + "' is shutting down.";
    }

    @Override
    protected void postStop() {
        RoomEvent.Closing closing = new RoomEvent.Closing(roomId, name, closeReason);
        SessionMessage.FromRoom msg = new SessionMessage.FromRoom(self(), closing);
        for (Iterator<ActorRef<SessionMessage>> it = members.values().iterator(); it.hasNext(); ) {
            it.next().tell(msg);
            it.remove();
        }
        log.info("Room {} stopped", roomId);
    }

    @Override
    protected void onUndelivered(RoomMessage message) {
        if (message instanceof RoomMessage.Join m) {
            m.session().tell(new SessionMessage.JoinReply(self(), roomId, JoinOutcome.ROOM_CLOSED, 0));
        } else if (message instanceof RoomMessage.Describe m) {
            m.reply().completeExceptionally(new IllegalStateException("room " + roomId + " is closed"));
        }
    }
}
