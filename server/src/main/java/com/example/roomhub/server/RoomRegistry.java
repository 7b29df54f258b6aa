package com.example.roomhub.server;

import com.example.roomhub.server.actor.Actor;
import com.example.roomhub.server.actor.ActorRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates rooms, answers matchmaking queries and keeps a best-effort population cache.
 * <p>
 * Cached counts are written only from {@link RegistryMessage.PopulationChanged} sent by the room
 * itself. Entries are removed when the watched room terminates.
 */
final class RoomRegistry extends Actor<RegistryMessage> {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    static final String EVICTION_REASON = "Room is empty";
    static final String SHUTDOWN_REASON = "Server shutdown";

    private final ServerConfig config;
    private final Map<String, Entry> rooms = new LinkedHashMap<>();
    private long counter;

    private static final class Entry {
        final String roomId;
        final String name;
        final int capacity;
        final boolean persistent;
        final ActorRef<RoomMessage> ref;
        int members;
        boolean occupied;
        boolean closing;

        Entry(String roomId, String name, int capacity, boolean persistent, ActorRef<RoomMessage> ref) {
            this.roomId = roomId;
            this.name = name;
            this.capacity = capacity;
            this.persistent = persistent;
            this.ref = ref;
        }

        boolean hasSpace() { return !closing && members < capacity; }

        RoomSummary summary() { return new RoomSummary(roomId, name, members, capacity, persistent); }
    }

    RoomRegistry(ServerConfig config) {
        this.config = config;
    }

    @Override
    protected void receive(RegistryMessage message) {
        if (message instanceof RegistryMessage.CreateRoom m) m.reply().complete(create(m.spec()));
        else if (message instanceof RegistryMessage.FindRoom m) m.reply().complete(find(m.criteria()));
        else if (message instanceof RegistryMessage.PopulationChanged m) onPopulation(m.roomId(), m.room(), m.members());
        else if (message instanceof RegistryMessage.RoomTerminated m) onTerminated(m.roomId(), m.room());
        else if (message instanceof RegistryMessage.ListRooms m) m.reply().complete(list());
        else if (message instanceof RegistryMessage.CloseRoom m) close(m.roomId(), m.reason());
        else throw new IllegalStateException("unhandled message " + message.getClass().getName());
    }

    private CreateRoomResult create(RoomSpec spec) {
        String id = spec.roomId() == null || spec.roomId().isBlank() ? nextRoomId() : spec.roomId().trim();
        if (rooms.containsKey(id)) {
            log.debug("create {} refused: already exists", id);
            return CreateRoomResult.alreadyExists(id);
        }
        String name = spec.name() == null || spec.name().isBlank() ? "Room " + id : spec.name().trim();
        int capacity = spec.capacity() <= 0 ? config.defaultRoomCapacity : Math.min(spec.capacity(), config.maxRoomCapacity);

        ActorRef<RoomMessage> ref = context().system().spawn("room-" + id, () -> new Room(id, name, capacity, self()));
        context().watch(ref, () -> new RegistryMessage.RoomTerminated(id, ref));

        Entry e = new Entry(id, name, capacity, spec.persistent(), ref);
        rooms.put(id, e);
        log.info("Created room {} ('{}'), capacity {}{}", id, name, capacity, spec.persistent() ? ", persistent" : "");
        return CreateRoomResult.created(e.summary(), ref);
    }

    private String nextRoomId() {
        String id;
        do {
            id = "room_" + (++counter);
        } while (rooms.containsKey(id));
        return id;
    }

    private FindRoomResult find(RoomCriteria criteria) {
        if (!criteria.isAny()) {
            Entry e = rooms.get(criteria.roomId());
            if (e == null || e.closing) return FindRoomResult.notFound(criteria.roomId());
            if (!e.hasSpace()) return FindRoomResult.full(e.roomId);
            return FindRoomResult.found(e.roomId, e.ref);
        }
        for (Entry e : rooms.values()) {
            if (e.hasSpace()) return FindRoomResult.found(e.roomId, e.ref);
        }
        return rooms.isEmpty() ? FindRoomResult.notFound(null) : FindRoomResult.full(null);
    }

    private void onPopulation(String roomId, ActorRef<RoomMessage> room, int members) {
        Entry e = rooms.get(roomId);
        if (e == null || !e.ref.equals(room)) {
            log.debug("ignoring population {} for unknown room {}", members, roomId);
            return;
        }
        e.members = members;
        if (members > 0) e.occupied = true;

        if (config.evictEmptyRooms && !e.persistent && e.occupied && members == 0 && !e.closing) {
            log.info("Room {} is empty, evicting", roomId);
            e.closing = true;
            e.ref.tell(new RoomMessage.Close(EVICTION_REASON));
        }
    }

    private void onTerminated(String roomId, ActorRef<RoomMessage> room) {
        Entry e = rooms.get(roomId);
        if (e != null && e.ref.equals(room)) {
            rooms.remove(roomId);
            log.info("Room {} removed from registry", roomId);
        }
    }

    private List<RoomSummary> list() {
        List<RoomSummary> out = new ArrayList<>(rooms.size());
        for (Entry e : rooms.values()) out.add(e.summary());
        return out;
    }

    private void close(String roomId, String reason) {
        Entry e = rooms.get(roomId);
        if (e == null) {
            log.debug("close: unknown room {}", roomId);
            return;
        }
        e.closing = true;
        e.ref.tell(new RoomMessage.Close(reason));
    }

    @Override
    protected void postStop() {
        for (Entry e : rooms.values()) e.ref.tell(new RoomMessage.Close(SHUTDOWN_REASON));
        rooms.clear();
    }
}
