package com.example.roomhub.server;

import com.example.roomhub.common.Messages;

/** Matchmaking query. A null room id matches any room with spare capacity. */
record RoomCriteria(String roomId) {

    static RoomCriteria any() { return new RoomCriteria(null); }

    static RoomCriteria parse(String criteria) {
        if (criteria == null) return any();
        String c = criteria.trim();
        if (c.isEmpty() || Messages.ANY_ROOM.equals(c)) return any();
        return new RoomCriteria(c);
    }

    boolean isAny() { return roomId == null; }
}
