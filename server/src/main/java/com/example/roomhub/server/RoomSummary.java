package com.example.roomhub.server;

import com.example.roomhub.common.Messages;

/** Cached view of a room held by the registry. Not authoritative. */
record RoomSummary(String roomId, String name, int members, int capacity, boolean persistent) {

    Messages.RoomInfo toInfo() {
        return new Messages.RoomInfo(roomId, name, members, capacity, persistent);
    }
}
