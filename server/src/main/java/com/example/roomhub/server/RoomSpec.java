package com.example.roomhub.server;

/**
 * Request to create a room. A blank id, blank name or non-positive capacity means "use the default".
 */
record RoomSpec(String roomId, String name, int capacity, boolean persistent) {

    static RoomSpec adHoc(String roomId, String name, int capacity) {
        return new RoomSpec(roomId, name, capacity, false);
    }
}
