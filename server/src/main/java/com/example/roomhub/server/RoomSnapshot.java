package com.example.roomhub.server;

import java.util.Set;

/** Authoritative membership, as seen by the room itself at the time it answered. */
record RoomSnapshot(String roomId, String name, int capacity, Set<String> members) {}
