package com.example.roomhub.server;

/** Fan-out payloads a room delivers to its members. */
sealed interface RoomEvent {

    record MemberJoined(String roomId, String playerId, int members) implements RoomEvent {}

    record MemberLeft(String roomId, String playerId, int members) implements RoomEvent {}

    record Chat(String roomId, String senderId, String text, long timestamp) implements RoomEvent {}

    record Closing(String roomId, String name, String reason) implements RoomEvent {}
}
