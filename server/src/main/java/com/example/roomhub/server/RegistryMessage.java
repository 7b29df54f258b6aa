package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Everything the {@link RoomRegistry} can receive. */
sealed interface RegistryMessage {

    record CreateRoom(RoomSpec spec, CompletableFuture<CreateRoomResult> reply) implements RegistryMessage {}

    record FindRoom(RoomCriteria criteria, CompletableFuture<FindRoomResult> reply) implements RegistryMessage {}

    /** Sent by a room after every membership change. */
    record PopulationChanged(String roomId, ActorRef<RoomMessage> room, int members) implements RegistryMessage {}

    record RoomTerminated(String roomId, ActorRef<RoomMessage> room) implements RegistryMessage {}

    record ListRooms(CompletableFuture<List<RoomSummary>> reply) implements RegistryMessage {}

    record CloseRoom(String roomId, String reason) implements RegistryMessage {}
}
