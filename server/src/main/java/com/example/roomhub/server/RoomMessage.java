package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;

import java.util.concurrent.CompletableFuture;

/** Everything a {@link Room} can receive. */
sealed interface RoomMessage {

    record Join(String playerId, ActorRef<SessionMessage> session) implements RoomMessage {}

    record Leave(String playerId, ActorRef<SessionMessage> session) implements RoomMessage {}

    /** A watched member session terminated. */
    record MemberGone(ActorRef<SessionMessage> session) implements RoomMessage {}

    record Broadcast(RoomEvent event, ActorRef<SessionMessage> sender, boolean excludeSender) implements RoomMessage {}

    record Describe(CompletableFuture<RoomSnapshot> reply) implements RoomMessage {}

    record Close(String reason) implements RoomMessage {}
}
