package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/** Everything the {@link WorldRegistry} can receive. */
sealed interface WorldMessage {

    record PlayerEntered(String playerId, ActorRef<SessionMessage> session) implements WorldMessage {}

    record PlayerLeft(String playerId, ActorRef<SessionMessage> session) implements WorldMessage {}

    record OnlinePlayers(CompletableFuture<Set<String>> reply) implements WorldMessage {}
}
