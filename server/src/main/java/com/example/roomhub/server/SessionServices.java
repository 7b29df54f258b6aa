package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;
import com.example.roomhub.server.ledger.LedgerService;
import com.example.roomhub.server.store.PlayerStore;

import java.util.concurrent.ExecutorService;

/** Collaborators every session needs, built once in {@link ServerMain}. */
record SessionServices(ServerConfig config,
                       ActorRef<RegistryMessage> roomRegistry,
                       ActorRef<WorldMessage> worldRegistry,
                       Authenticator authenticator,
                       PlayerStore playerStore,
                       LedgerService ledger,
                       ExecutorService ioExecutor) {}
