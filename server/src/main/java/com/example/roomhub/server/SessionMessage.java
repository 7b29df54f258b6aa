package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;
import com.example.roomhub.server.ledger.PreparedTransaction;
import com.example.roomhub.server.store.PlayerData;

import java.util.List;

/** Everything a {@link PlayerSession} can receive. */
sealed interface SessionMessage {

    // ---- from the connection ----
    record Connected(ClientChannel channel) implements SessionMessage {}

    record ClientMessage(byte[] bytes) implements SessionMessage {}

    record Disconnected(String reason) implements SessionMessage {}

    // ---- self / admin ----
    record DeadlineExpired(long generation) implements SessionMessage {}

    record Stop(String reason) implements SessionMessage {}

    // ---- replies from registries and rooms ----
    record RoomFound(FindRoomResult result) implements SessionMessage {}

    record JoinReply(ActorRef<RoomMessage> room, String roomId, JoinOutcome outcome, int members) implements SessionMessage {}

    record FromRoom(ActorRef<RoomMessage> room, RoomEvent event) implements SessionMessage {}

    record RoomCreated(CreateRoomResult result) implements SessionMessage {}

    record RoomsListed(List<RoomSummary> rooms) implements SessionMessage {}

    // ---- collaborator results, piped back into the mailbox ----
    record PlayerDataLoaded(String playerId, PlayerData data, Throwable failure) implements SessionMessage {}

    record LedgerCompleted(String actionName, PreparedTransaction transaction, Throwable failure) implements SessionMessage {}
}
