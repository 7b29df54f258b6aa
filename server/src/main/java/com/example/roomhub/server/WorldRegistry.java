package com.example.roomhub.server;

import com.example.roomhub.server.actor.Actor;
import com.example.roomhub.server.actor.ActorRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide set of authenticated players, independent of room membership.
 */
final class WorldRegistry extends Actor<WorldMessage> {
    private static final Logger log = LoggerFactory.getLogger(WorldRegistry.class);

    private final Map<String, ActorRef<SessionMessage>> players = new HashMap<>();

    @Override
    protected void receive(WorldMessage message) {
        if (message instanceof WorldMessage.PlayerEntered m) onEntered(m.playerId(), m.session());
        else if (message instanceof WorldMessage.PlayerLeft m) onLeft(m.playerId(), m.session());
        else if (message instanceof WorldMessage.OnlinePlayers m) m.reply().complete(Set.copyOf(players.keySet()));
        else throw new IllegalStateException("unhandled message " + message.getClass().getName());
    }

    private void onEntered(String playerId, ActorRef<SessionMessage> session) {
        ActorRef<SessionMessage> existing = players.putIfAbsent(playerId, session);
        if (existing != null) {
            log.warn("Player {} already online via {}, ignoring entry from {}", playerId, existing.name(), session.name());
            return;
        }
        log.info("Player {} entered the world ({} online)", playerId, players.size());
    }

    private void onLeft(String playerId, ActorRef<SessionMessage> session) {
        ActorRef<SessionMessage> existing = players.get(playerId);
        if (existing == null) {
            log.debug("Player {} left but was not registered", playerId);
            return;
        }
        if (!existing.equals(session)) {
            log.debug("Player {}: leave from {} does not match registered {}", playerId, session.name(), existing.name());
            return;
        }
        players.remove(playerId);
        log.info("Player {} left the world ({} online)", playerId, players.size());
    }
}
