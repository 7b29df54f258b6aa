package com.example.roomhub.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryPlayerStore implements PlayerStore {
    private final ConcurrentHashMap<String, PlayerData> data = new ConcurrentHashMap<>();

    @Override
    public Optional<PlayerData> load(String playerId) {
        return Optional.ofNullable(data.get(playerId));
    }

    @Override
    public void save(PlayerData d) {
        data.put(d.playerId(), d);
    }

    public int size() { return data.size(); }
}
