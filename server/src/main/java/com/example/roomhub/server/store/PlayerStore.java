package com.example.roomhub.server.store;

import java.util.Optional;

/**
 * Player persistence. Implementations may block; sessions call them from the I/O executor only.
 */
public interface PlayerStore {

    /** @return empty when the player has never been saved */
    Optional<PlayerData> load(String playerId) throws PlayerStoreException;

    void save(PlayerData data) throws PlayerStoreException;
}
