package com.example.roomhub.server.store;

import com.example.roomhub.common.Net;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.Optional;

/**
 * PostgreSQL player store. One row per player; the document is kept as JSON text.
 */
public final class JdbcPlayerStore implements PlayerStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcPlayerStore.class);

    private final String url;
    private final String user;
    private final String pass;

    public JdbcPlayerStore(String url, String user, String pass) {
        this.url = url;
        this.user = user;
        this.pass = pass;
    }

    private Connection get() throws SQLException {
        return DriverManager.getConnection(url, user, pass);
    }

    public void init() throws PlayerStoreException {
        try (Connection c = get(); Statement st = c.createStatement()) {
            st.execute(
                "CREATE TABLE IF NOT EXISTS player_data(" +
                "  player_id TEXT PRIMARY KEY," +
                "  data TEXT NOT NULL," +
                "  created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "  updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ");"
            );
            log.info("player_data table ready at {}", url);
        } catch (SQLException e) {
            throw new PlayerStoreException("schema init failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<PlayerData> load(String playerId) throws PlayerStoreException {
        try (Connection c = get();
             PreparedStatement ps = c.prepareStatement("SELECT data FROM player_data WHERE player_id = ?")) {
            ps.setString(1, playerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(Net.MAPPER.readValue(rs.getString("data"), PlayerData.class));
            }
        } catch (SQLException e) {
            throw new PlayerStoreException("load " + playerId + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new PlayerStoreException("stored data for " + playerId + " is unreadable", e);
        }
    }

    @Override
    public void save(PlayerData data) throws PlayerStoreException {
        try (Connection c = get();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO player_data(player_id, data, updated_at) VALUES (?, ?, now()) " +
                     "ON CONFLICT (player_id) DO UPDATE SET data = EXCLUDED.data, updated_at = now()"
             )) {
            ps.setString(1, data.playerId());
            ps.setString(2, Net.toJson(data));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PlayerStoreException("save " + data.playerId() + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new PlayerStoreException("cannot encode data for " + data.playerId(), e);
        }
    }
}
