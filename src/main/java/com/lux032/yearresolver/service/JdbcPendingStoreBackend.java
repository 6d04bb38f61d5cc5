package com.lux032.yearresolver.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.lux032.yearresolver.model.PendingEntry;
import com.lux032.yearresolver.model.VerificationReason;
import com.lux032.yearresolver.util.PendingKeys;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.IOException;
import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MySQL mode pending table {@code pending_year_verification}.
 */
@Slf4j
public class JdbcPendingStoreBackend implements PendingStoreBackend {

    static final String TABLE = "pending_year_verification";

    private static final String CREATE_TABLE_SQL =
        "CREATE TABLE IF NOT EXISTS " + TABLE + " (" +
        "album_key CHAR(64) NOT NULL PRIMARY KEY, " +
        "artist VARCHAR(500) NOT NULL, " +
        "album VARCHAR(500) NOT NULL, " +
        "timestamp DATETIME NOT NULL, " +
        "reason VARCHAR(64) NOT NULL, " +
        "metadata TEXT, " +
        "attempt_count INT NOT NULL DEFAULT 1" +
        ") DEFAULT CHARSET=utf8mb4";

    private static final String SELECT_SQL =
        "SELECT artist, album, timestamp, reason, metadata, attempt_count FROM " + TABLE;

    private static final String DELETE_SQL = "DELETE FROM " + TABLE;

    private static final String INSERT_SQL =
        "INSERT INTO " + TABLE + " (album_key, artist, album, timestamp, reason, metadata, attempt_count) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final Type METADATA_TYPE = new TypeToken<LinkedHashMap<String, String>>() { }.getType();

    private final DataSource dataSource;
    private final Gson gson = new Gson();

    public JdbcPendingStoreBackend(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create the table if it does not exist yet.
     */
    public void initSchema() throws IOException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
        } catch (SQLException e) {
            throw new IOException("Failed to create table " + TABLE, e);
        }
    }

    @Override
    public List<PendingEntry> loadAll() throws IOException {
        List<PendingEntry> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(SELECT_SQL);
             ResultSet rs = pstmt.executeQuery()) {
            while (rs.next()) {
                entries.add(PendingEntry.builder()
                    .artist(rs.getString("artist"))
                    .album(rs.getString("album"))
                    .timestamp(rs.getTimestamp("timestamp").toLocalDateTime())
                    .reason(VerificationReason.fromString(rs.getString("reason")))
                    .metadata(parseMetadata(rs.getString("metadata")))
                    .attemptCount(Math.max(1, rs.getInt("attempt_count")))
                    .build());
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load pending verification table", e);
        }
        return entries;
    }

    @Override
    public void saveAll(List<PendingEntry> entries) throws IOException {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement delete = conn.createStatement();
                 PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                delete.executeUpdate(DELETE_SQL);
                for (PendingEntry entry : entries) {
                    insert.setString(1, PendingKeys.of(entry.getArtist(), entry.getAlbum()));
                    insert.setString(2, entry.getArtist());
                    insert.setString(3, entry.getAlbum());
                    insert.setTimestamp(4, Timestamp.valueOf(entry.getTimestamp()));
                    insert.setString(5, entry.getReason().getValue());
                    insert.setString(6, gson.toJson(entry.getMetadata()));
                    insert.setInt(7, entry.getAttemptCount());
                    insert.addBatch();
                }
                insert.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to save pending verification table", e);
        }
    }

    @Override
    public String describe() {
        return "mysql:" + TABLE;
    }

    private Map<String, String> parseMetadata(String raw) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (raw == null || raw.trim().isEmpty()) {
            return metadata;
        }
        try {
            Map<String, String> parsed = gson.fromJson(raw, METADATA_TYPE);
            if (parsed != null) {
                metadata.putAll(parsed);
            }
        } catch (JsonParseException e) {
            log.warn("Ignoring unreadable pending metadata: {}", e.getMessage());
        }
        return metadata;
    }
}
