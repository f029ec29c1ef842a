package com.wmevs.db;

import com.wmevs.pipeline.regressor.EvFileKey;

import java.sql.*;
import java.util.Optional;

/**
 * SQLite record of emitted regressor files and their content hashes.
 */
public class EvManifestDao {

    private final String dbPath;

    public EvManifestDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /**
     * Fails with a constraint violation if the key was recorded before.
     */
    public void insert(EvFileKey key, String relPath, String contentHash) throws SQLException {
        String sql = "INSERT INTO ev_file (subject, design, run_id, condition_name, rel_path, content_hash, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, key, relPath, contentHash);
            ps.executeUpdate();
        }
    }

    public void upsert(EvFileKey key, String relPath, String contentHash) throws SQLException {
        String sql = "INSERT INTO ev_file (subject, design, run_id, condition_name, rel_path, content_hash, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(subject, design, run_id, condition_name) DO UPDATE SET " +
                "rel_path = excluded.rel_path, content_hash = excluded.content_hash, created_ts = excluded.created_ts";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, key, relPath, contentHash);
            ps.executeUpdate();
        }
    }

    public Optional<String> findHash(EvFileKey key) throws SQLException {
        String sql = "SELECT content_hash FROM ev_file " +
                "WHERE subject = ? AND design = ? AND run_id = ? AND condition_name = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.getSubject());
            ps.setString(2, key.getDesign());
            ps.setString(3, key.getRunId());
            ps.setString(4, key.getCondition());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString("content_hash"));
                }
            }
        }
        return Optional.empty();
    }

    public int countBySubject(String subject) throws SQLException {
        String sql = "SELECT COUNT(*) FROM ev_file WHERE subject = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, subject);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static void bind(PreparedStatement ps, EvFileKey key, String relPath, String contentHash)
            throws SQLException {
        ps.setString(1, key.getSubject());
        ps.setString(2, key.getDesign());
        ps.setString(3, key.getRunId());
        ps.setString(4, key.getCondition());
        ps.setString(5, relPath);
        ps.setString(6, contentHash);
        ps.setLong(7, System.currentTimeMillis());
    }
}
