package com.wmevs.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                // one row per emitted regressor file
                stmt.execute("CREATE TABLE IF NOT EXISTS ev_file (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "subject TEXT NOT NULL, " +
                        "design TEXT NOT NULL, " +
                        "run_id TEXT NOT NULL, " +
                        "condition_name TEXT NOT NULL, " +
                        "rel_path TEXT NOT NULL, " +
                        "content_hash TEXT NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (subject, design, run_id, condition_name)" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_ev_subject " +
                        "ON ev_file (subject, design);");
            }
        }
    }
}
