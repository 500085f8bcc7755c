package cloud.adauth.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Logger;

/**
 * SQLite schema for stored sessions.
 *
 * <p>
 * Group membership lives in its own table, one row per (identity, group), so group ids need no delimiter escaping.
 * </p>
 */
final class SessionSchema {

    private static final Logger LOGGER = Logger.getLogger(SessionSchema.class.getName());

    private SessionSchema() {
    }

    /**
     * Creates the tables if they don't exist. Safe to call multiple times.
     */
    static void initialize(Connection conn) throws SQLException {
        LOGGER.fine("[adauth] initializing session schema");

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS sessions (
                    identity TEXT PRIMARY KEY,
                    access_token TEXT,
                    refresh_token TEXT,
                    expires_on INTEGER NOT NULL,
                    token_type TEXT,
                    resource TEXT,
                    scope TEXT
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS session_groups (
                    identity TEXT NOT NULL,
                    group_id TEXT NOT NULL,
                    PRIMARY KEY (identity, group_id)
                )
                """);
        }
    }
}
