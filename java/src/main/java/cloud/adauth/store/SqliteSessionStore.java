package cloud.adauth.store;

import cloud.adauth.AuthException;
import cloud.adauth.Config;
import cloud.adauth.Session;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SQLite-backed session store.
 *
 * <p>
 * Supports two modes:
 * </p>
 * <ul>
 *   <li>Standalone: opens and owns its own JDBC connection from a URL.</li>
 *   <li>Shared: uses an externally managed connection; the caller closes it.</li>
 * </ul>
 *
 * <p>
 * Every operation runs under the store's lock and each upsert is a single transaction, so concurrent writers for the
 * same identity serialise and the last one wins with a complete row.
 * </p>
 */
public final class SqliteSessionStore implements SessionStore {

    private static final Logger LOGGER = Logger.getLogger(SqliteSessionStore.class.getName());

    private static final String UPSERT_SESSION = """
        INSERT INTO sessions (identity, access_token, refresh_token, expires_on, token_type, resource, scope)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(identity) DO UPDATE SET
            access_token = excluded.access_token,
            refresh_token = excluded.refresh_token,
            expires_on = excluded.expires_on,
            token_type = excluded.token_type,
            resource = excluded.resource,
            scope = excluded.scope
        """;

    private static final String DELETE_GROUPS = "DELETE FROM session_groups WHERE identity = ?";

    private static final String INSERT_GROUP = "INSERT INTO session_groups (identity, group_id) VALUES (?, ?)";

    private static final String SELECT_SESSION = """
        SELECT identity, access_token, refresh_token, expires_on, token_type, resource, scope
        FROM sessions WHERE identity = ?
        """;

    private static final String SELECT_GROUPS = "SELECT group_id FROM session_groups WHERE identity = ? ORDER BY rowid";

    private final Connection connection;
    private final boolean ownsConnection;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Opens a standalone store on {@code jdbcUrl} and creates the schema.
     *
     * @throws AuthException with {@link AuthException.Kind#STORAGE_FAILURE} when the database cannot be opened
     */
    public SqliteSessionStore(String jdbcUrl) throws AuthException {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        Connection opened = null;
        try {
            opened = DriverManager.getConnection(jdbcUrl);
            SessionSchema.initialize(opened);
        } catch (SQLException ex) {
            if (opened != null) {
                try {
                    opened.close();
                } catch (SQLException closeEx) {
                    ex.addSuppressed(closeEx);
                }
            }
            throw new AuthException(AuthException.Kind.STORAGE_FAILURE,
                "open session store " + jdbcUrl + ": " + ex.getMessage(), ex);
        }
        this.connection = opened;
        this.ownsConnection = true;
        LOGGER.fine(() -> "[adauth] session store opened on " + jdbcUrl);
    }

    public SqliteSessionStore(Config config) throws AuthException {
        this(config.getDatabaseUrl());
    }

    /**
     * Uses an externally managed connection. The schema is created if missing; the connection is not closed by
     * {@link #close()}.
     */
    public SqliteSessionStore(Connection connection) throws AuthException {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.ownsConnection = false;
        try {
            SessionSchema.initialize(connection);
        } catch (SQLException ex) {
            throw new AuthException(AuthException.Kind.STORAGE_FAILURE,
                "initialize session schema: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void upsert(Session session) throws AuthException {
        Objects.requireNonNull(session, "session");
        lock.lock();
        try {
            boolean previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                writeSession(session);
                connection.commit();
            } catch (SQLException ex) {
                rollbackQuietly(ex);
                throw ex;
            } finally {
                connection.setAutoCommit(previousAutoCommit);
            }
            LOGGER.fine(() -> "[adauth] stored session for " + session.getIdentity());
        } catch (SQLException ex) {
            throw new AuthException(AuthException.Kind.STORAGE_FAILURE,
                "store session " + session.getIdentity() + ": " + ex.getMessage(), ex);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Session> find(String identity) throws AuthException {
        if (identity == null || identity.isBlank()) {
            return Optional.empty();
        }
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_SESSION)) {
            stmt.setString(1, identity);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Session(
                    rs.getString("identity"),
                    rs.getString("access_token"),
                    rs.getString("refresh_token"),
                    rs.getLong("expires_on"),
                    rs.getString("token_type"),
                    rs.getString("resource"),
                    rs.getString("scope"),
                    readGroups(identity)
                ));
            }
        } catch (SQLException ex) {
            throw new AuthException(AuthException.Kind.STORAGE_FAILURE,
                "query session " + identity + ": " + ex.getMessage(), ex);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (!ownsConnection) {
            return;
        }
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException ex) {
            LOGGER.log(Level.WARNING, "[adauth] error closing session store connection", ex);
        }
    }

    private void writeSession(Session session) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(UPSERT_SESSION)) {
            stmt.setString(1, session.getIdentity());
            stmt.setString(2, session.getAccessToken());
            stmt.setString(3, session.getRefreshToken());
            stmt.setLong(4, session.getExpiresOn());
            stmt.setString(5, session.getTokenType());
            stmt.setString(6, session.getResource());
            stmt.setString(7, session.getScope());
            stmt.executeUpdate();
        }

        try (PreparedStatement stmt = connection.prepareStatement(DELETE_GROUPS)) {
            stmt.setString(1, session.getIdentity());
            stmt.executeUpdate();
        }

        if (session.getGroups().isEmpty()) {
            return;
        }
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_GROUP)) {
            for (String group : session.getGroups()) {
                stmt.setString(1, session.getIdentity());
                stmt.setString(2, group);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private List<String> readGroups(String identity) throws SQLException {
        List<String> groups = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_GROUPS)) {
            stmt.setString(1, identity);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    groups.add(rs.getString(1));
                }
            }
        }
        return groups;
    }

    private void rollbackQuietly(SQLException cause) {
        try {
            connection.rollback();
        } catch (SQLException ex) {
            cause.addSuppressed(ex);
        }
    }
}
