package cloud.adauth.store;

import cloud.adauth.AuthException;
import cloud.adauth.Session;

import java.util.Optional;

/**
 * Durable key-value persistence of sessions keyed by identity.
 */
public interface SessionStore extends AutoCloseable {

    /**
     * Inserts the session or fully replaces the stored row with the same identity. Never a partial update.
     */
    void upsert(Session session) throws AuthException;

    /**
     * Point lookup. Absence is a normal outcome and yields an empty optional.
     */
    Optional<Session> find(String identity) throws AuthException;

    @Override
    default void close() {
        // default no-op
    }
}
