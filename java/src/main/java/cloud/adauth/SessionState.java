package cloud.adauth;

import java.time.Clock;

/**
 * State of a stored session as seen by {@link SessionManager#resolve(String)}.
 */
public enum SessionState {
    /** Stored and not expired. */
    FRESH,
    /** Stored, expired, and carrying a refresh token. */
    STALE_REFRESHABLE,
    /** Stored and expired without a refresh token; the user has to sign in again. */
    EXPIRED_UNREFRESHABLE,
    /** No stored row. */
    UNKNOWN;

    static SessionState of(Session session, Clock clock) {
        if (session == null) {
            return UNKNOWN;
        }
        if (!session.isExpired(clock)) {
            return FRESH;
        }
        String refreshToken = session.getRefreshToken();
        return refreshToken == null || refreshToken.isBlank() ? EXPIRED_UNREFRESHABLE : STALE_REFRESHABLE;
    }
}
