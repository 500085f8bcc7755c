package cloud.adauth.guard;

import cloud.adauth.Config;
import cloud.adauth.Session;

import java.util.Optional;

/**
 * Group-based access check for routing middleware. The guard only decides; sending the redirect or the 403 is left to
 * the caller.
 */
public final class AccessGuard {

    static final String FORBIDDEN_MESSAGE = "You dont have the necessary group to access this view";

    private final String authGroup;
    private final String forbiddenRedirect;
    private final boolean disabled;

    public AccessGuard(String authGroup, String forbiddenRedirect, boolean disabled) {
        this.authGroup = authGroup == null || authGroup.isBlank() ? null : authGroup;
        this.forbiddenRedirect = forbiddenRedirect == null || forbiddenRedirect.isBlank() ? null : forbiddenRedirect;
        this.disabled = disabled;
    }

    public AccessGuard(Config config) {
        this(config.getAuthGroup(), config.getForbiddenRedirect(), config.isLoginDisabled());
    }

    /**
     * Requires a session that holds {@code requiredGroup}.
     */
    public AccessDecision check(Optional<Session> session, String requiredGroup) {
        if (disabled) {
            return AccessDecision.allow();
        }
        if (session.isEmpty() || !session.get().isAuthenticated()) {
            return AccessDecision.unauthenticated();
        }
        if (!session.get().hasGroup(requiredGroup)) {
            return AccessDecision.forbidden(forbiddenRedirect, FORBIDDEN_MESSAGE);
        }
        return AccessDecision.allow();
    }

    /**
     * Requires a session holding the configured baseline group, or any session when no baseline group is set.
     */
    public AccessDecision checkDefault(Optional<Session> session) {
        if (!disabled && authGroup == null) {
            return session.isPresent() && session.get().isAuthenticated()
                ? AccessDecision.allow() : AccessDecision.unauthenticated();
        }
        return check(session, authGroup);
    }
}
