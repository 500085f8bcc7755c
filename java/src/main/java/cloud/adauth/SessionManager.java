package cloud.adauth;

import cloud.adauth.auth.AuthorizationCodeTokenClient;
import cloud.adauth.auth.IssuedTokens;
import cloud.adauth.auth.RefreshedTokens;
import cloud.adauth.auth.TokenClient;
import cloud.adauth.directory.DirectoryClient;
import cloud.adauth.directory.GraphDirectoryClient;
import cloud.adauth.store.SessionStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Entry point of the library: turns authorization codes into stored sessions and resolves stored sessions on later
 * requests.
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>{@link #completeLogin(String)} persists a session only after both the token exchange and the group lookup
 *       succeeded.</li>
 *   <li>{@link #resolve(String)} answers fresh sessions straight from the store without network calls and refreshes
 *       expired ones. Refresh failures propagate; a stale session is never returned.</li>
 *   <li>Refresh is single-flight per identity: concurrent callers for the same identity wait for the first refresh and
 *       reuse its result.</li>
 * </ul>
 *
 * <p>
 * This is the only writer to the {@link SessionStore}.
 * </p>
 */
public final class SessionManager {

    private static final Logger LOGGER = Logger.getLogger(SessionManager.class.getName());

    static final String UNKNOWN_GROUP_NAME = "unknown";

    private final TokenClient tokenClient;
    private final DirectoryClient directoryClient;
    private final SessionStore store;
    private final Clock clock;
    private final String authGroup;

    // entries live only while a refresh for that identity is running or awaited
    private final Map<String, RefreshLock> refreshLocks = new ConcurrentHashMap<>();

    public SessionManager(
        TokenClient tokenClient,
        DirectoryClient directoryClient,
        SessionStore store,
        Clock clock,
        String authGroup
    ) {
        this.tokenClient = Objects.requireNonNull(tokenClient, "tokenClient");
        this.directoryClient = Objects.requireNonNull(directoryClient, "directoryClient");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.authGroup = authGroup == null || authGroup.isBlank() ? null : authGroup;
    }

    /**
     * Wires the HTTP clients from {@code config} around the supplied store.
     */
    public SessionManager(Config config, SessionStore store) {
        this(
            new AuthorizationCodeTokenClient(config),
            new GraphDirectoryClient(config),
            store,
            Clock.systemUTC(),
            config.getAuthGroup()
        );
    }

    /**
     * Exchanges an authorization code, resolves the new identity's groups with the newly issued access token and
     * stores the result.
     *
     * @throws AuthException when either remote call or the store write fails; nothing is persisted in that case.
     */
    public Session completeLogin(String code) throws AuthException {
        IssuedTokens tokens = tokenClient.exchangeCode(code);
        Set<String> groups = directoryClient.userGroups(tokens.accessToken());

        Session session = Session.fromIssued(tokens, groups);
        store.upsert(session);
        LOGGER.info(() -> "[adauth] user " + session.getIdentity() + " logged in");
        return session;
    }

    /**
     * Loads the stored session for {@code identity}, refreshing it first when it has expired.
     *
     * @return the usable session, or empty when no session is stored or the stored one can no longer be refreshed.
     * @throws AuthException when a refresh was needed and the token exchange, group lookup or store write failed.
     */
    public Optional<Session> resolve(String identity) throws AuthException {
        LOGGER.fine(() -> "[adauth] loading user " + identity);
        Optional<Session> stored = store.find(identity);
        switch (SessionState.of(stored.orElse(null), clock)) {
            case FRESH:
                return stored;
            case UNKNOWN:
                LOGGER.warning(() -> "[adauth] user " + identity + " not in database");
                return Optional.empty();
            case EXPIRED_UNREFRESHABLE:
                LOGGER.warning(() -> "[adauth] user " + identity + " expired without a refresh token");
                return Optional.empty();
            default:
                return refreshSingleFlight(identity);
        }
    }

    /**
     * Same as {@link #resolve(String)} but treats a missing session as an error.
     *
     * @throws AuthException with {@link AuthException.Kind#NOT_FOUND} when there is no usable session.
     */
    public Session require(String identity) throws AuthException {
        return resolve(identity).orElseThrow(() ->
            new AuthException(AuthException.Kind.NOT_FOUND, "no session for " + identity));
    }

    /**
     * Re-resolves the session's groups with its current access token and stores them.
     *
     * @return the refreshed group ids
     */
    public Set<String> refreshGroups(Session session) throws AuthException {
        Objects.requireNonNull(session, "session");
        Set<String> groups = directoryClient.userGroups(session.getAccessToken());

        Session updated = session.copy();
        updated.replaceGroups(groups);
        store.upsert(updated);
        session.replaceGroups(groups);
        return session.getGroups();
    }

    /**
     * Pairs each of the session's group ids with its directory display name, {@code "unknown"} when the directory
     * does not list it. Meant for display only.
     */
    public List<NamedGroup> namedGroups(Session session) throws AuthException {
        Objects.requireNonNull(session, "session");
        Map<String, String> names = directoryClient.allGroups(session.getAccessToken());
        List<NamedGroup> out = new ArrayList<>(session.getGroups().size());
        for (String group : session.getGroups()) {
            out.add(new NamedGroup(group, names.getOrDefault(group, UNKNOWN_GROUP_NAME)));
        }
        return out;
    }

    /**
     * @return whether the session holds the configured baseline group; always true when none is configured.
     */
    public boolean hasDefaultGroup(Session session) {
        return authGroup == null || session.hasGroup(authGroup);
    }

    public String getAuthGroup() {
        return authGroup;
    }

    int pendingRefreshLocks() {
        return refreshLocks.size();
    }

    private Optional<Session> refreshSingleFlight(String identity) throws AuthException {
        RefreshLock entry = refreshLocks.compute(identity, (key, existing) -> {
            RefreshLock held = existing == null ? new RefreshLock() : existing;
            held.users++;
            return held;
        });
        entry.lock.lock();
        try {
            // another caller may have refreshed while we waited
            Optional<Session> current = store.find(identity);
            switch (SessionState.of(current.orElse(null), clock)) {
                case FRESH:
                    return current;
                case STALE_REFRESHABLE:
                    return Optional.of(refresh(current.get()));
                default:
                    return Optional.empty();
            }
        } finally {
            entry.lock.unlock();
            refreshLocks.computeIfPresent(identity, (key, held) -> --held.users == 0 ? null : held);
        }
    }

    private Session refresh(Session stored) throws AuthException {
        LOGGER.info(() -> "[adauth] refreshing user " + stored.getIdentity());
        RefreshedTokens tokens = tokenClient.refresh(stored.getRefreshToken());
        Set<String> groups = directoryClient.userGroups(tokens.accessToken());

        Session updated = stored.copy();
        updated.applyRefresh(tokens, groups);
        store.upsert(updated);
        return updated;
    }

    /**
     * Per-identity refresh lock with a count of the callers holding or waiting on it. The count is only touched
     * inside {@code compute} calls on the owning map.
     */
    private static final class RefreshLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
