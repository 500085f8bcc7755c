package cloud.adauth;

import cloud.adauth.auth.IssuedTokens;
import cloud.adauth.auth.RefreshedTokens;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Authenticated identity with its provider tokens and resolved directory groups.
 *
 * <p>
 * Instances handed out by {@link SessionManager} are snapshots for one request. Only the manager mutates a session,
 * and only when a refresh or a group re-resolution succeeds.
 * </p>
 */
public final class Session {

    private static final Logger LOGGER = Logger.getLogger(Session.class.getName());

    /**
     * Safety margin subtracted from {@code expiresOn} so a token does not expire mid-request.
     */
    public static final long EXPIRY_SKEW_SECONDS = 10;

    private final String identity;
    private String accessToken;
    private String refreshToken;
    private long expiresOn;
    private final String tokenType;
    private final String resource;
    private final String scope;
    private Set<String> groups;

    public Session(
        String identity,
        String accessToken,
        String refreshToken,
        long expiresOn,
        String tokenType,
        String resource,
        String scope,
        Collection<String> groups
    ) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        this.identity = identity;
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresOn = expiresOn;
        this.tokenType = tokenType;
        this.resource = resource;
        this.scope = scope;
        this.groups = copyGroups(groups);
    }

    static Session fromIssued(IssuedTokens tokens, Collection<String> groups) {
        return new Session(
            tokens.identity(),
            tokens.accessToken(),
            tokens.refreshToken(),
            tokens.expiresOn(),
            tokens.tokenType(),
            tokens.resource(),
            tokens.scope(),
            groups
        );
    }

    void applyRefresh(RefreshedTokens tokens, Collection<String> refreshedGroups) {
        this.accessToken = tokens.accessToken();
        this.refreshToken = tokens.refreshToken();
        this.expiresOn = tokens.expiresOn();
        this.groups = copyGroups(refreshedGroups);
    }

    void replaceGroups(Collection<String> refreshedGroups) {
        this.groups = copyGroups(refreshedGroups);
    }

    Session copy() {
        return new Session(identity, accessToken, refreshToken, expiresOn, tokenType, resource, scope, groups);
    }

    public String getIdentity() {
        return identity;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    /**
     * @return epoch seconds after which the access token is no longer valid.
     */
    public long getExpiresOn() {
        return expiresOn;
    }

    public String getTokenType() {
        return tokenType;
    }

    public String getResource() {
        return resource;
    }

    public String getScope() {
        return scope;
    }

    public Set<String> getGroups() {
        return groups;
    }

    public boolean isAuthenticated() {
        return true;
    }

    public boolean isExpired() {
        return isExpired(Clock.systemUTC());
    }

    public boolean isExpired(Clock clock) {
        return clock.instant().getEpochSecond() >= expiresOn - EXPIRY_SKEW_SECONDS;
    }

    public Duration expiresIn() {
        return expiresIn(Clock.systemUTC());
    }

    /**
     * @return time left until {@code expiresOn}, negative once it has passed.
     */
    public Duration expiresIn(Clock clock) {
        return Duration.ofSeconds(expiresOn).minusMillis(clock.millis());
    }

    /**
     * Checks group membership. A miss is an authorization denial, not an error, and is logged as such.
     */
    public boolean hasGroup(String group) {
        if (group != null && groups.contains(group)) {
            return true;
        }
        LOGGER.warning(() -> "[adauth] user " + identity + " not in group " + group);
        return false;
    }

    private static Set<String> copyGroups(Collection<String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String group : source) {
            if (group != null && !group.isEmpty()) {
                copy.add(group);
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Session)) {
            return false;
        }
        Session other = (Session) o;
        return expiresOn == other.expiresOn
            && identity.equals(other.identity)
            && Objects.equals(accessToken, other.accessToken)
            && Objects.equals(refreshToken, other.refreshToken)
            && Objects.equals(tokenType, other.tokenType)
            && Objects.equals(resource, other.resource)
            && Objects.equals(scope, other.scope)
            && groups.equals(other.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, accessToken, refreshToken, expiresOn, tokenType, resource, scope, groups);
    }

    @Override
    public String toString() {
        return "Session[identity=" + identity + ", expiresOn=" + expiresOn + ", groups=" + groups.size() + "]";
    }
}
