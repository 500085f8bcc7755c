package cloud.adauth;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link SessionManager} and its collaborators.
 *
 * <p>
 * Only {@code appId}, {@code appKey} and {@code redirectUri} are mandatory. Everything else falls back to the public
 * Azure AD v1 endpoints and an in-memory SQLite database.
 * </p>
 *
 * <p>
 * {@code loginRedirect} and {@code callbackPath} are not read by this library. They are carried for the routing layer
 * that mounts the OAuth callback and sends users on after sign-in, so both sides share one configuration.
 * </p>
 */
public final class Config {

    public static final String DEFAULT_AUTH_URL = "https://login.microsoftonline.com/common/oauth2/authorize";
    public static final String DEFAULT_TOKEN_URL = "https://login.microsoftonline.com/common/oauth2/token";
    public static final String DEFAULT_GRAPH_URL = "https://graph.windows.net";
    public static final String DEFAULT_TENANT = "myorganization";
    public static final String DEFAULT_LOGIN_REDIRECT = "/";
    public static final String DEFAULT_CALLBACK_PATH = "/connect/get_token";
    public static final String DEFAULT_DATABASE_URL = "jdbc:sqlite:file::memory:?cache=shared";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final String appId;
    private final String appKey;
    private final String redirectUri;
    private final String authUrl;
    private final String tokenUrl;
    private final String graphUrl;
    private final String tenant;
    private final String authGroup;
    private final String forbiddenRedirect;
    private final String loginRedirect;
    private final String callbackPath;
    private final String databaseUrl;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final boolean loginDisabled;

    private Config(Builder builder) {
        this.appId = builder.appId;
        this.appKey = builder.appKey;
        this.redirectUri = builder.redirectUri;
        this.authUrl = builder.authUrl;
        this.tokenUrl = builder.tokenUrl;
        this.graphUrl = builder.graphUrl;
        this.tenant = builder.tenant;
        this.authGroup = builder.authGroup;
        this.forbiddenRedirect = builder.forbiddenRedirect;
        this.loginRedirect = builder.loginRedirect;
        this.callbackPath = builder.callbackPath;
        this.databaseUrl = builder.databaseUrl;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.loginDisabled = builder.loginDisabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("AppId is required");
        }
        if (appKey == null || appKey.isBlank()) {
            throw new IllegalArgumentException("AppKey is required");
        }
        if (redirectUri == null || redirectUri.isBlank()) {
            throw new IllegalArgumentException("RedirectUri is required");
        }

        String resolvedAuthUrl = sanitizeUrl(Optional.ofNullable(authUrl).orElse(DEFAULT_AUTH_URL));
        String resolvedTokenUrl = sanitizeUrl(Optional.ofNullable(tokenUrl).orElse(DEFAULT_TOKEN_URL));
        String resolvedGraphUrl = sanitizeUrl(Optional.ofNullable(graphUrl).orElse(DEFAULT_GRAPH_URL));
        sanitizeUrl(redirectUri);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        String resolvedDatabaseUrl = trimToNull(databaseUrl);
        if (resolvedDatabaseUrl == null) {
            resolvedDatabaseUrl = DEFAULT_DATABASE_URL;
        } else if (!resolvedDatabaseUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:")) {
            throw new IllegalArgumentException("DatabaseUrl must be a JDBC URL: " + resolvedDatabaseUrl);
        }

        return new Builder()
            .appId(appId.trim())
            .appKey(appKey)
            .redirectUri(redirectUri.trim())
            .authUrl(resolvedAuthUrl)
            .tokenUrl(resolvedTokenUrl)
            .graphUrl(resolvedGraphUrl)
            .tenant(Optional.ofNullable(trimToNull(tenant)).orElse(DEFAULT_TENANT))
            .authGroup(trimToNull(authGroup))
            .forbiddenRedirect(trimToNull(forbiddenRedirect))
            .loginRedirect(Optional.ofNullable(trimToNull(loginRedirect)).orElse(DEFAULT_LOGIN_REDIRECT))
            .callbackPath(Optional.ofNullable(trimToNull(callbackPath)).orElse(DEFAULT_CALLBACK_PATH))
            .databaseUrl(resolvedDatabaseUrl)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .loginDisabled(loginDisabled)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host: " + trimmed);
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new IllegalArgumentException("URL must use http or https: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getAppId() {
        return appId;
    }

    public String getAppKey() {
        return appKey;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getAuthUrl() {
        return authUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getGraphUrl() {
        return graphUrl;
    }

    public String getTenant() {
        return tenant;
    }

    /**
     * @return the group id granting baseline access, or {@code null} when any signed-in user is allowed.
     */
    public String getAuthGroup() {
        return authGroup;
    }

    public String getForbiddenRedirect() {
        return forbiddenRedirect;
    }

    /**
     * Where the routing layer sends a user after a completed sign-in.
     */
    public String getLoginRedirect() {
        return loginRedirect;
    }

    /**
     * Path the routing layer serves the OAuth callback on; should match the path of {@code redirectUri}.
     */
    public String getCallbackPath() {
        return callbackPath;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public boolean isLoginDisabled() {
        return loginDisabled;
    }

    public static final class Builder {
        private String appId;
        private String appKey;
        private String redirectUri;
        private String authUrl;
        private String tokenUrl;
        private String graphUrl;
        private String tenant;
        private String authGroup;
        private String forbiddenRedirect;
        private String loginRedirect;
        private String callbackPath;
        private String databaseUrl;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private boolean loginDisabled;

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder appKey(String appKey) {
            this.appKey = appKey;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder authUrl(String authUrl) {
            this.authUrl = authUrl;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder graphUrl(String graphUrl) {
            this.graphUrl = graphUrl;
            return this;
        }

        public Builder tenant(String tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder authGroup(String authGroup) {
            this.authGroup = authGroup;
            return this;
        }

        public Builder forbiddenRedirect(String forbiddenRedirect) {
            this.forbiddenRedirect = forbiddenRedirect;
            return this;
        }

        public Builder loginRedirect(String loginRedirect) {
            this.loginRedirect = loginRedirect;
            return this;
        }

        public Builder callbackPath(String callbackPath) {
            this.callbackPath = callbackPath;
            return this;
        }

        public Builder databaseUrl(String databaseUrl) {
            this.databaseUrl = databaseUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder loginDisabled(boolean loginDisabled) {
            this.loginDisabled = loginDisabled;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
