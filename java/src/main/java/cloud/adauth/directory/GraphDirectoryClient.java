package cloud.adauth.directory;

import cloud.adauth.AuthException;
import cloud.adauth.Config;
import cloud.adauth.internal.ApiErrorDecoder;
import cloud.adauth.internal.HttpUtil;
import cloud.adauth.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * DirectoryClient backed by the Azure AD graph ({@code api-version=1.6}).
 */
public final class GraphDirectoryClient implements DirectoryClient {

    private static final Logger LOGGER = Logger.getLogger(GraphDirectoryClient.class.getName());

    static final String API_VERSION = "1.6";

    private final HttpClient httpClient;
    private final String graphUrl;
    private final String tenant;
    private final Duration requestTimeout;

    public GraphDirectoryClient(HttpClient httpClient, String graphUrl, String tenant, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        String base = Objects.requireNonNull(graphUrl, "graphUrl");
        this.graphUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.tenant = tenant == null || tenant.isBlank() ? Config.DEFAULT_TENANT : tenant.trim();
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Config.DEFAULT_HTTP_TIMEOUT : requestTimeout;
    }

    public GraphDirectoryClient(Config config) {
        this(config.getHttpClient(), config.getGraphUrl(), config.getTenant(), config.getHttpTimeout());
    }

    @Override
    public Set<String> userGroups(String accessToken) throws AuthException {
        String url = graphUrl + "/me/getMemberGroups?api-version=" + API_VERSION;
        JsonNode value = fetchValue("POST", url, Map.of("securityEnabledOnly", false), accessToken, "member groups");

        Set<String> groups = new LinkedHashSet<>();
        for (JsonNode item : value) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new AuthException(AuthException.Kind.DIRECTORY_UNAVAILABLE,
                    "member groups response contains a non-string group id");
            }
            groups.add(item.asText());
        }
        LOGGER.fine(() -> String.format(Locale.ROOT, "[adauth] member groups returned %d ids", groups.size()));
        return Collections.unmodifiableSet(groups);
    }

    @Override
    public Map<String, String> allGroups(String accessToken) throws AuthException {
        String url = graphUrl + "/" + URLEncoder.encode(tenant, StandardCharsets.UTF_8)
            + "/groups?api-version=" + API_VERSION;
        JsonNode value = fetchValue("GET", url, null, accessToken, "groups");

        Map<String, String> groups = new LinkedHashMap<>();
        for (JsonNode item : value) {
            String id = Json.text(item, "objectId");
            if (id == null) {
                continue;
            }
            String name = Json.text(item, "displayName");
            groups.put(id, name == null ? id : name);
        }
        LOGGER.fine(() -> String.format(Locale.ROOT, "[adauth] groups returned %d records", groups.size()));
        return Collections.unmodifiableMap(groups);
    }

    private JsonNode fetchValue(String method, String url, Object payload, String accessToken, String action)
        throws AuthException {
        if (accessToken == null || accessToken.isBlank()) {
            throw new AuthException(AuthException.Kind.MISSING_FIELD, "access token is required for " + action);
        }

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendJson(httpClient, method, url, payload, accessToken, requestTimeout);
        } catch (HttpTimeoutException ex) {
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE,
                "fetch " + action + " timed out after " + requestTimeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE, "fetch " + action + " interrupted", ex);
        } catch (IOException ex) {
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE,
                "fetch " + action + ": " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw ApiErrorDecoder.decode(AuthException.Kind.DIRECTORY_UNAVAILABLE, response.statusCode(), bodyStream);
            }

            JsonNode value = Json.mapper().readTree(bodyStream).path("value");
            if (!value.isArray()) {
                throw new AuthException(AuthException.Kind.DIRECTORY_UNAVAILABLE,
                    action + " response missing value array");
            }
            return value;
        } catch (IOException ex) {
            throw new AuthException(AuthException.Kind.DIRECTORY_UNAVAILABLE,
                "decode " + action + " response: " + ex.getMessage(), ex);
        }
    }
}
