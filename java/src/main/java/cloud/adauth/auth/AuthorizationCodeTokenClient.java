package cloud.adauth.auth;

import cloud.adauth.AuthException;
import cloud.adauth.Config;
import cloud.adauth.internal.ApiErrorDecoder;
import cloud.adauth.internal.HttpUtil;
import cloud.adauth.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * TokenClient implementation performing the OAuth2 authorization-code and refresh-token grants against an Azure AD
 * style v1 token endpoint.
 *
 * <p>
 * The client keeps no state between calls and can be shared by concurrent requests.
 * </p>
 */
public final class AuthorizationCodeTokenClient implements TokenClient {

    private static final Logger LOGGER = Logger.getLogger(AuthorizationCodeTokenClient.class.getName());

    private final HttpClient httpClient;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;
    private final String resource;
    private final Duration requestTimeout;

    public AuthorizationCodeTokenClient(
        HttpClient httpClient,
        String tokenUrl,
        String clientId,
        String clientSecret,
        String redirectUri,
        String resource,
        Duration requestTimeout
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
        this.redirectUri = Objects.requireNonNull(redirectUri, "redirectUri");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Config.DEFAULT_HTTP_TIMEOUT : requestTimeout;
    }

    public AuthorizationCodeTokenClient(Config config) {
        this(
            config.getHttpClient(),
            config.getTokenUrl(),
            config.getAppId(),
            config.getAppKey(),
            config.getRedirectUri(),
            config.getGraphUrl(),
            config.getHttpTimeout()
        );
    }

    @Override
    public IssuedTokens exchangeCode(String code) throws AuthException {
        if (code == null || code.isBlank()) {
            throw new AuthException(AuthException.Kind.MISSING_FIELD, "authorization code is required");
        }

        Map<String, String> form = baseForm("authorization_code");
        form.put("code", code);
        JsonNode node = post(form, "exchange authorization code");

        IdentityClaims claims = IdentityClaims.decode(Json.text(node, "id_token"));
        IssuedTokens tokens = new IssuedTokens(
            claims.upn(),
            required(node, "access_token"),
            required(node, "refresh_token"),
            requiredEpoch(node),
            required(node, "token_type"),
            required(node, "resource"),
            required(node, "scope")
        );
        LOGGER.fine(() -> "[adauth] authorization code exchanged for " + tokens.identity()
            + (claims.name() == null ? "" : " (" + claims.name() + ")"));
        return tokens;
    }

    @Override
    public RefreshedTokens refresh(String refreshToken) throws AuthException {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new AuthException(AuthException.Kind.MISSING_FIELD, "refresh token is required");
        }

        Map<String, String> form = baseForm("refresh_token");
        form.put("refresh_token", refreshToken);
        JsonNode node = post(form, "refresh token");

        return new RefreshedTokens(
            required(node, "access_token"),
            required(node, "refresh_token"),
            requiredEpoch(node)
        );
    }

    private Map<String, String> baseForm(String grantType) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", grantType);
        form.put("redirect_uri", redirectUri);
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("resource", resource);
        return form;
    }

    private JsonNode post(Map<String, String> form, String action) throws AuthException {
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendForm(httpClient, tokenUrl, form, requestTimeout);
        } catch (HttpTimeoutException ex) {
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE,
                action + " timed out after " + requestTimeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE, action + " interrupted", ex);
        } catch (IOException ex) {
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE, action + ": " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw ApiErrorDecoder.decode(AuthException.Kind.PROVIDER_REJECTED, response.statusCode(), bodyStream);
            }

            JsonNode node = Json.mapper().readTree(bodyStream);
            if (node == null || !node.isObject()) {
                throw new AuthException(AuthException.Kind.PROVIDER_REJECTED, action + ": response is not a JSON object");
            }
            return node;
        } catch (IOException ex) {
            throw new AuthException(AuthException.Kind.PROVIDER_REJECTED,
                "decode " + action + " response: " + ex.getMessage(), ex);
        }
    }

    private static String required(JsonNode node, String field) throws AuthException {
        String value = Json.text(node, field);
        if (value == null) {
            throw new AuthException(AuthException.Kind.MISSING_FIELD, "token response missing " + field);
        }
        return value;
    }

    private static long requiredEpoch(JsonNode node) throws AuthException {
        Long value = Json.epochSeconds(node, "expires_on");
        if (value == null) {
            throw new AuthException(AuthException.Kind.MISSING_FIELD, "token response missing expires_on");
        }
        return value;
    }
}
