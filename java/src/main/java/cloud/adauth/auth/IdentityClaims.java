package cloud.adauth.auth;

import cloud.adauth.AuthException;
import cloud.adauth.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Base64;

/**
 * Claims read from the identity token returned by the code exchange.
 *
 * <p>
 * Decoding is structural only: the payload segment is base64url-decoded and parsed as a JSON object. The token is
 * received directly from the token endpoint over TLS and its signature is not verified.
 * </p>
 *
 * @param upn principal name, the session identity
 * @param name display name, {@code null} when the token carries none
 */
public record IdentityClaims(String upn, String name) {

    public static IdentityClaims decode(String idToken) throws AuthException {
        if (idToken == null || idToken.isBlank()) {
            throw new AuthException(AuthException.Kind.MISSING_FIELD, "token response missing id_token");
        }

        String[] parts = idToken.split("\\.", -1);
        if (parts.length != 3) {
            throw new AuthException(AuthException.Kind.MALFORMED_IDENTITY_TOKEN,
                "identity token must have three segments, got " + parts.length);
        }

        JsonNode node;
        try {
            node = Json.mapper().readTree(decodeBase64(parts[1]));
        } catch (IOException | IllegalArgumentException ex) {
            throw new AuthException(AuthException.Kind.MALFORMED_IDENTITY_TOKEN,
                "decode identity token: " + ex.getMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw new AuthException(AuthException.Kind.MALFORMED_IDENTITY_TOKEN,
                "identity token payload is not a JSON object");
        }

        String upn = Json.text(node, "upn");
        if (upn == null) {
            throw new AuthException(AuthException.Kind.MISSING_FIELD, "identity token missing upn");
        }

        return new IdentityClaims(upn.trim(), Json.text(node, "name"));
    }

    static byte[] decodeBase64(String segment) {
        String padded = pad(segment);
        try {
            return Base64.getUrlDecoder().decode(padded);
        } catch (IllegalArgumentException ex) {
            return Base64.getDecoder().decode(padded);
        }
    }

    /**
     * Pads a base64 segment with {@code =} to a multiple of four characters.
     */
    static String pad(String segment) {
        String trimmed = segment.strip();
        while (trimmed.endsWith("=")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        switch (trimmed.length() % 4) {
            case 0:
                return trimmed;
            case 2:
                return trimmed + "==";
            case 3:
                return trimmed + "=";
            default:
                throw new IllegalArgumentException("invalid base64 segment length " + trimmed.length());
        }
    }
}
