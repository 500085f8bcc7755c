package cloud.adauth;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Builds unsigned identity tokens for tests.
 */
public final class TestTokens {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestTokens() {
    }

    public static String idToken(Map<String, ?> claims) {
        try {
            return idTokenWithPayload(Base64.getUrlEncoder().withoutPadding().encodeToString(MAPPER.writeValueAsBytes(claims)));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static String idTokenFor(String upn) {
        return idToken(Map.of("upn", upn, "name", "Test User", "oid", "oid-1", "tid", "tid-1"));
    }

    public static String idTokenWithPayload(String payloadSegment) {
        String header = Base64.getUrlEncoder().withoutPadding()
            .encodeToString("{\"typ\":\"JWT\",\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));
        return header + "." + payloadSegment + ".c2ln";
    }

    public static String segment(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
