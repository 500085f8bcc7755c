package cloud.adauth.internal;

import cloud.adauth.AuthException;
import cloud.adauth.ProviderApiException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Decodes error payloads from the token endpoint and the directory graph.
 *
 * <p>
 * The token endpoint answers with the OAuth2 shape {@code {"error": ..., "error_description": ...}}; the graph wraps
 * its errors as {@code {"odata.error": {"code": ..., "message": {"value": ...}}}}. Anything else is kept as raw text.
 * </p>
 */
public final class ApiErrorDecoder {

    private static final int MAX_RAW_MESSAGE = 512;

    private ApiErrorDecoder() {
    }

    public static ProviderApiException decode(AuthException.Kind kind, int statusCode, InputStream bodyStream)
        throws IOException {
        if (bodyStream == null) {
            return new ProviderApiException(kind, statusCode, null, null);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new ProviderApiException(kind, statusCode, null, null);
        }

        try {
            JsonNode node = Json.mapper().readTree(bytes);
            String code = Json.text(node, "error");
            String message = Json.text(node, "error_description");

            JsonNode odata = node.path("odata.error");
            if (odata.isObject()) {
                code = Json.text(odata, "code");
                message = Json.text(odata.path("message"), "value");
            }
            return new ProviderApiException(kind, statusCode, code, message);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            if (fallback.length() > MAX_RAW_MESSAGE) {
                fallback = fallback.substring(0, MAX_RAW_MESSAGE);
            }
            return new ProviderApiException(kind, statusCode, null, fallback);
        }
    }
}
