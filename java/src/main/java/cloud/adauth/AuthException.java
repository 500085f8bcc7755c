package cloud.adauth;

import java.util.Objects;

/**
 * Base exception thrown by the session library. The {@link Kind} tells callers which branch of the login or refresh
 * flow failed so the routing layer can decide between "sign in again", "try later" and "forbidden".
 */
public class AuthException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Failure categories surfaced by the library.
     */
    public enum Kind {
        /** The token endpoint answered with a non-2xx status or an unreadable body. */
        PROVIDER_REJECTED,
        /** The identity token could not be decoded into a JSON object. */
        MALFORMED_IDENTITY_TOKEN,
        /** A required field was absent from a provider response or from the caller's input. */
        MISSING_FIELD,
        /** The directory answered with a non-2xx status or an unreadable body. */
        DIRECTORY_UNAVAILABLE,
        /** The identity provider or directory could not be reached in time. */
        PROVIDER_UNAVAILABLE,
        /** No stored session exists for the identity. */
        NOT_FOUND,
        /** The session store could not read or write a row. */
        STORAGE_FAILURE
    }

    private final Kind kind;

    public AuthException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public AuthException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind() {
        return kind;
    }
}
