package cloud.adauth;

/**
 * Exception representing an error status returned by the identity provider or the directory. Besides the
 * {@link AuthException.Kind} it exposes the HTTP status and, when the body carried one, the remote error code
 * (for example {@code invalid_grant} from the token endpoint or {@code Authentication_ExpiredToken} from the graph).
 */
public final class ProviderApiException extends AuthException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public ProviderApiException(Kind kind, int statusCode, String code, String message) {
        super(kind, message == null || message.isBlank() ? defaultMessage(kind, statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the remote service.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return remote error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(Kind kind, int status, String code) {
        String service = kind == Kind.DIRECTORY_UNAVAILABLE ? "directory" : "token";
        if (code == null || code.isBlank()) {
            return service + " request failed with status " + status;
        }
        return service + " request failed with status " + status + " (" + code + ")";
    }
}
