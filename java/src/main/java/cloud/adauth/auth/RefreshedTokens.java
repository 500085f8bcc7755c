package cloud.adauth.auth;

/**
 * Token pair returned by a refresh-token grant.
 */
public record RefreshedTokens(String accessToken, String refreshToken, long expiresOn) {

    @Override
    public String toString() {
        return "RefreshedTokens[expiresOn=" + expiresOn + "]";
    }
}
