package cloud.adauth.auth;

/**
 * Result of a successful authorization-code exchange.
 *
 * @param identity principal name ({@code upn}) read from the identity token
 * @param expiresOn epoch seconds after which {@code accessToken} is no longer valid
 */
public record IssuedTokens(
    String identity,
    String accessToken,
    String refreshToken,
    long expiresOn,
    String tokenType,
    String resource,
    String scope
) {

    @Override
    public String toString() {
        return "IssuedTokens[identity=" + identity + ", expiresOn=" + expiresOn + ", tokenType=" + tokenType
            + ", resource=" + resource + ", scope=" + scope + "]";
    }
}
