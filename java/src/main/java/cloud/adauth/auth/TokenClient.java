package cloud.adauth.auth;

import cloud.adauth.AuthException;

/**
 * Contract for talking to the identity provider's token endpoint.
 */
public interface TokenClient {

    IssuedTokens exchangeCode(String code) throws AuthException;

    RefreshedTokens refresh(String refreshToken) throws AuthException;
}
