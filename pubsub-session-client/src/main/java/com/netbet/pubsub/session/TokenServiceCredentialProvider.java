package com.netbet.pubsub.session;

import com.netbet.pubsub.client.TokenClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * CredentialProvider backed by the application's token endpoint. Each call fetches a new token.
 */
@Component
public class TokenServiceCredentialProvider implements CredentialProvider {

    private static final Logger log = LoggerFactory.getLogger(TokenServiceCredentialProvider.class);

    private final TokenClient tokenClient;

    public TokenServiceCredentialProvider(TokenClient tokenClient) {
        this.tokenClient = tokenClient;
    }

    @Override
    public String getCredential() throws CredentialException {
        try {
            String token = tokenClient.fetchToken();
            log.debug("Access token obtained");
            return token;
        } catch (TokenClient.TokenUnavailableException e) {
            throw new CredentialException("Failed to obtain access token: " + e.getMessage(), e);
        }
    }
}
