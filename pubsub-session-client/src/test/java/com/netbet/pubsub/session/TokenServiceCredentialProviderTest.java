package com.netbet.pubsub.session;

import com.netbet.pubsub.client.TokenClient;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TokenServiceCredentialProviderTest {

    private final TokenClient tokenClient = mock(TokenClient.class);
    private final TokenServiceCredentialProvider provider = new TokenServiceCredentialProvider(tokenClient);

    @Test
    void returnsFetchedToken() throws Exception {
        when(tokenClient.fetchToken()).thenReturn("jwt");

        assertThat(provider.getCredential()).isEqualTo("jwt");
    }

    @Test
    void unavailableTokenBecomesCredentialExceptionWithCause() throws Exception {
        TokenClient.TokenUnavailableException failure =
                new TokenClient.TokenUnavailableException("No token after 3 attempts", new IllegalStateException("503"));
        when(tokenClient.fetchToken()).thenThrow(failure);

        assertThatThrownBy(provider::getCredential)
                .isInstanceOf(CredentialProvider.CredentialException.class)
                .hasMessageContaining("No token after 3 attempts")
                .hasCause(failure);
    }
}
