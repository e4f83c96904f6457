package com.m2m.oauth2.server.endpoint;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.AuthorizationServerListener;
import com.m2m.oauth2.server.Client;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.OAuth2Response;
import com.m2m.oauth2.server.OAuth2Token;
import com.m2m.oauth2.server.ServerFixtures;
import com.m2m.oauth2.server.grant.ClientCredentialsGrant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static com.m2m.oauth2.server.ServerFixtures.REVOKE_URL;
import static com.m2m.oauth2.server.ServerFixtures.TOKEN_URL;
import static com.m2m.oauth2.server.ServerFixtures.basicHeader;
import static com.m2m.oauth2.server.ServerFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RevocationEndpointTest {

    @Mock
    AuthorizationServerListener listener;

    private AuthorizationServer server;
    private String accessToken;

    @BeforeEach
    void setUp() throws Exception {
        server = ServerFixtures.server(new ClientCredentialsGrant.Factory());
        server.registerEndpoint(new RevocationEndpoint());
        server.addListener(listener);
        var issued = json(server.createTokenResponse(OAuth2Request.post(TOKEN_URL,
            Map.of("grant_type", "client_credentials"), basicHeader("machine", "machine-secret"))));
        accessToken = (String) issued.get("access_token");
    }

    @Test
    void revokesOwnTokenAndNotifies() {
        var response = revoke(Map.of("token", accessToken, "token_type_hint", "access_token"));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{}");
        assertThat(server.getTokenStore().find(accessToken, null))
            .hasValueSatisfying(t -> assertThat(t.revoked()).isTrue());
        verify(listener).onTokenRevoked(any(OAuth2Token.class), any(Client.class));
    }

    @Test
    void revokingTwiceSucceedsTwice() {
        var first = revoke(Map.of("token", accessToken));
        var second = revoke(Map.of("token", accessToken));

        assertThat(first.status()).isEqualTo(200);
        assertThat(second.status()).isEqualTo(200);
        assertThat(server.getTokenStore().find(accessToken, "access_token"))
            .hasValueSatisfying(t -> assertThat(t.revoked()).isTrue());
        verify(listener, times(2)).onTokenRevoked(any(), any());
    }

    @Test
    void unknownTokenStillAnswersOk() {
        var response = revoke(Map.of("token", "never-issued"));

        assertThat(response.status()).isEqualTo(200);
        verify(listener, never()).onTokenRevoked(any(), any());
    }

    @Test
    void unsupportedHint() throws Exception {
        var response = revoke(Map.of("token", accessToken, "token_type_hint", "id_token"));

        assertThat(response.status()).isEqualTo(400);
        assertThat(json(response)).containsEntry("error", "unsupported_token_type");
        assertThat(server.getTokenStore().find(accessToken, null))
            .hasValueSatisfying(t -> assertThat(t.revoked()).isFalse());
    }

    @Test
    void tokenIsRequired() throws Exception {
        assertThat(json(revoke(Map.of()))).containsEntry("error", "invalid_request");
    }

    @Test
    void clientMustAuthenticate() throws Exception {
        var response = server.createEndpointResponse(RevocationEndpoint.ENDPOINT_NAME,
            OAuth2Request.post(REVOKE_URL, Map.of("token", accessToken), Map.of()));

        assertThat(response.status()).isEqualTo(401);
        assertThat(json(response)).containsEntry("error", "invalid_client");
    }

    @Test
    void otherClientsTokensAreLeftAlone() {
        var response = server.createEndpointResponse(RevocationEndpoint.ENDPOINT_NAME,
            OAuth2Request.post(REVOKE_URL, Map.of("token", accessToken), basicHeader("webapp", "webapp-secret")));

        assertThat(response.status()).isEqualTo(200);
        assertThat(server.getTokenStore().find(accessToken, null))
            .hasValueSatisfying(t -> assertThat(t.revoked()).isFalse());
    }

    private OAuth2Response revoke(Map<String, String> form) {
        return server.createEndpointResponse(RevocationEndpoint.ENDPOINT_NAME,
            OAuth2Request.post(REVOKE_URL, form, basicHeader("machine", "machine-secret")));
    }
}
