package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.ServerFixtures;
import com.m2m.oauth2.server.ServerFixtures.TestUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.m2m.oauth2.server.ServerFixtures.AUTHORIZE_URL;
import static com.m2m.oauth2.server.ServerFixtures.SPA_REDIRECT;
import static com.m2m.oauth2.server.ServerFixtures.redirectParams;
import static org.assertj.core.api.Assertions.assertThat;

class ImplicitGrantTest {
    private AuthorizationServer server;

    @BeforeEach
    void setUp() {
        server = ServerFixtures.server(new ImplicitGrant.Factory());
    }

    @Test
    void tokenIsDeliveredInFragment() {
        var response = server.createAuthorizationResponse(
            OAuth2Request.get(AUTHORIZE_URL + "?response_type=token&client_id=spa&state=abc"), new TestUser("alice"));

        assertThat(response.status()).isEqualTo(302);
        assertThat(response.location()).startsWith(SPA_REDIRECT + "#");
        var params = redirectParams(response);
        assertThat(params)
            .containsEntry("token_type", "Bearer")
            .containsEntry("expires_in", "3600")
            .containsEntry("scope", "profile")
            .containsEntry("state", "abc")
            .doesNotContainKey("refresh_token");
        assertThat(server.getTokenStore().find(params.get("access_token"), "access_token"))
            .hasValueSatisfying(t -> assertThat(t.userId()).isEqualTo("alice"));
    }

    @Test
    void denialIsDeliveredInFragment() {
        var response = server.createAuthorizationResponse(
            OAuth2Request.get(AUTHORIZE_URL + "?response_type=token&client_id=spa&state=abc"), null);

        assertThat(response.location()).startsWith(SPA_REDIRECT + "#");
        assertThat(redirectParams(response)).containsEntry("error", "access_denied").containsEntry("state", "abc");
    }

    @Test
    void clientNotRegisteredForResponseType() {
        var response = server.createAuthorizationResponse(
            OAuth2Request.get(AUTHORIZE_URL + "?response_type=token&client_id=webapp"), new TestUser("alice"));

        assertThat(response.location()).startsWith(ServerFixtures.WEBAPP_REDIRECT + "#");
        assertThat(redirectParams(response)).containsEntry("error", "unauthorized_client");
    }
}
