package com.m2m.oauth2.server.grant;

import com.m2m.oauth2.server.AuthorizationServer;
import com.m2m.oauth2.server.OAuth2Request;
import com.m2m.oauth2.server.ServerFixtures;
import com.m2m.oauth2.server.error.InvalidGrantError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.m2m.oauth2.server.ServerFixtures.TOKEN_URL;
import static com.m2m.oauth2.server.ServerFixtures.basicHeader;
import static com.m2m.oauth2.server.ServerFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RefreshTokenGrantTest {
    private RefreshTokenGrant.Factory refreshFactory;
    private AuthorizationServer server;
    private Map<String, Object> original;

    @BeforeEach
    void setUp() throws Exception {
        var users = ServerFixtures.users();
        refreshFactory = new RefreshTokenGrant.Factory(users);
        server = ServerFixtures.server(new ResourceOwnerPasswordGrant.Factory(users), refreshFactory);
        original = json(server.createTokenResponse(OAuth2Request.post(TOKEN_URL,
            Map.of("grant_type", "password", "username", "alice", "password", "wonderland"),
            basicHeader("webapp", "webapp-secret"))));
    }

    @Test
    void refreshRotatesTokensAndRevokesTheOldOne() throws Exception {
        var response = server.createTokenResponse(refresh(refreshToken(), null));

        assertThat(response.status()).isEqualTo(200);
        var body = json(response);
        assertThat(body.get("access_token")).isNotEqualTo(original.get("access_token"));
        assertThat(body.get("refresh_token")).isNotNull().isNotEqualTo(original.get("refresh_token"));
        assertThat(body).containsEntry("scope", "email profile").containsEntry("expires_in", 3600);
        assertThat(server.getTokenStore().find((String) original.get("access_token"), "access_token"))
            .hasValueSatisfying(t -> assertThat(t.revoked()).isTrue());
        assertThat(server.getTokenStore().find((String) body.get("access_token"), "access_token"))
            .hasValueSatisfying(t -> assertThat(t.userId()).isEqualTo("alice"));
    }

    @Test
    void scopeMayBeNarrowed() throws Exception {
        var body = json(server.createTokenResponse(refresh(refreshToken(), "email")));

        assertThat(body).containsEntry("scope", "email");
    }

    @Test
    void scopeMayNotBeWidened() throws Exception {
        var body = json(server.createTokenResponse(refresh(refreshToken(), "email admin")));

        assertThat(body).containsEntry("error", "invalid_scope");
    }

    @Test
    void refreshTokenIsSingleUse() throws Exception {
        server.createTokenResponse(refresh(refreshToken(), null));

        var second = server.createTokenResponse(refresh(refreshToken(), null));

        assertThat(second.status()).isEqualTo(400);
        assertThat(json(second)).containsEntry("error", "invalid_grant");
    }

    @Test
    void concurrentRefreshesOfOneTokenIssueOnce() throws Exception {
        var first = (TokenEndpointGrant) refreshFactory.create(refresh(refreshToken(), null), server);
        var second = (TokenEndpointGrant) refreshFactory.create(refresh(refreshToken(), null), server);

        // both see the token live before either revokes it
        first.validateTokenRequest();
        second.validateTokenRequest();

        assertThat(first.createTokenResponse().status()).isEqualTo(200);
        assertThatThrownBy(second::createTokenResponse).isInstanceOf(InvalidGrantError.class);
    }

    @Test
    void revokedTokenIsNotRefreshed() throws Exception {
        var grant = (TokenEndpointGrant) refreshFactory.create(refresh(refreshToken(), null), server);
        grant.validateTokenRequest();
        server.getTokenStore().revoke(server.getTokenStore().find(refreshToken(), "refresh_token").orElseThrow());

        assertThatThrownBy(grant::createTokenResponse).isInstanceOf(InvalidGrantError.class);
    }

    @Test
    void unknownRefreshToken() throws Exception {
        assertThat(json(server.createTokenResponse(refresh("nope", null)))).containsEntry("error", "invalid_grant");
    }

    @Test
    void missingRefreshToken() throws Exception {
        var request = OAuth2Request.post(TOKEN_URL, Map.of("grant_type", "refresh_token"),
            basicHeader("webapp", "webapp-secret"));

        assertThat(json(server.createTokenResponse(request))).containsEntry("error", "invalid_request");
    }

    private String refreshToken() {
        return (String) original.get("refresh_token");
    }

    private static OAuth2Request refresh(String refreshToken, String scope) {
        var form = new HashMap<String, String>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        if (scope != null) form.put("scope", scope);
        return OAuth2Request.post(TOKEN_URL, form, basicHeader("webapp", "webapp-secret"));
    }
}
