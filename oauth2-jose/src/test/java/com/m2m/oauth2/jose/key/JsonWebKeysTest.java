package com.m2m.oauth2.jose.key;

import com.m2m.oauth2.common.Encoding;
import com.m2m.oauth2.jose.InvalidKeyMaterialException;
import com.m2m.oauth2.jose.JwsAlgorithm;
import com.m2m.oauth2.jose.JwsAlgorithms;
import com.m2m.oauth2.jose.TestKeys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PublicKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonWebKeysTest {

    @Test
    void publicKeys_roundTripThroughJwk() {
        for (KeyPair pair : new KeyPair[]{TestKeys.rsa(), TestKeys.ec(EcCurves.P_256), TestKeys.ec(EcCurves.P_521)}) {
            String json = toJson(JsonWebKeys.fromPublicKey(pair.getPublic()));

            PublicKey parsed = JsonWebKeys.toPublicKey(JsonWebKeys.parse(json));

            assertThat(parsed).isEqualTo(pair.getPublic());
        }
    }

    @Test
    void ecCoordinates_areFullLength() {
        Map<String, Object> jwk = JsonWebKeys.fromPublicKey(TestKeys.ec(EcCurves.P_521).getPublic());

        assertThat(jwk).containsEntry("kty", "EC").containsEntry("crv", "P-521");
        assertThat(Encoding.urlsafeB64Decode((String) jwk.get("x"))).hasSize(66);
        assertThat(Encoding.urlsafeB64Decode((String) jwk.get("y"))).hasSize(66);
    }

    @Test
    void rsaPrivateJwk_signsVerifiably() {
        KeyPair pair = TestKeys.rsa();
        RSAPrivateCrtKey priv = (RSAPrivateCrtKey) pair.getPrivate();
        Map<String, Object> jwk = new LinkedHashMap<>(JsonWebKeys.fromPublicKey(pair.getPublic()));
        jwk.put("d", Encoding.intToBase64(priv.getPrivateExponent()));
        jwk.put("p", Encoding.intToBase64(priv.getPrimeP()));
        jwk.put("q", Encoding.intToBase64(priv.getPrimeQ()));
        jwk.put("dp", Encoding.intToBase64(priv.getPrimeExponentP()));
        jwk.put("dq", Encoding.intToBase64(priv.getPrimeExponentQ()));
        jwk.put("qi", Encoding.intToBase64(priv.getCrtCoefficient()));
        var parsed = JsonWebKeys.parse(toJson(jwk));

        JwsAlgorithm rs256 = JwsAlgorithms.get("RS256");
        byte[] msg = "jwk".getBytes(StandardCharsets.UTF_8);
        byte[] sig = rs256.sign(msg, JsonWebKeys.toPrivateKey(parsed));

        assertThat(JsonWebKeys.hasPrivateMaterial(parsed)).isTrue();
        assertThat(rs256.verify(msg, pair.getPublic(), sig)).isTrue();
        assertThat(rs256.verify(msg, JsonWebKeys.toPublicKey(parsed), sig)).isTrue();
    }

    @Test
    void ecPrivateJwk_parsedFromJsonText() {
        KeyPair pair = TestKeys.ec(EcCurves.P_256);
        Map<String, Object> members = new LinkedHashMap<>(JsonWebKeys.fromPublicKey(pair.getPublic()));
        members.put("d", Encoding.intToBase64(((ECPrivateKey) pair.getPrivate()).getS()));
        String json = toJson(members);

        JwsAlgorithm es256 = JwsAlgorithms.get("ES256");
        byte[] msg = "jwk".getBytes(StandardCharsets.UTF_8);
        byte[] sig = es256.sign(msg, es256.prepareSignKey(json));

        assertThat(es256.verify(msg, es256.prepareVerifyKey(KeyMaterial.jwk(json)), sig)).isTrue();
    }

    @Test
    void publicJwkHasNoPrivateKey() {
        String json = toJson(JsonWebKeys.fromPublicKey(TestKeys.ec(EcCurves.P_256).getPublic()));
        var jwk = JsonWebKeys.parse(json);

        assertThat(JsonWebKeys.hasPrivateMaterial(jwk)).isFalse();
        assertThatThrownBy(() -> JsonWebKeys.toPrivateKey(jwk))
            .isInstanceOf(InvalidKeyMaterialException.class)
            .hasMessageContaining("no private key material");
    }

    @Test
    void rejectsMalformedJwks() {
        assertThatThrownBy(() -> JsonWebKeys.parse("{not json"))
            .isInstanceOf(InvalidKeyMaterialException.class);
        // missing e
        assertThatThrownBy(() -> JsonWebKeys.parse("{\"kty\":\"RSA\",\"n\":\"AQAB\"}"))
            .isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> JsonWebKeys.parse("{\"kty\":\"EC\",\"crv\":\"P-192\",\"x\":\"AQ\",\"y\":\"AQ\"}"))
            .isInstanceOf(InvalidKeyMaterialException.class);
    }

    @Test
    void ecPointMustLieOnTheCurve() {
        Map<String, Object> jwk = new LinkedHashMap<>(JsonWebKeys.fromPublicKey(TestKeys.ec(EcCurves.P_256).getPublic()));
        jwk.put("y", jwk.get("x"));

        assertThatThrownBy(() -> JsonWebKeys.parse(toJson(jwk)))
            .isInstanceOf(InvalidKeyMaterialException.class);
    }

    @Test
    void keyFamilyMustMatchTheUse() {
        String secret = Encoding.urlsafeB64Encode("0123456789abcdef".repeat(2).getBytes(StandardCharsets.UTF_8));
        var oct = JsonWebKeys.parse("{\"kty\":\"oct\",\"k\":\"" + secret + "\"}");
        var rsa = JsonWebKeys.parse(toJson(JsonWebKeys.fromPublicKey(TestKeys.rsa().getPublic())));

        assertThat(JsonWebKeys.toSecret(oct)).hasSize(32);
        assertThatThrownBy(() -> JsonWebKeys.toPublicKey(oct)).isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> JsonWebKeys.toPrivateKey(oct)).isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> JsonWebKeys.toSecret(rsa))
            .isInstanceOf(InvalidKeyMaterialException.class)
            .hasMessageContaining("oct");
    }

    private static String toJson(Map<String, Object> members) {
        StringBuilder json = new StringBuilder("{");
        members.forEach((k, v) -> json.append('"').append(k).append("\":\"").append(v).append("\","));
        json.setCharAt(json.length() - 1, '}');
        return json.toString();
    }
}
