package com.m2m.oauth2.jose.key;

import com.m2m.oauth2.jose.InvalidKeyMaterialException;
import com.m2m.oauth2.jose.TestKeys;
import org.junit.jupiter.api.Test;

import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SshPublicKeyParserTest {

    @Test
    void parsesRsaLine() {
        RSAPublicKey key = (RSAPublicKey) TestKeys.rsa().getPublic();

        assertThat(SshPublicKeyParser.parse(TestKeys.sshRsa(key))).isEqualTo(key);
    }

    @Test
    void parsesEcdsaLinesForAllCurves() {
        for (EcCurves curve : EcCurves.values()) {
            ECPublicKey key = (ECPublicKey) TestKeys.ec(curve).getPublic();

            ECPublicKey parsed = (ECPublicKey) SshPublicKeyParser.parse(TestKeys.sshEc(key));

            assertThat(parsed.getW()).isEqualTo(key.getW());
            assertThat(EcCurves.of(parsed)).isEqualTo(curve);
        }
    }

    @Test
    void rejectsTypeMismatchBetweenPrefixAndBlob() {
        String line = TestKeys.sshRsa((RSAPublicKey) TestKeys.rsa().getPublic());
        String forged = "ecdsa-sha2-nistp256" + line.substring("ssh-rsa".length());

        assertThatThrownBy(() -> SshPublicKeyParser.parse(forged))
            .isInstanceOf(InvalidKeyMaterialException.class)
            .hasMessageContaining("mismatch");
    }

    @Test
    void rejectsTruncatedOrUnknownKeys() {
        assertThatThrownBy(() -> SshPublicKeyParser.parse("ssh-rsa AAAAB3NzaC1yc2E="))
            .isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> SshPublicKeyParser.parse("ssh-ed25519"))
            .isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> SshPublicKeyParser.parse("ssh-rsa !!!"))
            .isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> SshPublicKeyParser.parse(" "))
            .isInstanceOf(InvalidKeyMaterialException.class);
    }
}
