package com.m2m.oauth2.jose;

import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;

/**
 * PS256/PS384/PS512, RSASSA-PSS with MGF1 over the same digest and a salt as long as the digest.
 */
final class RsaPssAlgorithm extends RsaAlgorithm {
    private final PSSParameterSpec parameters;

    RsaPssAlgorithm(String id, String digestName, int digestLength) {
        super(id, "RSASSA-PSS");
        this.parameters = new PSSParameterSpec(
            digestName, "MGF1", new MGF1ParameterSpec(digestName), digestLength, PSSParameterSpec.TRAILER_FIELD_BC);
    }

    @Override
    protected Signature newSignature() throws GeneralSecurityException {
        Signature signature = super.newSignature();
        signature.setParameter(parameters);
        return signature;
    }
}
