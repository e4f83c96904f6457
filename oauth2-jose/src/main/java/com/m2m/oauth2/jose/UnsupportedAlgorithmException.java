package com.m2m.oauth2.jose;

import lombok.Getter;

@Getter
public class UnsupportedAlgorithmException extends JoseException {
    private final String algorithm;

    public UnsupportedAlgorithmException(String algorithm) {
        super("Unsupported algorithm: " + algorithm);
        this.algorithm = algorithm;
    }
}
