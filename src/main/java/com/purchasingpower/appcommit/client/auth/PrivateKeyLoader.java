package com.purchasingpower.appcommit.client.auth;

import com.purchasingpower.appcommit.exception.PreconditionException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import java.io.IOException;
import java.io.StringReader;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;

/**
 * Reads the GitHub App RSA private key from PEM text.
 * GitHub hands out PKCS#1 ({@code BEGIN RSA PRIVATE KEY}); PKCS#8 ({@code BEGIN PRIVATE KEY}) is accepted too.
 */
public final class PrivateKeyLoader {

    private PrivateKeyLoader() {
    }

    public static RSAPrivateKey load(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new PreconditionException("GitHub App private key is empty");
        }
        // single-line env values carry escaped newlines
        String normalized = pem.contains("\n") ? pem : pem.replace("\\n", "\n");

        try (PEMParser parser = new PEMParser(new StringReader(normalized))) {
            Object parsed = parser.readObject();
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            PrivateKey key;
            if (parsed instanceof PEMKeyPair keyPair) {
                key = converter.getPrivateKey(keyPair.getPrivateKeyInfo());
            } else if (parsed instanceof PrivateKeyInfo keyInfo) {
                key = converter.getPrivateKey(keyInfo);
            } else {
                throw new PreconditionException("GitHub App private key is not a PEM encoded private key");
            }
            if (!(key instanceof RSAPrivateKey rsaKey)) {
                throw new PreconditionException("GitHub App private key must be an RSA key, got " + key.getAlgorithm());
            }
            return rsaKey;
        } catch (IOException e) {
            throw new PreconditionException("Unable to parse GitHub App private key: " + e.getMessage(), e);
        }
    }
}
