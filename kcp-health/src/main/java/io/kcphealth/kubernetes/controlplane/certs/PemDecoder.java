/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.certs;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Reads the first certificate or private key from PEM encoded bytes.
 */
class PemDecoder {

    private PemDecoder() {
    }

    static X509Certificate decodeCertificate(byte[] pem) {
        Object object = readFirstObject(pem, "certificate");
        if (!(object instanceof X509CertificateHolder holder)) {
            throw new CertificateGenerationException("expected a PEM encoded certificate but found " + describe(object));
        }
        try {
            return new JcaX509CertificateConverter().getCertificate(holder);
        }
        catch (CertificateException e) {
            throw new CertificateGenerationException("failed to decode certificate", e);
        }
    }

    /**
     * Accepts PKCS#1 ({@code RSA PRIVATE KEY}), SEC1 ({@code EC PRIVATE KEY}) and
     * unencrypted PKCS#8 ({@code PRIVATE KEY}) keys.
     */
    static PrivateKey decodePrivateKey(byte[] pem) {
        Object object = readFirstObject(pem, "private key");
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        try {
            if (object instanceof PEMKeyPair keyPair) {
                return converter.getKeyPair(keyPair).getPrivate();
            }
            if (object instanceof PrivateKeyInfo keyInfo) {
                return converter.getPrivateKey(keyInfo);
            }
        }
        catch (IOException e) {
            throw new CertificateGenerationException("failed to decode private key", e);
        }
        throw new CertificateGenerationException("expected a PEM encoded private key but found " + describe(object));
    }

    private static Object readFirstObject(byte[] pem, String expected) {
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(pem), StandardCharsets.US_ASCII);
                PEMParser parser = new PEMParser(reader)) {
            Object object = parser.readObject();
            if (object == null) {
                throw new CertificateGenerationException("no PEM encoded " + expected + " found");
            }
            return object;
        }
        catch (IOException | IllegalStateException e) {
            throw new CertificateGenerationException("failed to parse PEM encoded " + expected, e);
        }
    }

    private static String describe(@Nullable Object object) {
        return object == null ? "nothing" : object.getClass().getSimpleName();
    }
}
