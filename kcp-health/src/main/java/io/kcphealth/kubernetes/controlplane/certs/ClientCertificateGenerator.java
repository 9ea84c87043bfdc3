/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.certs;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Objects;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints short lived etcd client certificates signed by a cluster's etcd certificate authority.
 */
public class ClientCertificateGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientCertificateGenerator.class);

    public static final String COMMON_NAME = "cluster-api.x-k8s.io";
    static final Duration CLOCK_SKEW_ALLOWANCE = Duration.ofMinutes(5);
    static final Duration VALIDITY = Duration.ofDays(365L * 10);
    private static final int KEY_SIZE = 2048;

    private final Clock clock;
    private final SecureRandom random;

    public ClientCertificateGenerator(Clock clock) {
        this(clock, new SecureRandom());
    }

    ClientCertificateGenerator(Clock clock, SecureRandom random) {
        this.clock = Objects.requireNonNull(clock);
        this.random = Objects.requireNonNull(random);
    }

    /**
     * Generates a fresh key pair and a client certificate for it signed by the given CA.
     *
     * @param caCertificatePem PEM encoded CA certificate
     * @param caKeyPem PEM encoded CA private key
     * @return the client identity, trusting the CA certificate
     * @throws CertificateGenerationException if the CA material cannot be decoded or used for signing
     */
    public EtcdTlsBundle generate(byte[] caCertificatePem, byte[] caKeyPem) {
        X509Certificate caCertificate = PemDecoder.decodeCertificate(caCertificatePem);
        PrivateKey caKey = PemDecoder.decodePrivateKey(caKeyPem);
        KeyPair keyPair = newKeyPair();
        X509Certificate clientCertificate = sign(caCertificate, caKey, keyPair);
        LOGGER.atDebug()
                .setMessage("Issued etcd client certificate {} signed by {}, valid until {}")
                .addArgument(clientCertificate::getSubjectX500Principal)
                .addArgument(caCertificate::getSubjectX500Principal)
                .addArgument(clientCertificate::getNotAfter)
                .log();
        return new EtcdTlsBundle(keyPair.getPrivate(), clientCertificate, List.of(caCertificate));
    }

    private KeyPair newKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(KEY_SIZE, random);
            return generator.generateKeyPair();
        }
        catch (NoSuchAlgorithmException e) {
            throw new CertificateGenerationException("RSA key generation is not available", e);
        }
    }

    private X509Certificate sign(X509Certificate caCertificate, PrivateKey caKey, KeyPair keyPair) {
        // X.509 validity has second precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        X500Name subject = new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.CN, COMMON_NAME)
                .build();
        try {
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    new JcaX509CertificateHolder(caCertificate).getSubject(),
                    new BigInteger(64, random).add(BigInteger.ONE),
                    Date.from(now.minus(CLOCK_SKEW_ALLOWANCE)),
                    Date.from(now.plus(VALIDITY)),
                    subject,
                    keyPair.getPublic())
                    .addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature))
                    .addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_clientAuth));
            ContentSigner signer = new JcaContentSignerBuilder(signatureAlgorithm(caKey))
                    .setProvider(new BouncyCastleProvider())
                    .build(caKey);
            X509CertificateHolder holder = builder.build(signer);
            return new JcaX509CertificateConverter().getCertificate(holder);
        }
        catch (CertIOException | OperatorCreationException | CertificateException e) {
            throw new CertificateGenerationException("failed to create signed client certificate for " + subject, e);
        }
    }

    private static String signatureAlgorithm(PrivateKey caKey) {
        return switch (caKey.getAlgorithm()) {
            case "RSA" -> "SHA256withRSA";
            case "EC", "ECDSA" -> "SHA256withECDSA";
            default -> throw new CertificateGenerationException("unsupported etcd CA key algorithm " + caKey.getAlgorithm());
        };
    }
}
