/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.certs;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;

/**
 * Client identity and trust anchors for a mutually authenticated TLS session with etcd.
 * Lives only as long as the health check that created it.
 *
 * @param clientKey private key of the client certificate
 * @param clientCertificate client certificate, signed by the etcd CA
 * @param trustedCertificates certificates the etcd server certificate must chain to
 */
public record EtcdTlsBundle(PrivateKey clientKey, X509Certificate clientCertificate, List<X509Certificate> trustedCertificates) {

    public EtcdTlsBundle {
        Objects.requireNonNull(clientKey);
        Objects.requireNonNull(clientCertificate);
        trustedCertificates = List.copyOf(trustedCertificates);
    }

    @Override
    public String toString() {
        // keep key material out of logs
        return "EtcdTlsBundle(subject=" + clientCertificate.getSubjectX500Principal() + ", notAfter=" + clientCertificate.getNotAfter() + ")";
    }
}
