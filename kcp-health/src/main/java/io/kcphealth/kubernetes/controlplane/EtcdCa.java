/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.Arrays;
import java.util.Objects;

/**
 * The PEM encoded etcd certificate authority of a workload cluster.
 *
 * @param certificatePem CA certificate
 * @param keyPem CA private key
 */
public record EtcdCa(byte[] certificatePem, byte[] keyPem) {

    public EtcdCa {
        Objects.requireNonNull(certificatePem);
        Objects.requireNonNull(keyPem);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EtcdCa other
                && Arrays.equals(certificatePem, other.certificatePem)
                && Arrays.equals(keyPem, other.keyPem);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(certificatePem) + Arrays.hashCode(keyPem);
    }

    @Override
    public String toString() {
        return "EtcdCa(certificate=" + certificatePem.length + " bytes, key=<redacted>)";
    }
}
