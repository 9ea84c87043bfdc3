/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane.certs;

import io.kcphealth.kubernetes.controlplane.ControlPlaneHealthException;

/**
 * The etcd CA material could not be decoded, or a client certificate could not be signed with it.
 * This is a configuration problem, so it is not worth retrying.
 */
public class CertificateGenerationException extends ControlPlaneHealthException {

    public CertificateGenerationException(String message) {
        super(message);
    }

    public CertificateGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
