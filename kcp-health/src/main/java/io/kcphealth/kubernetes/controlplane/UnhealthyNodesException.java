/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregates the per-node failures of a health check. Each failure stays addressable by
 * node name through {@link #nodeErrors()}, and is also attached as a suppressed exception so
 * that it shows up in stack traces.
 */
public class UnhealthyNodesException extends ControlPlaneHealthException {

    private final Map<String, Exception> nodeErrors;

    public UnhealthyNodesException(Map<String, ? extends Exception> nodeErrors) {
        super(describe(nodeErrors));
        if (nodeErrors.isEmpty()) {
            throw new IllegalArgumentException("at least one node error is required");
        }
        this.nodeErrors = Collections.unmodifiableMap(new LinkedHashMap<>(nodeErrors));
        this.nodeErrors.values().forEach(this::addSuppressed);
    }

    /**
     * @return the failures, keyed by node name, in the order the nodes were checked
     */
    public Map<String, Exception> nodeErrors() {
        return nodeErrors;
    }

    private static String describe(Map<String, ? extends Exception> nodeErrors) {
        String joined = nodeErrors.entrySet().stream()
                .map(e -> "node \"" + e.getKey() + "\": " + e.getValue().getMessage())
                .collect(Collectors.joining(", "));
        return nodeErrors.size() == 1 ? joined : "[" + joined + "]";
    }
}
