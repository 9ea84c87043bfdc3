/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The outcome of a health check for each node it looked at. Every checked node has
 * exactly one entry, holding either nothing (healthy) or the error found for it.
 */
public final class HealthCheckResult {

    private final Map<String, Exception> errors = new LinkedHashMap<>();

    /**
     * Sets the outcome for a node, replacing any outcome recorded for it earlier.
     *
     * @param nodeName node name
     * @param error the problem found, or null if the node is healthy
     */
    public void record(String nodeName, @Nullable Exception error) {
        errors.put(nodeName, error);
    }

    public void healthy(String nodeName) {
        record(nodeName, null);
    }

    public boolean contains(String nodeName) {
        return errors.containsKey(nodeName);
    }

    public Optional<Exception> errorFor(String nodeName) {
        return Optional.ofNullable(errors.get(nodeName));
    }

    public Set<String> nodeNames() {
        return Collections.unmodifiableSet(errors.keySet());
    }

    public int size() {
        return errors.size();
    }

    /**
     * @return the nodes which have an error, in check order
     */
    public Map<String, Exception> failures() {
        Map<String, Exception> failures = new LinkedHashMap<>();
        errors.forEach((node, error) -> {
            if (error != null) {
                failures.put(node, error);
            }
        });
        return failures;
    }

    @Override
    public String toString() {
        return "HealthCheckResult" + errors;
    }
}
