/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kcphealth.kubernetes.api.v1alpha3.Machine;

/**
 * Predicates for selecting {@link Machine}s. All of them are false for a null machine.
 */
public class MachineFilters {

    private static final Logger LOGGER = LoggerFactory.getLogger(MachineFilters.class);

    public static final String KUBEADM_CONTROL_PLANE_KIND = "KubeadmControlPlane";

    private MachineFilters() {
    }

    /**
     * Keeps the machines that pass every filter. No filters means no filtering.
     *
     * @param machines the machines
     * @param filters the filters, combined with logical AND
     * @return the machines accepted by all filters, in their original order
     */
    @SafeVarargs
    public static List<Machine> filter(List<Machine> machines, Predicate<Machine>... filters) {
        if (filters.length == 0) {
            return machines;
        }
        Predicate<Machine> all = Arrays.stream(filters).reduce(m -> true, Predicate::and);
        return machines.stream().filter(all).toList();
    }

    /**
     * @param controlPlaneName name of the {@code KubeadmControlPlane}
     * @return a filter matching machines whose controller is that control plane
     */
    public static Predicate<Machine> ownedControlPlaneMachines(String controlPlaneName) {
        Objects.requireNonNull(controlPlaneName);
        return machine -> machine != null
                && ResourcesUtil.controllerOf(machine)
                        .filter(ref -> KUBEADM_CONTROL_PLANE_KIND.equals(ref.getKind()) && controlPlaneName.equals(ref.getName()))
                        .isPresent();
    }

    public static Predicate<Machine> hasDeletionTimestamp() {
        return machine -> machine != null && machine.getMetadata().getDeletionTimestamp() != null;
    }

    /**
     * @param configHash the hash of the current control plane configuration
     * @return a filter matching machines labelled with that configuration hash
     */
    public static Predicate<Machine> matchesConfigurationHash(String configHash) {
        return machine -> {
            if (machine == null) {
                return false;
            }
            Map<String, String> labels = machine.getMetadata().getLabels();
            return labels != null && labels.containsKey(Labels.CONTROL_PLANE_HASH)
                    && labels.get(Labels.CONTROL_PLANE_HASH).equals(configHash);
        };
    }

    /**
     * @param configHash the hash of the current control plane configuration
     * @return a filter matching machines not labelled with that configuration hash, including unlabelled ones
     */
    public static Predicate<Machine> hasOutdatedConfiguration(String configHash) {
        Predicate<Machine> matches = matchesConfigurationHash(configHash);
        return machine -> machine != null && !matches.test(machine);
    }

    /**
     * @param time the cut off
     * @return a filter matching machines created strictly before {@code time}; a missing or
     * unparseable creation timestamp never matches
     */
    public static Predicate<Machine> olderThan(Instant time) {
        Objects.requireNonNull(time);
        return machine -> {
            if (machine == null || machine.getMetadata().getCreationTimestamp() == null) {
                return false;
            }
            try {
                return Instant.parse(machine.getMetadata().getCreationTimestamp()).isBefore(time);
            }
            catch (DateTimeParseException e) {
                LOGGER.atDebug()
                        .setMessage("Ignoring machine {} with unparseable creationTimestamp {}")
                        .addArgument(() -> ResourcesUtil.namespacedName(machine))
                        .addArgument(machine.getMetadata().getCreationTimestamp())
                        .log();
                return false;
            }
        };
    }
}
