/*
 * Copyright KCP Health Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kcphealth.kubernetes.controlplane;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;

public class ResourcesUtil {

    private ResourcesUtil() {
    }

    public static String name(HasMetadata resource) {
        return resource.getMetadata().getName();
    }

    public static String namespace(HasMetadata resource) {
        return resource.getMetadata().getNamespace();
    }

    public static String namespacedName(HasMetadata resource) {
        return namespace(resource) + "/" + name(resource);
    }

    /**
     * Finds the owner reference flagged as the resource's managing controller.
     *
     * @param resource the owned resource
     * @return the controller reference, or empty if nothing controls the resource
     */
    public static Optional<OwnerReference> controllerOf(HasMetadata resource) {
        List<OwnerReference> refs = resource.getMetadata().getOwnerReferences();
        if (refs == null) {
            return Optional.empty();
        }
        return refs.stream()
                .filter(ref -> Boolean.TRUE.equals(ref.getController()))
                .findFirst();
    }
}
