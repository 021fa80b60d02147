/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.kubebalance;

import java.util.Optional;

/**
 * Finds the workload object that controls a pod. The pod's controller reference is followed; when it points to a
 * {@link OwnerKind#ReplicaSet} that is itself controlled by a {@link OwnerKind#Deployment}, the deployment is
 * returned instead, since evictions are throttled per deployment rather than per rollout revision.
 */
public class OwnerResolver {

    private final ClusterState clusterState;

    public OwnerResolver(ClusterState clusterState) {
        this.clusterState = clusterState;
    }

    /**
     * Resolve the controlling owner of the given pod.
     *
     * @param pod the pod
     * @return the owner, or empty if the pod has no controller reference or its kind is not recognized
     * @throws OwnerLookupException if a referenced object can't be fetched
     */
    public Optional<WorkloadOwner> resolve(PodInfo pod) throws OwnerLookupException {
        final Optional<OwnerReference> ref = pod.getControllerReference();
        if (!ref.isPresent())
            return Optional.empty();
        final Optional<OwnerKind> kind = OwnerKind.fromKind(ref.get().getKind());
        if (!kind.isPresent())
            return Optional.empty();
        final WorkloadOwner owner = fetch(kind.get(), pod.getNamespace(), ref.get().getName());
        if (owner.getKind() != OwnerKind.ReplicaSet)
            return Optional.of(owner);
        final Optional<OwnerReference> parent = owner.getControllerReference();
        if (parent.isPresent() && OwnerKind.Deployment.name().equals(parent.get().getKind()))
            return Optional.of(fetch(OwnerKind.Deployment, pod.getNamespace(), parent.get().getName()));
        return Optional.of(owner);
    }

    private WorkloadOwner fetch(OwnerKind kind, String namespace, String name) throws OwnerLookupException {
        try {
            return clusterState.getOwner(kind, namespace, name);
        } catch (ClusterAccessException e) {
            throw new OwnerLookupException("Failed to get " + kind + " " + namespace + "/" + name + ": " + e.getMessage(), e);
        }
    }
}
