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

import java.util.List;

/**
 * Read and patch access to the cluster objects a rebalancing cycle needs. All reads return fresh snapshots; nothing
 * is cached across cycles. Implementations are expected to bound every call with a timeout.
 */
public interface ClusterState {

    /**
     * List all nodes of the cluster.
     *
     * @return the current node snapshots
     * @throws ClusterAccessException if nodes can't be listed
     */
    List<ClusterNode> listNodes() throws ClusterAccessException;

    /**
     * List all pods of the cluster, in all namespaces.
     *
     * @return the current pod snapshots
     * @throws ClusterAccessException if pods can't be listed
     */
    List<PodInfo> listPods() throws ClusterAccessException;

    /**
     * List the disruption budgets in a namespace.
     *
     * @param namespace the namespace
     * @return the current budget snapshots
     * @throws ClusterAccessException if budgets can't be listed
     */
    List<DisruptionBudget> listDisruptionBudgets(String namespace) throws ClusterAccessException;

    /**
     * Get a workload owner object.
     *
     * @param kind the kind of the owner
     * @param namespace the owner's namespace
     * @param name the owner's name
     * @return the owner snapshot
     * @throws ClusterAccessException if the owner can't be fetched or doesn't exist
     */
    WorkloadOwner getOwner(OwnerKind kind, String namespace, String name) throws ClusterAccessException;

    /**
     * Set one annotation on a workload owner with a merge patch, leaving the rest of the object unchanged.
     *
     * @param owner the owner to patch
     * @param key the annotation key
     * @param value the annotation value
     * @throws ClusterAccessException if the patch fails
     */
    void patchOwnerAnnotation(WorkloadOwner owner, String key, String value) throws ClusterAccessException;
}
