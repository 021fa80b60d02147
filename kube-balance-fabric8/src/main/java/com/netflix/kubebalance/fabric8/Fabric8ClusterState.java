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

package com.netflix.kubebalance.fabric8;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.kubebalance.ClusterAccessException;
import com.netflix.kubebalance.ClusterNode;
import com.netflix.kubebalance.ClusterState;
import com.netflix.kubebalance.DisruptionBudget;
import com.netflix.kubebalance.OwnerKind;
import com.netflix.kubebalance.PodInfo;
import com.netflix.kubebalance.WorkloadOwner;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link ClusterState} backed by a fabric8 {@link KubernetesClient}. Every call goes to the API server; request
 * timeouts are those configured on the client.
 */
public class Fabric8ClusterState implements ClusterState {

    private static final Logger logger = LoggerFactory.getLogger(Fabric8ClusterState.class);

    private final KubernetesClient client;
    private final ObjectMapper mapper;

    public Fabric8ClusterState(KubernetesClient client) {
        this(client, new ObjectMapper());
    }

    public Fabric8ClusterState(KubernetesClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public List<ClusterNode> listNodes() throws ClusterAccessException {
        try {
            return client.nodes().list().getItems().stream()
                    .map(Fabric8Conversions::toNode)
                    .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to list nodes: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PodInfo> listPods() throws ClusterAccessException {
        try {
            return client.pods().inAnyNamespace().list().getItems().stream()
                    .map(Fabric8Conversions::toPod)
                    .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to list pods: " + e.getMessage(), e);
        }
    }

    @Override
    public List<DisruptionBudget> listDisruptionBudgets(String namespace) throws ClusterAccessException {
        try {
            return client.policy().v1().podDisruptionBudget().inNamespace(namespace).list().getItems().stream()
                    .map(Fabric8Conversions::toDisruptionBudget)
                    .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to list pod disruption budgets in namespace " + namespace +
                    ": " + e.getMessage(), e);
        }
    }

    @Override
    public WorkloadOwner getOwner(OwnerKind kind, String namespace, String name) throws ClusterAccessException {
        final HasMetadata resource;
        try {
            resource = resourceOf(kind, namespace, name).get();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to get " + kind + " " + namespace + "/" + name + ": " +
                    e.getMessage(), e);
        }
        if (resource == null)
            throw new ClusterAccessException(kind + " " + namespace + "/" + name + " not found");
        return Fabric8Conversions.toOwner(kind, resource);
    }

    @Override
    public void patchOwnerAnnotation(WorkloadOwner owner, String key, String value) throws ClusterAccessException {
        final String patch = annotationPatch(key, value);
        logger.debug("Patching {} with {}", owner, patch);
        try {
            resourceOf(owner.getKind(), owner.getNamespace(), owner.getName())
                    .patch(PatchContext.of(PatchType.JSON_MERGE), patch);
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to patch annotation " + key + " on " + owner + ": " +
                    e.getMessage(), e);
        }
    }

    String annotationPatch(String key, String value) throws ClusterAccessException {
        final ObjectNode root = mapper.createObjectNode();
        root.putObject("metadata").putObject("annotations").put(key, value);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ClusterAccessException("Failed to build annotation patch for " + key, e);
        }
    }

    private Resource<? extends HasMetadata> resourceOf(OwnerKind kind, String namespace, String name) {
        switch (kind) {
            case Deployment:
                return client.apps().deployments().inNamespace(namespace).withName(name);
            case StatefulSet:
                return client.apps().statefulSets().inNamespace(namespace).withName(name);
            case ReplicaSet:
                return client.apps().replicaSets().inNamespace(namespace).withName(name);
            default:
                throw new IllegalArgumentException("Unsupported owner kind " + kind);
        }
    }
}
