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

import com.netflix.kubebalance.ClusterNode;
import com.netflix.kubebalance.ContainerResources;
import com.netflix.kubebalance.DisruptionBudget;
import com.netflix.kubebalance.LabelSelector;
import com.netflix.kubebalance.OwnerKind;
import com.netflix.kubebalance.OwnerReference;
import com.netflix.kubebalance.PodInfo;
import com.netflix.kubebalance.PodPhase;
import com.netflix.kubebalance.WorkloadOwner;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.policy.v1.PodDisruptionBudget;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts fabric8 model objects into the snapshots used by the rebalancer.
 */
final class Fabric8Conversions {

    private Fabric8Conversions() {
    }

    static ClusterNode toNode(Node node) {
        final ObjectMeta meta = node.getMetadata();
        return new ClusterNode(meta.getName(), nullToEmpty(meta.getAnnotations()));
    }

    static PodInfo toPod(Pod pod) {
        final ObjectMeta meta = pod.getMetadata();
        final PodInfo.Builder builder = PodInfo.newBuilder(meta.getNamespace(), meta.getName())
                .withLabels(nullToEmpty(meta.getLabels()))
                .withPhase(pod.getStatus() == null ? PodPhase.Unknown : PodPhase.fromName(pod.getStatus().getPhase()));
        if (pod.getSpec() != null) {
            builder.withNodeName(pod.getSpec().getNodeName());
            if (pod.getSpec().getContainers() != null) {
                for (Container c : pod.getSpec().getContainers())
                    builder.withContainer(toContainer(c));
            }
        }
        for (OwnerReference ref : toOwnerReferences(meta))
            builder.withOwnerReference(ref);
        return builder.build();
    }

    static ContainerResources toContainer(Container container) {
        final ResourceRequirements resources = container.getResources();
        if (resources == null)
            return new ContainerResources(container.getName(), null, null);
        return new ContainerResources(container.getName(), toAmounts(resources.getRequests()),
                toAmounts(resources.getLimits()));
    }

    static Map<String, BigDecimal> toAmounts(Map<String, Quantity> quantities) {
        if (quantities == null || quantities.isEmpty())
            return Collections.emptyMap();
        final Map<String, BigDecimal> result = new HashMap<>();
        for (Map.Entry<String, Quantity> entry : quantities.entrySet()) {
            if (entry.getValue() != null)
                result.put(entry.getKey(), Quantity.getAmountInBytes(entry.getValue()));
        }
        return result;
    }

    static List<OwnerReference> toOwnerReferences(ObjectMeta meta) {
        if (meta.getOwnerReferences() == null || meta.getOwnerReferences().isEmpty())
            return Collections.emptyList();
        final List<OwnerReference> result = new ArrayList<>();
        for (io.fabric8.kubernetes.api.model.OwnerReference ref : meta.getOwnerReferences())
            result.add(new OwnerReference(ref.getKind(), ref.getName(), Boolean.TRUE.equals(ref.getController())));
        return result;
    }

    static WorkloadOwner toOwner(OwnerKind kind, HasMetadata resource) {
        final ObjectMeta meta = resource.getMetadata();
        return new WorkloadOwner(kind, meta.getNamespace(), meta.getName(), nullToEmpty(meta.getAnnotations()),
                toOwnerReferences(meta));
    }

    static DisruptionBudget toDisruptionBudget(PodDisruptionBudget pdb) {
        final ObjectMeta meta = pdb.getMetadata();
        final LabelSelector selector = pdb.getSpec() == null ? null : toSelector(pdb.getSpec().getSelector());
        final Integer allowed = pdb.getStatus() == null ? null : pdb.getStatus().getDisruptionsAllowed();
        return new DisruptionBudget(meta.getNamespace(), meta.getName(), selector, allowed == null ? 0 : allowed);
    }

    static LabelSelector toSelector(io.fabric8.kubernetes.api.model.LabelSelector selector) {
        if (selector == null)
            return null;
        final List<LabelSelector.Requirement> requirements = new ArrayList<>();
        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement r : selector.getMatchExpressions())
                requirements.add(new LabelSelector.Requirement(r.getKey(), r.getOperator(), r.getValues()));
        }
        return new LabelSelector(nullToEmpty(selector.getMatchLabels()), requirements);
    }

    private static Map<String, String> nullToEmpty(Map<String, String> m) {
        return m == null ? Collections.emptyMap() : m;
    }
}
