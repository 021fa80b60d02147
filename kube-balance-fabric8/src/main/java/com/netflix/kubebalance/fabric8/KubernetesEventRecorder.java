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

import com.netflix.kubebalance.AdmissionCheck;
import com.netflix.kubebalance.ClusterNode;
import com.netflix.kubebalance.EvictionCandidate;
import com.netflix.kubebalance.EvictionCooldowns;
import com.netflix.kubebalance.EvictionException;
import com.netflix.kubebalance.PodInfo;
import com.netflix.kubebalance.RebalanceEventListener;
import com.netflix.kubebalance.RebalanceResult;
import com.netflix.kubebalance.WorkloadOwner;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Publishes the rebalancer's decisions as core/v1 events on the objects involved: the degraded node, the pod, or
 * the pod's owner. Events are best effort; a failure to create one is logged and otherwise ignored.
 */
public class KubernetesEventRecorder implements RebalanceEventListener {

    private static final Logger logger = LoggerFactory.getLogger(KubernetesEventRecorder.class);

    public static final String COMPONENT = "kube-balance-controller";

    static final String NORMAL = "Normal";
    static final String WARNING = "Warning";

    static final String REASON_NODE_DEGRADED = "NodeDegraded";
    static final String REASON_EVICTION_SKIPPED = "EvictionSkipped";
    static final String REASON_PDB_VIOLATION = "PDBViolation";
    static final String REASON_POD_EVICTED = "PodEvicted";
    static final String REASON_EVICTION_RATE_LIMITED = "EvictionRateLimited";
    static final String REASON_EVICTION_FAILED = "EvictionFailed";
    static final String REASON_COOLDOWN_SET = "CooldownSet";
    static final String REASON_COOLDOWN_FAILED = "CooldownAnnotationFailed";

    // namespace for events on cluster scoped objects
    private static final String DEFAULT_NAMESPACE = "default";

    private final KubernetesClient client;
    private final Clock clock;

    public KubernetesEventRecorder(KubernetesClient client) {
        this(client, Clock.systemUTC());
    }

    public KubernetesEventRecorder(KubernetesClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public void onRebalanceStart() {
    }

    @Override
    public void onNodeDegraded(ClusterNode node) {
        record(nodeReference(node), NORMAL, REASON_NODE_DEGRADED,
                "Node " + node.getName() + " marked as degraded");
    }

    @Override
    public void onCandidateSkipped(EvictionCandidate candidate, AdmissionCheck.Result rejection) {
        final PodInfo pod = candidate.getPod();
        if (rejection.getReason() == AdmissionCheck.Reason.DisruptionBudget) {
            record(podReference(pod), WARNING, REASON_PDB_VIOLATION,
                    "Pod " + pod.getName() + " cannot be evicted due to PDB violation: " + rejection.getMessage());
        } else {
            record(podReference(pod), NORMAL, REASON_EVICTION_SKIPPED, rejection.getMessage());
        }
    }

    @Override
    public void onPodEvicted(PodInfo pod, ClusterNode node) {
        record(podReference(pod), NORMAL, REASON_POD_EVICTED,
                "Pod " + pod.getName() + " evicted from degraded node " + node.getName());
    }

    @Override
    public void onEvictionRateLimited(PodInfo pod, EvictionException cause) {
        record(podReference(pod), WARNING, REASON_EVICTION_RATE_LIMITED,
                "Eviction of pod " + pod.getName() + " rate limited by the API server");
    }

    @Override
    public void onEvictionFailed(PodInfo pod, EvictionException cause) {
        record(podReference(pod), WARNING, REASON_EVICTION_FAILED,
                "Failed to evict pod " + pod.getName() + ": " + cause.getMessage());
    }

    @Override
    public void onCooldownSet(WorkloadOwner owner, Instant until) {
        record(ownerReference(owner), NORMAL, REASON_COOLDOWN_SET,
                "Cooldown set on owner " + owner.getName() + " until " + EvictionCooldowns.format(until));
    }

    @Override
    public void onCooldownFailed(WorkloadOwner owner, Exception cause) {
        record(ownerReference(owner), WARNING, REASON_COOLDOWN_FAILED,
                "Failed to add cooldown annotation to owner " + owner.getName() + ": " + cause.getMessage());
    }

    @Override
    public void onRebalanceFinish(RebalanceResult result) {
    }

    Event buildEvent(ObjectReference involved, String type, String reason, String message) {
        final String now = EvictionCooldowns.format(clock.instant());
        final String namespace = involved.getNamespace() == null ? DEFAULT_NAMESPACE : involved.getNamespace();
        return new EventBuilder()
                .withNewMetadata()
                    .withNamespace(namespace)
                    .withName(involved.getName() + "." + UUID.randomUUID().toString().replace("-", "").substring(0, 16))
                .endMetadata()
                .withInvolvedObject(involved)
                .withType(type)
                .withReason(reason)
                .withMessage(message)
                .withNewSource()
                    .withComponent(COMPONENT)
                .endSource()
                .withFirstTimestamp(now)
                .withLastTimestamp(now)
                .withCount(1)
                .build();
    }

    private void record(ObjectReference involved, String type, String reason, String message) {
        final Event event = buildEvent(involved, type, reason, message);
        try {
            client.v1().events().inNamespace(event.getMetadata().getNamespace()).resource(event).create();
        } catch (KubernetesClientException e) {
            logger.warn("Failed to record {} event on {} {}: {}", reason, involved.getKind(), involved.getName(),
                    e.getMessage());
        }
    }

    static ObjectReference nodeReference(ClusterNode node) {
        return new ObjectReferenceBuilder()
                .withApiVersion("v1")
                .withKind("Node")
                .withName(node.getName())
                .build();
    }

    static ObjectReference podReference(PodInfo pod) {
        return new ObjectReferenceBuilder()
                .withApiVersion("v1")
                .withKind("Pod")
                .withNamespace(pod.getNamespace())
                .withName(pod.getName())
                .build();
    }

    static ObjectReference ownerReference(WorkloadOwner owner) {
        return new ObjectReferenceBuilder()
                .withApiVersion(owner.getKind().getApiVersion())
                .withKind(owner.getKind().name())
                .withNamespace(owner.getNamespace())
                .withName(owner.getName())
                .build();
    }
}
