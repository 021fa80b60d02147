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

import com.netflix.kubebalance.profiles.WorkloadProfile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders the pods of a degraded node for eviction. Pods are sorted by
 * <ol>
 *     <li>QoS class, {@link QosClass#BestEffort} first, then {@link QosClass#Burstable}, then
 *     {@link QosClass#Guaranteed};</li>
 *     <li>within a QoS class, the eviction priority of the pod's workload profile, highest first. Pods without a
 *     profile come after all pods that have one.</li>
 * </ol>
 * The sort is stable: pods that compare equal keep their input order. Ordering has no side effects, so the same
 * input always yields the same output.
 */
public class EvictionOrder {

    private final String workloadTypeLabel;

    public EvictionOrder(String workloadTypeLabel) {
        this.workloadTypeLabel = workloadTypeLabel;
    }

    /**
     * Get the pods in eviction order.
     *
     * @param pods the candidate pods
     * @param profiles the current profiles, keyed by workload type
     * @return a new list with the pods in the order they should be evicted
     */
    public List<PodInfo> rank(Collection<PodInfo> pods, Map<String, WorkloadProfile> profiles) {
        List<PodInfo> ranked = new ArrayList<>(pods);
        ranked.sort(comparator(profiles));
        return ranked;
    }

    Comparator<PodInfo> comparator(Map<String, WorkloadProfile> profiles) {
        final Comparator<PodInfo> byQos =
                Comparator.comparingInt((PodInfo p) -> QosClass.evictionRankOf(QosClass.of(p))).reversed();
        return byQos.thenComparing((a, b) -> compareProfiles(profileOf(a, profiles), profileOf(b, profiles)));
    }

    // negative when a should be evicted first
    private static int compareProfiles(WorkloadProfile a, WorkloadProfile b) {
        if (a == null && b == null)
            return 0;
        if (a == null)
            return 1;
        if (b == null)
            return -1;
        return Integer.compare(b.getEvictionPriority(), a.getEvictionPriority());
    }

    /**
     * Get the profile matching the workload type label of a pod.
     *
     * @param pod the pod
     * @param profiles the profiles, keyed by workload type
     * @return the profile, or {@code null} if the pod has no workload type or no profile matches it
     */
    public WorkloadProfile profileOf(PodInfo pod, Map<String, WorkloadProfile> profiles) {
        final String workloadType = pod.getLabels().get(workloadTypeLabel);
        return workloadType == null ? null : profiles.get(workloadType);
    }
}
