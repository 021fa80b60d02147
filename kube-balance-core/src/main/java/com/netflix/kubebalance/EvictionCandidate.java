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

import java.util.Optional;

/**
 * A pod being considered for eviction, with what the rebalancing cycle learned about it: its QoS class, its
 * workload profile and its controlling owner.
 */
public class EvictionCandidate {

    private final PodInfo pod;
    private final QosClass qosClass;
    private final WorkloadProfile profile;
    private final WorkloadOwner owner;

    public EvictionCandidate(PodInfo pod, WorkloadProfile profile, WorkloadOwner owner) {
        this.pod = pod;
        this.qosClass = QosClass.of(pod);
        this.profile = profile;
        this.owner = owner;
    }

    public PodInfo getPod() {
        return pod;
    }

    public QosClass getQosClass() {
        return qosClass;
    }

    /**
     * @return the workload profile of the pod, or empty if no profile matches its workload type
     */
    public Optional<WorkloadProfile> getProfile() {
        return Optional.ofNullable(profile);
    }

    /**
     * @return the controlling owner, or empty if the pod has none or it could not be looked up
     */
    public Optional<WorkloadOwner> getOwner() {
        return Optional.ofNullable(owner);
    }

    @Override
    public String toString() {
        return "EvictionCandidate{" + pod.getId() +
                ", qos=" + qosClass +
                ", profile=" + (profile == null ? "none" : profile.getName()) +
                ", owner=" + owner +
                '}';
    }
}
