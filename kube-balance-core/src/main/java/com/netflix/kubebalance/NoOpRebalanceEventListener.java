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

import java.time.Instant;

class NoOpRebalanceEventListener implements RebalanceEventListener {

    static final RebalanceEventListener INSTANCE = new NoOpRebalanceEventListener();

    @Override
    public void onRebalanceStart() {
    }

    @Override
    public void onNodeDegraded(ClusterNode node) {
    }

    @Override
    public void onCandidateSkipped(EvictionCandidate candidate, AdmissionCheck.Result rejection) {
    }

    @Override
    public void onPodEvicted(PodInfo pod, ClusterNode node) {
    }

    @Override
    public void onEvictionRateLimited(PodInfo pod, EvictionException cause) {
    }

    @Override
    public void onEvictionFailed(PodInfo pod, EvictionException cause) {
    }

    @Override
    public void onCooldownSet(WorkloadOwner owner, Instant until) {
    }

    @Override
    public void onCooldownFailed(WorkloadOwner owner, Exception cause) {
    }

    @Override
    public void onRebalanceFinish(RebalanceResult result) {
    }
}
