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

/**
 * Receives a callback for every significant decision of a rebalancing cycle. Callbacks are made on the cycle's
 * thread and should return quickly. Exceptions thrown by a listener are logged and otherwise ignored.
 */
public interface RebalanceEventListener {

    /**
     * Called before a rebalancing cycle starts.
     */
    void onRebalanceStart();

    /**
     * Called for every node that carries the degraded marker.
     *
     * @param node the degraded node
     */
    void onNodeDegraded(ClusterNode node);

    /**
     * Called when a candidate is not evicted because an admission check rejected it.
     *
     * @param candidate the candidate
     * @param rejection the rejecting check's result, {@link AdmissionCheck.Result#getReason()} tells why
     */
    void onCandidateSkipped(EvictionCandidate candidate, AdmissionCheck.Result rejection);

    /**
     * Called when an eviction request for a pod succeeded.
     *
     * @param pod the evicted pod
     * @param node the degraded node the pod was evicted from
     */
    void onPodEvicted(PodInfo pod, ClusterNode node);

    /**
     * Called when the cluster refused an eviction because of rate limiting. The cycle ends after this callback.
     *
     * @param pod the pod that was not evicted
     * @param cause the refusal
     */
    void onEvictionRateLimited(PodInfo pod, EvictionException cause);

    /**
     * Called when an eviction request failed for any reason other than rate limiting.
     *
     * @param pod the pod that was not evicted
     * @param cause the failure
     */
    void onEvictionFailed(PodInfo pod, EvictionException cause);

    /**
     * Called when an eviction cooldown was set on an owner.
     *
     * @param owner the owner
     * @param until the cooldown deadline
     */
    void onCooldownSet(WorkloadOwner owner, Instant until);

    /**
     * Called when an eviction cooldown could not be set on an owner. The eviction itself stands.
     *
     * @param owner the owner
     * @param cause the failure
     */
    void onCooldownFailed(WorkloadOwner owner, Exception cause);

    /**
     * Called when the rebalancing cycle completes.
     *
     * @param result the cycle result
     */
    void onRebalanceFinish(RebalanceResult result);
}
