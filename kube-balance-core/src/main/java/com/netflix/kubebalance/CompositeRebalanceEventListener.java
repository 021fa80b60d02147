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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

class CompositeRebalanceEventListener implements RebalanceEventListener {

    private static final Logger logger = LoggerFactory.getLogger(CompositeRebalanceEventListener.class);

    private final List<RebalanceEventListener> listeners;

    private CompositeRebalanceEventListener(Collection<RebalanceEventListener> listeners) {
        this.listeners = new ArrayList<>(listeners);
    }

    @Override
    public void onRebalanceStart() {
        safely(RebalanceEventListener::onRebalanceStart);
    }

    @Override
    public void onNodeDegraded(ClusterNode node) {
        safely(listener -> listener.onNodeDegraded(node));
    }

    @Override
    public void onCandidateSkipped(EvictionCandidate candidate, AdmissionCheck.Result rejection) {
        safely(listener -> listener.onCandidateSkipped(candidate, rejection));
    }

    @Override
    public void onPodEvicted(PodInfo pod, ClusterNode node) {
        safely(listener -> listener.onPodEvicted(pod, node));
    }

    @Override
    public void onEvictionRateLimited(PodInfo pod, EvictionException cause) {
        safely(listener -> listener.onEvictionRateLimited(pod, cause));
    }

    @Override
    public void onEvictionFailed(PodInfo pod, EvictionException cause) {
        safely(listener -> listener.onEvictionFailed(pod, cause));
    }

    @Override
    public void onCooldownSet(WorkloadOwner owner, Instant until) {
        safely(listener -> listener.onCooldownSet(owner, until));
    }

    @Override
    public void onCooldownFailed(WorkloadOwner owner, Exception cause) {
        safely(listener -> listener.onCooldownFailed(owner, cause));
    }

    @Override
    public void onRebalanceFinish(RebalanceResult result) {
        safely(listener -> listener.onRebalanceFinish(result));
    }

    private void safely(Consumer<RebalanceEventListener> action) {
        listeners.forEach(listener -> {
            try {
                action.accept(listener);
            } catch (Exception e) {
                logger.warn("Rebalance event dispatching error: {} -> {}", listener.getClass().getSimpleName(), e.getMessage());
                if (logger.isDebugEnabled()) {
                    logger.debug("Details", e);
                }
            }
        });
    }

    static RebalanceEventListener of(Collection<RebalanceEventListener> listeners) {
        if (listeners.isEmpty()) {
            return NoOpRebalanceEventListener.INSTANCE;
        }
        return new CompositeRebalanceEventListener(listeners);
    }
}
