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

import java.time.Duration;

/**
 * Issues eviction requests through an {@link EvictionApi} and classifies the outcome.
 */
public class EvictionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(EvictionExecutor.class);

    private final EvictionApi evictionApi;
    private final Duration gracePeriod;

    public EvictionExecutor(EvictionApi evictionApi, Duration gracePeriod) {
        this.evictionApi = evictionApi;
        this.gracePeriod = gracePeriod;
    }

    public EvictionOutcome evict(PodInfo pod) {
        logger.info("Attempting to evict pod {} from node {}", pod.getId(), pod.getNodeName());
        try {
            evictionApi.evict(pod, gracePeriod);
        } catch (EvictionException e) {
            final EvictionOutcome outcome = EvictionOutcome.of(e);
            if (outcome.getStatus() == EvictionOutcome.Status.RateLimited)
                logger.info("Eviction of pod {} rate limited: {}", pod.getId(), e.getMessage());
            else
                logger.warn("Failed to evict pod " + pod.getId() + ": " + e.getMessage(), e);
            return outcome;
        }
        logger.info("Eviction request sent for pod {}", pod.getId());
        return EvictionOutcome.evicted();
    }
}
