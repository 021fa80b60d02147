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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The result of one rebalancing cycle, as returned by {@link PodRebalancer#reconcile()}. It always tells when the
 * next cycle should run. It also lists the pods evicted, and any exceptions that cut the cycle short.
 */
public class RebalanceResult {

    private final List<PodInfo> evictedPods = new ArrayList<>();
    private final List<Exception> exceptions = new ArrayList<>();
    private Duration recheckAfter;
    private boolean rateLimited;
    private boolean cancelled;
    private long runtime;

    public RebalanceResult(Duration recheckAfter) {
        this.recheckAfter = recheckAfter;
    }

    /**
     * Get the delay after which the next rebalancing cycle should run.
     *
     * @return the recheck delay
     */
    public Duration getRecheckAfter() {
        return recheckAfter;
    }

    void setRecheckAfter(Duration recheckAfter) {
        this.recheckAfter = recheckAfter;
    }

    /**
     * Get the pods for which an eviction request succeeded in this cycle, in eviction order.
     *
     * @return the evicted pods
     */
    public List<PodInfo> getEvictedPods() {
        return Collections.unmodifiableList(evictedPods);
    }

    void addEvictedPod(PodInfo pod) {
        evictedPods.add(pod);
    }

    public void addException(Exception e) {
        exceptions.add(e);
    }

    /**
     * Get the exceptions that aborted this cycle, such as a failure to list nodes or pods.
     *
     * @return the exceptions, empty if the cycle ran to completion
     */
    public List<Exception> getExceptions() {
        return Collections.unmodifiableList(exceptions);
    }

    /**
     * @return {@code true} if the cycle ended early because the cluster rate limited an eviction
     */
    public boolean isRateLimited() {
        return rateLimited;
    }

    void setRateLimited(boolean rateLimited) {
        this.rateLimited = rateLimited;
    }

    /**
     * @return {@code true} if the cycle's thread was interrupted and the cycle ended early; evictions already
     * issued are still listed
     */
    public boolean isCancelled() {
        return cancelled;
    }

    void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }

    /**
     * Get the time taken by this cycle, in milliseconds.
     *
     * @return the runtime in milliseconds
     */
    public long getRuntime() {
        return runtime;
    }

    void setRuntime(long runtime) {
        this.runtime = runtime;
    }

    @Override
    public String toString() {
        return "RebalanceResult{" +
                "evicted=" + evictedPods.size() +
                ", recheckAfter=" + recheckAfter +
                ", rateLimited=" + rateLimited +
                ", cancelled=" + cancelled +
                ", exceptions=" + exceptions.size() +
                ", runtime=" + runtime +
                '}';
    }
}
