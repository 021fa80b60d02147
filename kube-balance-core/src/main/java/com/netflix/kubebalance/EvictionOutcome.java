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

/**
 * Classified result of one eviction request.
 */
public class EvictionOutcome {

    public enum Status {
        Evicted,
        /**
         * The cluster refused the request because too many evictions are in progress. This applies to the whole
         * cluster, not to the pod.
         */
        RateLimited,
        Failed
    }

    private static final EvictionOutcome EVICTED = new EvictionOutcome(Status.Evicted, null);

    private final Status status;
    private final EvictionException cause;

    private EvictionOutcome(Status status, EvictionException cause) {
        this.status = status;
        this.cause = cause;
    }

    static EvictionOutcome evicted() {
        return EVICTED;
    }

    static EvictionOutcome of(EvictionException e) {
        return new EvictionOutcome(e.isTooManyRequests() ? Status.RateLimited : Status.Failed, e);
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return the exception the request failed with, or {@code null} if the pod was evicted
     */
    public EvictionException getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return cause == null ? status.toString() : status + "(" + cause.getMessage() + ")";
    }
}
