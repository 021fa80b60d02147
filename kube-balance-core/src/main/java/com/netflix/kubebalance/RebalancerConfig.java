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

/**
 * Settings of a {@link PodRebalancer}. Build with {@link RebalancerConfig.Builder}; every setting has a default.
 */
public class RebalancerConfig {

    public static final String DEFAULT_DEGRADED_NODE_ANNOTATION = "kube-balance.io/degraded-io";
    public static final String DEFAULT_WORKLOAD_TYPE_LABEL = "workload.k8s.io/type";
    public static final String DEFAULT_COOLDOWN_ANNOTATION = "kube-balance.io/eviction-cooldown-until";

    private final Duration recheckInterval;
    private final int maxEvictionsPerNodePerCycle;
    private final Duration postEvictionRecheckDelay;
    private final Duration rateLimitedRecheckDelay;
    private final Duration evictionGracePeriod;
    private final EvictionScope evictionScope;
    private final boolean evictUnprofiledPods;
    private final String degradedNodeAnnotation;
    private final String workloadTypeLabel;
    private final String cooldownAnnotation;

    private RebalancerConfig(Builder builder) {
        this.recheckInterval = builder.recheckInterval;
        this.maxEvictionsPerNodePerCycle = builder.maxEvictionsPerNodePerCycle;
        this.postEvictionRecheckDelay = builder.postEvictionRecheckDelay;
        this.rateLimitedRecheckDelay = builder.rateLimitedRecheckDelay;
        this.evictionGracePeriod = builder.evictionGracePeriod;
        this.evictionScope = builder.evictionScope;
        this.evictUnprofiledPods = builder.evictUnprofiledPods;
        this.degradedNodeAnnotation = builder.degradedNodeAnnotation;
        this.workloadTypeLabel = builder.workloadTypeLabel;
        this.cooldownAnnotation = builder.cooldownAnnotation;
    }

    public static RebalancerConfig defaults() {
        return new Builder().build();
    }

    public Duration getRecheckInterval() {
        return recheckInterval;
    }

    public int getMaxEvictionsPerNodePerCycle() {
        return maxEvictionsPerNodePerCycle;
    }

    public Duration getPostEvictionRecheckDelay() {
        return postEvictionRecheckDelay;
    }

    public Duration getRateLimitedRecheckDelay() {
        return rateLimitedRecheckDelay;
    }

    public Duration getEvictionGracePeriod() {
        return evictionGracePeriod;
    }

    public EvictionScope getEvictionScope() {
        return evictionScope;
    }

    public boolean isEvictUnprofiledPods() {
        return evictUnprofiledPods;
    }

    public String getDegradedNodeAnnotation() {
        return degradedNodeAnnotation;
    }

    public String getWorkloadTypeLabel() {
        return workloadTypeLabel;
    }

    public String getCooldownAnnotation() {
        return cooldownAnnotation;
    }

    /**
     * @return how long an owner stays in cooldown after one of its pods is evicted, two recheck intervals
     */
    public Duration getCooldown() {
        return recheckInterval.multipliedBy(2);
    }

    @Override
    public String toString() {
        return "RebalancerConfig{" +
                "recheckInterval=" + recheckInterval +
                ", maxEvictionsPerNodePerCycle=" + maxEvictionsPerNodePerCycle +
                ", postEvictionRecheckDelay=" + postEvictionRecheckDelay +
                ", rateLimitedRecheckDelay=" + rateLimitedRecheckDelay +
                ", evictionGracePeriod=" + evictionGracePeriod +
                ", evictionScope=" + evictionScope +
                ", evictUnprofiledPods=" + evictUnprofiledPods +
                ", degradedNodeAnnotation=" + degradedNodeAnnotation +
                ", workloadTypeLabel=" + workloadTypeLabel +
                ", cooldownAnnotation=" + cooldownAnnotation +
                '}';
    }

    public final static class Builder {

        private Duration recheckInterval = Duration.ofMinutes(2);
        private int maxEvictionsPerNodePerCycle = 1;
        private Duration postEvictionRecheckDelay = Duration.ofSeconds(5);
        private Duration rateLimitedRecheckDelay = Duration.ofSeconds(10);
        private Duration evictionGracePeriod = Duration.ofSeconds(30);
        private EvictionScope evictionScope = EvictionScope.SinglePerCycle;
        private boolean evictUnprofiledPods = false;
        private String degradedNodeAnnotation = DEFAULT_DEGRADED_NODE_ANNOTATION;
        private String workloadTypeLabel = DEFAULT_WORKLOAD_TYPE_LABEL;
        private String cooldownAnnotation = DEFAULT_COOLDOWN_ANNOTATION;

        /**
         * Use the given interval between rebalancing cycles when there is nothing to do. Default is 2 minutes. Owner
         * cooldowns last twice this interval.
         *
         * @param recheckInterval the recheck interval
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalancerConfig}
         */
        public Builder withRecheckInterval(Duration recheckInterval) {
            this.recheckInterval = recheckInterval;
            return this;
        }

        /**
         * Evict at most the given number of pods from one degraded node in one cycle. Default is 1.
         *
         * @param max the maximum number of evictions per node per cycle
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalancerConfig}
         */
        public Builder withMaxEvictionsPerNodePerCycle(int max) {
            this.maxEvictionsPerNodePerCycle = max;
            return this;
        }

        /**
         * Start the next cycle after the given delay once a cycle evicted a pod. Default is 5 seconds.
         *
         * @param delay the delay
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalancerConfig}
         */
        public Builder withPostEvictionRecheckDelay(Duration delay) {
            this.postEvictionRecheckDelay = delay;
            return this;
        }

        /**
         * Start the next cycle after the given delay when the cluster rate limited an eviction. Default is 10
         * seconds.
         *
         * @param delay the delay
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalancerConfig}
         */
        public Builder withRateLimitedRecheckDelay(Duration delay) {
            this.rateLimitedRecheckDelay = delay;
            return this;
        }

        /**
         * Give evicted pods the given time to terminate. Default is 30 seconds.
         *
         * @param gracePeriod the grace period
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalancerConfig}
         */
        public Builder withEvictionGracePeriod(Duration gracePeriod) {
            this.evictionGracePeriod = gracePeriod;
            return this;
        }

        public Builder withEvictionScope(EvictionScope evictionScope) {
            this.evictionScope = evictionScope;
            return this;
        }

        /**
         * Also evict pods whose workload type has no profile, after all pods with one in the same QoS class. By
         * default such pods are left alone.
         *
         * @param evictUnprofiledPods whether pods without a workload profile may be evicted
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalancerConfig}
         */
        public Builder withEvictUnprofiledPods(boolean evictUnprofiledPods) {
            this.evictUnprofiledPods = evictUnprofiledPods;
            return this;
        }

        public Builder withDegradedNodeAnnotation(String annotation) {
            this.degradedNodeAnnotation = annotation;
            return this;
        }

        public Builder withWorkloadTypeLabel(String label) {
            this.workloadTypeLabel = label;
            return this;
        }

        public Builder withCooldownAnnotation(String annotation) {
            this.cooldownAnnotation = annotation;
            return this;
        }

        /**
         * Creates a {@link RebalancerConfig} from the settings chained so far.
         *
         * @return the config
         * @throws IllegalArgumentException if a setting is out of range
         */
        public RebalancerConfig build() {
            requirePositive("recheck interval", recheckInterval);
            requirePositive("post eviction recheck delay", postEvictionRecheckDelay);
            requirePositive("rate limited recheck delay", rateLimitedRecheckDelay);
            if (evictionGracePeriod == null || evictionGracePeriod.isNegative())
                throw new IllegalArgumentException("Eviction grace period must not be negative: " + evictionGracePeriod);
            if (maxEvictionsPerNodePerCycle < 1)
                throw new IllegalArgumentException("Max evictions per node per cycle must be at least 1: " + maxEvictionsPerNodePerCycle);
            if (evictionScope == null)
                throw new NullPointerException("Null eviction scope not allowed");
            requireText("degraded node annotation", degradedNodeAnnotation);
            requireText("workload type label", workloadTypeLabel);
            requireText("cooldown annotation", cooldownAnnotation);
            return new RebalancerConfig(this);
        }

        private static void requirePositive(String what, Duration d) {
            if (d == null || d.isZero() || d.isNegative())
                throw new IllegalArgumentException("The " + what + " must be positive: " + d);
        }

        private static void requireText(String what, String s) {
            if (s == null || s.isEmpty())
                throw new IllegalArgumentException("The " + what + " must be set");
        }
    }
}
