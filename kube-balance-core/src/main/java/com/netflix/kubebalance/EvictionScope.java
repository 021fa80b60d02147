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
 * How many evictions one rebalancing cycle may issue.
 */
public enum EvictionScope {
    /**
     * A cycle ends after its first successful eviction, whichever node it was on. Further evictions happen in the
     * following cycles, which start after {@link RebalancerConfig#getPostEvictionRecheckDelay()}.
     */
    SinglePerCycle,
    /**
     * A cycle keeps evicting from each degraded node until the node reaches
     * {@link RebalancerConfig#getMaxEvictionsPerNodePerCycle()}, then moves to the next degraded node.
     */
    PerNode
}
