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
 * Lifecycle phase of a pod. Only {@link #Running} and {@link #Pending} pods are considered for eviction.
 */
public enum PodPhase {
    Pending,
    Running,
    Succeeded,
    Failed,
    Unknown;

    /**
     * Map a phase name as reported by the cluster to a phase. Unrecognized or missing names map to {@link #Unknown}.
     *
     * @param phase the phase name, e.g. "Running"
     * @return the matching phase
     */
    public static PodPhase fromName(String phase) {
        if (phase != null) {
            for (PodPhase p : values()) {
                if (p.name().equals(phase))
                    return p;
            }
        }
        return Unknown;
    }

    public boolean isEvictable() {
        return this == Running || this == Pending;
    }
}
