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

package com.netflix.kubebalance.profiles;

import java.util.Objects;

/**
 * Operator-declared metadata for one type of workload, identified by its name. Pods carry the workload type in a
 * label, which is looked up against the profile name when ordering pods for eviction.
 * <p>
 * The CPU and memory request hints are carried along for operators and are not interpreted here. The eviction
 * priority orders pods of the same QoS class: a higher value means the pod is evicted earlier.
 */
public class WorkloadProfile {

    private final String name;
    private final String cpuRequests;
    private final String memoryRequests;
    private final int evictionPriority;

    public WorkloadProfile(String name, String cpuRequests, String memoryRequests, int evictionPriority) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Workload profile name must be set");
        this.name = name;
        this.cpuRequests = cpuRequests;
        this.memoryRequests = memoryRequests;
        this.evictionPriority = evictionPriority;
    }

    public WorkloadProfile(String name, int evictionPriority) {
        this(name, null, null, evictionPriority);
    }

    /**
     * Returns the workload type this profile applies to.
     *
     * @return the profile name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the recommended CPU request for the workload type, as declared.
     *
     * @return the CPU request hint, or {@code null} if not declared
     */
    public String getCpuRequests() {
        return cpuRequests;
    }

    /**
     * Returns the recommended memory request for the workload type, as declared.
     *
     * @return the memory request hint, or {@code null} if not declared
     */
    public String getMemoryRequests() {
        return memoryRequests;
    }

    /**
     * Returns the eviction priority. Pods of a workload type with a higher priority are evicted before pods of the
     * same QoS class with a lower one.
     *
     * @return the eviction priority
     */
    public int getEvictionPriority() {
        return evictionPriority;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkloadProfile that = (WorkloadProfile) o;
        return evictionPriority == that.evictionPriority &&
                name.equals(that.name) &&
                Objects.equals(cpuRequests, that.cpuRequests) &&
                Objects.equals(memoryRequests, that.memoryRequests);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, cpuRequests, memoryRequests, evictionPriority);
    }

    @Override
    public String toString() {
        return "WorkloadProfile{" +
                "name=" + name +
                ", cpuRequests=" + cpuRequests +
                ", memoryRequests=" + memoryRequests +
                ", evictionPriority=" + evictionPriority +
                '}';
    }
}
