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

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Resource requests and limits declared by one container of a pod. Amounts are numeric, already normalized by the
 * caller from the cluster's quantity notation (so "500m" CPU is 0.5 and "1Ki" memory is 1024).
 * <p>
 * An empty map means the container declared nothing of that kind. A resource missing from a declared map counts as
 * zero when compared.
 */
public class ContainerResources {

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";

    private final String name;
    private final Map<String, BigDecimal> requests;
    private final Map<String, BigDecimal> limits;

    public ContainerResources(String name, Map<String, BigDecimal> requests, Map<String, BigDecimal> limits) {
        this.name = name;
        this.requests = copyOf(requests);
        this.limits = copyOf(limits);
    }

    public static ContainerResources of(String name, String cpuRequest, String memRequest, String cpuLimit, String memLimit) {
        return new ContainerResources(name, amounts(cpuRequest, memRequest), amounts(cpuLimit, memLimit));
    }

    private static Map<String, BigDecimal> amounts(String cpu, String mem) {
        Map<String, BigDecimal> m = new HashMap<>();
        if (cpu != null)
            m.put(CPU, new BigDecimal(cpu));
        if (mem != null)
            m.put(MEMORY, new BigDecimal(mem));
        return m;
    }

    private static Map<String, BigDecimal> copyOf(Map<String, BigDecimal> m) {
        return m == null || m.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(m));
    }

    public String getName() {
        return name;
    }

    public Map<String, BigDecimal> getRequests() {
        return requests;
    }

    public Map<String, BigDecimal> getLimits() {
        return limits;
    }

    public boolean declaresNothing() {
        return requests.isEmpty() && limits.isEmpty();
    }

    public BigDecimal getRequest(String resource) {
        return requests.getOrDefault(resource, BigDecimal.ZERO);
    }

    public BigDecimal getLimit(String resource) {
        return limits.getOrDefault(resource, BigDecimal.ZERO);
    }

    @Override
    public String toString() {
        return "ContainerResources{name=" + name + ", requests=" + requests + ", limits=" + limits + '}';
    }
}
