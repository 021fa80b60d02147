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
import java.util.List;

/**
 * Quality of service class of a pod, derived from the resource requests and limits of its containers. Classes with
 * weaker resource guarantees are evicted first.
 */
public enum QosClass {
    BestEffort(3),
    Burstable(2),
    Guaranteed(1);

    private final int evictionRank;

    QosClass(int evictionRank) {
        this.evictionRank = evictionRank;
    }

    /**
     * @return rank used to order pods for eviction, higher ranks are evicted first
     */
    public int getEvictionRank() {
        return evictionRank;
    }

    public static int evictionRankOf(QosClass qosClass) {
        return qosClass == null ? 0 : qosClass.evictionRank;
    }

    /**
     * Classify a pod. Containers are scanned in three passes so that the result does not depend on container order:
     * <ol>
     *     <li>{@link #BestEffort} if the pod has no containers, or any container declares neither requests nor
     *     limits.</li>
     *     <li>{@link #Burstable} if any container's CPU or memory request differs from its limit.</li>
     *     <li>{@link #Guaranteed} if no container has a zero CPU or memory request.</li>
     * </ol>
     * A pod whose requests all equal their limits but with some zero request is {@link #BestEffort}.
     *
     * @param pod the pod to classify
     * @return the QoS class
     */
    public static QosClass of(PodInfo pod) {
        final List<ContainerResources> containers = pod.getContainers();
        if (containers.isEmpty())
            return BestEffort;
        for (ContainerResources c : containers) {
            if (c.declaresNothing())
                return BestEffort;
        }
        for (ContainerResources c : containers) {
            if (differs(c, ContainerResources.CPU) || differs(c, ContainerResources.MEMORY))
                return Burstable;
        }
        for (ContainerResources c : containers) {
            if (c.getRequest(ContainerResources.CPU).signum() == 0 || c.getRequest(ContainerResources.MEMORY).signum() == 0)
                return BestEffort;
        }
        return Guaranteed;
    }

    private static boolean differs(ContainerResources c, String resource) {
        final BigDecimal request = c.getRequest(resource);
        final BigDecimal limit = c.getLimit(resource);
        return request.compareTo(limit) != 0;
    }
}
