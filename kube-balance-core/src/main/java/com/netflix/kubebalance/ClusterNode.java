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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A snapshot of a cluster node, as listed at the start of a rebalancing cycle. A node is degraded when it carries
 * the marker annotation named by {@link RebalancerConfig#getDegradedNodeAnnotation()}; the annotation value is not
 * interpreted.
 */
public class ClusterNode {

    private final String name;
    private final Map<String, String> annotations;

    public ClusterNode(String name, Map<String, String> annotations) {
        if (name == null)
            throw new NullPointerException("Node name must be set");
        this.name = name;
        this.annotations = annotations == null ?
                Collections.emptyMap() :
                Collections.unmodifiableMap(new HashMap<>(annotations));
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public boolean hasAnnotation(String key) {
        return annotations.containsKey(key);
    }

    @Override
    public String toString() {
        return "ClusterNode{name=" + name + ", annotations=" + annotations + '}';
    }
}
