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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A snapshot of a pod: identity, the node it is assigned to, its phase, labels, per container resources and owner
 * references. Pods are never modified, only selected for eviction.
 */
public class PodInfo {

    private final String namespace;
    private final String name;
    private final String nodeName;
    private final PodPhase phase;
    private final Map<String, String> labels;
    private final List<ContainerResources> containers;
    private final List<OwnerReference> ownerReferences;

    private PodInfo(Builder builder) {
        this.namespace = builder.namespace;
        this.name = builder.name;
        this.nodeName = builder.nodeName;
        this.phase = builder.phase;
        this.labels = Collections.unmodifiableMap(new HashMap<>(builder.labels));
        this.containers = Collections.unmodifiableList(new ArrayList<>(builder.containers));
        this.ownerReferences = Collections.unmodifiableList(new ArrayList<>(builder.ownerReferences));
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    /**
     * @return namespace and name joined by '/'
     */
    public String getId() {
        return namespace + "/" + name;
    }

    public String getNodeName() {
        return nodeName;
    }

    public PodPhase getPhase() {
        return phase;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public List<ContainerResources> getContainers() {
        return containers;
    }

    public List<OwnerReference> getOwnerReferences() {
        return ownerReferences;
    }

    /**
     * Get the owner reference marked as controller, if any.
     *
     * @return the controller reference, or empty if the pod has none
     */
    public Optional<OwnerReference> getControllerReference() {
        for (OwnerReference ref : ownerReferences) {
            if (ref.isController())
                return Optional.of(ref);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "PodInfo{" + getId() + ", node=" + nodeName + ", phase=" + phase + '}';
    }

    public static Builder newBuilder(String namespace, String name) {
        return new Builder(namespace, name);
    }

    public final static class Builder {
        private final String namespace;
        private final String name;
        private String nodeName;
        private PodPhase phase = PodPhase.Running;
        private final Map<String, String> labels = new HashMap<>();
        private final List<ContainerResources> containers = new ArrayList<>();
        private final List<OwnerReference> ownerReferences = new ArrayList<>();

        private Builder(String namespace, String name) {
            this.namespace = namespace;
            this.name = name;
        }

        public Builder withNodeName(String nodeName) {
            this.nodeName = nodeName;
            return this;
        }

        public Builder withPhase(PodPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder withLabel(String key, String value) {
            labels.put(key, value);
            return this;
        }

        public Builder withLabels(Map<String, String> labels) {
            if (labels != null)
                this.labels.putAll(labels);
            return this;
        }

        public Builder withContainer(ContainerResources container) {
            containers.add(container);
            return this;
        }

        public Builder withOwnerReference(OwnerReference ownerReference) {
            ownerReferences.add(ownerReference);
            return this;
        }

        public PodInfo build() {
            if (namespace == null || name == null)
                throw new NullPointerException("Pod namespace and name must be set");
            if (phase == null)
                phase = PodPhase.Unknown;
            return new PodInfo(this);
        }
    }
}
