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
 * A snapshot of the workload object that controls a pod. Its annotations carry the eviction cooldown deadline.
 */
public class WorkloadOwner {

    private final OwnerKind kind;
    private final String namespace;
    private final String name;
    private final Map<String, String> annotations;
    private final List<OwnerReference> ownerReferences;

    public WorkloadOwner(OwnerKind kind, String namespace, String name,
                         Map<String, String> annotations, List<OwnerReference> ownerReferences) {
        if (kind == null || name == null)
            throw new NullPointerException("Owner kind and name must be set");
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
        this.annotations = annotations == null ?
                Collections.emptyMap() :
                Collections.unmodifiableMap(new HashMap<>(annotations));
        this.ownerReferences = ownerReferences == null ?
                Collections.emptyList() :
                Collections.unmodifiableList(new ArrayList<>(ownerReferences));
    }

    public WorkloadOwner(OwnerKind kind, String namespace, String name, Map<String, String> annotations) {
        this(kind, namespace, name, annotations, null);
    }

    public OwnerKind getKind() {
        return kind;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public Optional<String> getAnnotation(String key) {
        return Optional.ofNullable(annotations.get(key));
    }

    public List<OwnerReference> getOwnerReferences() {
        return ownerReferences;
    }

    Optional<OwnerReference> getControllerReference() {
        for (OwnerReference ref : ownerReferences) {
            if (ref.isController())
                return Optional.of(ref);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return kind + "/" + namespace + "/" + name;
    }
}
