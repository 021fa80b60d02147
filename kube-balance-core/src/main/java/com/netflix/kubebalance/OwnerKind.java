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

import java.util.Optional;

/**
 * Kinds of workload objects recognized as pod owners. A {@link #ReplicaSet} is also the intermediate kind created
 * by a {@link #Deployment}, see {@link OwnerResolver}.
 */
public enum OwnerKind {
    Deployment("apps/v1"),
    StatefulSet("apps/v1"),
    ReplicaSet("apps/v1");

    private final String apiVersion;

    OwnerKind(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    /**
     * Get the owner kind for the given kind name as it appears in owner references.
     *
     * @param kind the kind name, e.g. "StatefulSet"
     * @return the owner kind, or empty if the kind is not one that is recognized
     */
    public static Optional<OwnerKind> fromKind(String kind) {
        if (kind != null) {
            for (OwnerKind k : values()) {
                if (k.name().equals(kind))
                    return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
