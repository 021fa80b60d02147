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
 * A reference from an object to one of its owners. At most one reference of an object is the controller.
 */
public class OwnerReference {

    private final String kind;
    private final String name;
    private final boolean controller;

    public OwnerReference(String kind, String name, boolean controller) {
        this.kind = kind;
        this.name = name;
        this.controller = controller;
    }

    public static OwnerReference controller(String kind, String name) {
        return new OwnerReference(kind, name, true);
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public boolean isController() {
        return controller;
    }

    @Override
    public String toString() {
        return kind + "/" + name + (controller ? "(controller)" : "");
    }
}
