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

import java.util.Map;

/**
 * A snapshot of a pod disruption budget: the pods it covers, selected by label, and how many of them may be
 * disrupted right now. Budgets are only read.
 */
public class DisruptionBudget {

    private final String namespace;
    private final String name;
    private final LabelSelector selector;
    private final int disruptionsAllowed;

    /**
     * @param namespace the budget's namespace
     * @param name the budget's name
     * @param selector the pod selector, or {@code null} if the budget has none, in which case it selects no pod
     * @param disruptionsAllowed the number of disruptions currently allowed
     */
    public DisruptionBudget(String namespace, String name, LabelSelector selector, int disruptionsAllowed) {
        this.namespace = namespace;
        this.name = name;
        this.selector = selector;
        this.disruptionsAllowed = disruptionsAllowed;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public LabelSelector getSelector() {
        return selector;
    }

    public int getDisruptionsAllowed() {
        return disruptionsAllowed;
    }

    /**
     * Test whether this budget covers a pod with the given labels.
     *
     * @param labels the pod labels
     * @return {@code true} if the selector matches
     * @throws InvalidSelectorException if the selector is malformed
     */
    public boolean selects(Map<String, String> labels) throws InvalidSelectorException {
        return selector != null && selector.matches(labels);
    }

    @Override
    public String toString() {
        return "DisruptionBudget{" + namespace + "/" + name + ", disruptionsAllowed=" + disruptionsAllowed + '}';
    }
}
