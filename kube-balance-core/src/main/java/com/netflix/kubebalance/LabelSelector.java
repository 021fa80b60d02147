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

/**
 * A label selector made of exact label matches and set-based requirements, all of which must hold. A selector with
 * neither matches every label set.
 * <p>
 * Selectors are built from cluster data as-is. Validity is checked only when matching, so that a single malformed
 * selector can be reported and skipped by the caller.
 */
public class LabelSelector {

    public static class Requirement {
        private final String key;
        private final String operator;
        private final List<String> values;

        public Requirement(String key, String operator, List<String> values) {
            this.key = key;
            this.operator = operator;
            this.values = values == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values));
        }

        public String getKey() {
            return key;
        }

        public String getOperator() {
            return operator;
        }

        public List<String> getValues() {
            return values;
        }

        boolean matches(Map<String, String> labels) throws InvalidSelectorException {
            if (key == null || key.isEmpty())
                throw new InvalidSelectorException("Requirement with empty key");
            if (operator == null)
                throw new InvalidSelectorException("Requirement on " + key + " has no operator");
            switch (operator) {
                case "In":
                    requireValues();
                    return labels.containsKey(key) && values.contains(labels.get(key));
                case "NotIn":
                    requireValues();
                    return !labels.containsKey(key) || !values.contains(labels.get(key));
                case "Exists":
                    requireNoValues();
                    return labels.containsKey(key);
                case "DoesNotExist":
                    requireNoValues();
                    return !labels.containsKey(key);
                default:
                    throw new InvalidSelectorException("Requirement on " + key + " has unknown operator " + operator);
            }
        }

        private void requireValues() throws InvalidSelectorException {
            if (values.isEmpty())
                throw new InvalidSelectorException("Operator " + operator + " on " + key + " requires values");
        }

        private void requireNoValues() throws InvalidSelectorException {
            if (!values.isEmpty())
                throw new InvalidSelectorException("Operator " + operator + " on " + key + " takes no values");
        }

        @Override
        public String toString() {
            return key + " " + operator + " " + values;
        }
    }

    private final Map<String, String> matchLabels;
    private final List<Requirement> matchExpressions;

    public LabelSelector(Map<String, String> matchLabels, List<Requirement> matchExpressions) {
        this.matchLabels = matchLabels == null ?
                Collections.emptyMap() :
                Collections.unmodifiableMap(new HashMap<>(matchLabels));
        this.matchExpressions = matchExpressions == null ?
                Collections.emptyList() :
                Collections.unmodifiableList(new ArrayList<>(matchExpressions));
    }

    public static LabelSelector ofLabels(Map<String, String> matchLabels) {
        return new LabelSelector(matchLabels, null);
    }

    public Map<String, String> getMatchLabels() {
        return matchLabels;
    }

    public List<Requirement> getMatchExpressions() {
        return matchExpressions;
    }

    /**
     * Test whether the given labels satisfy this selector.
     *
     * @param labels the labels of the object being tested
     * @return {@code true} if every label match and every requirement holds
     * @throws InvalidSelectorException if this selector is malformed
     */
    public boolean matches(Map<String, String> labels) throws InvalidSelectorException {
        final Map<String, String> l = labels == null ? Collections.emptyMap() : labels;
        boolean matched = true;
        for (Map.Entry<String, String> entry : matchLabels.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty())
                throw new InvalidSelectorException("Label match with empty key");
            if (!l.containsKey(entry.getKey()) || !l.get(entry.getKey()).equals(entry.getValue()))
                matched = false;
        }
        // every requirement is validated even once the outcome is known
        for (Requirement r : matchExpressions) {
            if (!r.matches(l))
                matched = false;
        }
        return matched;
    }

    @Override
    public String toString() {
        return "LabelSelector{matchLabels=" + matchLabels + ", matchExpressions=" + matchExpressions + '}';
    }
}
