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

import java.time.Instant;

/**
 * A check that decides whether an eviction candidate may be evicted right now. Checks are combined by
 * {@link AdmissionGate}. A rejection is an expected policy outcome, not an error.
 */
public interface AdmissionCheck {

    /**
     * Why a candidate was rejected.
     */
    enum Reason {
        /**
         * The candidate's owner had another pod evicted recently.
         */
        OwnerCooldown,
        /**
         * Evicting the candidate would exceed a disruption budget, or budgets could not be checked.
         */
        DisruptionBudget,
        Other
    }

    /**
     * The result of an admission check: either the candidate is admitted, or it is rejected for a reason.
     */
    class Result {
        private static final Result ADMITTED = new Result(true, null, "");

        private final boolean admitted;
        private final Reason reason;
        private final String message;

        private Result(boolean admitted, Reason reason, String message) {
            this.admitted = admitted;
            this.reason = reason;
            this.message = message;
        }

        public static Result admitted() {
            return ADMITTED;
        }

        public static Result rejected(Reason reason, String message) {
            return new Result(false, reason, message);
        }

        public boolean isAdmitted() {
            return admitted;
        }

        /**
         * @return the rejection reason, or {@code null} if admitted
         */
        public Reason getReason() {
            return reason;
        }

        /**
         * @return a description of why the candidate was rejected, or an empty string if admitted
         */
        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return admitted ? "Admitted" : "Rejected{" + reason + ": " + message + '}';
        }
    }

    /**
     * Returns the name of the check.
     *
     * @return the name of the check
     */
    default String getName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Decide whether the candidate may be evicted.
     *
     * @param candidate the eviction candidate
     * @param now the time of the decision
     * @return the admission result
     */
    Result evaluate(EvictionCandidate candidate, Instant now);
}
