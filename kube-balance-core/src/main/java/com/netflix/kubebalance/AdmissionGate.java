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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies {@link AdmissionCheck}s to an eviction candidate in order, stopping at the first rejection.
 */
public class AdmissionGate {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionGate.class);

    private final List<AdmissionCheck> checks;

    public AdmissionGate(List<AdmissionCheck> checks) {
        this.checks = Collections.unmodifiableList(new ArrayList<>(checks));
    }

    public List<AdmissionCheck> getChecks() {
        return checks;
    }

    public AdmissionCheck.Result evaluate(EvictionCandidate candidate, Instant now) {
        for (AdmissionCheck check : checks) {
            final AdmissionCheck.Result result = check.evaluate(candidate, now);
            if (!result.isAdmitted()) {
                logger.debug("{}: rejected by {}: {}", candidate.getPod().getId(), check.getName(), result.getMessage());
                return result;
            }
        }
        return AdmissionCheck.Result.admitted();
    }
}
