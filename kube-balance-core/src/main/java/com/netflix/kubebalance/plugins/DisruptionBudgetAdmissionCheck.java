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

package com.netflix.kubebalance.plugins;

import com.netflix.kubebalance.AdmissionCheck;
import com.netflix.kubebalance.ClusterAccessException;
import com.netflix.kubebalance.ClusterState;
import com.netflix.kubebalance.DisruptionBudget;
import com.netflix.kubebalance.EvictionCandidate;
import com.netflix.kubebalance.InvalidSelectorException;
import com.netflix.kubebalance.PodInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Rejects candidates covered by a disruption budget that allows no more disruptions. Budgets are listed fresh for
 * the candidate's namespace on every check. A budget with a malformed selector is logged and ignored. If budgets
 * can't be listed at all the candidate is rejected, since its safety can't be established.
 */
public class DisruptionBudgetAdmissionCheck implements AdmissionCheck {

    private static final Logger logger = LoggerFactory.getLogger(DisruptionBudgetAdmissionCheck.class);

    private final ClusterState clusterState;

    public DisruptionBudgetAdmissionCheck(ClusterState clusterState) {
        this.clusterState = clusterState;
    }

    @Override
    public Result evaluate(EvictionCandidate candidate, Instant now) {
        final PodInfo pod = candidate.getPod();
        final List<DisruptionBudget> budgets;
        try {
            budgets = clusterState.listDisruptionBudgets(pod.getNamespace());
        } catch (ClusterAccessException e) {
            logger.warn("Failed to list disruption budgets in namespace " + pod.getNamespace() + ": " + e.getMessage(), e);
            return Result.rejected(Reason.DisruptionBudget,
                    "Failed to list disruption budgets in namespace " + pod.getNamespace() + ": " + e.getMessage());
        }
        for (DisruptionBudget budget : budgets) {
            try {
                if (budget.selects(pod.getLabels()) && budget.getDisruptionsAllowed() <= 0) {
                    return Result.rejected(Reason.DisruptionBudget,
                            "Eviction would violate disruption budget " + budget.getName() +
                                    " (disruptionsAllowed: " + budget.getDisruptionsAllowed() + ")");
                }
            } catch (InvalidSelectorException e) {
                logger.error("Invalid selector on disruption budget {}/{}, ignoring it: {}",
                        budget.getNamespace(), budget.getName(), e.getMessage());
            }
        }
        return Result.admitted();
    }
}
