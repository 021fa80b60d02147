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
import com.netflix.kubebalance.EvictionCandidate;
import com.netflix.kubebalance.EvictionCooldowns;
import com.netflix.kubebalance.WorkloadOwner;

import java.time.Instant;
import java.util.Optional;

/**
 * Rejects candidates whose owner is still in an eviction cooldown, that is, whose cooldown deadline lies after the
 * time of the check. Candidates without a known owner are admitted.
 */
public class CooldownAdmissionCheck implements AdmissionCheck {

    private final EvictionCooldowns cooldowns;

    public CooldownAdmissionCheck(EvictionCooldowns cooldowns) {
        this.cooldowns = cooldowns;
    }

    @Override
    public Result evaluate(EvictionCandidate candidate, Instant now) {
        final Optional<WorkloadOwner> owner = candidate.getOwner();
        if (!owner.isPresent())
            return Result.admitted();
        final Optional<Instant> until = cooldowns.deadlineOf(owner.get());
        if (until.isPresent() && now.isBefore(until.get())) {
            return Result.rejected(Reason.OwnerCooldown,
                    "Pod " + candidate.getPod().getName() + " skipped due to owner " + owner.get().getName() +
                            " being in cooldown until " + EvictionCooldowns.format(until.get()));
        }
        return Result.admitted();
    }
}
