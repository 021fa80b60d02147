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

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Reads and writes eviction cooldown deadlines. A deadline is kept as an RFC 3339 timestamp in an annotation on
 * the workload owner, so it survives restarts and is seen by every replica. Until the deadline passes, no other pod
 * of that owner is evicted.
 * <p>
 * The annotation is read and then patched without a precondition, so two concurrent writers race and the last one
 * wins. Either value suppresses evictions for about the same window.
 */
public class EvictionCooldowns {

    private static final Logger logger = LoggerFactory.getLogger(EvictionCooldowns.class);

    private final ClusterState clusterState;
    private final String annotationKey;
    private final Duration cooldown;

    public EvictionCooldowns(ClusterState clusterState, String annotationKey, Duration cooldown) {
        this.clusterState = clusterState;
        this.annotationKey = annotationKey;
        this.cooldown = cooldown;
    }

    public String getAnnotationKey() {
        return annotationKey;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    /**
     * Get the cooldown deadline of an owner. A deadline that can't be parsed is logged and treated as absent.
     *
     * @param owner the workload owner
     * @return the deadline, or empty if the owner has none
     */
    public Optional<Instant> deadlineOf(WorkloadOwner owner) {
        final Optional<String> value = owner.getAnnotation(annotationKey);
        if (!value.isPresent())
            return Optional.empty();
        try {
            return Optional.of(parse(value.get()));
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring malformed cooldown annotation on {}: {}", owner, value.get());
            return Optional.empty();
        }
    }

    /**
     * Compute the deadline to set after evicting a pod of the owner. It is the cooldown after {@code now},
     * and always strictly later than the owner's current deadline.
     *
     * @param owner the workload owner
     * @param now the time of the eviction
     * @return the new deadline, at second precision
     */
    Instant nextDeadline(WorkloadOwner owner, Instant now) {
        Instant next = now.plus(cooldown).truncatedTo(ChronoUnit.SECONDS);
        final Optional<Instant> current = deadlineOf(owner);
        if (current.isPresent() && !next.isAfter(current.get()))
            next = current.get().truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        return next;
    }

    /**
     * Start a cooldown for the owner by patching its deadline annotation.
     *
     * @param owner the workload owner
     * @param now the time of the eviction
     * @return the deadline that was set
     * @throws ClusterAccessException if the owner could not be patched
     */
    public Instant start(WorkloadOwner owner, Instant now) throws ClusterAccessException {
        final Instant deadline = nextDeadline(owner, now);
        clusterState.patchOwnerAnnotation(owner, annotationKey, format(deadline));
        return deadline;
    }

    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    public static Instant parse(String value) throws DateTimeParseException {
        return OffsetDateTime.parse(value).toInstant();
    }
}
