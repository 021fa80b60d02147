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

import org.junit.Assert;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class EvictionCooldownsTest {

    private static final String KEY = RebalancerConfig.DEFAULT_COOLDOWN_ANNOTATION;

    private final ClusterState clusterState = mock(ClusterState.class);
    private final EvictionCooldowns cooldowns = new EvictionCooldowns(clusterState, KEY, Duration.ofMinutes(4));

    private static WorkloadOwner owner(String deadline) {
        return new WorkloadOwner(OwnerKind.Deployment, "default", "web",
                deadline == null ? null : Collections.singletonMap(KEY, deadline));
    }

    @Test
    public void testDeadlineOf() {
        Assert.assertFalse(cooldowns.deadlineOf(owner(null)).isPresent());
        Assert.assertEquals(Instant.parse("2026-01-01T00:04:00Z"),
                cooldowns.deadlineOf(owner("2026-01-01T00:04:00Z")).get());
        Assert.assertEquals(Instant.parse("2026-01-01T00:04:00Z"),
                cooldowns.deadlineOf(owner("2026-01-01T01:04:00+01:00")).get());
    }

    @Test
    public void testMalformedDeadlineIgnored() {
        Assert.assertFalse(cooldowns.deadlineOf(owner("tomorrow")).isPresent());
    }

    @Test
    public void testNextDeadline() {
        final Instant now = Instant.parse("2026-01-01T00:00:00.750Z");
        Assert.assertEquals(Instant.parse("2026-01-01T00:04:00Z"), cooldowns.nextDeadline(owner(null), now));
    }

    @Test
    public void testNextDeadlineAlwaysLater() {
        final Instant now = Instant.parse("2026-01-01T00:00:00Z");
        Assert.assertEquals(Instant.parse("2026-01-01T00:10:01Z"),
                cooldowns.nextDeadline(owner("2026-01-01T00:10:00Z"), now));
        Assert.assertEquals(Instant.parse("2026-01-01T00:04:01Z"),
                cooldowns.nextDeadline(owner("2026-01-01T00:04:00Z"), now));
    }

    @Test
    public void testStartPatchesAnnotation() throws Exception {
        final WorkloadOwner owner = owner(null);
        final Instant deadline = cooldowns.start(owner, Instant.parse("2026-01-01T00:00:00Z"));
        Assert.assertEquals(Instant.parse("2026-01-01T00:04:00Z"), deadline);
        verify(clusterState).patchOwnerAnnotation(owner, KEY, "2026-01-01T00:04:00Z");
    }

    @Test(expected = ClusterAccessException.class)
    public void testStartPropagatesPatchFailure() throws Exception {
        final WorkloadOwner owner = owner(null);
        doThrow(new ClusterAccessException("forbidden")).when(clusterState)
                .patchOwnerAnnotation(owner, KEY, "2026-01-01T00:04:00Z");
        cooldowns.start(owner, Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    public void testFormatAndParse() {
        Assert.assertEquals("2026-03-04T05:06:07Z", EvictionCooldowns.format(Instant.parse("2026-03-04T05:06:07.891Z")));
        Assert.assertEquals(Instant.parse("2026-03-04T05:06:07Z"), EvictionCooldowns.parse("2026-03-04T05:06:07Z"));
    }
}
