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

import com.netflix.kubebalance.profiles.WorkloadProfile;
import com.netflix.kubebalance.profiles.WorkloadProfileStore;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.netflix.kubebalance.PodProvider.NAMESPACE;
import static com.netflix.kubebalance.PodProvider.bestEffort;
import static com.netflix.kubebalance.PodProvider.degradedNode;
import static com.netflix.kubebalance.PodProvider.guaranteedPod;
import static com.netflix.kubebalance.PodProvider.healthyNode;
import static com.netflix.kubebalance.PodProvider.ownedPod;
import static com.netflix.kubebalance.PodProvider.pod;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class PodRebalancerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final String COOLDOWN = RebalancerConfig.DEFAULT_COOLDOWN_ANNOTATION;

    private FakeClusterState cluster;
    private FakeEvictionApi evictionApi;
    private WorkloadProfileStore store;
    private RebalanceEventListener listener;

    @Before
    public void setUp() {
        cluster = new FakeClusterState();
        evictionApi = new FakeEvictionApi();
        store = new WorkloadProfileStore();
        store.upsert(new WorkloadProfile("batch", 5));
        store.upsert(new WorkloadProfile("web", 1));
        listener = mock(RebalanceEventListener.class);
    }

    private PodRebalancer getRebalancer(RebalancerConfig config) {
        return new PodRebalancer.Builder()
                .withConfig(config)
                .withClusterState(cluster)
                .withEvictionApi(evictionApi)
                .withProfileStore(store)
                .withRebalanceEventListener(listener)
                .withClock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private PodRebalancer getRebalancer() {
        return getRebalancer(RebalancerConfig.defaults());
    }

    private void setupTwoOwnedPods() {
        cluster.withNode(degradedNode("n1"))
                .withPod(ownedPod("a-1", "n1", "batch", OwnerKind.Deployment, "a"))
                .withPod(ownedPod("b-1", "n1", "web", OwnerKind.Deployment, "b"))
                .withOwner(new WorkloadOwner(OwnerKind.Deployment, NAMESPACE, "a", null))
                .withOwner(new WorkloadOwner(OwnerKind.Deployment, NAMESPACE, "b", null));
    }

    @Test
    public void testHigherPriorityEvictedFirst() {
        setupTwoOwnedPods();
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("a-1"));
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofSeconds(5))));
        assertThat(result.getEvictedPods().size(), is(1));
        Assert.assertFalse(result.isRateLimited());
        assertThat(cluster.owner(OwnerKind.Deployment, NAMESPACE, "a").getAnnotation(COOLDOWN).orElse(null),
                is(equalTo("2026-01-01T00:04:00Z")));
        Assert.assertFalse(cluster.owner(OwnerKind.Deployment, NAMESPACE, "b").getAnnotation(COOLDOWN).isPresent());
        assertThat(evictionApi.lastGracePeriod, is(equalTo(Duration.ofSeconds(30))));
        verify(listener).onRebalanceStart();
        verify(listener).onPodEvicted(argThat(p -> p.getName().equals("a-1")), argThat(n -> n.getName().equals("n1")));
        verify(listener).onCooldownSet(any(WorkloadOwner.class), eq(Instant.parse("2026-01-01T00:04:00Z")));
        verify(listener).onRebalanceFinish(result);
    }

    @Test
    public void testOwnerInCooldownSkipped() {
        setupTwoOwnedPods();
        cluster.withOwner(new WorkloadOwner(OwnerKind.Deployment, NAMESPACE, "a",
                Collections.singletonMap(COOLDOWN, "2026-01-01T00:01:00Z")));
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("b-1"));
        final ArgumentCaptor<AdmissionCheck.Result> captor = ArgumentCaptor.forClass(AdmissionCheck.Result.class);
        verify(listener).onCandidateSkipped(any(EvictionCandidate.class), captor.capture());
        assertThat(captor.getValue().getReason(), is(AdmissionCheck.Reason.OwnerCooldown));
        assertThat(captor.getValue().getMessage(),
                is(equalTo("Pod a-1 skipped due to owner a being in cooldown until 2026-01-01T00:01:00Z")));
    }

    @Test
    public void testExpiredCooldownDoesNotBlock() {
        setupTwoOwnedPods();
        cluster.withOwner(new WorkloadOwner(OwnerKind.Deployment, NAMESPACE, "a",
                Collections.singletonMap(COOLDOWN, "2025-12-31T23:59:00Z")));
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("a-1"));
    }

    @Test
    public void testDisruptionBudgetBlocks() {
        setupTwoOwnedPods();
        cluster.withBudget(new DisruptionBudget(NAMESPACE, "batch-pdb",
                LabelSelector.ofLabels(Collections.singletonMap(RebalancerConfig.DEFAULT_WORKLOAD_TYPE_LABEL, "batch")), 0));
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("b-1"));
        final ArgumentCaptor<AdmissionCheck.Result> captor = ArgumentCaptor.forClass(AdmissionCheck.Result.class);
        verify(listener).onCandidateSkipped(any(EvictionCandidate.class), captor.capture());
        assertThat(captor.getValue().getReason(), is(AdmissionCheck.Reason.DisruptionBudget));
    }

    @Test
    public void testBudgetWithAllowedDisruptionsDoesNotBlock() {
        setupTwoOwnedPods();
        cluster.withBudget(new DisruptionBudget(NAMESPACE, "batch-pdb",
                LabelSelector.ofLabels(Collections.singletonMap(RebalancerConfig.DEFAULT_WORKLOAD_TYPE_LABEL, "batch")), 1));
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("a-1"));
    }

    @Test
    public void testBudgetListingFailureRejectsCandidates() {
        setupTwoOwnedPods();
        cluster.failBudgetListing = true;
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(evictionApi.attempted, is(empty()));
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofMinutes(2))));
        verify(listener, times(2)).onCandidateSkipped(any(EvictionCandidate.class), any(AdmissionCheck.Result.class));
    }

    @Test
    public void testRateLimitStopsCycle() {
        setupTwoOwnedPods();
        evictionApi.failWith("a-1", EvictionException.TOO_MANY_REQUESTS);
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(evictionApi.attempted, contains("a-1"));
        assertThat(result.getEvictedPods(), is(empty()));
        Assert.assertTrue(result.isRateLimited());
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofSeconds(10))));
        assertThat(cluster.patches, is(empty()));
        verify(listener).onEvictionRateLimited(any(PodInfo.class), any(EvictionException.class));
    }

    @Test
    public void testFailedEvictionMovesToNextCandidate() {
        setupTwoOwnedPods();
        evictionApi.failWith("a-1", 500);
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(evictionApi.attempted, contains("a-1", "b-1"));
        assertThat(evictionApi.evicted, contains("b-1"));
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofSeconds(5))));
        verify(listener).onEvictionFailed(any(PodInfo.class), any(EvictionException.class));
    }

    @Test
    public void testNoDegradedNodeSkipsPodListing() {
        cluster.withNode(healthyNode("n1"))
                .withPod(guaranteedPod("a-1", "n1", "batch"));
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(cluster.podListings.get(), is(0));
        assertThat(cluster.budgetListings.get(), is(0));
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofMinutes(2))));
        assertThat(evictionApi.attempted, is(empty()));
    }

    @Test
    public void testNoProfilesSkipsCycle() {
        setupTwoOwnedPods();
        store.remove("batch");
        store.remove("web");
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(cluster.podListings.get(), is(0));
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofMinutes(2))));
        verify(listener, never()).onNodeDegraded(any(ClusterNode.class));
    }

    @Test
    public void testNodeListingFailureAbortsCycle() {
        setupTwoOwnedPods();
        cluster.failNodeListing = true;
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(result.getExceptions().size(), is(1));
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofMinutes(2))));
        assertThat(cluster.podListings.get(), is(0));
    }

    @Test
    public void testQosClassBeforePriority() {
        cluster.withNode(degradedNode("n1"))
                .withPod(guaranteedPod("batch-1", "n1", "batch"))
                .withPod(pod("web-1", "n1", "web", bestEffort("main")).build());
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("web-1"));
    }

    @Test
    public void testUnprofiledPodsSkippedByDefault() {
        cluster.withNode(degradedNode("n1"))
                .withPod(guaranteedPod("other-1", "n1", "other"))
                .withPod(guaranteedPod("plain-1", "n1", null));
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(evictionApi.attempted, is(empty()));
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofMinutes(2))));
    }

    @Test
    public void testUnprofiledPodsEvictedAfterProfiledOnes() {
        cluster.withNode(degradedNode("n1"))
                .withPod(guaranteedPod("other-1", "n1", "other"))
                .withPod(guaranteedPod("web-1", "n1", "web"));
        final RebalancerConfig config = new RebalancerConfig.Builder()
                .withEvictUnprofiledPods(true)
                .withEvictionScope(EvictionScope.PerNode)
                .withMaxEvictionsPerNodePerCycle(5)
                .build();
        getRebalancer(config).reconcile();

        assertThat(evictionApi.evicted, contains("web-1", "other-1"));
    }

    @Test
    public void testOnlyRunningAndPendingPodsConsidered() {
        cluster.withNode(degradedNode("n1"))
                .withPod(pod("done-1", "n1", "batch", PodProvider.guaranteed("main")).withPhase(PodPhase.Succeeded).build())
                .withPod(pod("failed-1", "n1", "batch", PodProvider.guaranteed("main")).withPhase(PodPhase.Failed).build())
                .withPod(pod("pending-1", "n1", "web", PodProvider.guaranteed("main")).withPhase(PodPhase.Pending).build());
        getRebalancer().reconcile();

        assertThat(evictionApi.attempted, contains("pending-1"));
    }

    @Test
    public void testPodsOnHealthyNodesIgnored() {
        cluster.withNode(degradedNode("n1"))
                .withNode(healthyNode("n2"))
                .withPod(guaranteedPod("batch-1", "n2", "batch"))
                .withPod(guaranteedPod("web-1", "n1", "web"));
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("web-1"));
    }

    @Test
    public void testSinglePerCycleEvictsOnceAcrossNodes() {
        cluster.withNode(degradedNode("n2"))
                .withNode(degradedNode("n1"))
                .withPod(guaranteedPod("web-2", "n2", "web"))
                .withPod(guaranteedPod("web-1", "n1", "web"));
        final RebalancerConfig config = new RebalancerConfig.Builder()
                .withMaxEvictionsPerNodePerCycle(3)
                .build();
        final RebalanceResult result = getRebalancer(config).reconcile();

        assertThat(evictionApi.evicted, contains("web-1"));
        assertThat(result.getEvictedPods().size(), is(1));
    }

    @Test
    public void testPerNodeScopeRespectsCap() {
        cluster.withNode(degradedNode("n1")).withNode(degradedNode("n2"));
        for (int i = 0; i < 3; i++) {
            cluster.withPod(guaranteedPod("n1-" + i, "n1", "web"));
            cluster.withPod(guaranteedPod("n2-" + i, "n2", "web"));
        }
        final RebalancerConfig config = new RebalancerConfig.Builder()
                .withEvictionScope(EvictionScope.PerNode)
                .withMaxEvictionsPerNodePerCycle(2)
                .build();
        final RebalanceResult result = getRebalancer(config).reconcile();

        assertThat(evictionApi.evicted, contains("n1-0", "n1-1", "n2-0", "n2-1"));
        assertThat(result.getRecheckAfter(), is(equalTo(Duration.ofSeconds(5))));
    }

    @Test
    public void testPerNodeScopeSkipsOwnerAfterFirstEviction() {
        cluster.withNode(degradedNode("n1"))
                .withPod(ownedPod("a-1", "n1", "batch", OwnerKind.Deployment, "a"))
                .withPod(ownedPod("a-2", "n1", "batch", OwnerKind.Deployment, "a"))
                .withPod(ownedPod("b-1", "n1", "web", OwnerKind.Deployment, "b"))
                .withOwner(new WorkloadOwner(OwnerKind.Deployment, NAMESPACE, "a", null))
                .withOwner(new WorkloadOwner(OwnerKind.Deployment, NAMESPACE, "b", null));
        final RebalancerConfig config = new RebalancerConfig.Builder()
                .withEvictionScope(EvictionScope.PerNode)
                .withMaxEvictionsPerNodePerCycle(3)
                .build();
        getRebalancer(config).reconcile();

        assertThat(evictionApi.evicted, contains("a-1", "b-1"));
    }

    @Test
    public void testReplicaSetPodCooldownOnDeployment() {
        cluster.withNode(degradedNode("n1"))
                .withPod(ownedPod("web-1", "n1", "web", OwnerKind.ReplicaSet, "web-5d8f"))
                .withOwner(new WorkloadOwner(OwnerKind.ReplicaSet, NAMESPACE, "web-5d8f", null,
                        Collections.singletonList(OwnerReference.controller("Deployment", "web"))))
                .withOwner(new WorkloadOwner(OwnerKind.Deployment, NAMESPACE, "web", null));
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("web-1"));
        Assert.assertTrue(cluster.owner(OwnerKind.Deployment, NAMESPACE, "web").getAnnotation(COOLDOWN).isPresent());
        Assert.assertFalse(cluster.owner(OwnerKind.ReplicaSet, NAMESPACE, "web-5d8f").getAnnotation(COOLDOWN).isPresent());
    }

    @Test
    public void testOwnerLookupFailureStillEvicts() {
        cluster.withNode(degradedNode("n1"))
                .withPod(ownedPod("a-1", "n1", "batch", OwnerKind.Deployment, "missing"));
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("a-1"));
        assertThat(cluster.patches, is(empty()));
    }

    @Test
    public void testCooldownPatchFailureKeepsEviction() {
        setupTwoOwnedPods();
        cluster.failPatches = true;
        final RebalanceResult result = getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("a-1"));
        assertThat(result.getEvictedPods().size(), is(1));
        verify(listener).onCooldownFailed(any(WorkloadOwner.class), any(ClusterAccessException.class));
    }

    @Test
    public void testInterruptedCycleIsCancelled() {
        setupTwoOwnedPods();
        Thread.currentThread().interrupt();
        final RebalanceResult result;
        try {
            result = getRebalancer().reconcile();
        } finally {
            Thread.interrupted();
        }
        Assert.assertTrue(result.isCancelled());
        assertThat(evictionApi.attempted, is(empty()));
    }

    @Test
    public void testInterruptDuringOwnerLookupStopsBeforeEviction() {
        setupTwoOwnedPods();
        cluster.interruptOnOwnerLookup = true;
        final RebalanceResult result;
        try {
            result = getRebalancer().reconcile();
        } finally {
            Thread.interrupted();
        }
        Assert.assertTrue(result.isCancelled());
        assertThat(evictionApi.attempted, is(empty()));
        assertThat(result.getEvictedPods(), is(empty()));
    }

    @Test
    public void testListenerFailureDoesNotBreakCycle() {
        setupTwoOwnedPods();
        doThrow(new IllegalStateException("listener broken")).when(listener).onNodeDegraded(any(ClusterNode.class));
        getRebalancer().reconcile();

        assertThat(evictionApi.evicted, contains("a-1"));
    }

    @Test
    public void testAdditionalAdmissionCheckApplied() {
        setupTwoOwnedPods();
        final PodRebalancer rebalancer = new PodRebalancer.Builder()
                .withClusterState(cluster)
                .withEvictionApi(evictionApi)
                .withProfileStore(store)
                .withClock(Clock.fixed(NOW, ZoneOffset.UTC))
                .withAdmissionCheck((candidate, now) -> candidate.getPod().getName().startsWith("a") ?
                        AdmissionCheck.Result.rejected(AdmissionCheck.Reason.Other, "not a") :
                        AdmissionCheck.Result.admitted())
                .build();
        rebalancer.reconcile();

        assertThat(evictionApi.evicted, contains("b-1"));
    }

    @Test
    public void testSuccessiveCyclesHonorCooldown() {
        setupTwoOwnedPods();
        cluster.withPod(ownedPod("a-2", "n1", "batch", OwnerKind.Deployment, "a"));
        final PodRebalancer rebalancer = getRebalancer();
        rebalancer.reconcile();
        rebalancer.reconcile();

        final List<String> expected = Arrays.asList("a-1", "b-1");
        assertThat(evictionApi.evicted, is(equalTo(expected)));
    }

    @Test(expected = NullPointerException.class)
    public void testBuilderRequiresClusterState() {
        new PodRebalancer.Builder()
                .withEvictionApi(evictionApi)
                .withProfileStore(store)
                .build();
    }
}
