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

import com.netflix.kubebalance.plugins.CooldownAdmissionCheck;
import com.netflix.kubebalance.plugins.DisruptionBudgetAdmissionCheck;
import com.netflix.kubebalance.profiles.WorkloadProfile;
import com.netflix.kubebalance.profiles.WorkloadProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Moves pods off degraded nodes, one rebalancing cycle at a time. Each call to {@link #reconcile()}:
 * <UL>
 *     <LI>
 *         does nothing when there are no workload profiles or no node carries the degraded marker;
 *     </LI>
 *     <LI>
 *         otherwise takes the running and pending pods of each degraded node, in node name order, and ranks them
 *         with {@link EvictionOrder};
 *     </LI>
 *     <LI>
 *         walks the ranked pods, skipping those rejected by the {@link AdmissionGate} (owner cooldown, disruption
 *         budgets, and any additional checks), and evicts the first admitted one;
 *     </LI>
 *     <LI>
 *         after a successful eviction, starts a cooldown on the pod's owner. In the default
 *         {@link EvictionScope#SinglePerCycle} scope the cycle ends there, in {@link EvictionScope#PerNode} scope it
 *         continues until the node reaches its per cycle maximum.
 *     </LI>
 * </UL>
 * A rate limited eviction ends the cycle at once. Any other eviction failure moves on to the next ranked pod.
 * Failing to list nodes or pods aborts the cycle, other cluster access failures only skip the affected step.
 * <P>
 * Cycles must not run concurrently; {@link RebalanceService} runs them one at a time. Interrupting the thread running
 * a cycle ends it at the next step, keeping the evictions already made.
 */
public class PodRebalancer {

    private static final Logger logger = LoggerFactory.getLogger(PodRebalancer.class);

    private final RebalancerConfig config;
    private final ClusterState clusterState;
    private final WorkloadProfileStore profileStore;
    private final EvictionOrder evictionOrder;
    private final OwnerResolver ownerResolver;
    private final AdmissionGate admissionGate;
    private final EvictionExecutor evictionExecutor;
    private final EvictionCooldowns cooldowns;
    private final RebalanceEventListener eventListener;
    private final Clock clock;

    private PodRebalancer(Builder builder) {
        config = builder.config;
        clusterState = builder.clusterState;
        profileStore = builder.profileStore;
        clock = builder.clock;
        evictionOrder = new EvictionOrder(config.getWorkloadTypeLabel());
        ownerResolver = new OwnerResolver(clusterState);
        cooldowns = new EvictionCooldowns(clusterState, config.getCooldownAnnotation(), config.getCooldown());
        List<AdmissionCheck> checks = new ArrayList<>();
        checks.add(new CooldownAdmissionCheck(cooldowns));
        checks.add(new DisruptionBudgetAdmissionCheck(clusterState));
        checks.addAll(builder.admissionChecks);
        admissionGate = new AdmissionGate(checks);
        evictionExecutor = new EvictionExecutor(builder.evictionApi, config.getEvictionGracePeriod());
        eventListener = CompositeRebalanceEventListener.of(builder.eventListeners);
    }

    public RebalancerConfig getConfig() {
        return config;
    }

    AdmissionGate getAdmissionGate() {
        return admissionGate;
    }

    /**
     * Run one rebalancing cycle.
     *
     * @return the cycle result, telling when to run the next cycle
     */
    public RebalanceResult reconcile() {
        final long start = System.currentTimeMillis();
        eventListener.onRebalanceStart();
        final RebalanceResult result = new RebalanceResult(config.getRecheckInterval());
        try {
            rebalance(result);
        } finally {
            result.setRuntime(System.currentTimeMillis() - start);
            eventListener.onRebalanceFinish(result);
        }
        return result;
    }

    private void rebalance(RebalanceResult result) {
        final Map<String, WorkloadProfile> profiles = profileStore.getAll();
        if (profiles.isEmpty()) {
            logger.info("No workload profiles found, skipping rebalancing");
            return;
        }
        final List<ClusterNode> degradedNodes;
        try {
            degradedNodes = findDegradedNodes(clusterState.listNodes());
        } catch (ClusterAccessException e) {
            logger.error("Failed to list nodes", e);
            result.addException(e);
            return;
        }
        if (degradedNodes.isEmpty()) {
            logger.debug("No degraded nodes found, skipping rebalancing");
            return;
        }
        if (isCancelled(result))
            return;
        final Map<String, List<PodInfo>> podsByNode;
        try {
            podsByNode = groupEvictablePods(clusterState.listPods(), degradedNodes);
        } catch (ClusterAccessException e) {
            logger.error("Failed to list pods", e);
            result.addException(e);
            return;
        }
        for (ClusterNode node : degradedNodes) {
            final List<PodInfo> pods = podsByNode.getOrDefault(node.getName(), Collections.emptyList());
            if (pods.isEmpty()) {
                logger.debug("No running pods found on degraded node {}", node.getName());
                continue;
            }
            logger.info("Processing degraded node {} with {} pods", node.getName(), pods.size());
            if (!rebalanceNode(node, evictionOrder.rank(pods, profiles), profiles, result))
                return;
        }
    }

    private List<ClusterNode> findDegradedNodes(List<ClusterNode> nodes) {
        final List<ClusterNode> degraded = nodes.stream()
                .filter(n -> n.hasAnnotation(config.getDegradedNodeAnnotation()))
                .sorted(Comparator.comparing(ClusterNode::getName))
                .collect(Collectors.toList());
        for (ClusterNode node : degraded) {
            logger.debug("Identified degraded node {}", node.getName());
            eventListener.onNodeDegraded(node);
        }
        return degraded;
    }

    private Map<String, List<PodInfo>> groupEvictablePods(List<PodInfo> pods, List<ClusterNode> degradedNodes) {
        final Set<String> nodeNames = degradedNodes.stream().map(ClusterNode::getName).collect(Collectors.toSet());
        final Map<String, List<PodInfo>> result = new HashMap<>();
        for (PodInfo pod : pods) {
            if (pod.getNodeName() != null && nodeNames.contains(pod.getNodeName()) && pod.getPhase().isEvictable())
                result.computeIfAbsent(pod.getNodeName(), n -> new ArrayList<>()).add(pod);
        }
        return result;
    }

    // returns false when the cycle must not go on to the next node
    private boolean rebalanceNode(ClusterNode node, List<PodInfo> ranked, Map<String, WorkloadProfile> profiles,
                                  RebalanceResult result) {
        int evicted = 0;
        for (PodInfo pod : ranked) {
            if (evicted >= config.getMaxEvictionsPerNodePerCycle()) {
                logger.debug("Reached max evictions ({}) for node {} in the current cycle",
                        config.getMaxEvictionsPerNodePerCycle(), node.getName());
                break;
            }
            if (isCancelled(result))
                return false;
            final WorkloadProfile profile = evictionOrder.profileOf(pod, profiles);
            if (profile == null && !config.isEvictUnprofiledPods()) {
                logger.debug("Pod {} has no workload profile, skipping eviction consideration", pod.getId());
                continue;
            }
            final EvictionCandidate candidate = new EvictionCandidate(pod, profile, resolveOwner(pod));
            final AdmissionCheck.Result admission = admissionGate.evaluate(candidate, clock.instant());
            if (!admission.isAdmitted()) {
                eventListener.onCandidateSkipped(candidate, admission);
                continue;
            }
            if (isCancelled(result))
                return false;
            logger.info("Evicting pod {} from degraded node {}: qosClass={}, workloadType={}, evictionPriority={}",
                    pod.getId(), node.getName(), candidate.getQosClass(),
                    profile == null ? null : profile.getName(), profile == null ? null : profile.getEvictionPriority());
            final EvictionOutcome outcome = evictionExecutor.evict(pod);
            switch (outcome.getStatus()) {
                case Evicted:
                    evicted++;
                    result.addEvictedPod(pod);
                    result.setRecheckAfter(config.getPostEvictionRecheckDelay());
                    eventListener.onPodEvicted(pod, node);
                    if (candidate.getOwner().isPresent())
                        startCooldown(candidate.getOwner().get());
                    if (config.getEvictionScope() == EvictionScope.SinglePerCycle)
                        return false;
                    break;
                case RateLimited:
                    logger.info("Too many eviction requests, backing off for {}", config.getRateLimitedRecheckDelay());
                    result.setRateLimited(true);
                    result.setRecheckAfter(config.getRateLimitedRecheckDelay());
                    eventListener.onEvictionRateLimited(pod, outcome.getCause());
                    return false;
                default:
                    eventListener.onEvictionFailed(pod, outcome.getCause());
                    break;
            }
        }
        return true;
    }

    private WorkloadOwner resolveOwner(PodInfo pod) {
        try {
            return ownerResolver.resolve(pod).orElse(null);
        } catch (OwnerLookupException e) {
            logger.warn("Failed to get owner of pod {}, skipping cooldown check: {}", pod.getId(), e.getMessage());
            return null;
        }
    }

    private void startCooldown(WorkloadOwner owner) {
        try {
            final Instant until = cooldowns.start(owner, clock.instant());
            logger.debug("Added eviction cooldown to {} until {}", owner, EvictionCooldowns.format(until));
            eventListener.onCooldownSet(owner, until);
        } catch (ClusterAccessException e) {
            logger.error("Failed to add eviction cooldown annotation to " + owner, e);
            eventListener.onCooldownFailed(owner, e);
        }
    }

    private boolean isCancelled(RebalanceResult result) {
        if (Thread.currentThread().isInterrupted()) {
            logger.info("Rebalancing cycle interrupted after {} evictions", result.getEvictedPods().size());
            result.setCancelled(true);
            return true;
        }
        return false;
    }

    public final static class Builder {

        private RebalancerConfig config = RebalancerConfig.defaults();
        private ClusterState clusterState = null;
        private EvictionApi evictionApi = null;
        private WorkloadProfileStore profileStore = null;
        private final List<AdmissionCheck> admissionChecks = new ArrayList<>();
        private final List<RebalanceEventListener> eventListeners = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        public Builder withConfig(RebalancerConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Use the given cluster state to list nodes, pods and disruption budgets, and to read and patch owners.
         * Must be provided before this builder can create the rebalancer.
         *
         * @param clusterState the cluster state
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link PodRebalancer}
         */
        public Builder withClusterState(ClusterState clusterState) {
            this.clusterState = clusterState;
            return this;
        }

        /**
         * Use the given eviction API to evict pods. Must be provided before this builder can create the rebalancer.
         *
         * @param evictionApi the eviction API
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link PodRebalancer}
         */
        public Builder withEvictionApi(EvictionApi evictionApi) {
            this.evictionApi = evictionApi;
            return this;
        }

        /**
         * Read workload profiles from the given store. Must be provided before this builder can create the
         * rebalancer.
         *
         * @param profileStore the profile store
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link PodRebalancer}
         */
        public Builder withProfileStore(WorkloadProfileStore profileStore) {
            this.profileStore = profileStore;
            return this;
        }

        /**
         * Add an admission check, applied after the built-in cooldown and disruption budget checks.
         *
         * @param check the admission check
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link PodRebalancer}
         */
        public Builder withAdmissionCheck(AdmissionCheck check) {
            admissionChecks.add(check);
            return this;
        }

        public Builder withRebalanceEventListener(RebalanceEventListener listener) {
            eventListeners.add(listener);
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PodRebalancer build() {
            if (config == null)
                throw new NullPointerException("Null config not allowed");
            if (clusterState == null)
                throw new NullPointerException("Null cluster state not allowed");
            if (evictionApi == null)
                throw new NullPointerException("Null eviction API not allowed");
            if (profileStore == null)
                throw new NullPointerException("Null profile store not allowed");
            if (clock == null)
                throw new NullPointerException("Null clock not allowed");
            return new PodRebalancer(this);
        }
    }
}
