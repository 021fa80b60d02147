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
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs the rebalancing cycles of a {@link PodRebalancer} on a single thread. Each cycle runs after the delay
 * returned by the previous one in {@link RebalanceResult#getRecheckAfter()}, so at most one cycle runs at a time.
 * Here's a typical use of this service:
 * <UL>
 *     <LI>
 *         Build a {@link PodRebalancer} using its builder, {@link PodRebalancer.Builder}.
 *     </LI>
 *     <LI>
 *         Build this service using its builder, {@link RebalanceService.Builder}, optionally with a callback to
 *         receive each cycle's {@link RebalanceResult}.
 *     </LI>
 *     <LI>
 *         Start the loop by calling {@link #start()}. The first cycle runs at once.
 *     </LI>
 *     <LI>
 *         Call {@link #trigger()} to bring the next cycle forward, for example after workload profiles changed.
 *     </LI>
 * </UL>
 */
public class RebalanceService {

    private static final Logger logger = LoggerFactory.getLogger(RebalanceService.class);

    private final PodRebalancer rebalancer;
    private final Consumer<RebalanceResult> resultCallback;
    private final long minTriggerIntervalMillis;
    private final ScheduledExecutorService executorService;
    private ScheduledFuture<?> nextCycle = null;
    private long nextCycleAt = 0L;
    private boolean started = false;
    private boolean running = false;
    private boolean triggered = false;

    private RebalanceService(Builder builder) {
        rebalancer = builder.rebalancer;
        resultCallback = builder.resultCallback;
        minTriggerIntervalMillis = builder.minTriggerIntervalMillis;
        executorService = builder.executorService;
    }

    /**
     * Start the rebalancing loop. The first cycle runs at once.
     *
     * @throws IllegalStateException if this service was already started
     */
    public synchronized void start() {
        if (started)
            throw new IllegalStateException("Rebalance service already started");
        started = true;
        scheduleNext(0L);
    }

    /**
     * Run the next cycle soon, at least {@link Builder#withMinTriggerIntervalMillis(long)} from now, unless it is
     * already due earlier. A trigger arriving while a cycle runs applies to the cycle after it. Does nothing before
     * {@link #start()} or after {@link #shutdown()}.
     */
    public synchronized void trigger() {
        if (!started || isShutdown())
            return;
        if (running) {
            triggered = true;
            return;
        }
        if (nextCycle != null && nextCycleAt <= System.currentTimeMillis() + minTriggerIntervalMillis)
            return;
        scheduleNext(minTriggerIntervalMillis);
    }

    /**
     * Stop the loop. A cycle in progress is interrupted and stops at its next step, keeping the evictions it already
     * made. No further cycles start.
     */
    public void shutdown() {
        executorService.shutdownNow();
    }

    public boolean isShutdown() {
        return executorService.isShutdown();
    }

    private synchronized void scheduleNext(long delayMillis) {
        if (nextCycle != null)
            nextCycle.cancel(false);
        try {
            nextCycleAt = System.currentTimeMillis() + delayMillis;
            nextCycle = executorService.schedule(this::runOnce, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.info("Rebalance service shut down, not scheduling further cycles");
            nextCycle = null;
        }
    }

    private void runOnce() {
        synchronized (this) {
            nextCycle = null;
            running = true;
            triggered = false;
        }
        RebalanceResult result;
        try {
            result = rebalancer.reconcile();
        } catch (Exception e) {
            logger.error("Unexpected error in rebalancing cycle", e);
            result = new RebalanceResult(rebalancer.getConfig().getRecheckInterval());
            result.addException(e);
        }
        if (result.isCancelled() || Thread.currentThread().isInterrupted()) {
            logger.info("Rebalancing cycle cancelled, stopping");
            synchronized (this) {
                running = false;
            }
            return;
        }
        if (resultCallback != null) {
            try {
                resultCallback.accept(result);
            } catch (Exception e) {
                logger.warn("Rebalance result callback error: {}", e.getMessage());
                if (logger.isDebugEnabled()) {
                    logger.debug("Details", e);
                }
            }
        }
        final Duration recheckAfter = result.getRecheckAfter();
        synchronized (this) {
            running = false;
            final long delay = triggered ?
                    Math.min(minTriggerIntervalMillis, recheckAfter.toMillis()) :
                    recheckAfter.toMillis();
            logger.debug("Rebalancing cycle done: {}, next cycle in {} millis", result, delay);
            scheduleNext(delay);
        }
    }

    public final static class Builder {

        private PodRebalancer rebalancer = null;
        private Consumer<RebalanceResult> resultCallback = null;
        private long minTriggerIntervalMillis = 1000L;
        private final ScheduledExecutorService executorService;

        public Builder() {
            final AtomicInteger count = new AtomicInteger();
            ThreadFactory threadFactory = r -> {
                Thread thread = new Thread(r, "kube-balance-main-" + count.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            };
            executorService = new ScheduledThreadPoolExecutor(1, threadFactory);
        }

        /**
         * Use the given rebalancer to run cycles. A rebalancer must be provided before this builder can create the
         * service.
         *
         * @param rebalancer the rebalancer
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalanceService}
         */
        public Builder withRebalancer(PodRebalancer rebalancer) {
            this.rebalancer = rebalancer;
            return this;
        }

        /**
         * Give each cycle's result to the given callback, before the next cycle is scheduled.
         *
         * @param callback the callback
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalanceService}
         */
        public Builder withResultCallback(Consumer<RebalanceResult> callback) {
            this.resultCallback = callback;
            return this;
        }

        /**
         * Run a triggered cycle no sooner than the given delay. Default is 1000 millis.
         *
         * @param millis the minimum delay of a triggered cycle
         * @return this same {@code Builder}, suitable for further chaining or to build the {@link RebalanceService}
         */
        public Builder withMinTriggerIntervalMillis(long millis) {
            this.minTriggerIntervalMillis = millis;
            return this;
        }

        public RebalanceService build() {
            if (rebalancer == null)
                throw new NullPointerException("Null rebalancer not allowed");
            if (minTriggerIntervalMillis < 0)
                throw new IllegalArgumentException("Min trigger interval must not be negative: " + minTriggerIntervalMillis);
            return new RebalanceService(this);
        }
    }
}
