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

package com.netflix.kubebalance.fabric8;

import com.netflix.kubebalance.EvictionScope;
import com.netflix.kubebalance.RebalancerConfig;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link RebalancerConfig} from properties. Recognized keys, all optional:
 * <pre>
 * kube-balance.recheck-interval                    2m
 * kube-balance.max-evictions-per-node-per-cycle    1
 * kube-balance.post-eviction-recheck-delay         5s
 * kube-balance.rate-limited-recheck-delay          10s
 * kube-balance.eviction-grace-period               30s
 * kube-balance.eviction-scope                      SinglePerCycle | PerNode
 * kube-balance.evict-unprofiled-pods               false
 * kube-balance.degraded-node-annotation            kube-balance.io/degraded-io
 * kube-balance.workload-type-label                 workload.k8s.io/type
 * kube-balance.cooldown-annotation                 kube-balance.io/eviction-cooldown-until
 * </pre>
 * Durations are a number with one of the units {@code ms}, {@code s}, {@code m}, {@code h}, or an ISO-8601
 * duration such as {@code PT2M}.
 */
public final class RebalancerConfigs {

    public static final String PREFIX = "kube-balance.";

    public static final String RECHECK_INTERVAL = PREFIX + "recheck-interval";
    public static final String MAX_EVICTIONS_PER_NODE_PER_CYCLE = PREFIX + "max-evictions-per-node-per-cycle";
    public static final String POST_EVICTION_RECHECK_DELAY = PREFIX + "post-eviction-recheck-delay";
    public static final String RATE_LIMITED_RECHECK_DELAY = PREFIX + "rate-limited-recheck-delay";
    public static final String EVICTION_GRACE_PERIOD = PREFIX + "eviction-grace-period";
    public static final String EVICTION_SCOPE = PREFIX + "eviction-scope";
    public static final String EVICT_UNPROFILED_PODS = PREFIX + "evict-unprofiled-pods";
    public static final String DEGRADED_NODE_ANNOTATION = PREFIX + "degraded-node-annotation";
    public static final String WORKLOAD_TYPE_LABEL = PREFIX + "workload-type-label";
    public static final String COOLDOWN_ANNOTATION = PREFIX + "cooldown-annotation";

    private static final Pattern SIMPLE_DURATION = Pattern.compile("(\\d+)(ms|s|m|h)");

    private RebalancerConfigs() {
    }

    /**
     * Build a config from the given properties. Keys that are absent keep their defaults.
     *
     * @param properties the properties
     * @return the config
     * @throws IllegalArgumentException if a value can't be parsed or is out of range
     */
    public static RebalancerConfig fromProperties(Properties properties) {
        final RebalancerConfig.Builder builder = new RebalancerConfig.Builder();
        String value;
        if ((value = get(properties, RECHECK_INTERVAL)) != null)
            builder.withRecheckInterval(parseDuration(RECHECK_INTERVAL, value));
        if ((value = get(properties, MAX_EVICTIONS_PER_NODE_PER_CYCLE)) != null)
            builder.withMaxEvictionsPerNodePerCycle(parseInt(MAX_EVICTIONS_PER_NODE_PER_CYCLE, value));
        if ((value = get(properties, POST_EVICTION_RECHECK_DELAY)) != null)
            builder.withPostEvictionRecheckDelay(parseDuration(POST_EVICTION_RECHECK_DELAY, value));
        if ((value = get(properties, RATE_LIMITED_RECHECK_DELAY)) != null)
            builder.withRateLimitedRecheckDelay(parseDuration(RATE_LIMITED_RECHECK_DELAY, value));
        if ((value = get(properties, EVICTION_GRACE_PERIOD)) != null)
            builder.withEvictionGracePeriod(parseDuration(EVICTION_GRACE_PERIOD, value));
        if ((value = get(properties, EVICTION_SCOPE)) != null)
            builder.withEvictionScope(parseScope(value));
        if ((value = get(properties, EVICT_UNPROFILED_PODS)) != null)
            builder.withEvictUnprofiledPods(parseBoolean(EVICT_UNPROFILED_PODS, value));
        if ((value = get(properties, DEGRADED_NODE_ANNOTATION)) != null)
            builder.withDegradedNodeAnnotation(value);
        if ((value = get(properties, WORKLOAD_TYPE_LABEL)) != null)
            builder.withWorkloadTypeLabel(value);
        if ((value = get(properties, COOLDOWN_ANNOTATION)) != null)
            builder.withCooldownAnnotation(value);
        return builder.build();
    }

    /**
     * Parse a duration such as {@code 500ms}, {@code 30s}, {@code 2m}, {@code 1h} or {@code PT2M}.
     *
     * @param key the property key, for error messages
     * @param value the value
     * @return the duration
     * @throws IllegalArgumentException if the value is not a duration
     */
    public static Duration parseDuration(String key, String value) {
        final Matcher m = SIMPLE_DURATION.matcher(value);
        if (m.matches()) {
            final long amount = Long.parseLong(m.group(1));
            switch (m.group(2)) {
                case "ms":
                    return Duration.ofMillis(amount);
                case "s":
                    return Duration.ofSeconds(amount);
                case "m":
                    return Duration.ofMinutes(amount);
                default:
                    return Duration.ofHours(amount);
            }
        }
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }

    private static String get(Properties properties, String key) {
        final String value = properties.getProperty(key);
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value))
            return true;
        if ("false".equalsIgnoreCase(value))
            return false;
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
    }

    private static EvictionScope parseScope(String value) {
        for (EvictionScope scope : EvictionScope.values()) {
            if (scope.name().equalsIgnoreCase(value))
                return scope;
        }
        throw new IllegalArgumentException("Invalid value for " + EVICTION_SCOPE + ": " + value);
    }
}
