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

import com.netflix.kubebalance.EvictionApi;
import com.netflix.kubebalance.EvictionException;
import com.netflix.kubebalance.PodInfo;
import io.fabric8.kubernetes.api.model.DeleteOptionsBuilder;
import io.fabric8.kubernetes.api.model.policy.v1.Eviction;
import io.fabric8.kubernetes.api.model.policy.v1.EvictionBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.time.Duration;

/**
 * {@link EvictionApi} that posts a policy/v1 eviction for the pod, so the API server enforces disruption budgets.
 * The client reports a refusal for too many requests as a {@code false} return, which is mapped to
 * {@link EvictionException#TOO_MANY_REQUESTS}.
 */
public class Fabric8EvictionApi implements EvictionApi {

    private final KubernetesClient client;

    public Fabric8EvictionApi(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public void evict(PodInfo pod, Duration gracePeriod) throws EvictionException {
        final Eviction eviction = new EvictionBuilder()
                .withNewMetadata()
                    .withNamespace(pod.getNamespace())
                    .withName(pod.getName())
                .endMetadata()
                .withDeleteOptions(new DeleteOptionsBuilder()
                        .withGracePeriodSeconds(gracePeriod.getSeconds())
                        .build())
                .build();
        final boolean evicted;
        try {
            evicted = client.pods().inNamespace(pod.getNamespace()).withName(pod.getName()).evict(eviction);
        } catch (KubernetesClientException e) {
            throw new EvictionException(e.getCode(), "Failed to evict pod " + pod.getId() + ": " + e.getMessage(), e);
        }
        if (!evicted)
            throw new EvictionException(EvictionException.TOO_MANY_REQUESTS,
                    "Eviction of pod " + pod.getId() + " refused, too many requests");
    }
}
