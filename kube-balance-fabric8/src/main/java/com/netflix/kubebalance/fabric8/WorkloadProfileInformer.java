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

import com.netflix.kubebalance.profiles.WorkloadProfileEventHandler;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches the cluster scoped {@code workloadprofiles.kube-balance.io} resources and feeds their changes to a
 * {@link WorkloadProfileEventHandler}. An optional listener is run after every change, for example to trigger a
 * rebalancing cycle.
 */
public class WorkloadProfileInformer implements ResourceEventHandler<GenericKubernetesResource>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadProfileInformer.class);

    static final ResourceDefinitionContext WORKLOAD_PROFILES = new ResourceDefinitionContext.Builder()
            .withGroup("kube-balance.io")
            .withVersion("v1alpha1")
            .withKind("WorkloadProfile")
            .withPlural("workloadprofiles")
            .withNamespaced(false)
            .build();

    private final KubernetesClient client;
    private final WorkloadProfileEventHandler handler;
    private final Runnable changeListener;
    private final long resyncPeriodMillis;
    private SharedIndexInformer<GenericKubernetesResource> informer = null;

    public WorkloadProfileInformer(KubernetesClient client, WorkloadProfileEventHandler handler,
                                   Runnable changeListener, long resyncPeriodMillis) {
        this.client = client;
        this.handler = handler;
        this.changeListener = changeListener;
        this.resyncPeriodMillis = resyncPeriodMillis;
    }

    /**
     * Start watching. Existing profiles are delivered as additions.
     */
    public synchronized void start() {
        if (informer != null)
            throw new IllegalStateException("Workload profile informer already started");
        logger.info("Starting workload profile informer, resync every {} millis", resyncPeriodMillis);
        informer = client.genericKubernetesResources(WORKLOAD_PROFILES).inform(this, resyncPeriodMillis);
    }

    @Override
    public void onAdd(GenericKubernetesResource resource) {
        handler.onAdd(resource);
        changed();
    }

    @Override
    public void onUpdate(GenericKubernetesResource oldResource, GenericKubernetesResource newResource) {
        handler.onUpdate(oldResource, newResource);
        changed();
    }

    @Override
    public void onDelete(GenericKubernetesResource resource, boolean deletedFinalStateUnknown) {
        handler.onDelete(resource);
        changed();
    }

    private void changed() {
        if (changeListener != null)
            changeListener.run();
    }

    @Override
    public synchronized void close() {
        if (informer != null) {
            informer.close();
            informer = null;
        }
    }
}
