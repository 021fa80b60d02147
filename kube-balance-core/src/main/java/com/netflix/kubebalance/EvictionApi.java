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

import java.time.Duration;

/**
 * The cluster's graceful pod removal primitive. An eviction lets the pod's owner recreate it elsewhere, as opposed to
 * deleting it outright.
 */
public interface EvictionApi {

    /**
     * Request eviction of a pod.
     *
     * @param pod the pod to evict
     * @param gracePeriod time the pod is given to terminate
     * @throws EvictionException if the request is refused or fails; a refusal due to rate limiting is reported with
     *         status {@link EvictionException#TOO_MANY_REQUESTS}
     */
    void evict(PodInfo pod, Duration gracePeriod) throws EvictionException;
}
