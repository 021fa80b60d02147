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

package com.netflix.kubebalance.profiles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies workload profile change events to a {@link WorkloadProfileStore}. This is the only writer of the store.
 * Events may be delivered on any thread, and may be delivered more than once; adds and updates overwrite the cached
 * profile, deletes of an unknown profile are ignored.
 * <p>
 * A payload that can't be decoded is logged and dropped, it never fails the event source.
 */
public class WorkloadProfileEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadProfileEventHandler.class);

    private final WorkloadProfileStore store;
    private final WorkloadProfileDecoder decoder;

    public WorkloadProfileEventHandler(WorkloadProfileStore store) {
        this(store, new WorkloadProfileDecoder());
    }

    public WorkloadProfileEventHandler(WorkloadProfileStore store, WorkloadProfileDecoder decoder) {
        if (store == null)
            throw new NullPointerException("Null profile store not allowed");
        this.store = store;
        this.decoder = decoder;
    }

    public void onAdd(Object payload) {
        try {
            final WorkloadProfile profile = decoder.decode(payload);
            store.upsert(profile);
            logger.debug("Added workload profile {} to cache", profile.getName());
        } catch (WorkloadProfileDecodingException e) {
            logger.error("Failed to decode object for add event: " + e.getMessage(), e);
        }
    }

    public void onUpdate(Object oldPayload, Object newPayload) {
        try {
            final WorkloadProfile profile = decoder.decode(newPayload);
            store.upsert(profile);
            logger.debug("Updated workload profile {} in cache", profile.getName());
        } catch (WorkloadProfileDecodingException e) {
            logger.error("Failed to decode object for update event: " + e.getMessage(), e);
        }
    }

    public void onDelete(Object payload) {
        try {
            final String name = decoder.decodeName(payload);
            store.remove(name);
            logger.debug("Deleted workload profile {} from cache", name);
        } catch (WorkloadProfileDecodingException e) {
            logger.error("Failed to decode object for delete event: " + e.getMessage(), e);
        }
    }
}
