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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A cache of {@link WorkloadProfile}s keyed by profile name. Any number of threads may read concurrently, writes
 * are exclusive. Reads always return a copy, so callers never observe a later mutation.
 * <p>
 * Writes are expected only from {@link WorkloadProfileEventHandler}, on whichever thread delivers profile change
 * events.
 */
public class WorkloadProfileStore {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadProfileStore.class);

    private final Map<String, WorkloadProfile> profiles = new HashMap<>();
    private final Lock readLock;
    private final Lock writeLock;

    public WorkloadProfileStore() {
        ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        readLock = lock.readLock();
        writeLock = lock.writeLock();
    }

    /**
     * Get a snapshot of all cached profiles.
     *
     * @return an unmodifiable copy of the profile map, keyed by profile name
     */
    public Map<String, WorkloadProfile> getAll() {
        readLock.lock();
        try {
            return Collections.unmodifiableMap(new HashMap<>(profiles));
        } finally {
            readLock.unlock();
        }
    }

    public boolean isEmpty() {
        readLock.lock();
        try {
            return profiles.isEmpty();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Add the profile, or replace the cached profile of the same name.
     *
     * @param profile the profile to cache
     */
    public void upsert(WorkloadProfile profile) {
        if (profile == null)
            throw new NullPointerException("Can't cache null profile");
        writeLock.lock();
        try {
            profiles.put(profile.getName(), profile);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Remove the profile with the given name. Removing a name that is not cached does nothing.
     *
     * @param name the profile name
     * @return {@code true} if a profile was removed
     */
    public boolean remove(String name) {
        if (name == null)
            return false;
        writeLock.lock();
        try {
            final boolean removed = profiles.remove(name) != null;
            if (!removed)
                logger.debug("Profile {} not cached, nothing to remove", name);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }
}
