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

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

public class WorkloadProfileStoreTest {

    @Test
    public void testUpsertReplacesByName() {
        final WorkloadProfileStore store = new WorkloadProfileStore();
        Assert.assertTrue(store.isEmpty());
        store.upsert(new WorkloadProfile("web", 1));
        store.upsert(new WorkloadProfile("web", 7));
        final Map<String, WorkloadProfile> all = store.getAll();
        Assert.assertEquals(1, all.size());
        Assert.assertEquals(7, all.get("web").getEvictionPriority());
    }

    @Test
    public void testRemove() {
        final WorkloadProfileStore store = new WorkloadProfileStore();
        store.upsert(new WorkloadProfile("web", 1));
        Assert.assertTrue(store.remove("web"));
        Assert.assertFalse(store.remove("web"));
        Assert.assertFalse(store.remove("never-there"));
        Assert.assertTrue(store.isEmpty());
    }

    @Test
    public void testSnapshotUnaffectedByLaterWrites() {
        final WorkloadProfileStore store = new WorkloadProfileStore();
        store.upsert(new WorkloadProfile("web", 1));
        final Map<String, WorkloadProfile> snapshot = store.getAll();
        store.upsert(new WorkloadProfile("batch", 2));
        store.remove("web");
        Assert.assertEquals(1, snapshot.size());
        Assert.assertTrue(snapshot.containsKey("web"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testSnapshotUnmodifiable() {
        new WorkloadProfileStore().getAll().put("web", new WorkloadProfile("web", 1));
    }

    @Test(expected = NullPointerException.class)
    public void testNullProfileRejected() {
        new WorkloadProfileStore().upsert(null);
    }

    @Test
    public void testConcurrentReadersAndWriters() throws Exception {
        final WorkloadProfileStore store = new WorkloadProfileStore();
        final int writers = 4;
        final int perWriter = 500;
        final CountDownLatch done = new CountDownLatch(writers + 2);
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final List<Thread> threads = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            final int id = w;
            threads.add(new Thread(() -> {
                try {
                    for (int i = 0; i < perWriter; i++)
                        store.upsert(new WorkloadProfile("w" + id + "-" + i, i));
                } catch (Throwable t) {
                    failure.set(t);
                } finally {
                    done.countDown();
                }
            }));
        }
        for (int r = 0; r < 2; r++) {
            threads.add(new Thread(() -> {
                try {
                    for (int i = 0; i < perWriter; i++) {
                        for (WorkloadProfile p : store.getAll().values())
                            Assert.assertNotNull(p.getName());
                    }
                } catch (Throwable t) {
                    failure.set(t);
                } finally {
                    done.countDown();
                }
            }));
        }
        threads.forEach(Thread::start);
        Assert.assertTrue(done.await(30, TimeUnit.SECONDS));
        Assert.assertNull(failure.get());
        Assert.assertEquals(writers * perWriter, store.getAll().size());
    }
}
