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

import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.Optional;

import static com.netflix.kubebalance.PodProvider.guaranteedPod;
import static com.netflix.kubebalance.PodProvider.ownedPod;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class OwnerResolverTest {

    private final ClusterState clusterState = mock(ClusterState.class);
    private final OwnerResolver resolver = new OwnerResolver(clusterState);

    @Test
    public void testNoControllerReference() throws Exception {
        final PodInfo pod = PodInfo.newBuilder("default", "p")
                .withOwnerReference(new OwnerReference("Deployment", "d", false))
                .build();
        Assert.assertFalse(resolver.resolve(pod).isPresent());
        Assert.assertFalse(resolver.resolve(guaranteedPod("q", "n1", "web")).isPresent());
        verify(clusterState, never()).getOwner(any(OwnerKind.class), anyString(), anyString());
    }

    @Test
    public void testUnknownKindIgnored() throws Exception {
        final PodInfo pod = PodInfo.newBuilder("default", "p")
                .withOwnerReference(OwnerReference.controller("DaemonSet", "ds"))
                .build();
        Assert.assertFalse(resolver.resolve(pod).isPresent());
    }

    @Test
    public void testStatefulSetOwner() throws Exception {
        final WorkloadOwner sts = new WorkloadOwner(OwnerKind.StatefulSet, "default", "db", null);
        when(clusterState.getOwner(OwnerKind.StatefulSet, "default", "db")).thenReturn(sts);
        final Optional<WorkloadOwner> owner = resolver.resolve(ownedPod("db-0", "n1", "db", OwnerKind.StatefulSet, "db"));
        Assert.assertSame(sts, owner.get());
    }

    @Test
    public void testReplicaSetResolvesToDeployment() throws Exception {
        final WorkloadOwner rs = new WorkloadOwner(OwnerKind.ReplicaSet, "default", "web-5d8f", null,
                Collections.singletonList(OwnerReference.controller("Deployment", "web")));
        final WorkloadOwner deployment = new WorkloadOwner(OwnerKind.Deployment, "default", "web", null);
        when(clusterState.getOwner(OwnerKind.ReplicaSet, "default", "web-5d8f")).thenReturn(rs);
        when(clusterState.getOwner(OwnerKind.Deployment, "default", "web")).thenReturn(deployment);

        final Optional<WorkloadOwner> owner = resolver.resolve(ownedPod("web-1", "n1", "web", OwnerKind.ReplicaSet, "web-5d8f"));
        Assert.assertSame(deployment, owner.get());
    }

    @Test
    public void testStandaloneReplicaSet() throws Exception {
        final WorkloadOwner rs = new WorkloadOwner(OwnerKind.ReplicaSet, "default", "rs", null);
        when(clusterState.getOwner(OwnerKind.ReplicaSet, "default", "rs")).thenReturn(rs);
        Assert.assertSame(rs, resolver.resolve(ownedPod("rs-1", "n1", "web", OwnerKind.ReplicaSet, "rs")).get());
    }

    @Test(expected = OwnerLookupException.class)
    public void testLookupFailure() throws Exception {
        when(clusterState.getOwner(OwnerKind.Deployment, "default", "gone"))
                .thenThrow(new ClusterAccessException("not found"));
        resolver.resolve(ownedPod("p", "n1", "web", OwnerKind.Deployment, "gone"));
    }
}
