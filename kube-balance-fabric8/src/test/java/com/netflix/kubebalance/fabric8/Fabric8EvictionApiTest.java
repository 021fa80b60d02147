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

import com.netflix.kubebalance.EvictionException;
import com.netflix.kubebalance.PodInfo;
import io.fabric8.kubernetes.api.model.policy.v1.Eviction;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.PodResource;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class Fabric8EvictionApiTest {

    private final PodInfo pod = PodInfo.newBuilder("shop", "web-1").withNodeName("n1").build();

    private KubernetesClient client;
    private PodResource podResource;
    private Fabric8EvictionApi evictionApi;

    @Before
    public void setUp() {
        client = mock(KubernetesClient.class, RETURNS_DEEP_STUBS);
        podResource = mock(PodResource.class);
        when(client.pods().inNamespace("shop").withName("web-1")).thenReturn(podResource);
        evictionApi = new Fabric8EvictionApi(client);
    }

    @Test
    public void testEvictionPostedWithGracePeriod() throws Exception {
        when(podResource.evict(any(Eviction.class))).thenReturn(true);

        evictionApi.evict(pod, Duration.ofSeconds(30));

        final ArgumentCaptor<Eviction> captor = ArgumentCaptor.forClass(Eviction.class);
        verify(podResource).evict(captor.capture());
        assertThat(captor.getValue().getMetadata().getNamespace(), is(equalTo("shop")));
        assertThat(captor.getValue().getMetadata().getName(), is(equalTo("web-1")));
        assertThat(captor.getValue().getDeleteOptions().getGracePeriodSeconds(), is(equalTo(30L)));
    }

    @Test
    public void testRefusedEvictionIsTooManyRequests() {
        when(podResource.evict(any(Eviction.class))).thenReturn(false);
        try {
            evictionApi.evict(pod, Duration.ofSeconds(30));
            Assert.fail("Expected the refused eviction to fail");
        } catch (EvictionException e) {
            assertThat(e.getStatusCode(), is(EvictionException.TOO_MANY_REQUESTS));
            Assert.assertTrue(e.isTooManyRequests());
        }
    }

    @Test
    public void testClientErrorKeepsStatusCode() {
        when(podResource.evict(any(Eviction.class)))
                .thenThrow(new KubernetesClientException("internal error", 500, null));
        try {
            evictionApi.evict(pod, Duration.ofSeconds(30));
            Assert.fail("Expected the eviction to fail");
        } catch (EvictionException e) {
            assertThat(e.getStatusCode(), is(500));
            Assert.assertFalse(e.isTooManyRequests());
            Assert.assertTrue(e.getCause() instanceof KubernetesClientException);
        }
    }

    @Test
    public void testClientTooManyRequestsIsRateLimited() {
        when(podResource.evict(any(Eviction.class)))
                .thenThrow(new KubernetesClientException("too many requests", 429, null));
        try {
            evictionApi.evict(pod, Duration.ofSeconds(30));
            Assert.fail("Expected the eviction to fail");
        } catch (EvictionException e) {
            Assert.assertTrue(e.isTooManyRequests());
        }
    }
}
