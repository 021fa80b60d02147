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

import com.netflix.kubebalance.PodRebalancer;
import com.netflix.kubebalance.RebalanceService;
import com.netflix.kubebalance.RebalancerConfig;
import com.netflix.kubebalance.profiles.WorkloadProfileEventHandler;
import com.netflix.kubebalance.profiles.WorkloadProfileStore;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the rebalancer against the cluster of the current kubeconfig or in-cluster service account. An optional
 * argument names a properties file, see {@link RebalancerConfigs} for the keys; system properties with the same keys
 * take precedence.
 */
public class KubeBalanceLauncher {

    private static final Logger logger = LoggerFactory.getLogger(KubeBalanceLauncher.class);

    static final String PROFILE_RESYNC_PERIOD = RebalancerConfigs.PREFIX + "profile-resync-period";
    static final String MIN_TRIGGER_INTERVAL = RebalancerConfigs.PREFIX + "min-trigger-interval";

    public static void main(String[] args) throws IOException, InterruptedException {
        final Properties properties = loadProperties(args.length > 0 ? args[0] : null);
        final RebalancerConfig config = RebalancerConfigs.fromProperties(properties);
        logger.info("Starting kube-balance with {}", config);

        final KubernetesClient client = new KubernetesClientBuilder().build();
        final WorkloadProfileStore store = new WorkloadProfileStore();
        final PodRebalancer rebalancer = new PodRebalancer.Builder()
                .withConfig(config)
                .withProfileStore(store)
                .withClusterState(new Fabric8ClusterState(client))
                .withEvictionApi(new Fabric8EvictionApi(client))
                .withRebalanceEventListener(new KubernetesEventRecorder(client))
                .build();
        final RebalanceService service = new RebalanceService.Builder()
                .withRebalancer(rebalancer)
                .withMinTriggerIntervalMillis(
                        RebalancerConfigs.parseDuration(MIN_TRIGGER_INTERVAL,
                                properties.getProperty(MIN_TRIGGER_INTERVAL, "1s")).toMillis())
                .withResultCallback(result -> {
                    if (!result.getExceptions().isEmpty())
                        logger.warn("Rebalancing cycle failed: {}", result.getExceptions().get(0).getMessage());
                })
                .build();
        final WorkloadProfileInformer informer = new WorkloadProfileInformer(client,
                new WorkloadProfileEventHandler(store), service::trigger,
                RebalancerConfigs.parseDuration(PROFILE_RESYNC_PERIOD,
                        properties.getProperty(PROFILE_RESYNC_PERIOD, "10m")).toMillis());

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down kube-balance");
            service.shutdown();
            informer.close();
            client.close();
            stopped.countDown();
        }, "kube-balance-shutdown"));

        informer.start();
        service.start();
        stopped.await();
    }

    static Properties loadProperties(String file) throws IOException {
        final Properties properties = new Properties();
        if (file != null) {
            try (InputStream in = Files.newInputStream(Paths.get(file))) {
                properties.load(in);
            }
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(RebalancerConfigs.PREFIX))
                properties.setProperty(key, System.getProperty(key));
        }
        return properties;
    }
}
