/*
 * Copyright 2019 The Volcano Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package sh.volcano.controllers.kubernetes;

import java.util.ArrayList;
import java.util.List;

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.informer.SharedIndexInformer;

/**
 * Cache size and sync state of the shared informers, one gauge pair per watched resource.
 */
class KubeInformerMetrics {

    static final String METRIC_CACHE_SIZE = "volcano.kubeClient.informer.cacheSize";
    static final String METRIC_SYNCED = "volcano.kubeClient.informer.synced";

    private final Registry registry;
    private final List<Id> gaugeIds = new ArrayList<>();

    KubeInformerMetrics(Registry registry) {
        this.registry = registry;
    }

    synchronized <T extends KubernetesObject> void monitor(String resource, SharedIndexInformer<T> informer) {
        Id cacheSizeId = registry.createId(METRIC_CACHE_SIZE, "resource", resource);
        Id syncedId = registry.createId(METRIC_SYNCED, "resource", resource);
        PolledMeter.using(registry).withId(cacheSizeId).monitorValue(informer, i -> i.getIndexer().list().size());
        PolledMeter.using(registry).withId(syncedId).monitorValue(informer, i -> i.hasSynced() ? 1 : 0);
        gaugeIds.add(cacheSizeId);
        gaugeIds.add(syncedId);
    }

    synchronized void shutdown() {
        gaugeIds.forEach(id -> PolledMeter.remove(registry, id));
        gaugeIds.clear();
    }
}
