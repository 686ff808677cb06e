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

package sh.volcano.controllers.leaderelection;

import java.util.concurrent.atomic.AtomicBoolean;

import io.kubernetes.client.extended.event.EventType;
import io.kubernetes.client.extended.event.legacy.EventBroadcaster;
import io.kubernetes.client.extended.event.legacy.EventRecorder;
import io.kubernetes.client.extended.event.legacy.LegacyEventBroadcaster;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.openapi.models.V1EventSource;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records leadership transitions as {@code LeaderElection} events of the lock config map, in the lock namespace.
 */
public class KubeLeaderTransitionRecorder implements LeaderTransitionRecorder {

    private static final Logger logger = LoggerFactory.getLogger(KubeLeaderTransitionRecorder.class);

    private static final String REASON = "LeaderElection";

    private final EventBroadcaster broadcaster;
    private final EventRecorder recorder;
    private final V1ConfigMap lockObject;

    private final AtomicBoolean started = new AtomicBoolean();

    public KubeLeaderTransitionRecorder(ApiClient apiClient, String namespace, String lockName) {
        this.broadcaster = new LegacyEventBroadcaster(new CoreV1Api(apiClient));
        this.recorder = broadcaster.newRecorder(new V1EventSource().component(LeaseLocks.LOCK_NAME));
        this.lockObject = new V1ConfigMap()
                .apiVersion("v1")
                .kind("ConfigMap")
                .metadata(new V1ObjectMeta().namespace(namespace).name(lockName));
    }

    @Override
    public void record(String identity, String transition) {
        if (started.compareAndSet(false, true)) {
            broadcaster.startRecording();
        }
        logger.info("Leader election event: {} {}", identity, transition);
        recorder.event(lockObject, EventType.Normal, REASON, "%s %s", identity, transition);
    }

    public void shutdown() {
        if (started.get()) {
            broadcaster.shutdown();
        }
    }
}
