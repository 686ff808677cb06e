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

package sh.volcano.controllers.queue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.api.scheduling.v1beta1.SchedulingV1beta1;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroup;
import sh.volcano.api.scheduling.v1beta1.V1beta1Queue;
import sh.volcano.api.scheduling.v1beta1.V1beta1QueueStatus;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.StringExt;
import sh.volcano.controllers.ControllersConfiguration;
import sh.volcano.controllers.kubernetes.KubeApiException;
import sh.volcano.controllers.kubernetes.KubeApiFacade;
import sh.volcano.controllers.supervisor.BasePeriodicController;

/**
 * Keeps the queue status counters in line with the phases of the pod groups assigned to each queue. Only queues
 * whose counters changed are written back.
 */
@Singleton
public class QueueController extends BasePeriodicController<V1beta1Queue> {

    private static final Logger logger = LoggerFactory.getLogger(QueueController.class);

    public static final String NAME = "queueController";

    private final KubeApiFacade kubeApiFacade;

    @Inject
    public QueueController(ControllersConfiguration configuration, KubeApiFacade kubeApiFacade, VolcanoRuntime runtime) {
        super(NAME, configuration.getQueueControllerIntervalMs(), configuration.getPeriodicControllerBatchSize(), runtime);
        this.kubeApiFacade = kubeApiFacade;
    }

    @Override
    protected boolean isReady() {
        return kubeApiFacade.getQueueInformer().hasSynced() && kubeApiFacade.getPodGroupInformer().hasSynced();
    }

    /**
     * @return copies of the queues whose status differs from the pod group counts, with the new status set
     */
    @Override
    protected List<V1beta1Queue> getItemsToProcess() {
        Map<String, V1beta1QueueStatus> statuses = countPodGroups(kubeApiFacade.getPodGroupInformer().getIndexer().list());

        List<V1beta1Queue> result = new ArrayList<>();
        for (V1beta1Queue queue : kubeApiFacade.getQueueInformer().getIndexer().list()) {
            String name = queue.getMetadata().getName();
            V1beta1QueueStatus current = queue.getStatus() == null ? new V1beta1QueueStatus() : queue.getStatus();
            V1beta1QueueStatus counted = statuses.getOrDefault(name, new V1beta1QueueStatus());
            counted.setState(current.getState() == null ? SchedulingV1beta1.QUEUE_STATE_OPEN : current.getState());
            if (!Objects.equals(current, counted)) {
                V1beta1Queue updated = new V1beta1Queue();
                updated.setApiVersion(queue.getApiVersion());
                updated.setKind(queue.getKind());
                updated.setMetadata(queue.getMetadata());
                updated.setSpec(queue.getSpec());
                updated.setStatus(counted);
                result.add(updated);
            }
        }
        return result;
    }

    @Override
    protected boolean processItem(V1beta1Queue queue) {
        try {
            kubeApiFacade.updateQueueStatus(queue);
            logger.debug("Updated status of queue {}: {}", queue.getMetadata().getName(), queue.getStatus());
            return true;
        } catch (KubeApiException e) {
            logger.warn("Failed to update status of queue {}: {}", queue.getMetadata().getName(), e.getMessage());
            return false;
        }
    }

    @Override
    protected String describe(V1beta1Queue queue) {
        return queue.getMetadata().getName();
    }

    @VisibleForTesting
    static Map<String, V1beta1QueueStatus> countPodGroups(List<V1beta1PodGroup> podGroups) {
        Map<String, V1beta1QueueStatus> statuses = new HashMap<>();
        for (V1beta1PodGroup podGroup : podGroups) {
            String queueName = podGroup.getSpec() == null ? null : podGroup.getSpec().getQueue();
            if (StringExt.isEmpty(queueName)) {
                queueName = SchedulingV1beta1.DEFAULT_QUEUE;
            }
            V1beta1QueueStatus status = statuses.computeIfAbsent(queueName, name -> new V1beta1QueueStatus());
            String phase = podGroup.getStatus() == null ? null : podGroup.getStatus().getPhase();
            if (phase == null || SchedulingV1beta1.POD_GROUP_PENDING.equals(phase)) {
                status.setPending(status.getPending() + 1);
            } else if (SchedulingV1beta1.POD_GROUP_RUNNING.equals(phase)) {
                status.setRunning(status.getRunning() + 1);
            } else if (SchedulingV1beta1.POD_GROUP_INQUEUE.equals(phase)) {
                status.setInqueue(status.getInqueue() + 1);
            } else {
                status.setUnknown(status.getUnknown() + 1);
            }
        }
        return statuses;
    }
}
