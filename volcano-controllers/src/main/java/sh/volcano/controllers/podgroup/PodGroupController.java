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

package sh.volcano.controllers.podgroup;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import io.kubernetes.client.openapi.models.V1Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.api.scheduling.v1beta1.SchedulingV1beta1;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroup;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroupSpec;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.StringExt;
import sh.volcano.controllers.ControllersConfiguration;
import sh.volcano.controllers.kubernetes.KubeApiException;
import sh.volcano.controllers.kubernetes.KubeApiFacade;
import sh.volcano.controllers.kubernetes.KubeObjects;
import sh.volcano.controllers.supervisor.BasePeriodicController;

/**
 * Wraps plain pods, which request the volcano scheduler but were not created by a volcano job, in a single member
 * pod group, so that the scheduler can handle them uniformly.
 */
@Singleton
public class PodGroupController extends BasePeriodicController<V1Pod> {

    private static final Logger logger = LoggerFactory.getLogger(PodGroupController.class);

    public static final String NAME = "podGroupController";

    private static final String POD_GROUP_NAME_PREFIX = "podgroup-";

    private final String schedulerName;
    private final KubeApiFacade kubeApiFacade;

    @Inject
    public PodGroupController(ControllersConfiguration configuration, KubeApiFacade kubeApiFacade, VolcanoRuntime runtime) {
        super(NAME, configuration.getPodGroupControllerIntervalMs(), configuration.getPeriodicControllerBatchSize(), runtime);
        this.schedulerName = configuration.getSchedulerName();
        this.kubeApiFacade = kubeApiFacade;
    }

    @Override
    protected boolean isReady() {
        return kubeApiFacade.getPodInformer().hasSynced();
    }

    @Override
    protected List<V1Pod> getItemsToProcess() {
        return kubeApiFacade.getPodInformer().getIndexer().list().stream()
                .filter(this::needsPodGroup)
                .collect(Collectors.toList());
    }

    @Override
    protected boolean processItem(V1Pod pod) {
        V1ObjectMeta metadata = pod.getMetadata();
        String podGroupName = newPodGroupName(pod);
        try {
            kubeApiFacade.createPodGroup(newPodGroup(pod));
            logger.info("Created pod group {} for pod {}/{}", podGroupName, metadata.getNamespace(), metadata.getName());
        } catch (KubeApiException e) {
            if (e.getErrorCode() != KubeApiException.ErrorCode.CONFLICT_ALREADY_EXISTS) {
                logger.warn("Failed to create pod group {}: {}", podGroupName, e.getMessage());
                return false;
            }
        }

        V1Pod annotated = KubeObjects.deepCopy(pod, V1Pod.class);
        Map<String, String> annotations = new HashMap<>(StringExt.nonNull(annotated.getMetadata().getAnnotations()));
        annotations.put(SchedulingV1beta1.GROUP_NAME_ANNOTATION, podGroupName);
        annotated.getMetadata().setAnnotations(annotations);
        try {
            kubeApiFacade.replaceNamespacedPod(metadata.getNamespace(), metadata.getName(), annotated);
        } catch (KubeApiException e) {
            logger.warn("Failed to annotate pod {}/{} with its pod group: {}", metadata.getNamespace(), metadata.getName(), e.getMessage());
            return false;
        }
        return true;
    }

    @Override
    protected String describe(V1Pod pod) {
        return pod.getMetadata() == null ? "<no metadata>" : pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName();
    }

    @VisibleForTesting
    boolean needsPodGroup(V1Pod pod) {
        if (pod.getMetadata() == null || pod.getSpec() == null) {
            return false;
        }
        if (!schedulerName.equals(pod.getSpec().getSchedulerName())) {
            return false;
        }
        return StringExt.isEmpty(StringExt.getOrEmpty(pod.getMetadata().getAnnotations(), SchedulingV1beta1.GROUP_NAME_ANNOTATION));
    }

    @VisibleForTesting
    static String newPodGroupName(V1Pod pod) {
        return POD_GROUP_NAME_PREFIX + pod.getMetadata().getUid();
    }

    @VisibleForTesting
    static V1beta1PodGroup newPodGroup(V1Pod pod) {
        V1ObjectMeta podMetadata = pod.getMetadata();

        V1beta1PodGroupSpec spec = new V1beta1PodGroupSpec();
        spec.setMinMember(1);
        spec.setQueue(SchedulingV1beta1.DEFAULT_QUEUE);
        spec.setPriorityClassName(pod.getSpec().getPriorityClassName());

        V1beta1PodGroup podGroup = new V1beta1PodGroup();
        podGroup.setApiVersion(SchedulingV1beta1.API_VERSION);
        podGroup.setKind(SchedulingV1beta1.POD_GROUP_KIND);
        podGroup.setMetadata(new V1ObjectMeta()
                .name(newPodGroupName(pod))
                .namespace(podMetadata.getNamespace())
                .addOwnerReferencesItem(new V1OwnerReference()
                        .apiVersion("v1")
                        .kind("Pod")
                        .name(podMetadata.getName())
                        .uid(podMetadata.getUid())
                        .controller(true)
                        .blockOwnerDeletion(true)
                )
        );
        podGroup.setSpec(spec);
        return podGroup;
    }
}
