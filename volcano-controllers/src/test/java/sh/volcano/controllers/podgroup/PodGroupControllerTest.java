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

import java.util.Arrays;
import java.util.Collections;

import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.cache.Indexer;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import sh.volcano.api.scheduling.v1beta1.SchedulingV1beta1;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroup;
import sh.volcano.common.runtime.VolcanoRuntimes;
import sh.volcano.common.util.archaius2.Archaius2Ext;
import sh.volcano.controllers.ControllersConfiguration;
import sh.volcano.controllers.kubernetes.KubeApiException;
import sh.volcano.controllers.kubernetes.KubeApiFacade;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PodGroupControllerTest {

    private final KubeApiFacade kubeApiFacade = mock(KubeApiFacade.class);

    @SuppressWarnings("unchecked")
    private final SharedIndexInformer<V1Pod> podInformer = mock(SharedIndexInformer.class);
    @SuppressWarnings("unchecked")
    private final Indexer<V1Pod> podIndexer = mock(Indexer.class);

    private PodGroupController controller;

    @Before
    public void setUp() {
        when(kubeApiFacade.getPodInformer()).thenReturn(podInformer);
        when(podInformer.getIndexer()).thenReturn(podIndexer);
        when(podInformer.hasSynced()).thenReturn(true);

        controller = new PodGroupController(
                Archaius2Ext.newConfiguration(ControllersConfiguration.class),
                kubeApiFacade,
                VolcanoRuntimes.test()
        );
    }

    @Test
    public void testNeedsPodGroup() {
        assertThat(controller.needsPodGroup(newPod("p1", "volcano"))).isTrue();
        assertThat(controller.needsPodGroup(newPod("p2", "default-scheduler"))).isFalse();
        assertThat(controller.needsPodGroup(withGroup(newPod("p3", "volcano"), "job1"))).isFalse();
        assertThat(controller.needsPodGroup(new V1Pod().metadata(new V1ObjectMeta().name("p4")))).isFalse();
    }

    @Test
    public void testNewPodGroup() {
        V1Pod pod = newPod("p1", "volcano");
        pod.getSpec().setPriorityClassName("high");

        V1beta1PodGroup podGroup = PodGroupController.newPodGroup(pod);

        assertThat(podGroup.getMetadata().getName()).isEqualTo("podgroup-p1-uid");
        assertThat(podGroup.getMetadata().getNamespace()).isEqualTo("default");
        assertThat(podGroup.getSpec().getMinMember()).isEqualTo(1);
        assertThat(podGroup.getSpec().getQueue()).isEqualTo(SchedulingV1beta1.DEFAULT_QUEUE);
        assertThat(podGroup.getSpec().getPriorityClassName()).isEqualTo("high");

        V1OwnerReference owner = podGroup.getMetadata().getOwnerReferences().get(0);
        assertThat(owner.getKind()).isEqualTo("Pod");
        assertThat(owner.getName()).isEqualTo("p1");
        assertThat(owner.getUid()).isEqualTo("p1-uid");
        assertThat(owner.getController()).isTrue();
    }

    @Test
    public void testPlainPodIsAnnotatedWithNewPodGroup() {
        V1Pod pod = newPod("p1", "volcano");
        when(podIndexer.list()).thenReturn(Arrays.asList(pod, newPod("p2", "default-scheduler"), withGroup(newPod("p3", "volcano"), "job1")));

        controller.runIteration();

        verify(kubeApiFacade).createPodGroup(any(V1beta1PodGroup.class));

        ArgumentCaptor<V1Pod> podCaptor = ArgumentCaptor.forClass(V1Pod.class);
        verify(kubeApiFacade).replaceNamespacedPod(eq("default"), eq("p1"), podCaptor.capture());
        assertThat(podCaptor.getValue().getMetadata().getAnnotations())
                .containsEntry(SchedulingV1beta1.GROUP_NAME_ANNOTATION, "podgroup-p1-uid");

        // The informer cache object is not modified
        assertThat(pod.getMetadata().getAnnotations()).isNull();
    }

    @Test
    public void testExistingPodGroupIsReused() {
        when(podIndexer.list()).thenReturn(Arrays.asList(newPod("p1", "volcano")));
        when(kubeApiFacade.createPodGroup(any())).thenThrow(
                new KubeApiException(new ApiException(409, Collections.emptyMap(), "AlreadyExists"))
        );

        controller.runIteration();

        verify(kubeApiFacade).replaceNamespacedPod(eq("default"), eq("p1"), any(V1Pod.class));
    }

    @Test
    public void testPodIsNotAnnotatedIfPodGroupCreationFails() {
        when(podIndexer.list()).thenReturn(Arrays.asList(newPod("p1", "volcano")));
        when(kubeApiFacade.createPodGroup(any())).thenThrow(new KubeApiException("simulated error", null));

        controller.runIteration();

        verify(kubeApiFacade, never()).replaceNamespacedPod(any(), any(), any());
    }

    private static V1Pod newPod(String name, String schedulerName) {
        return new V1Pod()
                .metadata(new V1ObjectMeta().name(name).namespace("default").uid(name + "-uid"))
                .spec(new V1PodSpec().schedulerName(schedulerName));
    }

    private static V1Pod withGroup(V1Pod pod, String groupName) {
        pod.getMetadata().putAnnotationsItem(SchedulingV1beta1.GROUP_NAME_ANNOTATION, groupName);
        return pod;
    }
}
