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

import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1Secret;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroup;
import sh.volcano.api.scheduling.v1beta1.V1beta1Queue;

/**
 * Kubernetes API shared by all controllers: one API client and one set of informers.
 * {@link KubeApiException} with {@link KubeApiException.ErrorCode#NOT_FOUND} is thrown if an object to modify
 * does not exist.
 */
public interface KubeApiFacade {

    ApiClient getApiClient();

    /**
     * Informers are created and started on the first access to any of them.
     */
    SharedIndexInformer<V1alpha1Job> getJobInformer();

    SharedIndexInformer<V1Pod> getPodInformer();

    SharedIndexInformer<V1beta1PodGroup> getPodGroupInformer();

    SharedIndexInformer<V1beta1Queue> getQueueInformer();

    V1alpha1Job updateJobStatus(V1alpha1Job job) throws KubeApiException;

    void deleteJob(String namespace, String name) throws KubeApiException;

    V1Pod createNamespacedPod(String namespace, V1Pod pod) throws KubeApiException;

    V1Pod replaceNamespacedPod(String namespace, String name, V1Pod pod) throws KubeApiException;

    V1Secret createNamespacedSecret(String namespace, V1Secret secret) throws KubeApiException;

    V1Secret readNamespacedSecret(String namespace, String name) throws KubeApiException;

    void deleteNamespacedSecret(String namespace, String name) throws KubeApiException;

    V1beta1PodGroup createPodGroup(V1beta1PodGroup podGroup) throws KubeApiException;

    V1beta1Queue updateQueueStatus(V1beta1Queue queue) throws KubeApiException;
}
