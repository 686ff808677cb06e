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

import java.util.concurrent.ExecutorService;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubernetes.client.common.KubernetesType;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.util.CallGeneratorParams;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.api.batch.v1alpha1.BatchV1alpha1;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.batch.v1alpha1.V1alpha1JobList;
import sh.volcano.api.scheduling.v1beta1.SchedulingV1beta1;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroup;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroupList;
import sh.volcano.api.scheduling.v1beta1.V1beta1Queue;
import sh.volcano.api.scheduling.v1beta1.V1beta1QueueList;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.Evaluators;
import sh.volcano.controllers.ControllersConfiguration;

@Singleton
public class DefaultKubeApiFacade implements KubeApiFacade {

    private static final Logger logger = LoggerFactory.getLogger(DefaultKubeApiFacade.class);

    public static final String BACKGROUND = "Background";

    private final ControllersConfiguration configuration;
    private final ApiClient apiClient;
    private final CoreV1Api coreV1Api;
    private final GenericKubernetesApi<V1alpha1Job, V1alpha1JobList> jobApi;
    private final GenericKubernetesApi<V1beta1PodGroup, V1beta1PodGroupList> podGroupApi;
    private final GenericKubernetesApi<V1beta1Queue, V1beta1QueueList> queueApi;
    private final VolcanoRuntime runtime;

    private final Object activationLock = new Object();

    private volatile SharedInformerFactory sharedInformerFactory;
    private volatile ExecutorService informerThreadPool;
    private volatile SharedIndexInformer<V1alpha1Job> jobInformer;
    private volatile SharedIndexInformer<V1Pod> podInformer;
    private volatile SharedIndexInformer<V1beta1PodGroup> podGroupInformer;
    private volatile SharedIndexInformer<V1beta1Queue> queueInformer;

    private final KubeInformerMetrics informerMetrics;

    private volatile boolean shutdown;

    @Inject
    public DefaultKubeApiFacade(ControllersConfiguration configuration, ApiClient apiClient, VolcanoRuntime runtime) {
        this.configuration = configuration;
        this.apiClient = apiClient;
        this.coreV1Api = new CoreV1Api(apiClient);
        this.jobApi = new GenericKubernetesApi<>(
                V1alpha1Job.class, V1alpha1JobList.class,
                BatchV1alpha1.GROUP, BatchV1alpha1.VERSION, BatchV1alpha1.JOB_PLURAL,
                apiClient
        );
        this.podGroupApi = new GenericKubernetesApi<>(
                V1beta1PodGroup.class, V1beta1PodGroupList.class,
                SchedulingV1beta1.GROUP, SchedulingV1beta1.VERSION, SchedulingV1beta1.POD_GROUP_PLURAL,
                apiClient
        );
        this.queueApi = new GenericKubernetesApi<>(
                V1beta1Queue.class, V1beta1QueueList.class,
                SchedulingV1beta1.GROUP, SchedulingV1beta1.VERSION, SchedulingV1beta1.QUEUE_PLURAL,
                apiClient
        );
        this.runtime = runtime;
        this.informerMetrics = new KubeInformerMetrics(runtime.getRegistry());
    }

    public void shutdown() {
        synchronized (activationLock) {
            if (sharedInformerFactory != null) {
                sharedInformerFactory.stopAllRegisteredInformers();
            }
            Evaluators.acceptNotNull(informerThreadPool, ExecutorService::shutdownNow);
            informerMetrics.shutdown();
            this.shutdown = true;
        }
    }

    @Override
    public ApiClient getApiClient() {
        return apiClient;
    }

    @Override
    public SharedIndexInformer<V1alpha1Job> getJobInformer() {
        activate();
        return jobInformer;
    }

    @Override
    public SharedIndexInformer<V1Pod> getPodInformer() {
        activate();
        return podInformer;
    }

    @Override
    public SharedIndexInformer<V1beta1PodGroup> getPodGroupInformer() {
        activate();
        return podGroupInformer;
    }

    @Override
    public SharedIndexInformer<V1beta1Queue> getQueueInformer() {
        activate();
        return queueInformer;
    }

    @Override
    public V1alpha1Job updateJobStatus(V1alpha1Job job) throws KubeApiException {
        return checkResponse("updateJobStatus", jobApi.updateStatus(job, V1alpha1Job::getStatus));
    }

    @Override
    public void deleteJob(String namespace, String name) throws KubeApiException {
        checkResponse("deleteJob", jobApi.delete(namespace, name));
    }

    @Override
    public V1Pod createNamespacedPod(String namespace, V1Pod pod) throws KubeApiException {
        try {
            return coreV1Api.createNamespacedPod(namespace, pod, null, null, null);
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1Pod replaceNamespacedPod(String namespace, String name, V1Pod pod) throws KubeApiException {
        try {
            return coreV1Api.replaceNamespacedPod(name, namespace, pod, null, null, null);
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1Secret createNamespacedSecret(String namespace, V1Secret secret) throws KubeApiException {
        try {
            return coreV1Api.createNamespacedSecret(namespace, secret, null, null, null);
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1Secret readNamespacedSecret(String namespace, String name) throws KubeApiException {
        try {
            return coreV1Api.readNamespacedSecret(name, namespace, null, null, null);
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public void deleteNamespacedSecret(String namespace, String name) throws KubeApiException {
        try {
            coreV1Api.deleteNamespacedSecret(
                    name,
                    namespace,
                    null,
                    null,
                    0,
                    null,
                    BACKGROUND,
                    null
            );
        } catch (ApiException e) {
            throw new KubeApiException(e);
        }
    }

    @Override
    public V1beta1PodGroup createPodGroup(V1beta1PodGroup podGroup) throws KubeApiException {
        return checkResponse("createPodGroup", podGroupApi.create(podGroup));
    }

    @Override
    public V1beta1Queue updateQueueStatus(V1beta1Queue queue) throws KubeApiException {
        return checkResponse("updateQueueStatus", queueApi.updateStatus(queue, V1beta1Queue::getStatus));
    }

    private <T extends KubernetesType> T checkResponse(String operation, KubernetesApiResponse<T> response) {
        if (!response.isSuccess()) {
            throw KubeApiException.fromResponse(operation, response);
        }
        return response.getObject();
    }

    private void activate() {
        synchronized (activationLock) {
            if (shutdown) {
                throw new IllegalStateException("Kube API facade is shut down");
            }
            if (sharedInformerFactory != null) {
                return;
            }

            try {
                this.informerThreadPool = KubeApiClients.newInformerThreadPool("kube-shared-informer", runtime);
                this.sharedInformerFactory = new SharedInformerFactory(apiClient, informerThreadPool);

                long resyncMs = configuration.getInformerResyncIntervalMs();
                this.jobInformer = sharedInformerFactory.sharedIndexInformerFor(jobApi, V1alpha1Job.class, resyncMs);
                this.podInformer = createPodInformer(sharedInformerFactory, resyncMs);
                this.podGroupInformer = sharedInformerFactory.sharedIndexInformerFor(podGroupApi, V1beta1PodGroup.class, resyncMs);
                this.queueInformer = sharedInformerFactory.sharedIndexInformerFor(queueApi, V1beta1Queue.class, resyncMs);

                informerMetrics.monitor("job", jobInformer);
                informerMetrics.monitor("pod", podInformer);
                informerMetrics.monitor("podgroup", podGroupInformer);
                informerMetrics.monitor("queue", queueInformer);

                sharedInformerFactory.startAllRegisteredInformers();

                logger.info("Kube job, pod, pod group and queue informers activated");
            } catch (Exception e) {
                logger.error("Could not initialize Kube client shared informers", e);
                if (sharedInformerFactory != null) {
                    try {
                        sharedInformerFactory.stopAllRegisteredInformers();
                    } catch (Exception stopError) {
                        logger.warn("Failed to stop partially initialized informers", stopError);
                    }
                }
                informerMetrics.shutdown();
                Evaluators.acceptNotNull(informerThreadPool, ExecutorService::shutdownNow);
                sharedInformerFactory = null;
                jobInformer = null;
                podInformer = null;
                podGroupInformer = null;
                queueInformer = null;
                throw e;
            }
        }
    }

    private SharedIndexInformer<V1Pod> createPodInformer(SharedInformerFactory sharedInformerFactory, long resyncMs) {
        return sharedInformerFactory.sharedIndexInformerFor(
                (CallGeneratorParams params) -> coreV1Api.listPodForAllNamespacesCall(
                        null,
                        null,
                        null,
                        null,
                        null,
                        null,
                        params.resourceVersion,
                        null,
                        params.timeoutSeconds,
                        params.watch,
                        null
                ),
                V1Pod.class,
                V1PodList.class,
                resyncMs
        );
    }
}
