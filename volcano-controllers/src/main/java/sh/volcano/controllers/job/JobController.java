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

package sh.volcano.controllers.job;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import io.kubernetes.client.extended.workqueue.DefaultRateLimitingQueue;
import io.kubernetes.client.extended.workqueue.RateLimitingQueue;
import io.kubernetes.client.informer.ResourceEventHandler;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.api.batch.v1alpha1.BatchV1alpha1;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.batch.v1alpha1.V1alpha1TaskSpec;
import sh.volcano.api.helpers.JobHelpers;
import sh.volcano.api.scheduling.v1beta1.SchedulingV1beta1;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroup;
import sh.volcano.api.scheduling.v1beta1.V1beta1PodGroupSpec;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.ExecutorsExt;
import sh.volcano.common.util.StringExt;
import sh.volcano.common.util.concurrent.StopSignal;
import sh.volcano.controllers.ControllersConfiguration;
import sh.volcano.controllers.job.plugins.JobPluginException;
import sh.volcano.controllers.kubernetes.KubeApiException;
import sh.volcano.controllers.kubernetes.KubeApiFacade;
import sh.volcano.controllers.kubernetes.KubeObjects;
import sh.volcano.controllers.supervisor.Controller;

/**
 * Creates the pod group and the pods of a job, with the job plugins applied. Jobs are processed by a pool of
 * workers fed from a rate limiting work queue; the queue hands a given job key to one worker at a time, so the
 * plugin hooks of a job never run concurrently.
 */
@Singleton
public class JobController implements Controller {

    private static final Logger logger = LoggerFactory.getLogger(JobController.class);

    public static final String NAME = "jobController";

    private static final Duration SYNC_CHECK_INTERVAL = Duration.ofMillis(100);

    private final ControllersConfiguration configuration;
    private final KubeApiFacade kubeApiFacade;
    private final JobPluginManager pluginManager;
    private final VolcanoRuntime runtime;

    /**
     * Last known state of the deleted jobs, kept until their delete hooks succeed.
     */
    private final Map<String, V1alpha1Job> deletedJobs = new ConcurrentHashMap<>();

    @Inject
    public JobController(ControllersConfiguration configuration,
                         KubeApiFacade kubeApiFacade,
                         JobPluginManager pluginManager,
                         VolcanoRuntime runtime) {
        this.configuration = configuration;
        this.kubeApiFacade = kubeApiFacade;
        this.pluginManager = pluginManager;
        this.runtime = runtime;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void run(StopSignal stopSignal) throws Exception {
        ExecutorService queueExecutor = ExecutorsExt.namedSingleThreadExecutor(NAME + "-queue");
        RateLimitingQueue<String> queue = new DefaultRateLimitingQueue<>(queueExecutor);

        kubeApiFacade.getJobInformer().addEventHandler(new ResourceEventHandler<V1alpha1Job>() {
            @Override
            public void onAdd(V1alpha1Job job) {
                queue.add(JobHelpers.getJobKey(job));
            }

            @Override
            public void onUpdate(V1alpha1Job oldJob, V1alpha1Job newJob) {
                queue.add(JobHelpers.getJobKey(newJob));
            }

            @Override
            public void onDelete(V1alpha1Job job, boolean deletedFinalStateUnknown) {
                queue.add(recordDeletedJob(job));
            }
        });

        int workerCount = Math.max(1, configuration.getWorkerThreads());
        ExecutorService workers = ExecutorsExt.instrumentedFixedSizeThreadPool(runtime.getRegistry(), NAME + "-worker", workerCount);
        try {
            while (!stopSignal.isStopped() && !(kubeApiFacade.getJobInformer().hasSynced() && kubeApiFacade.getPodInformer().hasSynced())) {
                stopSignal.await(SYNC_CHECK_INTERVAL);
            }
            if (stopSignal.isStopped()) {
                return;
            }
            logger.info("Job and pod informers synced; starting {} workers", workerCount);
            for (int i = 0; i < workerCount; i++) {
                workers.submit(() -> runWorker(queue));
            }
            stopSignal.await();
        } finally {
            queue.shutDown();
            workers.shutdown();
            if (!workers.awaitTermination(configuration.getControllerShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                logger.warn("Job controller workers did not finish in time");
                workers.shutdownNow();
            }
            queueExecutor.shutdownNow();
        }
    }

    private void runWorker(RateLimitingQueue<String> queue) {
        while (!queue.isShuttingDown()) {
            String key;
            try {
                key = queue.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (key == null) {
                return;
            }
            try {
                processJob(key);
                queue.forget(key);
            } catch (Exception e) {
                logger.warn("Failed to process job {} (retry #{}): {}", key, queue.numRequeues(key), e.getMessage());
                logger.debug("Job processing error", e);
                queue.addRateLimited(key);
            } finally {
                queue.done(key);
            }
        }
    }

    @VisibleForTesting
    String recordDeletedJob(V1alpha1Job job) {
        String key = JobHelpers.getJobKey(job);
        deletedJobs.put(key, job);
        return key;
    }

    @VisibleForTesting
    void processJob(String key) {
        V1alpha1Job job = kubeApiFacade.getJobInformer().getIndexer().getByKey(key);
        if (job == null) {
            V1alpha1Job deleted = deletedJobs.get(key);
            if (deleted != null) {
                pluginManager.onJobDelete(deleted);
                deletedJobs.remove(key);
                logger.info("Job {} deleted", key);
            }
            return;
        }
        deletedJobs.remove(key);
        if (JobHelpers.isTerminal(job)) {
            return;
        }
        syncJob(KubeObjects.deepCopy(job, V1alpha1Job.class));
    }

    private void syncJob(V1alpha1Job job) {
        Map<String, String> controlledBefore = new HashMap<>(JobHelpers.getControlledResources(job));
        pluginManager.onJobAdd(job);
        if (!controlledBefore.equals(JobHelpers.getControlledResources(job))) {
            kubeApiFacade.updateJobStatus(job);
        }

        ensurePodGroup(job);

        Set<String> existingPods = findPodNames(job);
        for (V1alpha1TaskSpec task : JobHelpers.getTasks(job)) {
            for (int i = 0; i < task.getReplicas(); i++) {
                String podName = JobHelpers.makePodName(JobHelpers.getName(job), task.getName(), i);
                if (existingPods.contains(podName)) {
                    continue;
                }
                createPod(job, newPod(job, task, i));
            }
        }
    }

    private void ensurePodGroup(V1alpha1Job job) {
        if (kubeApiFacade.getPodGroupInformer().getIndexer().getByKey(JobHelpers.getJobKey(job)) != null) {
            return;
        }
        V1beta1PodGroupSpec spec = new V1beta1PodGroupSpec();
        spec.setMinMember(job.getSpec() == null ? 0 : job.getSpec().getMinAvailable());
        spec.setQueue(job.getSpec() == null || StringExt.isEmpty(job.getSpec().getQueue())
                ? SchedulingV1beta1.DEFAULT_QUEUE
                : job.getSpec().getQueue()
        );

        V1beta1PodGroup podGroup = new V1beta1PodGroup();
        podGroup.setApiVersion(SchedulingV1beta1.API_VERSION);
        podGroup.setKind(SchedulingV1beta1.POD_GROUP_KIND);
        podGroup.setMetadata(new V1ObjectMeta()
                .name(JobHelpers.getName(job))
                .namespace(JobHelpers.getNamespace(job))
                .addOwnerReferencesItem(JobHelpers.newControllerReference(job))
        );
        podGroup.setSpec(spec);
        try {
            kubeApiFacade.createPodGroup(podGroup);
        } catch (KubeApiException e) {
            if (e.getErrorCode() != KubeApiException.ErrorCode.CONFLICT_ALREADY_EXISTS) {
                throw e;
            }
        }
    }

    private void createPod(V1alpha1Job job, V1Pod pod) throws JobPluginException {
        pluginManager.onPodCreate(pod, job);
        try {
            kubeApiFacade.createNamespacedPod(JobHelpers.getNamespace(job), pod);
            logger.info("Created pod {}/{}", JobHelpers.getNamespace(job), pod.getMetadata().getName());
        } catch (KubeApiException e) {
            if (e.getErrorCode() != KubeApiException.ErrorCode.CONFLICT_ALREADY_EXISTS) {
                throw e;
            }
        }
    }

    private Set<String> findPodNames(V1alpha1Job job) {
        String namespace = JobHelpers.getNamespace(job);
        String jobName = JobHelpers.getName(job);
        return kubeApiFacade.getPodInformer().getIndexer().list().stream()
                .filter(pod -> pod.getMetadata() != null && namespace.equals(pod.getMetadata().getNamespace()))
                .filter(pod -> jobName.equals(StringExt.getOrEmpty(pod.getMetadata().getLabels(), BatchV1alpha1.JOB_NAME_LABEL)))
                .map(pod -> pod.getMetadata().getName())
                .collect(Collectors.toSet());
    }

    @VisibleForTesting
    static V1Pod newPod(V1alpha1Job job, V1alpha1TaskSpec task, int index) {
        V1PodTemplateSpec template = task.getTemplate() == null
                ? new V1PodTemplateSpec()
                : KubeObjects.deepCopy(task.getTemplate(), V1PodTemplateSpec.class);
        V1ObjectMeta metadata = template.getMetadata() == null ? new V1ObjectMeta() : template.getMetadata();
        V1PodSpec spec = template.getSpec() == null ? new V1PodSpec() : template.getSpec();

        Map<String, String> labels = new HashMap<>(StringExt.nonNull(metadata.getLabels()));
        labels.put(BatchV1alpha1.JOB_NAME_LABEL, JobHelpers.getName(job));
        labels.put(BatchV1alpha1.JOB_NAMESPACE_LABEL, JobHelpers.getNamespace(job));
        labels.put(BatchV1alpha1.TASK_SPEC_LABEL, task.getName());

        Map<String, String> annotations = new HashMap<>(StringExt.nonNull(metadata.getAnnotations()));
        annotations.put(SchedulingV1beta1.GROUP_NAME_ANNOTATION, JobHelpers.getName(job));

        metadata.name(JobHelpers.makePodName(JobHelpers.getName(job), task.getName(), index))
                .namespace(JobHelpers.getNamespace(job))
                .labels(labels)
                .annotations(annotations)
                .ownerReferences(null)
                .addOwnerReferencesItem(JobHelpers.newControllerReference(job));

        if (StringExt.isEmpty(spec.getSchedulerName()) && job.getSpec() != null) {
            spec.setSchedulerName(job.getSpec().getSchedulerName());
        }

        // Same host names as listed in the ssh config of the job
        if (StringExt.isEmpty(spec.getHostname())) {
            spec.setHostname(metadata.getName());
        }
        if (StringExt.isEmpty(spec.getSubdomain())) {
            spec.setSubdomain(JobHelpers.getName(job));
        }

        return new V1Pod()
                .apiVersion("v1")
                .kind("Pod")
                .metadata(metadata)
                .spec(spec);
    }
}
