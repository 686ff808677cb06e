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

package sh.volcano.controllers.garbagecollector;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.helpers.JobHelpers;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.controllers.ControllersConfiguration;
import sh.volcano.controllers.kubernetes.KubeApiException;
import sh.volcano.controllers.kubernetes.KubeApiFacade;
import sh.volcano.controllers.supervisor.BasePeriodicController;

/**
 * Deletes finished jobs once their {@code ttlSecondsAfterFinished} has elapsed. Jobs without the TTL are kept
 * forever.
 */
@Singleton
public class GarbageCollector extends BasePeriodicController<V1alpha1Job> {

    private static final Logger logger = LoggerFactory.getLogger(GarbageCollector.class);

    public static final String NAME = "garbageCollector";

    private final KubeApiFacade kubeApiFacade;

    @Inject
    public GarbageCollector(ControllersConfiguration configuration, KubeApiFacade kubeApiFacade, VolcanoRuntime runtime) {
        super(NAME, configuration.getGarbageCollectorIntervalMs(), configuration.getPeriodicControllerBatchSize(), runtime);
        this.kubeApiFacade = kubeApiFacade;
    }

    @Override
    protected boolean isReady() {
        return kubeApiFacade.getJobInformer().hasSynced();
    }

    @Override
    protected List<V1alpha1Job> getItemsToProcess() {
        long now = runtime.getClock().wallTime();
        return kubeApiFacade.getJobInformer().getIndexer().list().stream()
                .filter(job -> getExpiryTime(job).map(expiry -> expiry <= now).orElse(false))
                .collect(Collectors.toList());
    }

    @Override
    protected boolean processItem(V1alpha1Job job) {
        try {
            kubeApiFacade.deleteJob(JobHelpers.getNamespace(job), JobHelpers.getName(job));
            logger.info("Deleted expired job: {}", JobHelpers.getJobKey(job));
        } catch (KubeApiException e) {
            if (e.getErrorCode() != KubeApiException.ErrorCode.NOT_FOUND) {
                logger.warn("Failed to delete expired job {}: {}", JobHelpers.getJobKey(job), e.getMessage());
                return false;
            }
        }
        return true;
    }

    @Override
    protected String describe(V1alpha1Job job) {
        return JobHelpers.getJobKey(job);
    }

    /**
     * @return the wall time at which the job expires, or empty if it is not finished or has no TTL
     */
    @VisibleForTesting
    static Optional<Long> getExpiryTime(V1alpha1Job job) {
        if (job.getSpec() == null || job.getSpec().getTtlSecondsAfterFinished() == null || !JobHelpers.isTerminal(job)) {
            return Optional.empty();
        }
        OffsetDateTime finishedAt = job.getStatus().getState().getLastTransitionTime();
        if (finishedAt == null) {
            return Optional.empty();
        }
        return Optional.of(finishedAt.toInstant().toEpochMilli() + job.getSpec().getTtlSecondsAfterFinished() * 1000L);
    }
}
