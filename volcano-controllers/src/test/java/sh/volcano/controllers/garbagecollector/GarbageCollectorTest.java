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

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.cache.Indexer;
import io.kubernetes.client.openapi.ApiException;
import org.junit.Before;
import org.junit.Test;
import sh.volcano.api.batch.v1alpha1.BatchV1alpha1;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.runtime.VolcanoRuntimes;
import sh.volcano.common.util.archaius2.Archaius2Ext;
import sh.volcano.common.util.time.Clocks;
import sh.volcano.common.util.time.TestClock;
import sh.volcano.controllers.ControllersConfiguration;
import sh.volcano.controllers.kubernetes.KubeApiException;
import sh.volcano.controllers.kubernetes.KubeApiFacade;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sh.volcano.controllers.job.JobFixtures.newJob;
import static sh.volcano.controllers.job.JobFixtures.withPhase;

public class GarbageCollectorTest {

    private static final long START_TIME = 1_600_000_000_000L;

    private final TestClock clock = Clocks.test(START_TIME);

    private final VolcanoRuntime runtime = VolcanoRuntimes.test(clock);

    private final KubeApiFacade kubeApiFacade = mock(KubeApiFacade.class);

    @SuppressWarnings("unchecked")
    private final SharedIndexInformer<V1alpha1Job> jobInformer = mock(SharedIndexInformer.class);
    @SuppressWarnings("unchecked")
    private final Indexer<V1alpha1Job> jobIndexer = mock(Indexer.class);

    private GarbageCollector garbageCollector;

    @Before
    public void setUp() {
        when(kubeApiFacade.getJobInformer()).thenReturn(jobInformer);
        when(jobInformer.getIndexer()).thenReturn(jobIndexer);
        when(jobInformer.hasSynced()).thenReturn(true);

        garbageCollector = new GarbageCollector(
                Archaius2Ext.newConfiguration(ControllersConfiguration.class),
                kubeApiFacade,
                runtime
        );
    }

    @Test
    public void testExpiryTime() {
        assertThat(GarbageCollector.getExpiryTime(finishedJob("noTtl", null, 0))).isEmpty();
        assertThat(GarbageCollector.getExpiryTime(withTtl(newJob("running"), 10))).isEmpty();
        assertThat(GarbageCollector.getExpiryTime(finishedJob("finished", 10, 0))).contains(START_TIME + 10_000);
    }

    @Test
    public void testExpiredJobIsDeleted() {
        V1alpha1Job expired = finishedJob("expired", 60, 0);
        V1alpha1Job notYetExpired = finishedJob("fresh", 600, 0);
        V1alpha1Job withoutTtl = finishedJob("keep", null, 0);
        when(jobIndexer.list()).thenReturn(Arrays.asList(expired, notYetExpired, withoutTtl));

        garbageCollector.runIteration();
        verify(kubeApiFacade, never()).deleteJob(any(), any());

        clock.advanceTime(60, TimeUnit.SECONDS);
        garbageCollector.runIteration();
        verify(kubeApiFacade).deleteJob("default", "expired");
        verify(kubeApiFacade, never()).deleteJob("default", "fresh");
        verify(kubeApiFacade, never()).deleteJob("default", "keep");
        assertThat(gauge("successes")).isEqualTo(1);
    }

    @Test
    public void testAlreadyDeletedJobCountsAsSuccess() {
        when(jobIndexer.list()).thenReturn(Arrays.asList(finishedJob("expired", 0, 0)));
        doThrow(new KubeApiException(new ApiException(404, "Not Found"))).when(kubeApiFacade).deleteJob(any(), any());

        garbageCollector.runIteration();

        assertThat(gauge("successes")).isEqualTo(1);
        assertThat(gauge("failures")).isEqualTo(0);
    }

    @Test
    public void testDeleteFailureIsCounted() {
        when(jobIndexer.list()).thenReturn(Arrays.asList(finishedJob("expired", 0, 0)));
        doThrow(new KubeApiException("simulated error", null)).when(kubeApiFacade).deleteJob(any(), any());

        garbageCollector.runIteration();

        assertThat(gauge("successes")).isEqualTo(0);
        assertThat(gauge("failures")).isEqualTo(1);
    }

    @Test
    public void testNothingIsDeletedBeforeCacheSync() {
        when(jobInformer.hasSynced()).thenReturn(false);
        when(jobIndexer.list()).thenReturn(Arrays.asList(finishedJob("expired", 0, 0)));

        garbageCollector.runIteration();

        verify(kubeApiFacade, never()).deleteJob(any(), any());
    }

    private V1alpha1Job finishedJob(String name, Integer ttlSeconds, long finishedAgoMs) {
        OffsetDateTime finishedAt = OffsetDateTime.ofInstant(Instant.ofEpochMilli(clock.wallTime() - finishedAgoMs), ZoneOffset.UTC);
        return withTtl(withPhase(newJob(name), BatchV1alpha1.PHASE_COMPLETED, finishedAt), ttlSeconds);
    }

    private static V1alpha1Job withTtl(V1alpha1Job job, Integer ttlSeconds) {
        job.getSpec().setTtlSecondsAfterFinished(ttlSeconds);
        return job;
    }

    private double gauge(String type) {
        return runtime.getRegistry().gauge("volcano.controllers." + GarbageCollector.NAME, "type", type).value();
    }
}
