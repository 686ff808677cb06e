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

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Test;
import sh.volcano.common.runtime.VolcanoRuntimes;
import sh.volcano.common.util.archaius2.Archaius2Ext;
import sh.volcano.common.util.concurrent.StopSignal;

import static com.jayway.awaitility.Awaitility.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class LeaderElectionSupervisorTest {

    private static final String A = "hostA_1";
    private static final String B = "hostB_2";

    private final InMemoryLeaseStore store = new InMemoryLeaseStore();

    private final LeaderTransitionRecorder transitionRecorder = mock(LeaderTransitionRecorder.class);

    private final ExecutorService executor = Executors.newCachedThreadPool();

    /**
     * Number of candidates inside their active phase.
     */
    private final AtomicInteger activeCount = new AtomicInteger();
    private final AtomicBoolean overlap = new AtomicBoolean();

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testInvalidDurations() {
        expectInvalid(newConfiguration(10_000, 10_000, 2_000));
        expectInvalid(newConfiguration(15_000, 6_000, 5_000));
        expectInvalid(newConfiguration(15_000, 10_000, 0));
    }

    @Test(timeout = 30_000)
    public void testStopReleasesTheLease() throws Exception {
        Candidate candidate = start(A, fastConfiguration());
        candidate.awaitActive();

        assertThat(candidate.supervisor.isLeader()).isTrue();
        assertThat(store.getHolder()).isEqualTo(A);

        candidate.stopSignal.stop();

        assertThat(candidate.expectError().getErrorCode()).isEqualTo(LeaderElectionException.ErrorCode.Stopped);
        assertThat(candidate.activeSignalRef.get().isStopped()).isTrue();
        assertThat(candidate.stoppedLeading.get()).isFalse();
        assertThat(candidate.supervisor.isLeader()).isFalse();
        assertThat(store.isReleased()).isTrue();

        verify(transitionRecorder).record(A, LeaderTransitionRecorder.BECAME_LEADER);
        verify(transitionRecorder).record(A, LeaderTransitionRecorder.STOPPED_LEADING);
    }

    @Test(timeout = 30_000)
    public void testNeverTwoLeadersAtTheSameInstant() throws Exception {
        Candidate first = start(A, timedConfiguration());
        first.awaitActive();
        Candidate second = start(B, timedConfiguration());

        // B keeps polling a lease that is renewed, so it must not take over
        Thread.sleep(1_000);
        assertThat(second.activeSignalRef.get()).isNull();

        store.partition(A);

        assertThat(first.expectError().getErrorCode()).isEqualTo(LeaderElectionException.ErrorCode.LeadershipLost);
        assertThat(first.stoppedLeading.get()).isTrue();
        assertThat(first.supervisor.isLeader()).isFalse();

        second.awaitActive();
        assertThat(store.getHolder()).isEqualTo(B);
        assertThat(overlap.get()).describedAs("both candidates active at the same time").isFalse();

        second.stopSignal.stop();
        assertThat(second.expectError().getErrorCode()).isEqualTo(LeaderElectionException.ErrorCode.Stopped);
    }

    @Test(timeout = 30_000)
    public void testReleasedLeaseIsTakenOverBeforeExpiry() throws Exception {
        Candidate first = start(A, timedConfiguration());
        first.awaitActive();
        Candidate second = start(B, timedConfiguration());
        Thread.sleep(500);

        first.stopSignal.stop();
        assertThat(first.expectError().getErrorCode()).isEqualTo(LeaderElectionException.ErrorCode.Stopped);

        // Well below the lease duration
        await().atMost(1_500, TimeUnit.MILLISECONDS).until(() -> second.activeSignalRef.get() != null);
        assertThat(store.getHolder()).isEqualTo(B);
        assertThat(overlap.get()).isFalse();

        second.stopSignal.stop();
        second.expectError();
    }

    @Test(timeout = 30_000)
    public void testActivePhaseReturningEndsTheLeadership() throws Exception {
        AtomicBoolean stoppedLeading = new AtomicBoolean();
        LeaderElectionSupervisor supervisor = new LeaderElectionSupervisor(store.newLock(A), fastConfiguration(), transitionRecorder, VolcanoRuntimes.internal());

        Future<?> result = executor.submit(() -> supervisor.run(new LeaderCallbacks() {
            @Override
            public void onStartedLeading(StopSignal activeSignal) {
            }

            @Override
            public void onStoppedLeading() {
                stoppedLeading.set(true);
            }
        }, StopSignal.newSignal()));

        assertThat(expectError(result).getErrorCode()).isEqualTo(LeaderElectionException.ErrorCode.ActivePhaseFinished);
        assertThat(stoppedLeading.get()).isTrue();
        assertThat(store.isReleased()).isTrue();
    }

    @Test(timeout = 30_000)
    public void testStopBeforeAcquisition() throws Exception {
        Candidate holder = start(B, fastConfiguration());
        holder.awaitActive();

        Candidate waiting = start(A, newConfiguration(15_000, 10_000, 100));
        Thread.sleep(300);
        waiting.stopSignal.stop();

        assertThat(waiting.expectError().getErrorCode()).isEqualTo(LeaderElectionException.ErrorCode.Stopped);
        assertThat(waiting.activeSignalRef.get()).isNull();
        assertThat(store.getHolder()).isEqualTo(B);

        holder.stopSignal.stop();
        holder.expectError();
    }

    private Candidate start(String identity, LeaderElectionConfiguration configuration) {
        Candidate candidate = new Candidate(
                new LeaderElectionSupervisor(store.newLock(identity), configuration, transitionRecorder, VolcanoRuntimes.internal())
        );
        candidate.result = executor.submit(() -> candidate.supervisor.run(candidate, candidate.stopSignal));
        return candidate;
    }

    private void expectInvalid(LeaderElectionConfiguration configuration) {
        try {
            new LeaderElectionSupervisor(store.newLock(A), configuration, transitionRecorder, VolcanoRuntimes.test());
            fail("Expected configuration error");
        } catch (LeaderElectionException e) {
            assertThat(e.getErrorCode()).isEqualTo(LeaderElectionException.ErrorCode.InvalidConfiguration);
        }
    }

    private static LeaderElectionConfiguration fastConfiguration() {
        return newConfiguration(1_000, 500, 100);
    }

    /**
     * Renew deadline is much shorter than the lease duration, so that a lapsed leader gives up well before another
     * candidate takes over.
     */
    private static LeaderElectionConfiguration timedConfiguration() {
        return newConfiguration(3_000, 1_000, 200);
    }

    private static LeaderElectionConfiguration newConfiguration(long leaseDurationMs, long renewDeadlineMs, long retryPeriodMs) {
        return Archaius2Ext.newConfiguration(LeaderElectionConfiguration.class,
                "volcano.controllers.leaderElection.leaseDurationMs", Long.toString(leaseDurationMs),
                "volcano.controllers.leaderElection.renewDeadlineMs", Long.toString(renewDeadlineMs),
                "volcano.controllers.leaderElection.retryPeriodMs", Long.toString(retryPeriodMs)
        );
    }

    private static LeaderElectionException expectError(Future<?> result) throws Exception {
        try {
            result.get(15, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(LeaderElectionException.class);
            return (LeaderElectionException) e.getCause();
        }
        throw new AssertionError("Leader election returned normally");
    }

    private class Candidate implements LeaderCallbacks {

        private final LeaderElectionSupervisor supervisor;
        private final StopSignal stopSignal = StopSignal.newSignal();
        private final AtomicReference<StopSignal> activeSignalRef = new AtomicReference<>();
        private final AtomicBoolean stoppedLeading = new AtomicBoolean();

        private volatile Future<?> result;

        private Candidate(LeaderElectionSupervisor supervisor) {
            this.supervisor = supervisor;
        }

        @Override
        public void onStartedLeading(StopSignal activeSignal) {
            if (activeCount.incrementAndGet() > 1) {
                overlap.set(true);
            }
            activeSignalRef.set(activeSignal);
            try {
                activeSignal.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                activeCount.decrementAndGet();
            }
        }

        @Override
        public void onStoppedLeading() {
            stoppedLeading.set(true);
        }

        private void awaitActive() {
            await().timeout(10, TimeUnit.SECONDS).until(() -> activeSignalRef.get() != null);
        }

        private LeaderElectionException expectError() throws Exception {
            return LeaderElectionSupervisorTest.expectError(result);
        }
    }
}
