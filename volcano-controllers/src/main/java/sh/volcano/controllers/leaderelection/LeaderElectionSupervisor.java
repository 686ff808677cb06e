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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.netflix.spectator.api.Gauge;
import io.kubernetes.client.extended.leaderelection.LeaderElectionConfig;
import io.kubernetes.client.extended.leaderelection.LeaderElectionRecord;
import io.kubernetes.client.extended.leaderelection.LeaderElector;
import io.kubernetes.client.extended.leaderelection.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.ExecutorsExt;
import sh.volcano.common.util.concurrent.StopSignal;

/**
 * Runs the active phase of this process under the client-java {@link LeaderElector}. The elector itself acquires and
 * renews the lease; this class maps the ways it can end to {@link LeaderElectionException} error codes, and gives the
 * lease up when the process stops leading on its own.
 */
public class LeaderElectionSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(LeaderElectionSupervisor.class);

    private static final String METRIC_ROOT = "volcano.leaderElection.";

    private static final double JITTER_FACTOR = 1.2;

    private final Lock lock;
    private final String identity;
    private final LeaderElectionConfig electionConfig;
    private final long renewDeadlineMs;
    private final LeaderTransitionRecorder transitionRecorder;

    private final Gauge leaderGauge;

    private volatile boolean leader;

    public LeaderElectionSupervisor(Lock lock,
                                    LeaderElectionConfiguration configuration,
                                    LeaderTransitionRecorder transitionRecorder,
                                    VolcanoRuntime runtime) {
        validate(configuration);
        this.lock = lock;
        this.identity = lock.identity();
        this.renewDeadlineMs = configuration.getRenewDeadlineMs();
        this.transitionRecorder = transitionRecorder;
        this.electionConfig = new LeaderElectionConfig(
                lock,
                Duration.ofMillis(configuration.getLeaseDurationMs()),
                Duration.ofMillis(configuration.getRenewDeadlineMs()),
                Duration.ofMillis(configuration.getRetryPeriodMs())
        );
        this.leaderGauge = runtime.getRegistry().gauge(METRIC_ROOT + "isLeader");
        leaderGauge.set(0);
    }

    public String getIdentity() {
        return identity;
    }

    /**
     * @return true between the lease acquisition and the moment the elector gives the leadership up
     */
    public boolean isLeader() {
        return leader;
    }

    /**
     * Run the election until the leadership is lost or the stop signal fires. Never returns normally.
     *
     * @throws LeaderElectionException with {@link LeaderElectionException.ErrorCode#LeadershipLost} if the lease
     *                                 could not be renewed, or {@link LeaderElectionException.ErrorCode#Stopped} if the
     *                                 stop signal fired
     */
    public void run(LeaderCallbacks callbacks, StopSignal stopSignal) throws LeaderElectionException {
        logger.info("Starting leader election: identity={}, lock={}", identity, lock.describe());

        LeaderElector elector = newElector();
        StopSignal activeSignal = stopSignal.newChild();
        CompletableFuture<Boolean> acquired = new CompletableFuture<>();
        AtomicBoolean lost = new AtomicBoolean();

        ExecutorService electionExecutor = ExecutorsExt.namedSingleThreadExecutor("leader-election");
        electionExecutor.submit(() -> {
            try {
                elector.run(
                        () -> acquired.complete(true),
                        () -> {
                            lost.set(true);
                            setLeader(false);
                            activeSignal.stop();
                        }
                );
            } catch (Throwable e) {
                logger.error("Leader election loop of {} failed", identity, e);
            } finally {
                acquired.complete(false);
            }
        });
        stopSignal.onStop(() -> acquired.complete(false));

        if (!acquired.join()) {
            shutdown(elector, electionExecutor);
            release();
            if (stopSignal.isStopped()) {
                throw LeaderElectionException.stopped(identity, false);
            }
            throw LeaderElectionException.leadershipLost(identity, lock.describe());
        }

        logger.info("Acquired the lease {}: identity={}", lock.describe(), identity);
        if (!lost.get()) {
            setLeader(true);
        }
        transitionRecorder.record(identity, LeaderTransitionRecorder.BECAME_LEADER);

        Throwable activePhaseError = null;
        try {
            callbacks.onStartedLeading(activeSignal);
        } catch (Throwable e) {
            logger.error("Active phase failed", e);
            activePhaseError = e;
        } finally {
            activeSignal.stop();
            setLeader(false);
        }

        boolean leaseLost = lost.get();
        shutdown(elector, electionExecutor);
        transitionRecorder.record(identity, LeaderTransitionRecorder.STOPPED_LEADING);

        if (leaseLost) {
            logger.error("Failed to renew the lease {} within {}ms", lock.describe(), renewDeadlineMs);
            callbacks.onStoppedLeading();
            throw LeaderElectionException.leadershipLost(identity, lock.describe());
        }
        release();
        if (stopSignal.isStopped() && activePhaseError == null) {
            throw LeaderElectionException.stopped(identity, true);
        }
        callbacks.onStoppedLeading();
        throw LeaderElectionException.activePhaseFinished(identity, activePhaseError);
    }

    /**
     * Give up the lease, so that other candidates can take it over without waiting for its expiry. A record without
     * renew time is treated by the elector as not held.
     */
    void release() {
        try {
            LeaderElectionRecord current = lock.get();
            if (current == null || !identity.equals(current.getHolderIdentity())) {
                return;
            }
            LeaderElectionRecord released = new LeaderElectionRecord("", 1, null, null, current.getLeaderTransitions());
            if (lock.update(released)) {
                logger.info("Released the lease {}", lock.describe());
            } else {
                logger.warn("Cannot release the lease {}; it will expire on its own", lock.describe());
            }
        } catch (Exception e) {
            logger.warn("Cannot release the lease {}; it will expire on its own", lock.describe(), e);
        }
    }

    private LeaderElector newElector() {
        try {
            return new LeaderElector(electionConfig);
        } catch (IllegalArgumentException e) {
            throw LeaderElectionException.invalidConfiguration(e.getMessage());
        }
    }

    private void shutdown(LeaderElector elector, ExecutorService electionExecutor) {
        try {
            elector.close();
        } catch (Exception e) {
            logger.warn("Cannot close the leader elector of {} cleanly", identity, e);
        }
        electionExecutor.shutdownNow();
        try {
            if (!electionExecutor.awaitTermination(renewDeadlineMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Leader election loop of {} did not terminate in time", identity);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void setLeader(boolean leader) {
        this.leader = leader;
        leaderGauge.set(leader ? 1 : 0);
    }

    private static void validate(LeaderElectionConfiguration configuration) {
        long lease = configuration.getLeaseDurationMs();
        long renew = configuration.getRenewDeadlineMs();
        long retry = configuration.getRetryPeriodMs();
        if (retry <= 0) {
            throw LeaderElectionException.invalidConfiguration("retryPeriodMs must be > 0, is " + retry);
        }
        if (renew <= JITTER_FACTOR * retry) {
            throw LeaderElectionException.invalidConfiguration(String.format("renewDeadlineMs (%s) must be greater than %s * retryPeriodMs (%s)", renew, JITTER_FACTOR, retry));
        }
        if (lease <= renew) {
            throw LeaderElectionException.invalidConfiguration(String.format("leaseDurationMs (%s) must be greater than renewDeadlineMs (%s)", lease, renew));
        }
    }
}
