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

package sh.volcano.controllers.supervisor;

import java.net.UnknownHostException;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubernetes.client.extended.leaderelection.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.common.runtime.SystemAbortEvent;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.concurrent.StopSignal;
import sh.volcano.controllers.health.HealthzServer;
import sh.volcano.controllers.leaderelection.LeaderCallbacks;
import sh.volcano.controllers.leaderelection.LeaderElectionConfiguration;
import sh.volcano.controllers.leaderelection.LeaderElectionException;
import sh.volcano.controllers.leaderelection.LeaderElectionSupervisor;
import sh.volcano.controllers.leaderelection.LeaderTransitionRecorder;
import sh.volcano.controllers.leaderelection.LeaseLockFactory;
import sh.volcano.controllers.leaderelection.LeaseLocks;

/**
 * Top level run loop of the controller manager process. Starts the health check endpoint, and then runs the
 * controllers either directly, or as the active phase of the leader election. The run method never returns normally:
 * every way it can end is reported as a {@link ControllerServerException}.
 */
@Singleton
public class ControllerServer {

    private static final Logger logger = LoggerFactory.getLogger(ControllerServer.class);

    private static final String COMPONENT = "controllerServer";

    private final LeaderElectionConfiguration leaderElectionConfiguration;
    private final ControllerSupervisor supervisor;
    private final LeaseLockFactory leaseLockFactory;
    private final LeaderTransitionRecorder transitionRecorder;
    private final HealthzServer healthzServer;
    private final VolcanoRuntime runtime;

    @Inject
    public ControllerServer(LeaderElectionConfiguration leaderElectionConfiguration,
                            ControllerSupervisor supervisor,
                            LeaseLockFactory leaseLockFactory,
                            LeaderTransitionRecorder transitionRecorder,
                            HealthzServer healthzServer,
                            VolcanoRuntime runtime) {
        this.leaderElectionConfiguration = leaderElectionConfiguration;
        this.supervisor = supervisor;
        this.leaseLockFactory = leaseLockFactory;
        this.transitionRecorder = transitionRecorder;
        this.healthzServer = healthzServer;
        this.runtime = runtime;
    }

    public void run(StopSignal stopSignal) throws ControllerServerException {
        try {
            healthzServer.start();
        } catch (Exception e) {
            throw ControllerServerException.startupFailure("cannot start the healthz server: " + e.getMessage(), e);
        }
        try {
            if (!leaderElectionConfiguration.isEnabled()) {
                logger.info("Leader election disabled; starting the controllers");
                supervisor.run(stopSignal);
                throw ControllerServerException.finishedWithoutLeaderElection();
            }
            runWithLeaderElection(stopSignal);
        } finally {
            healthzServer.stop();
        }
    }

    private void runWithLeaderElection(StopSignal stopSignal) {
        String identity;
        try {
            identity = LeaseLocks.newIdentity();
        } catch (UnknownHostException e) {
            throw ControllerServerException.startupFailure("cannot resolve the local host name", e);
        }

        Lock lock;
        try {
            lock = leaseLockFactory.create(identity);
        } catch (LeaderElectionException e) {
            runtime.beforeAbort(SystemAbortEvent.nonrecoverable(COMPONENT, "lockCreationFailed", e.getMessage(), runtime.getClock().wallTime()));
            throw ControllerServerException.lockCreationFailed(e);
        }

        LeaderElectionSupervisor elector;
        try {
            elector = new LeaderElectionSupervisor(lock, leaderElectionConfiguration, transitionRecorder, runtime);
        } catch (LeaderElectionException e) {
            throw ControllerServerException.startupFailure(e.getMessage(), e);
        }

        try {
            elector.run(new LeaderCallbacks() {
                @Override
                public void onStartedLeading(StopSignal activeSignal) {
                    logger.info("Elected as the leader ({}); starting the controllers", identity);
                    supervisor.run(activeSignal);
                }

                @Override
                public void onStoppedLeading() {
                    runtime.beforeAbort(SystemAbortEvent.recoverable(
                            COMPONENT,
                            "leaderLost",
                            "Leader election lost: " + identity,
                            runtime.getClock().wallTime()
                    ));
                }
            }, stopSignal);
        } catch (LeaderElectionException e) {
            switch (e.getErrorCode()) {
                case Stopped:
                    throw ControllerServerException.stopped(e);
                case LockCreationFailed:
                    throw ControllerServerException.lockCreationFailed(e);
                case InvalidConfiguration:
                    throw ControllerServerException.startupFailure(e.getMessage(), e);
                default:
                    throw ControllerServerException.leadershipLost(e);
            }
        }
        throw new IllegalStateException("Leader election finished without an error");
    }
}
