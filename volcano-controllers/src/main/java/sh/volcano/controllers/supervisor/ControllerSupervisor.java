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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.ExecutorsExt;
import sh.volcano.common.util.concurrent.StopSignal;
import sh.volcano.common.util.time.Clock;
import sh.volcano.controllers.ControllersConfiguration;

/**
 * Runs the fixed set of controllers, each on its own thread, until the stop signal fires. Before returning, waits for
 * all of them to finish, up to the configured shutdown timeout.
 */
@Singleton
public class ControllerSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ControllerSupervisor.class);

    private static final String METRIC_RUNNING = "volcano.controllers.running";

    private final List<Controller> controllers;
    private final ControllersConfiguration configuration;
    private final Clock clock;
    private final Gauge runningGauge;

    @Inject
    public ControllerSupervisor(Set<Controller> controllers,
                                ControllersConfiguration configuration,
                                VolcanoRuntime runtime) {
        this.controllers = new ArrayList<>(controllers);
        this.configuration = configuration;
        this.clock = runtime.getClock();
        this.runningGauge = runtime.getRegistry().gauge(METRIC_RUNNING);
    }

    public void run(StopSignal stopSignal) {
        StopSignal controllersSignal = stopSignal.newChild();
        Map<Controller, ExecutorService> executors = new LinkedHashMap<>();
        Map<Controller, Future<?>> futures = new LinkedHashMap<>();

        logger.info("Starting {} controllers", controllers.size());
        for (Controller controller : controllers) {
            ExecutorService executor = ExecutorsExt.namedSingleThreadExecutor("controller-" + controller.getName());
            executors.put(controller, executor);
            futures.put(controller, executor.submit(() -> runController(controller, controllersSignal)));
        }
        runningGauge.set(controllers.size());

        try {
            controllersSignal.await();
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for the stop signal; stopping the controllers");
            Thread.currentThread().interrupt();
            controllersSignal.stop();
        }

        join(futures);
        executors.values().forEach(ExecutorService::shutdownNow);
        runningGauge.set(0);
    }

    private void runController(Controller controller, StopSignal stopSignal) {
        logger.info("Controller {} started", controller.getName());
        try {
            controller.run(stopSignal);
            logger.info("Controller {} finished", controller.getName());
        } catch (Exception e) {
            logger.error("Controller {} terminated with an error", controller.getName(), e);
        }
    }

    private void join(Map<Controller, Future<?>> futures) {
        long deadline = clock.wallTime() + configuration.getControllerShutdownTimeoutMs();
        for (Map.Entry<Controller, Future<?>> entry : futures.entrySet()) {
            String name = entry.getKey().getName();
            long remainingMs = clock.millisUntil(deadline);
            try {
                entry.getValue().get(remainingMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.warn("Controller {} did not finish within the shutdown timeout", name);
            } catch (InterruptedException e) {
                logger.warn("Interrupted while waiting for controller {} to finish", name);
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                logger.error("Controller {} failed", name, e.getCause());
            }
        }
        logger.info("All controllers stopped");
    }
}
