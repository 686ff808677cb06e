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

package sh.volcano.controllers;

import java.io.FileReader;
import java.io.IOException;
import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.netflix.archaius.config.MapConfig;
import com.netflix.archaius.guice.ArchaiusModule;
import com.sampullara.cli.Args;
import com.sampullara.cli.Argument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.concurrent.StopSignal;
import sh.volcano.controllers.kubernetes.DefaultKubeApiFacade;
import sh.volcano.controllers.leaderelection.KubeLeaderTransitionRecorder;
import sh.volcano.controllers.supervisor.ControllerServer;
import sh.volcano.controllers.supervisor.ControllerServerException;

public class VolcanoControllers {

    private static final Logger logger = LoggerFactory.getLogger(VolcanoControllers.class);

    private static final long SHUTDOWN_HOOK_TIMEOUT_MS = 60_000;

    @Argument(alias = "p", description = "Specify a properties file")
    private static String propertiesFile;

    public static void main(String[] args) {
        try {
            Args.parse(VolcanoControllers.class, args);
        } catch (IllegalArgumentException e) {
            Args.usage(VolcanoControllers.class);
            System.exit(1);
        }

        Injector injector;
        try {
            injector = Guice.createInjector(
                    new VolcanoControllersModule(),
                    new ArchaiusModule() {
                        @Override
                        protected void configureArchaius() {
                            bindApplicationConfigurationOverride().toInstance(loadPropertiesFile(propertiesFile));
                        }
                    }
            );
        } catch (Exception e) {
            logger.error("Cannot bootstrap the controller manager: {}", e.getMessage(), e);
            System.exit(2);
            return;
        }

        StopSignal stopSignal = StopSignal.newSignal();
        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown requested");
            stopSignal.stop();
            try {
                terminated.await(SHUTDOWN_HOOK_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "volcano-controllers-shutdown"));

        VolcanoRuntime runtime = injector.getInstance(VolcanoRuntime.class);
        int exitCode = 0;
        try {
            injector.getInstance(ControllerServer.class).run(stopSignal);
        } catch (ControllerServerException e) {
            if (e.getErrorCode() == ControllerServerException.ErrorCode.Stopped) {
                logger.info("Controller manager stopped");
            } else {
                logger.error("Controller manager terminated: {}", e.getMessage(), e);
                exitCode = 1;
            }
        } catch (Exception e) {
            logger.error("Unexpected error: {}", e.getMessage(), e);
            exitCode = 2;
        } finally {
            injector.getInstance(DefaultKubeApiFacade.class).shutdown();
            injector.getInstance(KubeLeaderTransitionRecorder.class).shutdown();
            terminated.countDown();
        }

        // Calling System.exit while the shutdown hook runs would block forever.
        if (exitCode != 0 && !stopSignal.isStopped() && runtime.isSystemExitOnFailure()) {
            System.exit(exitCode);
        }
    }

    private static MapConfig loadPropertiesFile(String propertiesFile) {
        if (propertiesFile == null) {
            return MapConfig.from(Collections.emptyMap());
        }
        Properties properties = new Properties();
        try (FileReader fr = new FileReader(propertiesFile)) {
            properties.load(fr);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot load file: " + propertiesFile, e);
        }
        return MapConfig.from(properties);
    }
}
