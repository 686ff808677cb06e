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

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "volcano.controllers")
public interface ControllersConfiguration {

    /**
     * @return Kubernetes API server URL. If not set, the client is configured from {@link #getKubeConfigPath()}, or
     * from the in-cluster service account.
     */
    @DefaultValue("")
    String getKubeApiServerUrl();

    /**
     * @return path to a kubeconfig file. Ignored if {@link #getKubeApiServerUrl()} is set.
     */
    @DefaultValue("")
    String getKubeConfigPath();

    /**
     * @return steady state number of Kubernetes API requests per second.
     */
    @DefaultValue("50")
    int getKubeApiQps();

    /**
     * @return maximum number of Kubernetes API requests issued in a burst.
     */
    @DefaultValue("100")
    int getKubeApiBurst();

    @DefaultValue("60")
    long getKubeApiReadTimeoutSec();

    /**
     * @return host:port the health check endpoint binds to.
     */
    @DefaultValue("0.0.0.0:11251")
    String getHealthzBindAddress();

    /**
     * @return number of job controller workers processing the job work queue concurrently.
     */
    @DefaultValue("3")
    int getWorkerThreads();

    /**
     * @return scheduler name set on pods created for jobs that do not declare one, and the pods the pod group
     * controller manages.
     */
    @DefaultValue("volcano")
    String getSchedulerName();

    @DefaultValue("30000")
    long getInformerResyncIntervalMs();

    /**
     * @return how long the supervisor waits for the controllers to finish after the stop signal fired.
     */
    @DefaultValue("30000")
    long getControllerShutdownTimeoutMs();

    @DefaultValue("10000")
    long getGarbageCollectorIntervalMs();

    @DefaultValue("5000")
    long getQueueControllerIntervalMs();

    @DefaultValue("5000")
    long getPodGroupControllerIntervalMs();

    /**
     * @return maximum number of objects a periodic controller modifies in one iteration.
     */
    @DefaultValue("100")
    int getPeriodicControllerBatchSize();
}
