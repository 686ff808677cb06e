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

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.multibindings.Multibinder;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.kubernetes.client.openapi.ApiClient;
import sh.volcano.common.runtime.SystemAbortListener;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.runtime.internal.DefaultVolcanoRuntime;
import sh.volcano.controllers.garbagecollector.GarbageCollector;
import sh.volcano.controllers.job.JobController;
import sh.volcano.controllers.job.plugins.JobPluginRegistry;
import sh.volcano.controllers.job.plugins.PluginClientset;
import sh.volcano.controllers.job.plugins.ssh.SshPlugin;
import sh.volcano.controllers.kubernetes.DefaultKubeApiFacade;
import sh.volcano.controllers.kubernetes.KubeApiClients;
import sh.volcano.controllers.kubernetes.KubeApiFacade;
import sh.volcano.controllers.leaderelection.KubeLeaderTransitionRecorder;
import sh.volcano.controllers.leaderelection.LeaderElectionConfiguration;
import sh.volcano.controllers.leaderelection.LeaderTransitionRecorder;
import sh.volcano.controllers.leaderelection.LeaseLockFactory;
import sh.volcano.controllers.leaderelection.LeaseLocks;
import sh.volcano.controllers.podgroup.PodGroupController;
import sh.volcano.controllers.queue.QueueController;
import sh.volcano.controllers.supervisor.Controller;

public class VolcanoControllersModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(SystemAbortListener.class).toInstance(SystemAbortListener.NONE);
        bind(VolcanoRuntime.class).to(DefaultVolcanoRuntime.class);
        bind(KubeApiFacade.class).to(DefaultKubeApiFacade.class);
        bind(LeaderTransitionRecorder.class).to(KubeLeaderTransitionRecorder.class);

        Multibinder<Controller> controllers = Multibinder.newSetBinder(binder(), Controller.class);
        controllers.addBinding().to(JobController.class);
        controllers.addBinding().to(GarbageCollector.class);
        controllers.addBinding().to(QueueController.class);
        controllers.addBinding().to(PodGroupController.class);
    }

    @Provides
    @Singleton
    public Registry getRegistry() {
        return new DefaultRegistry();
    }

    @Provides
    @Singleton
    public ControllersConfiguration getControllersConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(ControllersConfiguration.class);
    }

    @Provides
    @Singleton
    public LeaderElectionConfiguration getLeaderElectionConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(LeaderElectionConfiguration.class);
    }

    @Provides
    @Singleton
    public ApiClient getApiClient(ControllersConfiguration configuration, VolcanoRuntime runtime) {
        return KubeApiClients.createApiClient(
                configuration.getKubeApiServerUrl(),
                configuration.getKubeConfigPath(),
                configuration.getKubeApiQps(),
                configuration.getKubeApiBurst(),
                configuration.getKubeApiReadTimeoutSec(),
                runtime
        );
    }

    @Provides
    @Singleton
    public PluginClientset getPluginClientset(KubeApiFacade kubeApiFacade) {
        return new PluginClientset(kubeApiFacade);
    }

    @Provides
    @Singleton
    public JobPluginRegistry getJobPluginRegistry() {
        return JobPluginRegistry.newBuilder()
                .register(SshPlugin.NAME, SshPlugin.FACTORY)
                .build();
    }

    @Provides
    @Singleton
    public LeaseLockFactory getLeaseLockFactory(LeaderElectionConfiguration configuration, ApiClient apiClient) {
        return identity -> LeaseLocks.newConfigMapLock(
                configuration.getLockObjectNamespace(),
                LeaseLocks.LOCK_NAME,
                identity,
                apiClient
        );
    }

    @Provides
    @Singleton
    public KubeLeaderTransitionRecorder getLeaderTransitionRecorder(LeaderElectionConfiguration configuration, ApiClient apiClient) {
        return new KubeLeaderTransitionRecorder(apiClient, configuration.getLockObjectNamespace(), LeaseLocks.LOCK_NAME);
    }
}
