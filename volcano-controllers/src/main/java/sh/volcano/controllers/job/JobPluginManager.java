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

import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.kubernetes.client.openapi.models.V1Pod;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.helpers.JobHelpers;
import sh.volcano.controllers.job.plugins.JobPlugin;
import sh.volcano.controllers.job.plugins.JobPluginException;
import sh.volcano.controllers.job.plugins.JobPluginRegistry;
import sh.volcano.controllers.job.plugins.PluginClientset;

/**
 * Invokes the hooks of the plugins a job declares, in the declaration order. The first failure stops the iteration.
 */
@Singleton
public class JobPluginManager {

    private final JobPluginRegistry registry;
    private final PluginClientset clientset;

    @Inject
    public JobPluginManager(JobPluginRegistry registry, PluginClientset clientset) {
        this.registry = registry;
        this.clientset = clientset;
    }

    public void onJobAdd(V1alpha1Job job) throws JobPluginException {
        for (Map.Entry<String, List<String>> entry : JobHelpers.getPlugins(job).entrySet()) {
            JobPlugin plugin = newPlugin(job, entry.getKey(), entry.getValue());
            try {
                plugin.onJobAdd(job);
            } catch (JobPluginException e) {
                throw JobPluginException.withJobContext(job, e);
            } catch (RuntimeException e) {
                throw JobPluginException.operationFailed(plugin.getName(), job, "onJobAdd", e);
            }
        }
    }

    public void onPodCreate(V1Pod pod, V1alpha1Job job) throws JobPluginException {
        for (Map.Entry<String, List<String>> entry : JobHelpers.getPlugins(job).entrySet()) {
            JobPlugin plugin = newPlugin(job, entry.getKey(), entry.getValue());
            try {
                plugin.onPodCreate(pod, job);
            } catch (JobPluginException e) {
                throw JobPluginException.withJobContext(job, e);
            } catch (RuntimeException e) {
                throw JobPluginException.operationFailed(plugin.getName(), job, "onPodCreate", e);
            }
        }
    }

    public void onJobDelete(V1alpha1Job job) throws JobPluginException {
        for (Map.Entry<String, List<String>> entry : JobHelpers.getPlugins(job).entrySet()) {
            JobPlugin plugin = newPlugin(job, entry.getKey(), entry.getValue());
            try {
                plugin.onJobDelete(job);
            } catch (JobPluginException e) {
                throw JobPluginException.withJobContext(job, e);
            } catch (RuntimeException e) {
                throw JobPluginException.operationFailed(plugin.getName(), job, "onJobDelete", e);
            }
        }
    }

    private JobPlugin newPlugin(V1alpha1Job job, String name, List<String> arguments) {
        try {
            return registry.newPlugin(name, clientset, arguments);
        } catch (JobPluginException e) {
            throw JobPluginException.withJobContext(job, e);
        }
    }
}
