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

package sh.volcano.controllers.job.plugins;

import java.util.HashMap;
import java.util.Map;

import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.batch.v1alpha1.V1alpha1JobStatus;
import sh.volcano.api.helpers.JobHelpers;

/**
 * Markers of the side effects applied by plugins, kept in the job's {@code status.controlledResources} map.
 */
public final class JobPlugins {

    private static final String CONTROLLED_RESOURCE_PREFIX = "plugin-";

    private JobPlugins() {
    }

    public static String controlledResourceKey(String pluginName) {
        return CONTROLLED_RESOURCE_PREFIX + pluginName;
    }

    public static boolean isApplied(V1alpha1Job job, String pluginName) {
        return pluginName.equals(JobHelpers.getControlledResources(job).get(controlledResourceKey(pluginName)));
    }

    /**
     * Set the marker on the given job object. The caller persists the job status.
     */
    public static void markApplied(V1alpha1Job job, String pluginName) {
        if (job.getStatus() == null) {
            job.setStatus(new V1alpha1JobStatus());
        }
        Map<String, String> controlledResources = job.getStatus().getControlledResources() == null
                ? new HashMap<>()
                : new HashMap<>(job.getStatus().getControlledResources());
        controlledResources.put(controlledResourceKey(pluginName), pluginName);
        job.getStatus().setControlledResources(controlledResources);
    }
}
