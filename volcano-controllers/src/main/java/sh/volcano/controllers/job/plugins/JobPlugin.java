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

import io.kubernetes.client.openapi.models.V1Pod;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;

/**
 * Per job extension invoked by the job controller at fixed points of the job life cycle. A plugin instance is created
 * for a single invocation, and does not keep state between the calls. Everything it must remember goes to the job
 * status, or to the Kubernetes objects it owns.
 */
public interface JobPlugin {

    String getName();

    /**
     * Called before any pod of the job is created. Side effects must be applied at most once per job; a plugin checks
     * {@link JobPlugins#isApplied(V1alpha1Job, String)} first, and calls {@link JobPlugins#markApplied(V1alpha1Job, String)}
     * after a successful provisioning. Concurrent calls for the same job are not expected.
     */
    void onJobAdd(V1alpha1Job job) throws JobPluginException;

    /**
     * Called for every pod of the job before it is submitted, after {@link #onJobAdd(V1alpha1Job)} succeeded. Mutates
     * the pod in place.
     */
    void onPodCreate(V1Pod pod, V1alpha1Job job) throws JobPluginException;

    /**
     * Called after the job is deleted. Cleanup of resources that no longer exist must succeed.
     */
    void onJobDelete(V1alpha1Job job) throws JobPluginException;
}
