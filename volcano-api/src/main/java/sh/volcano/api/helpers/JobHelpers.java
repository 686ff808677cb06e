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

package sh.volcano.api.helpers;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import sh.volcano.api.batch.v1alpha1.BatchV1alpha1;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.batch.v1alpha1.V1alpha1JobSpec;
import sh.volcano.api.batch.v1alpha1.V1alpha1JobStatus;
import sh.volcano.api.batch.v1alpha1.V1alpha1TaskSpec;

/**
 * Null safe accessors and naming rules shared by the job controller and the job plugins.
 */
public final class JobHelpers {

    private static final String POD_NAME_FORMAT = "%s-%s-%d";

    private JobHelpers() {
    }

    /**
     * Name of the pod created for replica {@code index} of the given task. The same value is the pod's default
     * hostname.
     */
    public static String makePodName(String jobName, String taskName, int index) {
        return String.format(POD_NAME_FORMAT, jobName, taskName, index);
    }

    /**
     * Work queue and log key of a job, formatted as {@code namespace/name}.
     */
    public static String getJobKey(V1alpha1Job job) {
        V1ObjectMeta metadata = job.getMetadata();
        if (metadata == null) {
            return "";
        }
        return metadata.getNamespace() + "/" + metadata.getName();
    }

    public static String getName(V1alpha1Job job) {
        return job.getMetadata() == null ? "" : job.getMetadata().getName();
    }

    public static String getNamespace(V1alpha1Job job) {
        return job.getMetadata() == null ? "" : job.getMetadata().getNamespace();
    }

    public static String getUid(V1alpha1Job job) {
        return job.getMetadata() == null ? "" : job.getMetadata().getUid();
    }

    public static List<V1alpha1TaskSpec> getTasks(V1alpha1Job job) {
        V1alpha1JobSpec spec = job.getSpec();
        if (spec == null || spec.getTasks() == null) {
            return Collections.emptyList();
        }
        return spec.getTasks();
    }

    public static Map<String, List<String>> getPlugins(V1alpha1Job job) {
        V1alpha1JobSpec spec = job.getSpec();
        if (spec == null || spec.getPlugins() == null) {
            return Collections.emptyMap();
        }
        return spec.getPlugins();
    }

    public static Map<String, String> getControlledResources(V1alpha1Job job) {
        V1alpha1JobStatus status = job.getStatus();
        if (status == null || status.getControlledResources() == null) {
            return Collections.emptyMap();
        }
        return status.getControlledResources();
    }

    public static String getPhase(V1alpha1Job job) {
        V1alpha1JobStatus status = job.getStatus();
        if (status == null || status.getState() == null || status.getState().getPhase() == null) {
            return BatchV1alpha1.PHASE_PENDING;
        }
        return status.getState().getPhase();
    }

    public static boolean isTerminal(V1alpha1Job job) {
        return BatchV1alpha1.TERMINAL_PHASES.contains(getPhase(job));
    }

    /**
     * Owner reference marking the job as the managing controller, so that Kubernetes garbage collects
     * the owned object together with the job.
     */
    public static V1OwnerReference newControllerReference(V1alpha1Job job) {
        return new V1OwnerReference()
                .apiVersion(BatchV1alpha1.API_VERSION)
                .kind(BatchV1alpha1.JOB_KIND)
                .name(getName(job))
                .uid(getUid(job))
                .controller(true)
                .blockOwnerDeletion(true);
    }
}
