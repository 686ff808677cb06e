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

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import sh.volcano.api.batch.v1alpha1.BatchV1alpha1;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.batch.v1alpha1.V1alpha1JobSpec;
import sh.volcano.api.batch.v1alpha1.V1alpha1JobState;
import sh.volcano.api.batch.v1alpha1.V1alpha1JobStatus;
import sh.volcano.api.batch.v1alpha1.V1alpha1TaskSpec;

public final class JobFixtures {

    public static final String NAMESPACE = "default";

    private JobFixtures() {
    }

    public static V1alpha1Job newJob(String name, V1alpha1TaskSpec... tasks) {
        V1alpha1JobSpec spec = new V1alpha1JobSpec();
        spec.setSchedulerName("volcano");
        spec.setMinAvailable(1);
        spec.setQueue("default");
        spec.setTasks(new ArrayList<>(Arrays.asList(tasks)));
        spec.setPlugins(new LinkedHashMap<>());

        V1alpha1Job job = new V1alpha1Job();
        job.setApiVersion(BatchV1alpha1.API_VERSION);
        job.setKind(BatchV1alpha1.JOB_KIND);
        job.setMetadata(new V1ObjectMeta().name(name).namespace(NAMESPACE).uid(name + "-uid"));
        job.setSpec(spec);
        job.setStatus(new V1alpha1JobStatus());
        return job;
    }

    public static V1alpha1Job withPlugin(V1alpha1Job job, String name, String... arguments) {
        Map<String, List<String>> plugins = new LinkedHashMap<>(job.getSpec().getPlugins());
        plugins.put(name, Arrays.asList(arguments));
        job.getSpec().setPlugins(plugins);
        return job;
    }

    public static V1alpha1Job withPhase(V1alpha1Job job, String phase, OffsetDateTime lastTransitionTime) {
        V1alpha1JobState state = new V1alpha1JobState();
        state.setPhase(phase);
        state.setLastTransitionTime(lastTransitionTime);
        job.getStatus().setState(state);
        return job;
    }

    public static V1alpha1TaskSpec newTask(String name, int replicas, String... containerNames) {
        V1PodSpec podSpec = new V1PodSpec();
        for (String containerName : containerNames) {
            podSpec.addContainersItem(new V1Container().name(containerName).image("busybox"));
        }

        V1alpha1TaskSpec task = new V1alpha1TaskSpec();
        task.setName(name);
        task.setReplicas(replicas);
        task.setTemplate(new V1PodTemplateSpec()
                .metadata(new V1ObjectMeta().putLabelsItem("app", name))
                .spec(podSpec)
        );
        return task;
    }
}
