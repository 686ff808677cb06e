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

package sh.volcano.controllers.job.plugins.ssh;

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1KeyToPath;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.controllers.job.plugins.JobPluginException;
import sh.volcano.controllers.job.plugins.JobPlugins;
import sh.volcano.controllers.job.plugins.PluginClientset;
import sh.volcano.controllers.kubernetes.KubeApiException;
import sh.volcano.controllers.kubernetes.KubeApiFacade;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static sh.volcano.controllers.job.JobFixtures.newJob;
import static sh.volcano.controllers.job.JobFixtures.newTask;

public class SshPluginTest {

    private final KubeApiFacade kubeApiFacade = mock(KubeApiFacade.class);

    private final V1alpha1Job job = newJob("job1", newTask("T", 2, "main"));

    @Test
    public void testSecretNameIsDerivedFromTheJob() {
        assertThat(SshPlugin.secretName(job)).isEqualTo("job1-job1-uid-ssh");
        assertThat(SshPlugin.secretName(newJob("job1"))).isEqualTo(SshPlugin.secretName(job));
    }

    @Test
    public void testOnJobAddCreatesSecretAndSetsMarker() {
        newPlugin().onJobAdd(job);

        ArgumentCaptor<V1Secret> secretCaptor = ArgumentCaptor.forClass(V1Secret.class);
        verify(kubeApiFacade).createNamespacedSecret(eq("default"), secretCaptor.capture());

        V1Secret secret = secretCaptor.getValue();
        assertThat(secret.getMetadata().getName()).isEqualTo("job1-job1-uid-ssh");
        assertThat(secret.getMetadata().getNamespace()).isEqualTo("default");
        assertThat(secret.getMetadata().getOwnerReferences()).hasSize(1);
        assertThat(secret.getMetadata().getOwnerReferences().get(0).getUid()).isEqualTo("job1-uid");
        assertThat(secret.getData()).containsOnlyKeys("id_rsa", "id_rsa.pub", "config");

        assertThat(job.getStatus().getControlledResources()).containsEntry("plugin-ssh", "ssh");
    }

    @Test
    public void testOnJobAddWithMarkerSetDoesNothing() {
        JobPlugins.markApplied(job, SshPlugin.NAME);

        newPlugin().onJobAdd(job);
        newPlugin().onJobAdd(job);

        verifyNoInteractions(kubeApiFacade);
    }

    @Test
    public void testOnJobAddFailureLeavesJobUnmarked() {
        when(kubeApiFacade.createNamespacedSecret(any(), any())).thenThrow(new KubeApiException("simulated error", null));

        try {
            newPlugin().onJobAdd(job);
            fail("Expected secret creation failure");
        } catch (JobPluginException e) {
            assertThat(e.getErrorCode()).isEqualTo(JobPluginException.ErrorCode.OperationFailed);
            assertThat(e.getMessage()).contains("default/job1");
        }
        assertThat(JobPlugins.isApplied(job, SshPlugin.NAME)).isFalse();
    }

    @Test
    public void testOnJobAddReusesSecretLeftByAnEarlierAttempt() {
        when(kubeApiFacade.createNamespacedSecret(any(), any())).thenThrow(alreadyExists());
        when(kubeApiFacade.readNamespacedSecret("default", "job1-job1-uid-ssh")).thenReturn(newSecret("job1-uid"));

        newPlugin().onJobAdd(job);

        assertThat(JobPlugins.isApplied(job, SshPlugin.NAME)).isTrue();
    }

    @Test
    public void testOnJobAddFailsOnSecretOwnedByAnotherJob() {
        when(kubeApiFacade.createNamespacedSecret(any(), any())).thenThrow(alreadyExists());
        when(kubeApiFacade.readNamespacedSecret("default", "job1-job1-uid-ssh")).thenReturn(newSecret("other-uid"));

        try {
            newPlugin().onJobAdd(job);
            fail("Expected secret creation failure");
        } catch (JobPluginException e) {
            assertThat(e.getErrorCode()).isEqualTo(JobPluginException.ErrorCode.OperationFailed);
        }
        assertThat(JobPlugins.isApplied(job, SshPlugin.NAME)).isFalse();
    }

    @Test
    public void testOnPodCreateMountsTheSecretInEveryContainer() {
        V1Pod pod = newPod("c1", "c2", "c3");

        newPlugin().onPodCreate(pod, job);

        assertThat(pod.getSpec().getVolumes()).hasSize(1);
        V1Volume volume = pod.getSpec().getVolumes().get(0);
        assertThat(volume.getName()).isEqualTo("job1-job1-uid-ssh");
        assertThat(volume.getSecret().getSecretName()).isEqualTo("job1-job1-uid-ssh");
        assertThat(volume.getSecret().getDefaultMode()).isEqualTo(0600);
        assertThat(volume.getSecret().getItems().stream().map(V1KeyToPath::getPath).collect(Collectors.toList()))
                .containsExactly(".ssh/id_rsa", ".ssh/id_rsa.pub", ".ssh/authorized_keys", ".ssh/config");
        assertThat(volume.getSecret().getItems().get(2).getKey()).isEqualTo("id_rsa.pub");

        for (V1Container container : pod.getSpec().getContainers()) {
            assertThat(container.getVolumeMounts()).hasSize(1);
            V1VolumeMount mount = container.getVolumeMounts().get(0);
            assertThat(mount.getName()).isEqualTo("job1-job1-uid-ssh");
            assertThat(mount.getMountPath()).isEqualTo("/root/.ssh");
            assertThat(mount.getSubPath()).isEqualTo(".ssh");
        }
    }

    @Test
    public void testOnPodCreateForNonRootUser() {
        V1Pod pod = newPod("c1");

        newPlugin("--no-root").onPodCreate(pod, job);

        assertThat(pod.getSpec().getVolumes().get(0).getSecret().getDefaultMode()).isEqualTo(0755);
        assertThat(pod.getSpec().getContainers().get(0).getVolumeMounts().get(0).getMountPath()).isEqualTo("/etc/volcano/.ssh");
    }

    @Test
    public void testOnJobDeleteRemovesTheSecret() {
        newPlugin().onJobDelete(job);
        verify(kubeApiFacade).deleteNamespacedSecret("default", "job1-job1-uid-ssh");
    }

    @Test
    public void testOnJobDeleteOfMissingSecretSucceeds() {
        doThrow(new KubeApiException(new ApiException(404, "Not Found")))
                .when(kubeApiFacade).deleteNamespacedSecret(any(), any());

        newPlugin().onJobDelete(job);
    }

    @Test
    public void testOnJobDeleteFailure() {
        doThrow(new KubeApiException(new ApiException(500, "Internal Server Error")))
                .when(kubeApiFacade).deleteNamespacedSecret(any(), any());

        try {
            newPlugin().onJobDelete(job);
            fail("Expected secret deletion failure");
        } catch (JobPluginException e) {
            assertThat(e.getErrorCode()).isEqualTo(JobPluginException.ErrorCode.OperationFailed);
        }
    }

    private SshPlugin newPlugin(String... arguments) {
        return (SshPlugin) SshPlugin.FACTORY.create(new PluginClientset(kubeApiFacade), Arrays.asList(arguments));
    }

    private static KubeApiException alreadyExists() {
        return new KubeApiException(new ApiException(409, Collections.emptyMap(), "reason: AlreadyExists"));
    }

    private static V1Secret newSecret(String ownerUid) {
        return new V1Secret().metadata(new V1ObjectMeta()
                .name("job1-job1-uid-ssh")
                .namespace("default")
                .addOwnerReferencesItem(new V1OwnerReference().kind("Job").name("job1").uid(ownerUid))
        );
    }

    private static V1Pod newPod(String... containerNames) {
        V1PodSpec spec = new V1PodSpec();
        for (String containerName : containerNames) {
            spec.addContainersItem(new V1Container().name(containerName));
        }
        return new V1Pod().metadata(new V1ObjectMeta().name("job1-T-0").namespace("default")).spec(spec);
    }
}
