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
import java.util.List;

import com.google.common.base.Strings;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1KeyToPath;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1OwnerReference;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1SecretVolumeSource;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.helpers.JobHelpers;
import sh.volcano.controllers.job.plugins.JobPlugin;
import sh.volcano.controllers.job.plugins.JobPluginException;
import sh.volcano.controllers.job.plugins.JobPluginFactory;
import sh.volcano.controllers.job.plugins.JobPlugins;
import sh.volcano.controllers.job.plugins.PluginClientset;
import sh.volcano.controllers.kubernetes.KubeApiException;
import sh.volcano.controllers.kubernetes.KubeApiFacade;

/**
 * Provisions a password-less ssh setup between the pods of a job. A single key pair is generated per job, and stored
 * in a secret owned by the job. Every pod mounts the secret as its ssh directory.
 */
public class SshPlugin implements JobPlugin {

    private static final Logger logger = LoggerFactory.getLogger(SshPlugin.class);

    public static final String NAME = "ssh";

    public static final JobPluginFactory FACTORY = (clientset, arguments) ->
            new SshPlugin(clientset, SshPluginConfiguration.parse(arguments), new SshKeyBundleGenerator());

    private final KubeApiFacade kubeApiFacade;
    private final SshPluginConfiguration configuration;
    private final SshKeyBundleGenerator generator;

    public SshPlugin(PluginClientset clientset, SshPluginConfiguration configuration, SshKeyBundleGenerator generator) {
        this.kubeApiFacade = clientset.getKubeApiFacade();
        this.configuration = configuration;
        this.generator = generator;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public SshPluginConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public void onJobAdd(V1alpha1Job job) throws JobPluginException {
        if (JobPlugins.isApplied(job, NAME)) {
            return;
        }

        SshKeyBundle bundle;
        try {
            bundle = generator.generate(job);
        } catch (Exception e) {
            throw JobPluginException.operationFailed(NAME, job, "ssh key generation", e);
        }

        String secretName = secretName(job);
        V1Secret secret = new V1Secret()
                .metadata(new V1ObjectMeta()
                        .name(secretName)
                        .namespace(JobHelpers.getNamespace(job))
                        .addOwnerReferencesItem(JobHelpers.newControllerReference(job))
                )
                .data(bundle.toSecretData());
        try {
            kubeApiFacade.createNamespacedSecret(JobHelpers.getNamespace(job), secret);
            logger.info("Created ssh secret {} for job {}", secretName, JobHelpers.getJobKey(job));
        } catch (KubeApiException e) {
            if (e.getErrorCode() != KubeApiException.ErrorCode.CONFLICT_ALREADY_EXISTS || !isOwnedBy(job, secretName)) {
                throw JobPluginException.operationFailed(NAME, job, "create secret", e);
            }
            // Created by an earlier attempt, whose job status update did not go through
            logger.info("Reusing ssh secret {} of job {}", secretName, JobHelpers.getJobKey(job));
        }

        JobPlugins.markApplied(job, NAME);
    }

    @Override
    public void onPodCreate(V1Pod pod, V1alpha1Job job) {
        String secretName = secretName(job);
        int mode = SshConstants.SSH_ABSOLUTE_PATH.equals(configuration.getSshKeyFilePath())
                ? SshConstants.ROOT_MODE
                : SshConstants.NO_ROOT_MODE;

        pod.getSpec().addVolumesItem(new V1Volume()
                .name(secretName)
                .secret(new V1SecretVolumeSource()
                        .secretName(secretName)
                        .items(keyItems())
                        .defaultMode(mode)
                )
        );

        if (pod.getSpec().getContainers() == null) {
            return;
        }
        for (V1Container container : pod.getSpec().getContainers()) {
            container.addVolumeMountsItem(new V1VolumeMount()
                    .name(secretName)
                    .mountPath(configuration.getSshKeyFilePath())
                    .subPath(SshConstants.SSH_RELATIVE_PATH)
            );
        }
    }

    @Override
    public void onJobDelete(V1alpha1Job job) throws JobPluginException {
        String secretName = secretName(job);
        try {
            kubeApiFacade.deleteNamespacedSecret(JobHelpers.getNamespace(job), secretName);
            logger.info("Deleted ssh secret {} of job {}", secretName, JobHelpers.getJobKey(job));
        } catch (KubeApiException e) {
            if (e.getErrorCode() == KubeApiException.ErrorCode.NOT_FOUND) {
                logger.debug("Ssh secret {} of job {} already removed", secretName, JobHelpers.getJobKey(job));
                return;
            }
            throw JobPluginException.operationFailed(NAME, job, "delete secret", e);
        }
    }

    private boolean isOwnedBy(V1alpha1Job job, String secretName) {
        V1Secret existing;
        try {
            existing = kubeApiFacade.readNamespacedSecret(JobHelpers.getNamespace(job), secretName);
        } catch (KubeApiException e) {
            throw JobPluginException.operationFailed(NAME, job, "read secret", e);
        }
        if (existing == null || existing.getMetadata() == null || existing.getMetadata().getOwnerReferences() == null) {
            return false;
        }
        String jobUid = JobHelpers.getUid(job);
        if (Strings.isNullOrEmpty(jobUid)) {
            return false;
        }
        for (V1OwnerReference owner : existing.getMetadata().getOwnerReferences()) {
            if (jobUid.equals(owner.getUid())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Stable across retries, and unique per job, as it includes the job UID.
     */
    public static String secretName(V1alpha1Job job) {
        return String.format("%s-%s-%s", JobHelpers.getName(job), JobHelpers.getUid(job), NAME);
    }

    private static List<V1KeyToPath> keyItems() {
        return Arrays.asList(
                keyItem(SshConstants.SSH_PRIVATE_KEY, SshConstants.SSH_PRIVATE_KEY),
                keyItem(SshConstants.SSH_PUBLIC_KEY, SshConstants.SSH_PUBLIC_KEY),
                keyItem(SshConstants.SSH_PUBLIC_KEY, SshConstants.SSH_AUTHORIZED_KEYS),
                keyItem(SshConstants.SSH_CONFIG, SshConstants.SSH_CONFIG)
        );
    }

    private static V1KeyToPath keyItem(String key, String fileName) {
        return new V1KeyToPath().key(key).path(SshConstants.SSH_RELATIVE_PATH + "/" + fileName);
    }
}
