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

import java.io.IOException;
import java.io.StringWriter;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;

import io.kubernetes.client.openapi.models.V1PodSpec;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.util.OpenSSHPublicKeyUtil;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.batch.v1alpha1.V1alpha1TaskSpec;
import sh.volcano.api.helpers.JobHelpers;
import sh.volcano.common.util.StringExt;

public class SshKeyBundleGenerator {

    private static final String KEY_ALGORITHM = "RSA";
    private static final int KEY_SIZE = 1024;

    private static final String PUBLIC_KEY_TYPE = "ssh-rsa";

    private static final String CONFIG_HEADER = "StrictHostKeyChecking no\nUserKnownHostsFile /dev/null\n";

    public SshKeyBundle generate(V1alpha1Job job) throws GeneralSecurityException, IOException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
        generator.initialize(KEY_SIZE);
        KeyPair keyPair = generator.generateKeyPair();

        return new SshKeyBundle(
                toPem(keyPair),
                toAuthorizedKey((RSAPublicKey) keyPair.getPublic()),
                generateConfig(job)
        );
    }

    private static String toPem(KeyPair keyPair) throws IOException {
        StringWriter writer = new StringWriter();
        try (JcaPEMWriter pemWriter = new JcaPEMWriter(writer)) {
            pemWriter.writeObject(keyPair.getPrivate());
        }
        return writer.toString();
    }

    private static String toAuthorizedKey(RSAPublicKey publicKey) throws IOException {
        RSAKeyParameters keyParameters = new RSAKeyParameters(false, publicKey.getModulus(), publicKey.getPublicExponent());
        byte[] encoded = OpenSSHPublicKeyUtil.encodePublicKey(keyParameters);
        return PUBLIC_KEY_TYPE + " " + Base64.getEncoder().encodeToString(encoded) + "\n";
    }

    /**
     * Client configuration with one entry per pod of the job. A task with an explicit hostname contributes its first
     * replica only, as all its replicas would resolve to the same host entry.
     */
    public static String generateConfig(V1alpha1Job job) {
        String jobName = JobHelpers.getName(job);
        StringBuilder config = new StringBuilder(CONFIG_HEADER);
        for (V1alpha1TaskSpec task : JobHelpers.getTasks(job)) {
            V1PodSpec podSpec = task.getTemplate() == null ? null : task.getTemplate().getSpec();
            String templateHostname = podSpec == null ? null : podSpec.getHostname();
            String templateSubdomain = podSpec == null ? null : podSpec.getSubdomain();

            for (int i = 0; i < task.getReplicas(); i++) {
                String hostname = StringExt.isEmpty(templateHostname) ? JobHelpers.makePodName(jobName, task.getName(), i) : templateHostname;
                String subdomain = StringExt.isEmpty(templateSubdomain) ? jobName : templateSubdomain;

                config.append("Host ").append(hostname).append('\n');
                config.append("  HostName ").append(hostname).append('.').append(subdomain).append('\n');
                if (!StringExt.isEmpty(templateHostname)) {
                    break;
                }
            }
        }
        return config.toString();
    }
}
