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

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key pair and client configuration shared by all pods of a job.
 */
public class SshKeyBundle {

    private final String privateKeyPem;
    private final String publicKey;
    private final String config;

    public SshKeyBundle(String privateKeyPem, String publicKey, String config) {
        this.privateKeyPem = privateKeyPem;
        this.publicKey = publicKey;
        this.config = config;
    }

    /**
     * PKCS#1 private key in the PEM format.
     */
    public String getPrivateKeyPem() {
        return privateKeyPem;
    }

    /**
     * Public key in the authorized_keys format, terminated by a new line.
     */
    public String getPublicKey() {
        return publicKey;
    }

    public String getConfig() {
        return config;
    }

    public Map<String, byte[]> toSecretData() {
        Map<String, byte[]> data = new LinkedHashMap<>();
        data.put(SshConstants.SSH_PRIVATE_KEY, privateKeyPem.getBytes(StandardCharsets.UTF_8));
        data.put(SshConstants.SSH_PUBLIC_KEY, publicKey.getBytes(StandardCharsets.UTF_8));
        data.put(SshConstants.SSH_CONFIG, config.getBytes(StandardCharsets.UTF_8));
        return data;
    }

    @Override
    public String toString() {
        return "SshKeyBundle{publicKey='" + publicKey.trim() + "'}";
    }
}
