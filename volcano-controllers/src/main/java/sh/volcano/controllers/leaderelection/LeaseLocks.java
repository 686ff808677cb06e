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

package sh.volcano.controllers.leaderelection;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

import com.google.common.base.Strings;
import io.kubernetes.client.extended.leaderelection.Lock;
import io.kubernetes.client.extended.leaderelection.resourcelock.ConfigMapLock;
import io.kubernetes.client.openapi.ApiClient;

public final class LeaseLocks {

    /**
     * Name of the lock object, shared by all controller manager replicas.
     */
    public static final String LOCK_NAME = "vc-controllers";

    private LeaseLocks() {
    }

    /**
     * Unique identity of this process in the election: host name and a random UUID, so that two processes on the
     * same host never share it.
     */
    public static String newIdentity() throws UnknownHostException {
        return InetAddress.getLocalHost().getHostName() + "_" + UUID.randomUUID();
    }

    public static Lock newConfigMapLock(String namespace, String name, String identity, ApiClient apiClient) {
        if (Strings.isNullOrEmpty(namespace)) {
            throw LeaderElectionException.lockCreationFailed("lock namespace not set");
        }
        if (Strings.isNullOrEmpty(name)) {
            throw LeaderElectionException.lockCreationFailed("lock name not set");
        }
        if (Strings.isNullOrEmpty(identity)) {
            throw LeaderElectionException.lockCreationFailed("lock identity not set");
        }
        if (apiClient == null) {
            throw LeaderElectionException.lockCreationFailed("Kubernetes API client not set");
        }
        return new ConfigMapLock(namespace, name, identity, apiClient);
    }
}
