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

final class SshConstants {

    static final String SSH_PRIVATE_KEY = "id_rsa";
    static final String SSH_PUBLIC_KEY = "id_rsa.pub";
    static final String SSH_AUTHORIZED_KEYS = "authorized_keys";
    static final String SSH_CONFIG = "config";

    static final String SSH_ABSOLUTE_PATH = "/root/.ssh";
    static final String SSH_RELATIVE_PATH = ".ssh";

    /**
     * Base directory of the files volcano mounts into the job pods.
     */
    static final String CONFIG_MAP_MOUNT_PATH = "/etc/volcano";

    /**
     * Secret volume modes (octal 0600 and 0755).
     */
    static final int ROOT_MODE = 0600;
    static final int NO_ROOT_MODE = 0755;

    private SshConstants() {
    }
}
