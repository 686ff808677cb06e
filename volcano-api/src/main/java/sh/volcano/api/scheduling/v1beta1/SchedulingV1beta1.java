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

package sh.volcano.api.scheduling.v1beta1;

/**
 * Coordinates and well known values of the {@code scheduling.volcano.sh/v1beta1} API group.
 */
public final class SchedulingV1beta1 {

    public static final String GROUP = "scheduling.volcano.sh";
    public static final String VERSION = "v1beta1";
    public static final String API_VERSION = GROUP + "/" + VERSION;

    public static final String POD_GROUP_KIND = "PodGroup";
    public static final String POD_GROUP_PLURAL = "podgroups";

    public static final String QUEUE_KIND = "Queue";
    public static final String QUEUE_PLURAL = "queues";

    /**
     * Pod annotation naming the pod group a pod belongs to.
     */
    public static final String GROUP_NAME_ANNOTATION = "scheduling.k8s.io/group-name";

    public static final String DEFAULT_QUEUE = "default";

    public static final String POD_GROUP_PENDING = "Pending";
    public static final String POD_GROUP_RUNNING = "Running";
    public static final String POD_GROUP_UNKNOWN = "Unknown";
    public static final String POD_GROUP_INQUEUE = "Inqueue";

    public static final String QUEUE_STATE_OPEN = "Open";

    private SchedulingV1beta1() {
    }
}
