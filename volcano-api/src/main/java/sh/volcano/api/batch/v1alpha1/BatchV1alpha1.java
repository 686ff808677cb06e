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

package sh.volcano.api.batch.v1alpha1;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Coordinates, phases and well known labels of the {@code batch.volcano.sh/v1alpha1} API group.
 */
public final class BatchV1alpha1 {

    public static final String GROUP = "batch.volcano.sh";
    public static final String VERSION = "v1alpha1";
    public static final String API_VERSION = GROUP + "/" + VERSION;

    public static final String JOB_KIND = "Job";
    public static final String JOB_PLURAL = "jobs";

    public static final String JOB_NAME_LABEL = "volcano.sh/job-name";
    public static final String JOB_NAMESPACE_LABEL = "volcano.sh/job-namespace";
    public static final String TASK_SPEC_LABEL = "volcano.sh/task-spec";

    public static final String PHASE_PENDING = "Pending";
    public static final String PHASE_ABORTING = "Aborting";
    public static final String PHASE_ABORTED = "Aborted";
    public static final String PHASE_RUNNING = "Running";
    public static final String PHASE_RESTARTING = "Restarting";
    public static final String PHASE_COMPLETING = "Completing";
    public static final String PHASE_COMPLETED = "Completed";
    public static final String PHASE_TERMINATING = "Terminating";
    public static final String PHASE_TERMINATED = "Terminated";
    public static final String PHASE_FAILED = "Failed";

    /**
     * Phases after which the job controller does not create pods anymore, and the garbage collector may
     * remove the job once its TTL expires.
     */
    public static final Set<String> TERMINAL_PHASES = ImmutableSet.of(
            PHASE_COMPLETED,
            PHASE_FAILED,
            PHASE_TERMINATED,
            PHASE_ABORTED
    );

    private BatchV1alpha1() {
    }
}
