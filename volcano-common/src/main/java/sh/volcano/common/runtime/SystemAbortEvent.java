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

package sh.volcano.common.runtime;

import com.google.common.base.MoreObjects;

/**
 * Reason why a controller process is about to stop reconciling, reported through
 * {@link VolcanoRuntime#beforeAbort(SystemAbortEvent)}.
 */
public final class SystemAbortEvent {

    public enum FailureType {
        /**
         * A restarted process is expected to recover on its own, for example after losing the controller lease.
         */
        Recoverable,

        /**
         * The process cannot run until its environment is fixed.
         */
        Nonrecoverable
    }

    private final String component;
    private final String failureId;
    private final FailureType failureType;
    private final String reason;
    private final long timestamp;

    private SystemAbortEvent(String component, String failureId, FailureType failureType, String reason, long timestamp) {
        this.component = component;
        this.failureId = failureId;
        this.failureType = failureType;
        this.reason = reason;
        this.timestamp = timestamp;
    }

    public String getComponent() {
        return component;
    }

    public String getFailureId() {
        return failureId;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    public String getReason() {
        return reason;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("component", component)
                .add("failureId", failureId)
                .add("failureType", failureType)
                .add("reason", reason)
                .add("timestamp", timestamp)
                .toString();
    }

    public static SystemAbortEvent recoverable(String component, String failureId, String reason, long timestamp) {
        return new SystemAbortEvent(component, failureId, FailureType.Recoverable, reason, timestamp);
    }

    public static SystemAbortEvent nonrecoverable(String component, String failureId, String reason, long timestamp) {
        return new SystemAbortEvent(component, failureId, FailureType.Nonrecoverable, reason, timestamp);
    }
}
