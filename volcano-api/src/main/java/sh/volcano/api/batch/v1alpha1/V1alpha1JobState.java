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

import java.time.OffsetDateTime;
import java.util.Objects;

import com.google.gson.annotations.SerializedName;

/**
 * GSON-compatible POJO, with a default constructor following JavaBeans conventions.
 */
public class V1alpha1JobState {
    @SerializedName("phase")
    private String phase;

    @SerializedName("reason")
    private String reason;

    @SerializedName("message")
    private String message;

    @SerializedName("lastTransitionTime")
    private OffsetDateTime lastTransitionTime;

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public OffsetDateTime getLastTransitionTime() {
        return lastTransitionTime;
    }

    public void setLastTransitionTime(OffsetDateTime lastTransitionTime) {
        this.lastTransitionTime = lastTransitionTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1alpha1JobState that = (V1alpha1JobState) o;
        return Objects.equals(phase, that.phase) &&
                Objects.equals(reason, that.reason) &&
                Objects.equals(message, that.message) &&
                Objects.equals(lastTransitionTime, that.lastTransitionTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, reason, message, lastTransitionTime);
    }

    @Override
    public String toString() {
        return "V1alpha1JobState{" +
                "phase='" + phase + '\'' +
                ", reason='" + reason + '\'' +
                ", message='" + message + '\'' +
                ", lastTransitionTime=" + lastTransitionTime +
                '}';
    }
}
