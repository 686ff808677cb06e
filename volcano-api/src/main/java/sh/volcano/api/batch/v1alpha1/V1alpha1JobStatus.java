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

import java.util.Map;
import java.util.Objects;

import com.google.gson.annotations.SerializedName;

/**
 * GSON-compatible POJO, with a default constructor following JavaBeans conventions.
 */
public class V1alpha1JobStatus {
    @SerializedName("state")
    private V1alpha1JobState state;

    @SerializedName("pending")
    private int pending;

    @SerializedName("running")
    private int running;

    @SerializedName("succeeded")
    private int succeeded;

    @SerializedName("failed")
    private int failed;

    @SerializedName("controlledResources")
    private Map<String, String> controlledResources;

    public V1alpha1JobState getState() {
        return state;
    }

    public void setState(V1alpha1JobState state) {
        this.state = state;
    }

    public int getPending() {
        return pending;
    }

    public void setPending(int pending) {
        this.pending = pending;
    }

    public int getRunning() {
        return running;
    }

    public void setRunning(int running) {
        this.running = running;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public void setSucceeded(int succeeded) {
        this.succeeded = succeeded;
    }

    public int getFailed() {
        return failed;
    }

    public void setFailed(int failed) {
        this.failed = failed;
    }

    public Map<String, String> getControlledResources() {
        return controlledResources;
    }

    public void setControlledResources(Map<String, String> controlledResources) {
        this.controlledResources = controlledResources;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1alpha1JobStatus that = (V1alpha1JobStatus) o;
        return Objects.equals(state, that.state) &&
                pending == that.pending &&
                running == that.running &&
                succeeded == that.succeeded &&
                failed == that.failed &&
                Objects.equals(controlledResources, that.controlledResources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, pending, running, succeeded, failed, controlledResources);
    }

    @Override
    public String toString() {
        return "V1alpha1JobStatus{" +
                "state=" + state +
                ", pending=" + pending +
                ", running=" + running +
                ", succeeded=" + succeeded +
                ", failed=" + failed +
                ", controlledResources=" + controlledResources +
                '}';
    }
}
