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

import java.util.Objects;

import com.google.gson.annotations.SerializedName;

/**
 * GSON-compatible POJO, with a default constructor following JavaBeans conventions.
 */
public class V1beta1PodGroupStatus {
    @SerializedName("phase")
    private String phase;

    @SerializedName("running")
    private int running;

    @SerializedName("succeeded")
    private int succeeded;

    @SerializedName("failed")
    private int failed;

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1beta1PodGroupStatus that = (V1beta1PodGroupStatus) o;
        return Objects.equals(phase, that.phase) &&
                running == that.running &&
                succeeded == that.succeeded &&
                failed == that.failed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, running, succeeded, failed);
    }

    @Override
    public String toString() {
        return "V1beta1PodGroupStatus{" +
                "phase='" + phase + '\'' +
                ", running=" + running +
                ", succeeded=" + succeeded +
                ", failed=" + failed +
                '}';
    }
}
