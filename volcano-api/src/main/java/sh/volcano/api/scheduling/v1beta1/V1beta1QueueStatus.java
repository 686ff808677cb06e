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
public class V1beta1QueueStatus {
    @SerializedName("state")
    private String state;

    @SerializedName("pending")
    private int pending;

    @SerializedName("running")
    private int running;

    @SerializedName("unknown")
    private int unknown;

    @SerializedName("inqueue")
    private int inqueue;

    public String getState() {
        return state;
    }

    public void setState(String state) {
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

    public int getUnknown() {
        return unknown;
    }

    public void setUnknown(int unknown) {
        this.unknown = unknown;
    }

    public int getInqueue() {
        return inqueue;
    }

    public void setInqueue(int inqueue) {
        this.inqueue = inqueue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1beta1QueueStatus that = (V1beta1QueueStatus) o;
        return Objects.equals(state, that.state) &&
                pending == that.pending &&
                running == that.running &&
                unknown == that.unknown &&
                inqueue == that.inqueue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, pending, running, unknown, inqueue);
    }

    @Override
    public String toString() {
        return "V1beta1QueueStatus{" +
                "state='" + state + '\'' +
                ", pending=" + pending +
                ", running=" + running +
                ", unknown=" + unknown +
                ", inqueue=" + inqueue +
                '}';
    }
}
