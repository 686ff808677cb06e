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
public class V1beta1PodGroupSpec {
    @SerializedName("minMember")
    private int minMember;

    @SerializedName("queue")
    private String queue;

    @SerializedName("priorityClassName")
    private String priorityClassName;

    public int getMinMember() {
        return minMember;
    }

    public void setMinMember(int minMember) {
        this.minMember = minMember;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getPriorityClassName() {
        return priorityClassName;
    }

    public void setPriorityClassName(String priorityClassName) {
        this.priorityClassName = priorityClassName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1beta1PodGroupSpec that = (V1beta1PodGroupSpec) o;
        return minMember == that.minMember &&
                Objects.equals(queue, that.queue) &&
                Objects.equals(priorityClassName, that.priorityClassName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minMember, queue, priorityClassName);
    }

    @Override
    public String toString() {
        return "V1beta1PodGroupSpec{" +
                "minMember=" + minMember +
                ", queue='" + queue + '\'' +
                ", priorityClassName='" + priorityClassName + '\'' +
                '}';
    }
}
