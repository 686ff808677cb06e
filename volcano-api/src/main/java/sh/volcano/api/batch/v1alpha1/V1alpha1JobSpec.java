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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.gson.annotations.SerializedName;

/**
 * GSON-compatible POJO, with a default constructor following JavaBeans conventions.
 */
public class V1alpha1JobSpec {
    @SerializedName("schedulerName")
    private String schedulerName;

    @SerializedName("minAvailable")
    private int minAvailable;

    @SerializedName("queue")
    private String queue;

    @SerializedName("tasks")
    private List<V1alpha1TaskSpec> tasks = new ArrayList<>();

    @SerializedName("plugins")
    private Map<String, List<String>> plugins;

    @SerializedName("ttlSecondsAfterFinished")
    private Integer ttlSecondsAfterFinished;

    public String getSchedulerName() {
        return schedulerName;
    }

    public void setSchedulerName(String schedulerName) {
        this.schedulerName = schedulerName;
    }

    public int getMinAvailable() {
        return minAvailable;
    }

    public void setMinAvailable(int minAvailable) {
        this.minAvailable = minAvailable;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public List<V1alpha1TaskSpec> getTasks() {
        return tasks;
    }

    public void setTasks(List<V1alpha1TaskSpec> tasks) {
        this.tasks = tasks;
    }

    public Map<String, List<String>> getPlugins() {
        return plugins;
    }

    public void setPlugins(Map<String, List<String>> plugins) {
        this.plugins = plugins;
    }

    public Integer getTtlSecondsAfterFinished() {
        return ttlSecondsAfterFinished;
    }

    public void setTtlSecondsAfterFinished(Integer ttlSecondsAfterFinished) {
        this.ttlSecondsAfterFinished = ttlSecondsAfterFinished;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1alpha1JobSpec that = (V1alpha1JobSpec) o;
        return Objects.equals(schedulerName, that.schedulerName) &&
                minAvailable == that.minAvailable &&
                Objects.equals(queue, that.queue) &&
                Objects.equals(tasks, that.tasks) &&
                Objects.equals(plugins, that.plugins) &&
                Objects.equals(ttlSecondsAfterFinished, that.ttlSecondsAfterFinished);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schedulerName, minAvailable, queue, tasks, plugins, ttlSecondsAfterFinished);
    }

    @Override
    public String toString() {
        return "V1alpha1JobSpec{" +
                "schedulerName='" + schedulerName + '\'' +
                ", minAvailable=" + minAvailable +
                ", queue='" + queue + '\'' +
                ", tasks=" + tasks +
                ", plugins=" + plugins +
                ", ttlSecondsAfterFinished=" + ttlSecondsAfterFinished +
                '}';
    }
}
