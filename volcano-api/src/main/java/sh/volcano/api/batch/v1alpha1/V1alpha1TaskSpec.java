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

import java.util.Objects;

import com.google.gson.annotations.SerializedName;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;

/**
 * GSON-compatible POJO, with a default constructor following JavaBeans conventions.
 */
public class V1alpha1TaskSpec {
    @SerializedName("name")
    private String name;

    @SerializedName("replicas")
    private int replicas;

    @SerializedName("template")
    private V1PodTemplateSpec template;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getReplicas() {
        return replicas;
    }

    public void setReplicas(int replicas) {
        this.replicas = replicas;
    }

    public V1PodTemplateSpec getTemplate() {
        return template;
    }

    public void setTemplate(V1PodTemplateSpec template) {
        this.template = template;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        V1alpha1TaskSpec that = (V1alpha1TaskSpec) o;
        return Objects.equals(name, that.name) &&
                replicas == that.replicas &&
                Objects.equals(template, that.template);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, replicas, template);
    }

    @Override
    public String toString() {
        return "V1alpha1TaskSpec{" +
                "name='" + name + '\'' +
                ", replicas=" + replicas +
                ", template=" + template +
                '}';
    }
}
