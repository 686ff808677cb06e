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

package sh.volcano.controllers.job.plugins;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable name to factory mapping of the available job plugins. Populated once during the process bootstrap.
 */
public class JobPluginRegistry {

    private final Map<String, JobPluginFactory> factories;

    private JobPluginRegistry(Map<String, JobPluginFactory> factories) {
        this.factories = factories;
    }

    public Set<String> getPluginNames() {
        return factories.keySet();
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    /**
     * @throws JobPluginException with {@link JobPluginException.ErrorCode#PluginNotFound} for an unknown name, or
     *                            {@link JobPluginException.ErrorCode#InvalidArguments} if the plugin rejects the arguments
     */
    public JobPlugin newPlugin(String name, PluginClientset clientset, List<String> arguments) throws JobPluginException {
        JobPluginFactory factory = factories.get(name);
        if (factory == null) {
            throw JobPluginException.pluginNotFound(name);
        }
        return factory.create(clientset, arguments == null ? Collections.emptyList() : arguments);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private final ImmutableMap.Builder<String, JobPluginFactory> factories = ImmutableMap.builder();

        private Builder() {
        }

        public Builder register(String name, JobPluginFactory factory) {
            Preconditions.checkNotNull(name, "plugin name is null");
            Preconditions.checkNotNull(factory, "plugin factory is null");
            factories.put(name, factory);
            return this;
        }

        /**
         * @throws IllegalArgumentException if the same name is registered twice
         */
        public JobPluginRegistry build() {
            return new JobPluginRegistry(factories.build());
        }
    }
}
