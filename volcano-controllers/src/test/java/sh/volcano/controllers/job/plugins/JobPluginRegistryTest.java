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

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;
import sh.volcano.controllers.job.plugins.ssh.SshPlugin;
import sh.volcano.controllers.kubernetes.KubeApiFacade;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

public class JobPluginRegistryTest {

    private final PluginClientset clientset = new PluginClientset(mock(KubeApiFacade.class));

    @Test
    public void testNewPluginPassesArgumentsToFactory() {
        AtomicReference<List<String>> argumentsRef = new AtomicReference<>();
        JobPluginRegistry registry = JobPluginRegistry.newBuilder()
                .register("recording", (clientset, arguments) -> {
                    argumentsRef.set(arguments);
                    return mock(JobPlugin.class);
                })
                .build();

        registry.newPlugin("recording", clientset, Arrays.asList("--a", "b"));
        assertThat(argumentsRef.get()).containsExactly("--a", "b");

        registry.newPlugin("recording", clientset, null);
        assertThat(argumentsRef.get()).isEmpty();
    }

    @Test
    public void testUnknownPlugin() {
        JobPluginRegistry registry = JobPluginRegistry.newBuilder().register(SshPlugin.NAME, SshPlugin.FACTORY).build();

        assertThat(registry.contains("ssh")).isTrue();
        assertThat(registry.contains("env")).isFalse();
        assertThatThrownBy(() -> registry.newPlugin("env", clientset, null))
                .isInstanceOf(JobPluginException.class)
                .hasMessageContaining("env")
                .matches(e -> ((JobPluginException) e).getErrorCode() == JobPluginException.ErrorCode.PluginNotFound);
    }

    @Test
    public void testInvalidArgumentsAreReportedByFactory() {
        JobPluginRegistry registry = JobPluginRegistry.newBuilder().register(SshPlugin.NAME, SshPlugin.FACTORY).build();

        assertThatThrownBy(() -> registry.newPlugin("ssh", clientset, Arrays.asList("--unknown-flag")))
                .isInstanceOf(JobPluginException.class)
                .matches(e -> ((JobPluginException) e).getErrorCode() == JobPluginException.ErrorCode.InvalidArguments);
    }

    @Test
    public void testDuplicateRegistrationIsRejected() {
        JobPluginRegistry.Builder builder = JobPluginRegistry.newBuilder()
                .register(SshPlugin.NAME, SshPlugin.FACTORY)
                .register(SshPlugin.NAME, SshPlugin.FACTORY);

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testPluginNames() {
        JobPluginRegistry registry = JobPluginRegistry.newBuilder()
                .register("ssh", SshPlugin.FACTORY)
                .register("other", (clientset, arguments) -> mock(JobPlugin.class))
                .build();

        assertThat(registry.getPluginNames()).containsExactly("ssh", "other");
    }
}
