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

package sh.volcano.controllers.job.plugins.ssh;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;
import sh.volcano.controllers.job.plugins.JobPluginException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

public class SshPluginConfigurationTest {

    @Test
    public void testDefaults() {
        SshPluginConfiguration configuration = SshPluginConfiguration.parse(Collections.emptyList());
        assertThat(configuration.isNoRoot()).isFalse();
        assertThat(configuration.getSshKeyFilePath()).isEqualTo("/root/.ssh");
    }

    @Test
    public void testNoRootMovesTheDefaultPath() {
        assertThat(SshPluginConfiguration.parse(Arrays.asList("--no-root")).getSshKeyFilePath()).isEqualTo("/etc/volcano/.ssh");
        assertThat(SshPluginConfiguration.parse(Arrays.asList("-no-root")).getSshKeyFilePath()).isEqualTo("/etc/volcano/.ssh");
    }

    @Test
    public void testNoRootWithInlineValue() {
        assertThat(SshPluginConfiguration.parse(Arrays.asList("--no-root=true")).isNoRoot()).isTrue();
        assertThat(SshPluginConfiguration.parse(Arrays.asList("-no-root=1")).getSshKeyFilePath()).isEqualTo("/etc/volcano/.ssh");

        SshPluginConfiguration disabled = SshPluginConfiguration.parse(Arrays.asList("-no-root=false"));
        assertThat(disabled.isNoRoot()).isFalse();
        assertThat(disabled.getSshKeyFilePath()).isEqualTo("/root/.ssh");
    }

    @Test
    public void testLastNoRootOccurrenceWins() {
        assertThat(SshPluginConfiguration.parse(Arrays.asList("--no-root", "--no-root=false")).isNoRoot()).isFalse();
        assertThat(SshPluginConfiguration.parse(Arrays.asList("--no-root=false", "--no-root")).isNoRoot()).isTrue();
    }

    @Test
    public void testBareNoRootDoesNotConsumeTheNextArgument() {
        SshPluginConfiguration configuration = SshPluginConfiguration.parse(Arrays.asList("--no-root", "--ssh-key-file-path", "/home/user/.ssh"));
        assertThat(configuration.isNoRoot()).isTrue();
        assertThat(configuration.getSshKeyFilePath()).isEqualTo("/home/user/.ssh");

        expectInvalidArguments("--no-root", "false");
    }

    @Test
    public void testInvalidNoRootValue() {
        expectInvalidArguments("--no-root=yes");
        expectInvalidArguments("-no-root=");
    }

    @Test
    public void testExplicitPath() {
        assertThat(SshPluginConfiguration.parse(Arrays.asList("--ssh-key-file-path=/home/user/.ssh")).getSshKeyFilePath())
                .isEqualTo("/home/user/.ssh");
        assertThat(SshPluginConfiguration.parse(Arrays.asList("--ssh-key-file-path", "/home/user/.ssh")).getSshKeyFilePath())
                .isEqualTo("/home/user/.ssh");
    }

    @Test
    public void testExplicitPathWinsOverNoRoot() {
        SshPluginConfiguration configuration = SshPluginConfiguration.parse(Arrays.asList("--no-root", "--ssh-key-file-path=/home/user/.ssh"));
        assertThat(configuration.isNoRoot()).isTrue();
        assertThat(configuration.getSshKeyFilePath()).isEqualTo("/home/user/.ssh");
    }

    @Test
    public void testUnknownOption() {
        expectInvalidArguments("--unknown");
        expectInvalidArguments("-x");
    }

    @Test
    public void testUnexpectedPositionalArgument() {
        expectInvalidArguments("--no-root", "extra");
    }

    @Test
    public void testMissingOptionValue() {
        expectInvalidArguments("--ssh-key-file-path");
    }

    private static void expectInvalidArguments(String... arguments) {
        try {
            SshPluginConfiguration.parse(Arrays.asList(arguments));
            fail("Expected invalid arguments error for " + Arrays.toString(arguments));
        } catch (JobPluginException e) {
            assertThat(e.getErrorCode()).isEqualTo(JobPluginException.ErrorCode.InvalidArguments);
        }
    }
}
