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

package sh.volcano.common.runtime;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class VolcanoRuntimesTest {

    @Test
    public void testBeforeAbortNotifiesListener() {
        List<SystemAbortEvent> events = new ArrayList<>();
        VolcanoRuntime runtime = VolcanoRuntimes.internal(events::add);

        SystemAbortEvent event = SystemAbortEvent.recoverable("test", "leaderLost", "simulated", runtime.getClock().wallTime());
        runtime.beforeAbort(event);

        assertThat(events).containsExactly(event);
        assertThat(event.getFailureType()).isEqualTo(SystemAbortEvent.FailureType.Recoverable);
        assertThat(event.toString()).contains("component=test").contains("failureId=leaderLost");
        assertThat(runtime.isSystemExitOnFailure()).isFalse();
    }

    @Test
    public void testDefaultRuntimeHasNoListener() {
        VolcanoRuntime runtime = VolcanoRuntimes.test();
        runtime.beforeAbort(SystemAbortEvent.recoverable("test", "leaderLost", "simulated", runtime.getClock().wallTime()));
        assertThat(runtime.getClock().wallTime()).isZero();
    }

    @Test
    public void testListenerErrorIsNotPropagated() {
        VolcanoRuntime runtime = VolcanoRuntimes.internal(event -> {
            throw new RuntimeException("simulated listener error");
        });
        runtime.beforeAbort(SystemAbortEvent.nonrecoverable("test", "test", "simulated", 0));
    }
}
