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

package sh.volcano.controllers.supervisor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import org.junit.Test;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.runtime.internal.DefaultVolcanoRuntime;
import sh.volcano.common.util.time.Clocks;
import sh.volcano.common.util.time.TestClock;

import static org.assertj.core.api.Assertions.assertThat;

public class BasePeriodicControllerTest {

    private static final long INTERVAL_MS = 1_000;

    private final TestClock clock = Clocks.test();
    private final Registry registry = new DefaultRegistry();
    private final VolcanoRuntime runtime = DefaultVolcanoRuntime.newBuilder()
            .withClock(clock)
            .withRegistry(registry)
            .build();

    private final TestPeriodicController controller = new TestPeriodicController(runtime);

    @Test
    public void testItemsPerIntervalAreLimitedByTheBatchSize() {
        controller.runIteration();
        assertThat(controller.processed).containsExactly(0, 1, 2, 3);
        assertThat(gaugeValue("successes")).isEqualTo(4);
        assertThat(gaugeValue("skipped")).isEqualTo(6);

        // No tokens left until the next interval
        controller.runIteration();
        assertThat(controller.processed).hasSize(4);

        clock.advanceTime(INTERVAL_MS, TimeUnit.MILLISECONDS);
        controller.runIteration();
        assertThat(controller.processed).hasSize(8);
    }

    @Test
    public void testFailuresAreCounted() {
        controller.failing = true;
        controller.runIteration();
        assertThat(gaugeValue("failures")).isEqualTo(4);
        assertThat(gaugeValue("successes")).isEqualTo(0);
    }

    @Test
    public void testIterationSkippedWhenNotReady() {
        controller.ready = false;
        controller.runIteration();
        assertThat(controller.processed).isEmpty();
    }

    private double gaugeValue(String type) {
        return registry.gauge("volcano.controllers.test", "type", type).value();
    }

    private static class TestPeriodicController extends BasePeriodicController<Integer> {

        private final List<Integer> processed = new ArrayList<>();
        private boolean ready = true;
        private boolean failing;
        private int next;

        private TestPeriodicController(VolcanoRuntime runtime) {
            super("test", INTERVAL_MS, 4, runtime);
        }

        @Override
        protected boolean isReady() {
            return ready;
        }

        @Override
        protected List<Integer> getItemsToProcess() {
            return IntStream.range(next, next + 10).boxed().collect(Collectors.toList());
        }

        @Override
        protected boolean processItem(Integer item) {
            if (failing) {
                throw new IllegalStateException("simulated failure");
            }
            processed.add(item);
            next = item + 1;
            return true;
        }
    }
}
