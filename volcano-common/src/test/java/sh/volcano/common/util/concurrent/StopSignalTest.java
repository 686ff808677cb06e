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

package sh.volcano.common.util.concurrent;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class StopSignalTest {

    @Test
    public void testStopIsIdempotent() {
        StopSignal signal = StopSignal.newSignal();
        AtomicInteger counter = new AtomicInteger();
        signal.onStop(counter::incrementAndGet);

        assertThat(signal.isStopped()).isFalse();
        signal.stop();
        signal.stop();

        assertThat(signal.isStopped()).isTrue();
        assertThat(counter.get()).isEqualTo(1);
    }

    @Test
    public void testParentStopPropagatesToChild() {
        StopSignal parent = StopSignal.newSignal();
        StopSignal child = parent.newChild();

        parent.stop();
        assertThat(child.isStopped()).isTrue();
    }

    @Test
    public void testChildStopDoesNotStopParent() {
        StopSignal parent = StopSignal.newSignal();
        StopSignal child = parent.newChild();

        child.stop();
        assertThat(child.isStopped()).isTrue();
        assertThat(parent.isStopped()).isFalse();
    }

    @Test
    public void testChildOfStoppedParentIsStopped() {
        StopSignal parent = StopSignal.newSignal();
        parent.stop();

        assertThat(parent.newChild().isStopped()).isTrue();
    }

    @Test
    public void testAwaitWithTimeout() throws Exception {
        StopSignal signal = StopSignal.newSignal();
        assertThat(signal.await(Duration.ofMillis(10))).isFalse();

        CountDownLatch latch = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                signal.await();
                latch.countDown();
            } catch (InterruptedException ignore) {
            }
        });
        waiter.start();

        signal.stop();
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(signal.await(Duration.ofMillis(10))).isTrue();
    }
}
