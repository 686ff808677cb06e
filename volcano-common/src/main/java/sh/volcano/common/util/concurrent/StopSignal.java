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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot stop notification shared between a component and its owner. Once stopped, a signal stays stopped.
 * Child signals are stopped together with their parent, but stopping a child does not affect the parent.
 */
public class StopSignal {

    private final CompletableFuture<Void> stopFuture = new CompletableFuture<>();

    public void stop() {
        stopFuture.complete(null);
    }

    public boolean isStopped() {
        return stopFuture.isDone();
    }

    /**
     * Block until the signal is stopped.
     */
    public void await() throws InterruptedException {
        try {
            stopFuture.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Stop signal completed exceptionally", e);
        }
    }

    /**
     * Block until the signal is stopped or the timeout elapses.
     *
     * @return true if the signal was stopped
     */
    public boolean await(Duration timeout) throws InterruptedException {
        try {
            stopFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Stop signal completed exceptionally", e);
        }
    }

    /**
     * Register an action executed once, when the signal is stopped. If the signal is already stopped, the action
     * runs immediately in the caller's thread.
     */
    public void onStop(Runnable action) {
        stopFuture.thenRun(action);
    }

    public StopSignal newChild() {
        StopSignal child = new StopSignal();
        onStop(child::stop);
        return child;
    }

    public static StopSignal newSignal() {
        return new StopSignal();
    }
}
