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

import sh.volcano.common.runtime.internal.DefaultVolcanoRuntime;
import sh.volcano.common.util.time.Clocks;
import sh.volcano.common.util.time.TestClock;

public final class VolcanoRuntimes {

    private VolcanoRuntimes() {
    }

    public static VolcanoRuntime internal() {
        return DefaultVolcanoRuntime.newBuilder().build();
    }

    public static VolcanoRuntime internal(SystemAbortListener systemAbortListener) {
        return DefaultVolcanoRuntime.newBuilder()
                .withSystemAbortListener(systemAbortListener)
                .build();
    }

    public static VolcanoRuntime test() {
        return test(Clocks.test());
    }

    public static VolcanoRuntime test(TestClock clock) {
        return DefaultVolcanoRuntime.newBuilder()
                .withClock(clock)
                .build();
    }

    public static VolcanoRuntime test(TestClock clock, SystemAbortListener systemAbortListener) {
        return DefaultVolcanoRuntime.newBuilder()
                .withClock(clock)
                .withSystemAbortListener(systemAbortListener)
                .build();
    }
}
