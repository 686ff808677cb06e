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

package sh.volcano.common.util.time;

public final class Clocks {

    private static final Clock SYSTEM = System::currentTimeMillis;

    private Clocks() {
    }

    public static Clock system() {
        return SYSTEM;
    }

    public static TestClock test() {
        return new TestClock(0);
    }

    public static TestClock test(long startTime) {
        return new TestClock(startTime);
    }
}
