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

/**
 * Millisecond time source. Lease deadlines, garbage collection TTLs and rate limiter refills are computed against
 * it, so tests can drive them with a {@link TestClock}.
 */
public interface Clock {

    long wallTime();

    /**
     * @return milliseconds left until the given deadline, or 0 if it already passed
     */
    default long millisUntil(long deadline) {
        return Math.max(0, deadline - wallTime());
    }
}
