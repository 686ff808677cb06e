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

package sh.volcano.common.util.limiter;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import sh.volcano.common.util.limiter.tokenbucket.TokenBucket;
import sh.volcano.common.util.limiter.tokenbucket.internal.DefaultTokenBucket;
import sh.volcano.common.util.time.Clock;

public final class Limiters {

    private Limiters() {
    }

    /**
     * Create a {@link TokenBucket} that gains the given number of tokens every interval.
     */
    public static TokenBucket createFixedIntervalTokenBucket(String name,
                                                             long capacity,
                                                             long initialNumberOfTokens,
                                                             long numberOfTokensPerInterval,
                                                             long interval,
                                                             TimeUnit unit,
                                                             Clock clock) {
        return new DefaultTokenBucket(name, capacity, initialNumberOfTokens, numberOfTokensPerInterval, unit.toMillis(interval), clock);
    }

    /**
     * Token bucket with the client-go QPS/burst semantics: the bucket starts full with burst tokens, and
     * refills one token every 1/qps seconds.
     */
    public static TokenBucket createQpsTokenBucket(String name, int qps, int burst, Clock clock) {
        Preconditions.checkArgument(qps > 0, "QPS must be > 0");
        Preconditions.checkArgument(burst > 0, "Burst must be > 0");
        return createFixedIntervalTokenBucket(name, burst, burst, 1, TimeUnit.SECONDS.toMicros(1) / qps, TimeUnit.MICROSECONDS, clock);
    }
}
