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

package sh.volcano.common.util.limiter.tokenbucket.internal;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import sh.volcano.common.util.limiter.tokenbucket.TokenBucket;
import sh.volcano.common.util.time.Clock;

/**
 * Adds a fixed number of tokens each time a full interval elapses. The time of a partial interval carries over to
 * the next refill, so the long term rate is exact.
 */
public class DefaultTokenBucket implements TokenBucket {

    private final String name;
    private final long capacity;
    private final long tokensPerInterval;
    private final long intervalMs;
    private final Clock clock;

    private long numberOfTokens;
    private long lastRefillTime;

    public DefaultTokenBucket(String name,
                              long capacity,
                              long initialNumberOfTokens,
                              long tokensPerInterval,
                              long intervalMs,
                              Clock clock) {
        Preconditions.checkArgument(capacity > 0, "Capacity must be > 0");
        Preconditions.checkArgument(initialNumberOfTokens >= 0 && initialNumberOfTokens <= capacity,
                "Initial number of tokens must be in range [0, %s]", capacity);
        Preconditions.checkArgument(tokensPerInterval > 0, "Number of tokens per interval must be > 0");
        this.name = name;
        this.capacity = capacity;
        this.tokensPerInterval = tokensPerInterval;
        this.intervalMs = Math.max(1, intervalMs);
        this.clock = clock;
        this.numberOfTokens = initialNumberOfTokens;
        this.lastRefillTime = clock.wallTime();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long getCapacity() {
        return capacity;
    }

    @Override
    public synchronized long getNumberOfTokens() {
        refill();
        return numberOfTokens;
    }

    @Override
    public boolean tryTake() {
        return tryTake(1);
    }

    @Override
    public synchronized boolean tryTake(long count) {
        Preconditions.checkArgument(count > 0 && count <= capacity, "Number of tokens must be in range [1, %s]", capacity);
        refill();
        if (numberOfTokens < count) {
            return false;
        }
        numberOfTokens -= count;
        return true;
    }

    @Override
    public void take() {
        while (!tryTake()) {
            try {
                Thread.sleep(Math.max(1, getMillisUntilNextRefill()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for tokens in bucket " + name, e);
            }
        }
    }

    @Override
    public synchronized long getMillisUntilNextRefill() {
        return clock.millisUntil(lastRefillTime + intervalMs);
    }

    private void refill() {
        long intervals = (clock.wallTime() - lastRefillTime) / intervalMs;
        if (intervals <= 0) {
            return;
        }
        lastRefillTime += intervals * intervalMs;
        numberOfTokens = Math.min(capacity, numberOfTokens + intervals * tokensPerInterval);
    }

    @Override
    public synchronized String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("capacity", capacity)
                .add("numberOfTokens", numberOfTokens)
                .toString();
    }
}
