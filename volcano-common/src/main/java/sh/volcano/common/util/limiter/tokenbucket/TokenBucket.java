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

package sh.volcano.common.util.limiter.tokenbucket;

/**
 * Token bucket refilled with a fixed number of tokens per interval. Used to throttle the API server calls of the
 * controllers.
 */
public interface TokenBucket {

    String getName();

    long getCapacity();

    /**
     * @return the number of tokens currently in the bucket, after the refill due at this time
     */
    long getNumberOfTokens();

    boolean tryTake();

    /**
     * Take all or none of the given number of tokens.
     *
     * @return true if the tokens were taken
     */
    boolean tryTake(long numberOfTokens);

    /**
     * Take a token from the bucket, blocking until one is available.
     */
    void take();

    /**
     * @return milliseconds until the next refill adds tokens to the bucket
     */
    long getMillisUntilNextRefill();
}
