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

package sh.volcano.controllers.kubernetes.okhttp;

import java.io.IOException;

import okhttp3.Interceptor;
import okhttp3.Response;
import sh.volcano.common.util.limiter.tokenbucket.TokenBucket;

/**
 * Blocks each outgoing request until a token is available in the shared bucket.
 */
public class RateLimitingInterceptor implements Interceptor {

    private final TokenBucket tokenBucket;

    public RateLimitingInterceptor(TokenBucket tokenBucket) {
        this.tokenBucket = tokenBucket;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        tokenBucket.take();
        return chain.proceed(chain.request());
    }
}
