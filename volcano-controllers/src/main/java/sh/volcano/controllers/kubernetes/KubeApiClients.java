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

package sh.volcano.controllers.kubernetes;

import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Strings;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.Config;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.ExecutorsExt;
import sh.volcano.common.util.limiter.Limiters;
import sh.volcano.common.util.limiter.tokenbucket.TokenBucket;
import sh.volcano.controllers.kubernetes.okhttp.RateLimitingInterceptor;

public final class KubeApiClients {

    private KubeApiClients() {
    }

    /**
     * Create an API client. The connection settings are resolved in this order: explicit API server URL,
     * kubeconfig file, default client configuration (in-cluster service account or ~/.kube/config).
     * All requests share one token bucket with the given QPS and burst.
     */
    public static ApiClient createApiClient(String kubeApiServerUrl,
                                            String kubeConfigPath,
                                            int qps,
                                            int burst,
                                            long readTimeoutSec,
                                            VolcanoRuntime runtime) {
        ApiClient client;
        if (Strings.isNullOrEmpty(kubeApiServerUrl)) {
            try {
                if (Strings.isNullOrEmpty(kubeConfigPath)) {
                    client = Config.defaultClient();
                } else {
                    client = Config.fromConfig(kubeConfigPath);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Cannot load Kubernetes client configuration", e);
            }
        } else {
            client = Config.fromUrl(kubeApiServerUrl);
        }

        TokenBucket tokenBucket = Limiters.createQpsTokenBucket("kubeApiClient", qps, burst, runtime.getClock());

        // See: https://github.com/kubernetes-client/java/pull/960
        OkHttpClient httpClient = client.getHttpClient().newBuilder()
                .protocols(Collections.singletonList(Protocol.HTTP_1_1))
                .addInterceptor(new RateLimitingInterceptor(tokenBucket))
                .readTimeout(readTimeoutSec, TimeUnit.SECONDS)
                .build();
        client.setHttpClient(httpClient);
        return client;
    }

    static ExecutorService newInformerThreadPool(String threadNamePrefix, VolcanoRuntime runtime) {
        return ExecutorsExt.instrumentedCachedThreadPool(runtime.getRegistry(), threadNamePrefix);
    }
}
