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

import io.kubernetes.client.openapi.JSON;

/**
 * Objects returned by the informers are shared with the caches, and must not be modified in place.
 */
public final class KubeObjects {

    private static final JSON KUBE_JSON = new JSON();

    private KubeObjects() {
    }

    public static <T> T deepCopy(T object, Class<T> type) {
        if (object == null) {
            return null;
        }
        return KUBE_JSON.deserialize(KUBE_JSON.serialize(object), type);
    }
}
