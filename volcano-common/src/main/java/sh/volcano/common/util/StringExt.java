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

package sh.volcano.common.util;

import java.util.Collections;
import java.util.Map;

/**
 * A set of string manipulation related functions.
 */
public final class StringExt {

    private StringExt() {
    }

    /**
     * Return true if the string value is null or an empty string.
     */
    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Null safe map getter, as Kubernetes models leave label and annotation maps unset when empty.
     */
    public static String getOrEmpty(Map<String, String> map, String key) {
        if (map == null) {
            return "";
        }
        String value = map.get(key);
        return value == null ? "" : value;
    }

    public static Map<String, String> nonNull(Map<String, String> map) {
        return map == null ? Collections.emptyMap() : map;
    }
}
