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

/**
 * Hook for alerting about a controller process that stops reconciling. The event itself is always logged by the
 * runtime; a listener adds other channels.
 */
@FunctionalInterface
public interface SystemAbortListener {

    SystemAbortListener NONE = event -> {
    };

    void onSystemAbortEvent(SystemAbortEvent event);
}
