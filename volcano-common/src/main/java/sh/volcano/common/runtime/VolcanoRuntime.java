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

import com.netflix.spectator.api.Registry;
import sh.volcano.common.util.time.Clock;

/**
 * Collection of core services shared by all controller components. It is passed explicitly through constructors
 * instead of being reached through static accessors.
 */
public interface VolcanoRuntime {

    /**
     * Returns the configured Spectator registry.
     */
    Registry getRegistry();

    /**
     * Returns the configured clock.
     */
    Clock getClock();

    /**
     * If true, fatal errors returned to the process entry point cause JVM termination via System.exit.
     */
    boolean isSystemExitOnFailure();

    /**
     * A component that can no longer act safely (for example a controller replica that lost its lease) must
     * call this method before it stops, so the {@link SystemAbortListener} can alert an administrator. The
     * decision whether to terminate the process belongs to the caller that receives the error.
     */
    void beforeAbort(SystemAbortEvent event);
}
