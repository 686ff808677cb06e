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

package sh.volcano.common.runtime.internal;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.volcano.common.runtime.SystemAbortEvent;
import sh.volcano.common.runtime.SystemAbortListener;
import sh.volcano.common.runtime.VolcanoRuntime;
import sh.volcano.common.util.time.Clock;
import sh.volcano.common.util.time.Clocks;

@Singleton
public class DefaultVolcanoRuntime implements VolcanoRuntime {

    private static final Logger logger = LoggerFactory.getLogger(DefaultVolcanoRuntime.class);

    public static final String SYSTEM_EXIT_ON_FAILURE_PROPERTY = "volcano.runtime.systemExitOnFailure";

    private final SystemAbortListener systemAbortListener;
    private final Registry registry;
    private final Clock clock;
    private final boolean systemExitOnFailure;

    @Inject
    public DefaultVolcanoRuntime(SystemAbortListener systemAbortListener, Registry registry) {
        this(
                systemAbortListener,
                registry,
                Clocks.system(),
                "true".equals(System.getProperty(SYSTEM_EXIT_ON_FAILURE_PROPERTY, "true"))
        );
    }

    public DefaultVolcanoRuntime(SystemAbortListener systemAbortListener,
                                 Registry registry,
                                 Clock clock,
                                 boolean systemExitOnFailure) {
        this.systemAbortListener = systemAbortListener;
        this.registry = registry;
        this.clock = clock;
        this.systemExitOnFailure = systemExitOnFailure;
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public boolean isSystemExitOnFailure() {
        return systemExitOnFailure;
    }

    @Override
    public void beforeAbort(SystemAbortEvent event) {
        logger.error("System abort requested: {}", event);
        try {
            systemAbortListener.onSystemAbortEvent(event);
        } catch (Exception e) {
            logger.error("Unexpected exception from the system abort listener", e);
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private SystemAbortListener systemAbortListener = SystemAbortListener.NONE;
        private Registry registry;
        private Clock clock = Clocks.system();
        private boolean systemExitOnFailure;

        private Builder() {
        }

        public Builder withSystemAbortListener(SystemAbortListener systemAbortListener) {
            this.systemAbortListener = systemAbortListener;
            return this;
        }

        public Builder withRegistry(Registry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withSystemExitOnFailure(boolean systemExitOnFailure) {
            this.systemExitOnFailure = systemExitOnFailure;
            return this;
        }

        public DefaultVolcanoRuntime build() {
            return new DefaultVolcanoRuntime(
                    systemAbortListener,
                    registry == null ? new DefaultRegistry() : registry,
                    clock,
                    systemExitOnFailure
            );
        }
    }
}
