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

package sh.volcano.controllers.leaderelection;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "volcano.controllers.leaderElection")
public interface LeaderElectionConfiguration {

    /**
     * @return if false, the controllers are started immediately, without acquiring the lease.
     */
    @DefaultValue("true")
    boolean isEnabled();

    /**
     * @return namespace of the config map holding the lease record.
     */
    @DefaultValue("volcano-system")
    String getLockObjectNamespace();

    /**
     * @return how long non-leaders wait after observing the last change of the lease record before they try
     * to take it over.
     */
    @DefaultValue("15000")
    long getLeaseDurationMs();

    /**
     * @return how long the leader keeps retrying to renew the lease before it gives up the leadership.
     */
    @DefaultValue("10000")
    long getRenewDeadlineMs();

    /**
     * @return interval between consecutive acquire or renew attempts.
     */
    @DefaultValue("5000")
    long getRetryPeriodMs();
}
