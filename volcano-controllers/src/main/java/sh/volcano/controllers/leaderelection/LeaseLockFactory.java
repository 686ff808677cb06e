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

import io.kubernetes.client.extended.leaderelection.Lock;

/**
 * Creates the lease lock for the given identity.
 */
public interface LeaseLockFactory {

    /**
     * @throws LeaderElectionException with {@link LeaderElectionException.ErrorCode#LockCreationFailed} if the lock
     *                                 cannot be built from the current configuration
     */
    Lock create(String identity) throws LeaderElectionException;
}
