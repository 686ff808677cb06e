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

import sh.volcano.common.util.concurrent.StopSignal;

public interface LeaderCallbacks {

    /**
     * Invoked in the election loop thread once the lease is acquired. The call is expected to block for the whole
     * active phase, and return soon after the active signal is stopped.
     *
     * @param activeSignal stopped when this member stops leading, or the election itself is stopped
     */
    void onStartedLeading(StopSignal activeSignal);

    /**
     * Invoked in the election loop thread after the active phase returned, when the lease was lost or the active
     * phase ended on its own. Not invoked when the election is stopped.
     */
    void onStoppedLeading();
}
