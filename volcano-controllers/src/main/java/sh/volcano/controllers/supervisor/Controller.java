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

package sh.volcano.controllers.supervisor;

import sh.volcano.common.util.concurrent.StopSignal;

/**
 * A reconciliation loop started by the {@link ControllerSupervisor} on its own thread.
 */
public interface Controller {

    String getName();

    /**
     * Run the controller until the stop signal fires. Implementations must return soon after that, letting in-flight
     * work complete.
     */
    void run(StopSignal stopSignal) throws Exception;
}
