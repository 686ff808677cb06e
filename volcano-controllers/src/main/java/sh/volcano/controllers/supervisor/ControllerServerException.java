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

import static java.lang.String.format;

public class ControllerServerException extends RuntimeException {

    public enum ErrorCode {
        StartupFailure,
        FinishedWithoutLeaderElection,
        LockCreationFailed,
        LeadershipLost,
        Stopped,
    }

    private final ErrorCode errorCode;

    private ControllerServerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static ControllerServerException startupFailure(String message, Throwable cause) {
        return new ControllerServerException(ErrorCode.StartupFailure, "Startup failure: " + message, cause);
    }

    public static ControllerServerException finishedWithoutLeaderElection() {
        return new ControllerServerException(ErrorCode.FinishedWithoutLeaderElection,
                "Controllers finished without leader election", null);
    }

    public static ControllerServerException lockCreationFailed(Throwable cause) {
        return new ControllerServerException(ErrorCode.LockCreationFailed, format("Lease lock creation failed: %s", cause.getMessage()), cause);
    }

    public static ControllerServerException leadershipLost(Throwable cause) {
        return new ControllerServerException(ErrorCode.LeadershipLost, format("Leader election lost: %s", cause.getMessage()), cause);
    }

    public static ControllerServerException stopped(Throwable cause) {
        return new ControllerServerException(ErrorCode.Stopped, "Controller server stopped", cause);
    }
}
