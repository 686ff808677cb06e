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

import static java.lang.String.format;

public class LeaderElectionException extends RuntimeException {

    public enum ErrorCode {
        InvalidConfiguration,
        LockCreationFailed,
        LeadershipLost,
        ActivePhaseFinished,
        Stopped,
    }

    private final ErrorCode errorCode;

    private LeaderElectionException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    private LeaderElectionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static LeaderElectionException invalidConfiguration(String message) {
        return new LeaderElectionException(ErrorCode.InvalidConfiguration, "Invalid leader election configuration: " + message);
    }

    public static LeaderElectionException lockCreationFailed(String reason) {
        return new LeaderElectionException(ErrorCode.LockCreationFailed, "Cannot create the lease lock: " + reason);
    }

    public static LeaderElectionException leadershipLost(String identity, String lockDescription) {
        return new LeaderElectionException(ErrorCode.LeadershipLost, format("Leader %s lost the lease %s", identity, lockDescription));
    }

    public static LeaderElectionException activePhaseFinished(String identity, Throwable cause) {
        return new LeaderElectionException(ErrorCode.ActivePhaseFinished,
                format("Leader %s stopped leading, as its active phase finished unexpectedly", identity), cause);
    }

    public static LeaderElectionException stopped(String identity, boolean wasLeader) {
        return new LeaderElectionException(ErrorCode.Stopped,
                format("Leader election of %s stopped (wasLeader=%s)", identity, wasLeader));
    }
}
