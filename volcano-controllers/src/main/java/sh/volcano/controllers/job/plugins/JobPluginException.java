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

package sh.volcano.controllers.job.plugins;

import sh.volcano.api.batch.v1alpha1.V1alpha1Job;
import sh.volcano.api.helpers.JobHelpers;

import static java.lang.String.format;

public class JobPluginException extends RuntimeException {

    public enum ErrorCode {
        PluginNotFound,
        InvalidArguments,
        OperationFailed,
    }

    private final ErrorCode errorCode;

    private JobPluginException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static JobPluginException pluginNotFound(String pluginName) {
        return new JobPluginException(ErrorCode.PluginNotFound, format("Job plugin not found: %s", pluginName), null);
    }

    public static JobPluginException invalidArguments(String pluginName, String reason, Throwable cause) {
        return new JobPluginException(ErrorCode.InvalidArguments, format("Invalid arguments of job plugin %s: %s", pluginName, reason), cause);
    }

    public static JobPluginException operationFailed(String pluginName, V1alpha1Job job, String operation, Throwable cause) {
        return new JobPluginException(ErrorCode.OperationFailed,
                format("%s for job <%s> with %s plugin failed: %s", operation, JobHelpers.getJobKey(job), pluginName, cause.getMessage()),
                cause
        );
    }

    /**
     * Add the job key to the error message, keeping the error code of the original exception.
     */
    public static JobPluginException withJobContext(V1alpha1Job job, JobPluginException cause) {
        String jobKey = JobHelpers.getJobKey(job);
        if (cause.getMessage() != null && cause.getMessage().contains("<" + jobKey + ">")) {
            return cause;
        }
        return new JobPluginException(cause.getErrorCode(), format("job <%s>: %s", jobKey, cause.getMessage()), cause);
    }
}
