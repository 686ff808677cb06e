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

package sh.volcano.controllers.kubernetes;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.generic.KubernetesApiResponse;

public class KubeApiException extends RuntimeException {

    private static final String NOT_FOUND = "Not Found";
    private static final String ALREADY_EXISTS = "AlreadyExists";

    public enum ErrorCode {
        CONFLICT_ALREADY_EXISTS,
        CONFLICT,
        INTERNAL,
        NOT_FOUND,
    }

    private final ErrorCode errorCode;

    private KubeApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public KubeApiException(String message, Throwable cause) {
        this(cause instanceof ApiException ? toErrorCode((ApiException) cause) : ErrorCode.INTERNAL, message, cause);
    }

    public KubeApiException(ApiException cause) {
        this(String.format("%s: httpStatus=%s, body=%s", cause.getMessage(), cause.getCode(), cause.getResponseBody()), cause);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Build an exception from a failed generic API call, which reports errors as a status object rather than
     * an {@link ApiException}.
     */
    public static KubeApiException fromResponse(String operation, KubernetesApiResponse<?> response) {
        V1Status status = response.getStatus();
        int code = response.getHttpStatusCode();
        String reason = status == null ? null : status.getReason();
        String message = status == null ? null : status.getMessage();
        return new KubeApiException(
                toErrorCode(code, reason, message),
                String.format("%s failed: httpStatus=%s, reason=%s, message=%s", operation, code, reason, message),
                null
        );
    }

    private static ErrorCode toErrorCode(ApiException e) {
        if (e.getCode() == 404 || NOT_FOUND.equalsIgnoreCase(e.getMessage())) {
            return ErrorCode.NOT_FOUND;
        }
        return toErrorCode(e.getCode(), null, e.getResponseBody());
    }

    private static ErrorCode toErrorCode(int code, String reason, String details) {
        if (code == 404) {
            return ErrorCode.NOT_FOUND;
        }
        if (code == 409) {
            boolean alreadyExists = ALREADY_EXISTS.equals(reason) || (details != null && details.contains(ALREADY_EXISTS));
            return alreadyExists ? ErrorCode.CONFLICT_ALREADY_EXISTS : ErrorCode.CONFLICT;
        }
        return ErrorCode.INTERNAL;
    }
}
