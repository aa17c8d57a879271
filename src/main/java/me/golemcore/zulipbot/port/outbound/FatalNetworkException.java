/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.zulipbot.port.outbound;

/**
 * Unrecoverable transport condition: rejected credentials, malformed request,
 * or transient failures that exhausted (or were not allowed) retries.
 */
public class FatalNetworkException extends ZulipTransportException {

    public FatalNetworkException(String message, String code, int httpStatus, Throwable cause) {
        super(message, code, httpStatus, cause);
    }

    public FatalNetworkException(String message, Throwable cause) {
        this(message, codeOf(cause), statusOf(cause), cause);
    }

    private static String codeOf(Throwable cause) {
        return cause instanceof ZulipTransportException transportException ? transportException.getCode() : null;
    }

    private static int statusOf(Throwable cause) {
        return cause instanceof ZulipTransportException transportException ? transportException.getHttpStatus() : 0;
    }
}
