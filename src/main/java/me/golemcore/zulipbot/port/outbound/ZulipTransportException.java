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
 * Base failure of a single call through {@link ZulipTransportPort}.
 *
 * <p>
 * Carries the server-side error code when the server answered with a
 * structured error body (e.g. {@code BAD_EVENT_QUEUE_ID}), and the HTTP
 * status when one was received (0 for I/O failures).
 */
public class ZulipTransportException extends RuntimeException {

    private final String code;
    private final int httpStatus;

    public ZulipTransportException(String message, String code, int httpStatus, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public ZulipTransportException(String message, String code, int httpStatus) {
        this(message, code, httpStatus, null);
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
