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

import java.time.Duration;

/**
 * Connection failure, timeout, rate limit or server-side 5xx. Safe to retry.
 */
public class TransientNetworkException extends ZulipTransportException {

    private final Duration retryAfter;

    public TransientNetworkException(String message, String code, int httpStatus, Duration retryAfter,
            Throwable cause) {
        super(message, code, httpStatus, cause);
        this.retryAfter = retryAfter;
    }

    public TransientNetworkException(String message, Throwable cause) {
        this(message, null, 0, null, cause);
    }

    /**
     * Server-requested delay before the next attempt, or {@code null}.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
