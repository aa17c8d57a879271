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
 * The server no longer knows the event queue (garbage-collected after
 * inactivity or never existed). Recovered by registering a new queue.
 */
public class QueueExpiredException extends ZulipTransportException {

    public static final String CODE = "BAD_EVENT_QUEUE_ID";

    private final String queueId;

    public QueueExpiredException(String queueId, String message, int httpStatus) {
        super(message, CODE, httpStatus);
        this.queueId = queueId;
    }

    public String getQueueId() {
        return queueId;
    }
}
