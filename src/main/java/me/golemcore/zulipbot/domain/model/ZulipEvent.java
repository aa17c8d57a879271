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

package me.golemcore.zulipbot.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One event drained from a server-side event queue.
 *
 * <p>
 * Ordering is by {@code id}. The payload is the full event object as sent by
 * the server; {@code message} holds the decoded message for {@code message}
 * events.
 *
 * @param id
 *            event id, monotonically increasing within a queue
 * @param type
 *            event type, e.g. {@code message}, {@code heartbeat}
 * @param payload
 *            raw event JSON
 * @param message
 *            decoded message for {@code message} events, otherwise null
 */
public record ZulipEvent(long id, String type, JsonNode payload, ZulipMessage message) {

    public static final String TYPE_MESSAGE = "message";
    public static final String TYPE_HEARTBEAT = "heartbeat";

    public boolean isMessage() {
        return TYPE_MESSAGE.equals(type) && message != null;
    }
}
