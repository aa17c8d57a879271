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

import java.util.List;

/**
 * Message to send: either to a stream topic or to private recipients.
 */
public record OutgoingMessage(String type, Long streamId, String topic, List<Long> recipientIds, String content) {

    public static OutgoingMessage toStream(long streamId, String topic, String content) {
        return new OutgoingMessage(ZulipMessage.TYPE_STREAM, streamId, topic, List.of(), content);
    }

    public static OutgoingMessage toPrivate(List<Long> recipientIds, String content) {
        return new OutgoingMessage(ZulipMessage.TYPE_PRIVATE, null, null, List.copyOf(recipientIds), content);
    }

    public boolean isPrivate() {
        return ZulipMessage.TYPE_PRIVATE.equals(type);
    }
}
