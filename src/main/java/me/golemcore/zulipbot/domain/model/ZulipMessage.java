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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A chat message as delivered inside a {@code message} event.
 *
 * <p>
 * {@code displayRecipient} is the stream name for stream messages and the
 * list of participants for private messages, so it is kept as raw JSON and
 * interpreted by {@link #getPrivateRecipientIds()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ZulipMessage {

    public static final String TYPE_STREAM = "stream";
    public static final String TYPE_PRIVATE = "private";
    private static final String DEFAULT_TOPIC = "general";

    private long id;
    private String type;
    private String content;

    @JsonProperty("sender_id")
    private long senderId;

    @JsonProperty("sender_email")
    private String senderEmail;

    @JsonProperty("sender_full_name")
    private String senderFullName;

    private String client;

    @JsonProperty("stream_id")
    private Long streamId;

    @JsonProperty("display_recipient")
    private JsonNode displayRecipient;

    private String subject;
    private String topic;

    @JsonIgnore
    public boolean isPrivate() {
        return TYPE_PRIVATE.equals(type);
    }

    /**
     * Topic of a stream message; older servers send it as {@code subject}.
     */
    @JsonIgnore
    public String getTopicOrSubject() {
        if (subject != null && !subject.isEmpty()) {
            return subject;
        }
        return topic;
    }

    @JsonIgnore
    public String getReplyTopic() {
        String resolved = getTopicOrSubject();
        return resolved != null && !resolved.isEmpty() ? resolved : DEFAULT_TOPIC;
    }

    /**
     * Participant ids of a private conversation; empty for stream messages.
     */
    @JsonIgnore
    public List<Long> getPrivateRecipientIds() {
        List<Long> ids = new ArrayList<>();
        if (displayRecipient == null || !displayRecipient.isArray()) {
            return ids;
        }
        for (JsonNode recipient : displayRecipient) {
            JsonNode id = recipient.get("id");
            if (id != null && id.canConvertToLong()) {
                ids.add(id.asLong());
            }
        }
        return ids;
    }
}
