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

package me.golemcore.zulipbot.domain.service;

import me.golemcore.zulipbot.domain.model.EventQueue;
import me.golemcore.zulipbot.domain.model.OutgoingMessage;
import me.golemcore.zulipbot.domain.model.UserProfile;
import me.golemcore.zulipbot.domain.model.ZulipEvent;
import me.golemcore.zulipbot.domain.model.ZulipMessage;
import me.golemcore.zulipbot.port.outbound.FatalNetworkException;
import me.golemcore.zulipbot.port.outbound.ZulipTransportPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed calls over {@link ZulipTransportPort}. Only the endpoints the bot
 * runtime needs are covered.
 */
@Slf4j
public class ZulipApiClient {

    private final ZulipTransportPort transport;
    private final ObjectMapper objectMapper;

    public ZulipApiClient(ZulipTransportPort transport, ObjectMapper objectMapper) {
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    public EventQueue register(Set<String> eventTypes, List<List<String>> narrow) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("event_types", List.copyOf(eventTypes));
        if (!narrow.isEmpty()) {
            params.put("narrow", narrow);
        }
        JsonNode response = transport.call("POST", "register", params);
        String queueId = response.path("queue_id").asText(null);
        if (queueId == null || queueId.isBlank()) {
            throw new FatalNetworkException("Register response has no queue_id", null);
        }
        return new EventQueue(queueId, response.path("last_event_id").asLong(-1), eventTypes, narrow);
    }

    /**
     * Long-poll the queue for events after its current cursor. Blocks until
     * the server returns a batch, possibly an empty heartbeat.
     */
    public List<ZulipEvent> getEvents(EventQueue queue) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("queue_id", queue.getQueueId());
        params.put("last_event_id", queue.getLastEventId());
        JsonNode response = transport.longPoll("GET", "events", params);

        List<ZulipEvent> events = new ArrayList<>();
        for (JsonNode node : response.path("events")) {
            events.add(toEvent(node));
        }
        return events;
    }

    public void deleteQueue(String queueId) {
        transport.call("DELETE", "events", Map.of("queue_id", queueId));
    }

    public UserProfile getProfile() {
        JsonNode response = transport.call("GET", "users/me", Map.of());
        return objectMapper.convertValue(response, UserProfile.class);
    }

    /**
     * @return id of the created message
     */
    public long sendMessage(OutgoingMessage message) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("type", message.type());
        if (message.isPrivate()) {
            params.put("to", message.recipientIds());
        } else {
            params.put("to", message.streamId());
            params.put("topic", message.topic());
        }
        params.put("content", message.content());
        JsonNode response = transport.call("POST", "messages", params);
        return response.path("id").asLong();
    }

    public void updatePresence(String status) {
        transport.call("POST", "users/me/presence", Map.of("status", status));
    }

    private ZulipEvent toEvent(JsonNode node) {
        String type = node.path("type").asText("");
        ZulipMessage message = null;
        JsonNode messageNode = node.get("message");
        if (ZulipEvent.TYPE_MESSAGE.equals(type) && messageNode != null && messageNode.isObject()) {
            try {
                message = objectMapper.treeToValue(messageNode, ZulipMessage.class);
            } catch (JsonProcessingException e) {
                log.warn("[Events] Failed to decode message in event {}: {}", node.path("id").asLong(),
                        e.getMessage());
            }
        }
        return new ZulipEvent(node.path("id").asLong(), type, node, message);
    }
}
