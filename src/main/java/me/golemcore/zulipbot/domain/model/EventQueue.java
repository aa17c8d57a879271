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
import java.util.Set;

/**
 * Client-side view of a registered server event queue.
 *
 * <p>
 * {@code lastEventId} only moves forward while the queue lives. A queue
 * reported expired is discarded and never reused; recovery registers a new
 * one.
 */
public final class EventQueue {

    private final String queueId;
    private final Set<String> eventTypes;
    private final List<List<String>> narrow;
    private volatile long lastEventId;

    public EventQueue(String queueId, long lastEventId, Set<String> eventTypes, List<List<String>> narrow) {
        this.queueId = queueId;
        this.lastEventId = lastEventId;
        this.eventTypes = Set.copyOf(eventTypes);
        this.narrow = narrow.stream().map(List::copyOf).toList();
    }

    public String getQueueId() {
        return queueId;
    }

    public long getLastEventId() {
        return lastEventId;
    }

    public Set<String> getEventTypes() {
        return eventTypes;
    }

    public List<List<String>> getNarrow() {
        return narrow;
    }

    /**
     * Move the cursor to {@code eventId} if it is ahead of the current one.
     *
     * @return the cursor after the update
     */
    public synchronized long advanceTo(long eventId) {
        if (eventId > lastEventId) {
            lastEventId = eventId;
        }
        return lastEventId;
    }

    @Override
    public String toString() {
        return "EventQueue{" + queueId + ", lastEventId=" + lastEventId + "}";
    }
}
