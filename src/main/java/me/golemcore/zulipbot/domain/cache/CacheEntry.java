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

package me.golemcore.zulipbot.domain.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Cached value of one key.
 *
 * <p>
 * Every write bumps {@code version}. A flush persists a snapshot and only
 * clears {@code dirty} if no write happened in between, so an entry is either
 * clean with its value persisted or still dirty.
 *
 * <p>
 * A deleted entry is a tombstone: it reads as absent and stays dirty until the
 * store confirms the delete.
 */
public final class CacheEntry {

    private final String key;
    private JsonNode value;
    private boolean dirty;
    private Instant lastWriteAt;
    private long version;
    private boolean deleted;

    CacheEntry(String key, JsonNode value, boolean dirty, Instant lastWriteAt) {
        this.key = key;
        this.value = value;
        this.dirty = dirty;
        this.lastWriteAt = lastWriteAt;
    }

    public String getKey() {
        return key;
    }

    public synchronized JsonNode getValue() {
        return value;
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    public synchronized Instant getLastWriteAt() {
        return lastWriteAt;
    }

    public synchronized long getVersion() {
        return version;
    }

    public synchronized boolean isDeleted() {
        return deleted;
    }

    synchronized void write(JsonNode newValue, Instant now) {
        this.value = newValue;
        this.deleted = false;
        this.dirty = true;
        this.lastWriteAt = now;
        this.version++;
    }

    synchronized void markDeleted(Instant now) {
        this.value = null;
        this.deleted = true;
        this.dirty = true;
        this.lastWriteAt = now;
        this.version++;
    }

    synchronized Snapshot snapshot() {
        return new Snapshot(value, version, deleted);
    }

    /**
     * Clear the dirty flag if {@code persistedVersion} is still current.
     *
     * @return true if the entry is now clean
     */
    synchronized boolean markClean(long persistedVersion) {
        if (version == persistedVersion) {
            dirty = false;
        }
        return !dirty;
    }

    record Snapshot(JsonNode value, long version, boolean deleted) {
    }
}
