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
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Scoped batch of reads and writes against a {@link BotStorage}.
 *
 * <pre>
 * try (CacheSession session = storage.session("count")) {
 *     long count = session.get("count", Long.class, 0L);
 *     session.put("count", count + 1);
 * }
 * </pre>
 *
 * Closing flushes the namespace; entries the store refused stay dirty for the
 * background flusher.
 */
@Slf4j
public class CacheSession implements AutoCloseable {

    private final BotStorage storage;
    private boolean closed;

    CacheSession(BotStorage storage, List<String> prefetchKeys) {
        this.storage = storage;
        for (String key : prefetchKeys) {
            storage.get(key, JsonNode.class);
        }
    }

    public <T> T get(String key, Class<T> type, T defaultValue) {
        ensureOpen();
        return storage.get(key, type, defaultValue);
    }

    public void put(String key, Object value) {
        ensureOpen();
        storage.put(key, value);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        FlushResult result = storage.flush();
        if (!result.isClean()) {
            log.debug("[Cache] Session closed with {} dirty entries in '{}'", result.remainingDirty(),
                    storage.getNamespace());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Cache session is closed");
        }
    }
}
