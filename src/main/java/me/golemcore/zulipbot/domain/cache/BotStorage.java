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

import java.util.List;

/**
 * Storage view of a single bot: the shared {@link WriteBackCache} bound to
 * the bot's namespace.
 */
public class BotStorage {

    private final WriteBackCache cache;
    private final String namespace;

    public BotStorage(WriteBackCache cache, String namespace) {
        this.cache = cache;
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }

    public <T> T get(String key, Class<T> type, T defaultValue) {
        return cache.get(namespace, key, type, defaultValue);
    }

    public <T> T get(String key, Class<T> type) {
        return cache.get(namespace, key, type, null);
    }

    public void put(String key, Object value) {
        cache.put(namespace, key, value);
    }

    public void delete(String key) {
        cache.delete(namespace, key);
    }

    public List<String> keys() {
        return cache.keys(namespace);
    }

    public FlushResult flush() {
        return cache.flush(namespace);
    }

    /**
     * Open a session that preloads {@code keys} and flushes the namespace
     * when closed. Use with try-with-resources.
     */
    public CacheSession session(String... keys) {
        return new CacheSession(this, List.of(keys));
    }
}
