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

import java.util.List;
import java.util.Optional;

/**
 * Port for the persistent key/value store backing the write-back cache.
 *
 * <p>
 * Keys are always addressed as {@code (namespace, key)}; one namespace never
 * observes another's keys even when both live in the same physical store.
 * Any operation may throw {@link StoreBusyException} when the store is
 * contended, or {@link StoreException} for unrecoverable failures.
 */
public interface KeyValueStorePort {

    /**
     * Read raw value bytes, or empty when the key is absent.
     */
    Optional<byte[]> get(String namespace, String key);

    /**
     * Write raw value bytes, replacing any previous value.
     */
    void put(String namespace, String key, byte[] value);

    /**
     * Delete a key. Deleting an absent key is not an error.
     */
    void delete(String namespace, String key);

    /**
     * List all keys stored in a namespace.
     */
    List<String> keys(String namespace);
}
