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

import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.port.outbound.KeyValueStorePort;
import me.golemcore.zulipbot.port.outbound.StoreBusyException;
import me.golemcore.zulipbot.port.outbound.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * In-memory write-back cache over {@link KeyValueStorePort}, shared by all
 * bots and partitioned by namespace.
 *
 * <p>
 * Writes land in memory and are marked dirty; reads always see the latest
 * write. {@link #flush(String)} persists the dirty entries of a namespace,
 * retrying each entry while the store reports {@link StoreBusyException}.
 * Entries that still fail stay dirty for the next cycle. Reads and deletes
 * that reach the store retry busy responses the same way.
 *
 * <p>
 * Values are held as Jackson trees and persisted as JSON bytes.
 */
@Component
@Slf4j
public class WriteBackCache {

    private final KeyValueStorePort store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BotProperties.CacheProperties settings;

    private final Map<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Object> namespaceLocks = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> autoFlushTasks = new ConcurrentHashMap<>();
    private ScheduledExecutorService scheduler;

    public WriteBackCache(KeyValueStorePort store, ObjectMapper objectMapper, Clock clock,
            BotProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.settings = properties.getCache();
    }

    /**
     * Read-through lookup. Falls back to the store on a miss and caches what
     * it finds; returns {@code defaultValue} when neither has the key.
     *
     * @throws StoreBusyException
     *             if the store stays busy for every read attempt
     */
    public <T> T get(String namespace, String key, Class<T> type, T defaultValue) {
        CacheKey cacheKey = new CacheKey(namespace, key);
        CacheEntry entry = entries.get(cacheKey);
        if (entry == null) {
            Optional<byte[]> stored = withBusyRetry(namespace, key, settings.getRetryDelay(),
                    settings.getMaxRetries(), () -> store.get(namespace, key));
            if (stored.isEmpty()) {
                return defaultValue;
            }
            CacheEntry loaded = new CacheEntry(key, readTree(namespace, key, stored.get()), false, clock.instant());
            CacheEntry existing = entries.putIfAbsent(cacheKey, loaded);
            entry = existing != null ? existing : loaded;
        }
        JsonNode value = entry.getValue();
        if (value == null || value.isNull() || value.isMissingNode()) {
            return defaultValue;
        }
        return objectMapper.convertValue(value, type);
    }

    /**
     * Store {@code value} in memory and mark it dirty. Never touches the
     * backing store.
     */
    public void put(String namespace, String key, Object value) {
        JsonNode node = value != null ? objectMapper.valueToTree(value) : NullNode.getInstance();
        entries.compute(new CacheKey(namespace, key), (cacheKey, existing) -> {
            CacheEntry entry = existing != null ? existing : new CacheEntry(key, node, true, clock.instant());
            entry.write(node, clock.instant());
            return entry;
        });
    }

    /**
     * Remove a key from memory and from the store. The key reads as absent
     * right away; if the store cannot delete it now, a dirty tombstone is kept
     * and the next flush retries the delete.
     */
    public void delete(String namespace, String key) {
        CacheKey cacheKey = new CacheKey(namespace, key);
        synchronized (lockFor(namespace)) {
            CacheEntry tombstone = entries.compute(cacheKey, (k, existing) -> {
                CacheEntry entry = existing != null ? existing : new CacheEntry(key, null, true, clock.instant());
                entry.markDeleted(clock.instant());
                return entry;
            });
            CacheEntry.Snapshot snapshot = tombstone.snapshot();
            if (remove(namespace, key, settings.getRetryDelay(), settings.getMaxRetries())) {
                settle(cacheKey, tombstone, snapshot);
            }
        }
    }

    /**
     * Keys known for a namespace, persisted or not yet flushed. Deleted keys
     * are left out even while their store delete is pending.
     */
    public List<String> keys(String namespace) {
        List<String> stored = withBusyRetry(namespace, "*", settings.getRetryDelay(), settings.getMaxRetries(),
                () -> store.keys(namespace));
        TreeSet<String> keys = new TreeSet<>(stored);
        entries.forEach((cacheKey, entry) -> {
            if (!cacheKey.namespace().equals(namespace)) {
                return;
            }
            if (entry.isDeleted()) {
                keys.remove(cacheKey.key());
            } else {
                keys.add(cacheKey.key());
            }
        });
        return new ArrayList<>(keys);
    }

    public boolean isDirty(String namespace, String key) {
        CacheEntry entry = entries.get(new CacheKey(namespace, key));
        return entry != null && entry.isDirty();
    }

    public FlushResult flush(String namespace) {
        return flush(namespace, settings.getRetryDelay(), settings.getMaxRetries());
    }

    /**
     * Persist all dirty entries of {@code namespace}.
     *
     * @param retryDelay
     *            pause between attempts while the store is busy
     * @param maxRetries
     *            total attempts per entry in this cycle
     */
    public FlushResult flush(String namespace, Duration retryDelay, int maxRetries) {
        synchronized (lockFor(namespace)) {
            int persisted = 0;
            int failed = 0;
            for (Map.Entry<CacheKey, CacheEntry> item : dirtyEntries(namespace)) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("[Cache] Flush of '{}' interrupted, remaining entries stay dirty", namespace);
                    break;
                }
                CacheEntry entry = item.getValue();
                CacheEntry.Snapshot snapshot = entry.snapshot();
                boolean stored = snapshot.deleted()
                        ? remove(namespace, entry.getKey(), retryDelay, maxRetries)
                        : persist(namespace, entry.getKey(), snapshot.value(), retryDelay, maxRetries);
                if (stored) {
                    settle(item.getKey(), entry, snapshot);
                    persisted++;
                } else {
                    failed++;
                }
            }
            int remaining = dirtyEntries(namespace).size();
            if (persisted > 0 || failed > 0) {
                log.debug("[Cache] Flushed '{}': persisted={}, failed={}, dirty={}",
                        namespace, persisted, failed, remaining);
            }
            return new FlushResult(persisted, failed, remaining);
        }
    }

    /**
     * Start flushing {@code namespace} in the background every
     * {@code interval}. Replaces a previous schedule for the same namespace.
     */
    public synchronized void autoFlush(String namespace, Duration interval, Duration retryDelay, int maxRetries) {
        cancelAutoFlush(namespace);
        if (scheduler == null || scheduler.isShutdown()) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cache-auto-flush");
                t.setDaemon(true);
                return t;
            });
        }
        long intervalMs = Math.max(1, interval.toMillis());
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(() -> {
            try {
                flush(namespace, retryDelay, maxRetries);
            } catch (RuntimeException e) {
                log.error("[Cache] Auto-flush of '{}' failed: {}", namespace, e.getMessage(), e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        autoFlushTasks.put(namespace, task);
        log.info("[Cache] Auto-flush for '{}' every {}ms", namespace, intervalMs);
    }

    public void cancelAutoFlush(String namespace) {
        ScheduledFuture<?> task = autoFlushTasks.remove(namespace);
        if (task != null) {
            task.cancel(false);
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        autoFlushTasks.keySet().forEach(this::cancelAutoFlush);
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Cache] Shut down");
    }

    private boolean persist(String namespace, String key, JsonNode value, Duration retryDelay, int maxRetries) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            log.error("[Cache] Cannot serialize {}/{}: {}", namespace, key, e.getMessage());
            return false;
        }
        try {
            withBusyRetry(namespace, key, retryDelay, maxRetries, () -> {
                store.put(namespace, key, bytes);
                return null;
            });
            return true;
        } catch (StoreBusyException e) {
            log.warn("[Cache] Store still busy for {}/{}, will retry next cycle", namespace, key);
            return false;
        } catch (StoreException e) {
            log.error("[Cache] Failed to persist {}/{}: {}", namespace, key, e.getMessage());
            return false;
        }
    }

    private boolean remove(String namespace, String key, Duration retryDelay, int maxRetries) {
        try {
            withBusyRetry(namespace, key, retryDelay, maxRetries, () -> {
                store.delete(namespace, key);
                return null;
            });
            return true;
        } catch (StoreBusyException e) {
            log.warn("[Cache] Store still busy deleting {}/{}, keeping tombstone for next cycle", namespace, key);
            return false;
        } catch (StoreException e) {
            log.error("[Cache] Failed to delete {}/{}: {}", namespace, key, e.getMessage());
            return false;
        }
    }

    /**
     * Run {@code call}, retrying while the store reports busy. At most
     * {@code maxRetries} attempts are made, {@code retryDelay} apart; the last
     * {@link StoreBusyException} is rethrown when they run out or the thread
     * is interrupted.
     */
    private <T> T withBusyRetry(String namespace, String key, Duration retryDelay, int maxRetries,
            Supplier<T> call) {
        int attempts = Math.max(1, maxRetries);
        for (int attempt = 1;; attempt++) {
            try {
                return call.get();
            } catch (StoreBusyException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.debug("[Cache] Store busy for {}/{} (attempt {}/{})", namespace, key, attempt, attempts);
                if (!sleepForRetry(retryDelay)) {
                    throw e;
                }
            }
        }
    }

    /**
     * Mark {@code entry} clean at the persisted version and drop it if it was
     * a tombstone. Writes made after the snapshot keep the entry dirty.
     */
    private void settle(CacheKey cacheKey, CacheEntry entry, CacheEntry.Snapshot snapshot) {
        entries.computeIfPresent(cacheKey, (k, current) -> {
            if (current != entry) {
                return current;
            }
            boolean clean = entry.markClean(snapshot.version());
            return clean && snapshot.deleted() ? null : entry;
        });
    }

    boolean sleepForRetry(Duration retryDelay) {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private List<Map.Entry<CacheKey, CacheEntry>> dirtyEntries(String namespace) {
        return entries.entrySet().stream()
                .filter(item -> item.getKey().namespace().equals(namespace) && item.getValue().isDirty())
                .toList();
    }

    private JsonNode readTree(String namespace, String key, byte[] bytes) {
        try {
            return objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new StoreException("Corrupt value for " + namespace + "/" + key, e);
        }
    }

    private Object lockFor(String namespace) {
        return namespaceLocks.computeIfAbsent(namespace, ns -> new Object());
    }

    private record CacheKey(String namespace, String key) {
    }
}
