package me.golemcore.zulipbot.domain.cache;

import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.port.outbound.KeyValueStorePort;
import me.golemcore.zulipbot.port.outbound.StoreBusyException;
import me.golemcore.zulipbot.testsupport.storage.InMemoryKeyValueStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class WriteBackCacheTest {

    private static final String NS = "counter";

    private InMemoryKeyValueStore store;
    private WriteBackCache cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        cache = newCache(store);
    }

    @AfterEach
    void tearDown() {
        cache.shutdown();
    }

    @Test
    void shouldReadOwnWritesBeforeFlush() {
        cache.put(NS, "counter", 5L);

        assertEquals(5L, cache.get(NS, "counter", Long.class, 0L));
        assertTrue(cache.isDirty(NS, "counter"));
        assertEquals(0, store.getPutCalls());
    }

    @Test
    void shouldReturnDefaultForUnknownKey() {
        assertEquals(7L, cache.get(NS, "missing", Long.class, 7L));
        assertNull(cache.get(NS, "missing", String.class, null));
    }

    @Test
    void shouldReadThroughFromStore() {
        store.putText(NS, "greeting", "\"hello\"");

        assertEquals("hello", cache.get(NS, "greeting", String.class, null));
        assertFalse(cache.isDirty(NS, "greeting"));
    }

    @Test
    void shouldPersistDirtyEntriesOnFlush() {
        cache.put(NS, "counter", 3L);
        cache.put(NS, "settings", Map.of("lang", "en"));

        FlushResult result = cache.flush(NS);

        assertEquals(2, result.persisted());
        assertTrue(result.isClean());
        assertEquals("3", store.getText(NS, "counter"));
        assertEquals("{\"lang\":\"en\"}", store.getText(NS, "settings"));
        assertFalse(cache.isDirty(NS, "counter"));
    }

    @Test
    void shouldNotRewriteCleanEntries() {
        cache.put(NS, "counter", 1L);
        cache.flush(NS);

        FlushResult second = cache.flush(NS);

        assertEquals(0, second.persisted());
        assertEquals(1, store.getPutCalls());
    }

    @Test
    void shouldRetryWhileStoreIsBusy() {
        store.failNextWritesWithBusy(2);
        cache.put(NS, "counter", 9L);

        FlushResult result = cache.flush(NS, Duration.ZERO, 3);

        assertEquals(1, result.persisted());
        assertTrue(result.isClean());
        assertEquals(3, store.getPutCalls());
        assertEquals("9", store.getText(NS, "counter"));
    }

    @Test
    void shouldKeepEntryDirtyWhenBusyOutlastsAttempts() {
        store.failNextWritesWithBusy(5);
        cache.put(NS, "counter", 9L);

        FlushResult result = cache.flush(NS, Duration.ZERO, 3);

        assertEquals(0, result.persisted());
        assertEquals(1, result.failed());
        assertEquals(1, result.remainingDirty());
        assertTrue(cache.isDirty(NS, "counter"));
        assertEquals(9L, cache.get(NS, "counter", Long.class, 0L));
    }

    @Test
    void shouldKeepEntryDirtyOnStoreFailureAndRecoverNextCycle() {
        store.setFailing(true);
        cache.put(NS, "counter", 4L);

        FlushResult failed = cache.flush(NS, Duration.ZERO, 3);

        assertEquals(1, failed.failed());
        assertEquals(1, store.getPutCalls());
        assertTrue(cache.isDirty(NS, "counter"));

        store.setFailing(false);
        FlushResult recovered = cache.flush(NS, Duration.ZERO, 3);

        assertTrue(recovered.isClean());
        assertEquals("4", store.getText(NS, "counter"));
    }

    @Test
    void shouldPauseBetweenBusyAttempts() {
        WriteBackCache spied = spy(cache);
        doAnswer(invocation -> true).when(spied).sleepForRetry(any());
        store.failNextWritesWithBusy(2);
        spied.put(NS, "counter", 1L);

        spied.flush(NS, Duration.ofMillis(50), 5);

        verify(spied, times(2)).sleepForRetry(Duration.ofMillis(50));
    }

    @Test
    void shouldKeepWriteMadeDuringFlushDirty() {
        KeyValueStorePort racing = mock(KeyValueStorePort.class);
        WriteBackCache racingCache = newCache(racing);
        doAnswer(invocation -> {
            racingCache.put(NS, "counter", 2L);
            return null;
        }).when(racing).put(anyString(), anyString(), any());
        racingCache.put(NS, "counter", 1L);

        FlushResult result = racingCache.flush(NS, Duration.ZERO, 1);

        assertEquals(1, result.persisted());
        assertEquals(1, result.remainingDirty());
        assertTrue(racingCache.isDirty(NS, "counter"));
        assertEquals(2L, racingCache.get(NS, "counter", Long.class, 0L));
    }

    @Test
    void shouldIsolateNamespaces() {
        cache.put("alpha", "key", "a");
        cache.put("beta", "key", "b");

        cache.flush("alpha");

        assertEquals("a", cache.get("alpha", "key", String.class, null));
        assertEquals("b", cache.get("beta", "key", String.class, null));
        assertFalse(cache.isDirty("alpha", "key"));
        assertTrue(cache.isDirty("beta", "key"));
        assertNull(store.getText("beta", "key"));
    }

    @Test
    void shouldListPersistedAndPendingKeys() {
        store.putText(NS, "stored", "1");
        cache.put(NS, "pending", 2);

        assertEquals(List.of("pending", "stored"), cache.keys(NS));
    }

    @Test
    void shouldDeleteFromMemoryAndStore() {
        cache.put(NS, "counter", 1L);
        cache.flush(NS);

        cache.delete(NS, "counter");

        assertEquals(0L, cache.get(NS, "counter", Long.class, 0L));
        assertNull(store.getText(NS, "counter"));
        assertFalse(cache.isDirty(NS, "counter"));
    }

    @Test
    void shouldRetryBusyDelete() {
        cache.put(NS, "counter", 1L);
        cache.flush(NS);
        cache.put(NS, "counter", 2L);
        store.failNextDeletesWithBusy(1);

        cache.delete(NS, "counter");

        assertEquals(0L, cache.get(NS, "counter", Long.class, 0L));
        assertNull(store.getText(NS, "counter"));
        assertFalse(cache.isDirty(NS, "counter"));
    }

    @Test
    void shouldKeepTombstoneWhenDeleteStaysBusy() {
        cache.put(NS, "counter", 1L);
        cache.flush(NS);
        cache.put(NS, "counter", 2L);
        store.failNextDeletesWithBusy(100);

        cache.delete(NS, "counter");

        assertEquals(0L, cache.get(NS, "counter", Long.class, 0L));
        assertTrue(cache.isDirty(NS, "counter"));
        assertFalse(cache.keys(NS).contains("counter"));
        assertEquals("1", store.getText(NS, "counter"));

        store.failNextDeletesWithBusy(0);
        FlushResult result = cache.flush(NS);

        assertEquals(1, result.persisted());
        assertTrue(result.isClean());
        assertNull(store.getText(NS, "counter"));
        assertFalse(cache.isDirty(NS, "counter"));
        assertEquals(0L, cache.get(NS, "counter", Long.class, 0L));
    }

    @Test
    void shouldLetWriteAfterPendingDeleteWin() {
        store.putText(NS, "counter", "1");
        store.failNextDeletesWithBusy(100);
        cache.delete(NS, "counter");

        cache.put(NS, "counter", 3L);
        store.failNextDeletesWithBusy(0);
        cache.flush(NS);

        assertEquals("3", store.getText(NS, "counter"));
        assertEquals(3L, cache.get(NS, "counter", Long.class, 0L));
        assertEquals(List.of("counter"), cache.keys(NS));
    }

    @Test
    void shouldRetryBusyReadThrough() {
        store.putText(NS, "counter", "5");
        store.failNextReadsWithBusy(1);

        assertEquals(5L, cache.get(NS, "counter", Long.class, -1L));
        assertFalse(cache.isDirty(NS, "counter"));
    }

    @Test
    void shouldFailReadWhenStoreStaysBusy() {
        store.putText(NS, "counter", "5");
        store.failNextReadsWithBusy(100);

        assertThrows(StoreBusyException.class, () -> cache.get(NS, "counter", Long.class, -1L));

        store.failNextReadsWithBusy(0);
        assertEquals(5L, cache.get(NS, "counter", Long.class, -1L));
    }

    @Test
    void shouldFlushInBackgroundUntilCancelled() throws InterruptedException {
        cache.put(NS, "counter", 1L);

        cache.autoFlush(NS, Duration.ofMillis(10), Duration.ZERO, 1);
        long deadline = System.currentTimeMillis() + 2000;
        while (store.getText(NS, "counter") == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals("1", store.getText(NS, "counter"));

        cache.cancelAutoFlush(NS);
        Thread.sleep(50);
        int putsAfterCancel = store.getPutCalls();
        cache.put(NS, "counter", 2L);
        Thread.sleep(100);

        assertEquals(putsAfterCancel, store.getPutCalls());
        assertEquals("1", store.getText(NS, "counter"));
        assertTrue(cache.isDirty(NS, "counter"));
    }

    @Test
    void shouldTreatStoredNullAsDefault() {
        cache.put(NS, "nothing", null);

        assertEquals("fallback", cache.get(NS, "nothing", String.class, "fallback"));
    }

    @Test
    void shouldStopFlushingWhenInterrupted() {
        KeyValueStorePort tracked = mock(KeyValueStorePort.class);
        WriteBackCache interrupted = newCache(tracked);
        interrupted.put(NS, "counter", 1L);

        Thread.currentThread().interrupt();
        try {
            FlushResult result = interrupted.flush(NS, Duration.ZERO, 1);
            assertEquals(1, result.remainingDirty());
        } finally {
            Thread.interrupted();
        }
        verify(tracked, never()).put(anyString(), anyString(), any());
    }

    private static WriteBackCache newCache(KeyValueStorePort store) {
        BotProperties properties = new BotProperties();
        properties.getCache().setRetryDelay(Duration.ZERO);
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        return new WriteBackCache(store, new ObjectMapper(), clock, properties);
    }
}
