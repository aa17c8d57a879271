package me.golemcore.zulipbot.domain.cache;

import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.testsupport.storage.InMemoryKeyValueStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BotStorageTest {

    private InMemoryKeyValueStore store;
    private WriteBackCache cache;
    private BotStorage storage;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        BotProperties properties = new BotProperties();
        properties.getCache().setRetryDelay(Duration.ZERO);
        cache = new WriteBackCache(store, new ObjectMapper(), Clock.systemUTC(), properties);
        storage = new BotStorage(cache, "echo");
    }

    @AfterEach
    void tearDown() {
        cache.shutdown();
    }

    @Test
    void shouldScopeKeysToNamespace() {
        storage.put("hits", 3);

        assertEquals(3, cache.get("echo", "hits", Integer.class, 0));
        assertEquals(0, cache.get("other", "hits", Integer.class, 0));
    }

    @Test
    void shouldFlushOnceWhenSessionCloses() {
        store.putText("echo", "counter", "41");

        try (CacheSession session = storage.session("counter")) {
            long next = session.get("counter", Long.class, 0L) + 1;
            session.put("counter", next);
            session.put("total", 1L);
            assertEquals(0, store.getPutCalls());
        }

        assertEquals("42", store.getText("echo", "counter"));
        assertEquals("1", store.getText("echo", "total"));
        assertEquals(2, store.getPutCalls());
    }

    @Test
    void shouldRejectUseAfterClose() {
        CacheSession session = storage.session();
        session.close();
        session.close();

        assertThrows(IllegalStateException.class, () -> session.put("key", "value"));
        assertThrows(IllegalStateException.class, () -> session.get("key", String.class, null));
    }

    @Test
    void shouldLeaveValuesReadableWhenSessionFlushFails() {
        store.setFailing(true);

        try (CacheSession session = storage.session()) {
            session.put("counter", 5L);
        }

        assertEquals(5L, storage.get("counter", Long.class, 0L));
        assertEquals(1, storage.flush().remainingDirty());
    }
}
