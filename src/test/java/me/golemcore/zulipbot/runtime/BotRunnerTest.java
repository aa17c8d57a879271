package me.golemcore.zulipbot.runtime;

import me.golemcore.zulipbot.domain.model.ZulipMessage;
import me.golemcore.zulipbot.domain.service.ZulipEventHandler;
import me.golemcore.zulipbot.domain.service.ZulipEventSource;
import me.golemcore.zulipbot.port.outbound.FatalNetworkException;
import me.golemcore.zulipbot.testsupport.bot.BotHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class BotRunnerTest {

    private BotHarness harness;
    private ZulipEventSource eventSource;
    private LifecycleBot bot;
    private BotRunner runner;

    @BeforeEach
    void setUp() {
        harness = new BotHarness("lifecycle");
        harness.getProperties().getCache().setEnabled(false);
        eventSource = mock(ZulipEventSource.class);
        bot = new LifecycleBot();
        BotContext context = harness.buildContext();
        bot.init(context);
        runner = new BotRunner(bot, context, eventSource, harness.getCache(), harness.getProperties());
    }

    @AfterEach
    void tearDown() {
        harness.getCache().shutdown();
    }

    @Test
    void shouldRunLifecycleAndFlushOnExit() {
        doAnswer(invocation -> {
            bot.getStorage().put("seen", 1L);
            return null;
        }).when(eventSource).run(any(), any(), anyList());

        runner.runForever();

        assertEquals(BotRunner.State.STOPPED, runner.getState());
        assertEquals(1, bot.starts.get());
        assertEquals(1, bot.stops.get());
        assertEquals("1", harness.getStore().getText("lifecycle", "seen"));
        verify(eventSource).run(any(), eq(Set.of("message")), eq(List.of()));
    }

    @Test
    void shouldPassBotEventsToHandler() {
        doAnswer(invocation -> {
            ZulipEventHandler handler = invocation.getArgument(0);
            handler.onEvent(BotHarness.streamMessage(1, "user@example.com", "plain text"));
            return null;
        }).when(eventSource).run(any(), any(), anyList());

        runner.runForever();

        assertEquals(1, bot.plainMessages.get());
    }

    @Test
    void shouldUseInstanceEventTypesAndNarrow() {
        harness.getInstance().setEventTypes(List.of("message", "reaction"));
        harness.getInstance().setNarrow(List.of(List.of("stream", "bots")));
        BotContext context = harness.buildContext();
        BotRunner narrowed = new BotRunner(bot, context, eventSource, harness.getCache(), harness.getProperties());

        narrowed.runForever();

        verify(eventSource).run(any(), eq(Set.of("message", "reaction")),
                eq(List.of(List.of("stream", "bots"))));
    }

    @Test
    void shouldRecordFatalFailureAndStillShutDown() {
        FatalNetworkException fatal = new FatalNetworkException("invalid api key", null);
        doAnswer(invocation -> {
            bot.getStorage().put("pending", "value");
            throw fatal;
        }).when(eventSource).run(any(), any(), anyList());

        runner.runForever();

        assertEquals(BotRunner.State.FAILED, runner.getState());
        assertSame(fatal, runner.getFailure());
        assertEquals(1, bot.stops.get());
        assertEquals("\"value\"", harness.getStore().getText("lifecycle", "pending"));
    }

    @Test
    void shouldFlushEvenWhenStopInterruptsThread() {
        doAnswer(invocation -> {
            bot.getStorage().put("counter", 3L);
            Thread.currentThread().interrupt();
            return null;
        }).when(eventSource).run(any(), any(), anyList());

        try {
            runner.runForever();
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertEquals("3", harness.getStore().getText("lifecycle", "counter"));
    }

    @Test
    void shouldSurviveFailingOnStop() {
        bot.failOnStop = true;

        runner.runForever();

        assertEquals(BotRunner.State.STOPPED, runner.getState());
    }

    @Test
    void shouldStopRunningThread() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        doAnswer(invocation -> {
            running.countDown();
            cancelled.await(5, TimeUnit.SECONDS);
            return null;
        }).when(eventSource).run(any(), any(), anyList());
        doAnswer(invocation -> {
            cancelled.countDown();
            return null;
        }).when(eventSource).cancel();

        runner.start();
        runner.start();
        assertTrue(running.await(5, TimeUnit.SECONDS));
        assertEquals(BotRunner.State.RUNNING, runner.getState());

        runner.stop(Duration.ofSeconds(5));

        assertEquals(BotRunner.State.STOPPED, runner.getState());
        verify(eventSource).cancel();
        verify(eventSource).run(any(), any(), anyList());
    }

    @Test
    void shouldFailWhenProfileCannotBeLoaded() {
        doThrow(new FatalNetworkException("unauthorized", null)).when(harness.getApi()).getProfile();

        runner.runForever();

        assertEquals(BotRunner.State.FAILED, runner.getState());
        assertEquals(0, bot.starts.get());
    }

    private static final class LifecycleBot extends ZulipBot {

        private final AtomicInteger starts = new AtomicInteger();
        private final AtomicInteger stops = new AtomicInteger();
        private final AtomicInteger plainMessages = new AtomicInteger();
        private volatile boolean failOnStop;

        @Override
        protected void onStart() {
            starts.incrementAndGet();
        }

        @Override
        protected void onStop() {
            stops.incrementAndGet();
            if (failOnStop) {
                throw new IllegalStateException("cleanup failed");
            }
        }

        @Override
        protected void onMessage(ZulipMessage message) {
            plainMessages.incrementAndGet();
        }
    }
}
