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

package me.golemcore.zulipbot.runtime;

import me.golemcore.zulipbot.domain.cache.FlushResult;
import me.golemcore.zulipbot.domain.cache.WriteBackCache;
import me.golemcore.zulipbot.domain.service.ZulipEventSource;
import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Drives one bot: login, event loop on a dedicated thread, cache auto-flush,
 * and an orderly shutdown that flushes what is still dirty.
 */
@Slf4j
public class BotRunner {

    public enum State {
        NEW, RUNNING, STOPPED, FAILED
    }

    private static final String MDC_BOT = "bot";

    private final ZulipBot bot;
    private final BotContext context;
    private final ZulipEventSource eventSource;
    private final WriteBackCache cache;
    private final BotProperties.CacheProperties cacheSettings;
    private final Set<String> eventTypes;
    private final List<List<String>> narrow;

    private final Object lifecycleLock = new Object();
    private volatile State state = State.NEW;
    private volatile Throwable failure;
    private Thread thread;

    public BotRunner(ZulipBot bot, BotContext context, ZulipEventSource eventSource, WriteBackCache cache,
            BotProperties properties) {
        this.bot = bot;
        this.context = context;
        this.eventSource = eventSource;
        this.cache = cache;
        this.cacheSettings = properties.getCache();
        List<String> instanceTypes = context.getInstance() != null ? context.getInstance().getEventTypes() : null;
        this.eventTypes = new LinkedHashSet<>(instanceTypes != null && !instanceTypes.isEmpty()
                ? instanceTypes
                : properties.getEvents().getEventTypes());
        this.narrow = context.getInstance() != null && context.getInstance().getNarrow() != null
                ? context.getInstance().getNarrow()
                : List.of();
    }

    /**
     * Start the bot on its own thread. No-op if already started.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (thread != null) {
                log.debug("[Runner] Bot '{}' already started", context.getName());
                return;
            }
            thread = new Thread(this::runForever, "zulip-bot-" + context.getName());
            thread.start();
        }
    }

    /**
     * Run the bot on the calling thread until stopped or a fatal error.
     */
    public void runForever() {
        MDC.put(MDC_BOT, context.getName());
        try {
            bot.postInit();
            bot.onStart();
            if (cacheSettings.isEnabled()) {
                cache.autoFlush(context.getNamespace(), cacheSettings.getFlushInterval(),
                        cacheSettings.getRetryDelay(), cacheSettings.getMaxRetries());
            }
            state = State.RUNNING;
            log.info("[Runner] Bot '{}' running (events={}, narrow={})", context.getName(), eventTypes, narrow);
            eventSource.run(bot::onEvent, eventTypes, narrow);
            state = State.STOPPED;
        } catch (RuntimeException e) {
            failure = e;
            state = State.FAILED;
            log.error("[Runner] Bot '{}' failed: {}", context.getName(), e.getMessage(), e);
        } finally {
            shutdownBot();
            MDC.remove(MDC_BOT);
        }
    }

    /**
     * Cancel the event loop and wait up to {@code timeout} for the bot
     * thread to finish its shutdown.
     */
    public void stop(Duration timeout) {
        Thread running;
        synchronized (lifecycleLock) {
            running = thread;
        }
        eventSource.cancel();
        if (running == null || running == Thread.currentThread()) {
            return;
        }
        try {
            running.join(timeout.toMillis());
            if (running.isAlive()) {
                log.warn("[Runner] Bot '{}' did not stop within {}ms", context.getName(), timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public State getState() {
        return state;
    }

    public Throwable getFailure() {
        return failure;
    }

    public ZulipBot getBot() {
        return bot;
    }

    public String getName() {
        return context.getName();
    }

    private void shutdownBot() {
        // the stop signal interrupts this thread; the final flush must still run
        boolean interrupted = Thread.interrupted();
        cache.cancelAutoFlush(context.getNamespace());
        try {
            bot.onStop();
        } catch (RuntimeException e) {
            log.error("[Runner] onStop of '{}' failed: {}", context.getName(), e.getMessage(), e);
        }
        FlushResult result = cache.flush(context.getNamespace());
        if (!result.isClean()) {
            log.warn("[Runner] Bot '{}' stopped with {} unflushed entries", context.getName(),
                    result.remainingDirty());
        }
        if (state == State.RUNNING) {
            state = State.STOPPED;
        }
        log.info("[Runner] Bot '{}' stopped", context.getName());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
