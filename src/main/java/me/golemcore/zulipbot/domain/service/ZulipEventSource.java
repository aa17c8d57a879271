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

package me.golemcore.zulipbot.domain.service;

import me.golemcore.zulipbot.domain.model.EventQueue;
import me.golemcore.zulipbot.domain.model.EventSourceState;
import me.golemcore.zulipbot.domain.model.ZulipEvent;
import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.port.outbound.FatalNetworkException;
import me.golemcore.zulipbot.port.outbound.QueueExpiredException;
import me.golemcore.zulipbot.port.outbound.TransientNetworkException;
import me.golemcore.zulipbot.port.outbound.ZulipTransportException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Keeps a server-side event queue alive and drains it with long polls.
 *
 * <p>
 * {@link #run} registers a queue, then polls it until cancelled. Each batch
 * first advances the queue cursor to the highest event id seen, then hands
 * events to the handler in arrival order; the next poll starts only after the
 * whole batch was delivered.
 *
 * <p>
 * Error handling:
 * <ul>
 * <li>{@link QueueExpiredException} - the queue is dropped and exactly one new
 * one is registered. Events between the last delivered id and the new queue
 * may be lost; the gap is logged.</li>
 * <li>{@link TransientNetworkException} - retried with bounded exponential
 * backoff up to {@code bot.events.max-retries}. With retries disabled, or
 * once the ceiling is hit, the failure becomes fatal.</li>
 * <li>{@link FatalNetworkException} - the loop stops and the exception
 * propagates to the owner.</li>
 * <li>Handler exceptions are logged per event and never stop the loop.</li>
 * </ul>
 *
 * <p>
 * Cancellation is checked between polls, between events and during backoff
 * sleeps.
 */
@Slf4j
public class ZulipEventSource {

    private final ZulipApiClient api;
    private final BotProperties.EventsProperties policy;

    private volatile EventSourceState state = EventSourceState.UNREGISTERED;
    private volatile EventQueue currentQueue;
    private volatile boolean cancelled;
    private volatile Thread loopThread;

    public ZulipEventSource(ZulipApiClient api, BotProperties.EventsProperties policy) {
        this.api = api;
        this.policy = policy;
    }

    public EventQueue register(Set<String> eventTypes, List<List<String>> narrow) {
        EventQueue queue = withRetry("register", () -> api.register(eventTypes, narrow));
        currentQueue = queue;
        state = EventSourceState.REGISTERED;
        log.info("[Events] Registered queue {} (last_event_id={}, types={})",
                queue.getQueueId(), queue.getLastEventId(), eventTypes);
        return queue;
    }

    /**
     * Fetch the next batch and advance the queue cursor past it.
     */
    public List<ZulipEvent> poll(EventQueue queue) {
        List<ZulipEvent> batch = withRetry("poll", () -> api.getEvents(queue));
        for (ZulipEvent event : batch) {
            queue.advanceTo(event.id());
        }
        return batch;
    }

    /**
     * Best effort; the server garbage-collects idle queues anyway.
     */
    public void deregister(EventQueue queue) {
        try {
            api.deleteQueue(queue.getQueueId());
            log.info("[Events] Deregistered queue {}", queue.getQueueId());
        } catch (ZulipTransportException e) {
            log.debug("[Events] Failed to deregister queue {}: {}", queue.getQueueId(), e.getMessage());
        }
    }

    /**
     * Run the poll loop on the calling thread until {@link #cancel()} or a
     * fatal error.
     *
     * @throws FatalNetworkException
     *             when the loop cannot continue
     */
    public void run(ZulipEventHandler handler, Set<String> eventTypes, List<List<String>> narrow) {
        loopThread = Thread.currentThread();
        EventQueue queue = null;
        boolean queueLive = false;
        try {
            queue = register(eventTypes, narrow);
            queueLive = true;
            while (!isCancelled()) {
                List<ZulipEvent> batch;
                try {
                    state = EventSourceState.POLLING;
                    batch = poll(queue);
                } catch (QueueExpiredException e) {
                    log.warn("[Events] Queue {} expired after event {}; re-registering, events since then may be lost",
                            queue.getQueueId(), queue.getLastEventId());
                    state = EventSourceState.REGISTERED;
                    // expired queues are never reused or deregistered
                    queueLive = false;
                    queue = register(eventTypes, narrow);
                    queueLive = true;
                    continue;
                }
                deliver(batch, handler);
            }
            log.info("[Events] Event loop cancelled");
        } catch (CancellationException e) {
            log.info("[Events] Event loop cancelled during {}", e.getMessage());
        } catch (FatalNetworkException e) {
            log.error("[Events] Event loop aborted: {}", e.getMessage());
            throw e;
        } finally {
            if (queueLive) {
                // a pending interrupt would abort the delete call
                boolean interrupted = Thread.interrupted();
                deregister(queue);
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
            state = EventSourceState.CLOSED;
            loopThread = null;
        }
    }

    public void cancel() {
        cancelled = true;
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
        }
    }

    public EventSourceState getState() {
        return state;
    }

    public EventQueue getCurrentQueue() {
        return currentQueue;
    }

    private void deliver(List<ZulipEvent> batch, ZulipEventHandler handler) {
        for (ZulipEvent event : batch) {
            if (isCancelled()) {
                return;
            }
            try {
                handler.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[Events] Handler failed for event {} ({}): {}", event.id(), event.type(),
                        e.getMessage(), e);
            }
        }
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            if (isCancelled()) {
                throw new CancellationException(operation);
            }
            try {
                return call.get();
            } catch (TransientNetworkException e) {
                if (isCancelled()) {
                    throw new CancellationException(operation);
                }
                if (!policy.isRetryEnabled()) {
                    throw new FatalNetworkException(operation + " failed and retries are disabled: "
                            + e.getMessage(), e);
                }
                if (attempt >= policy.getMaxRetries()) {
                    throw new FatalNetworkException(operation + " failed after " + attempt + " retries: "
                            + e.getMessage(), e);
                }
                long backoffMs = backoffMillis(attempt, e.getRetryAfter());
                log.warn("[Events] {} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt + 1, policy.getMaxRetries(), backoffMs, e.getMessage());
                sleepForRetry(backoffMs);
                attempt++;
            }
        }
    }

    long backoffMillis(int attempt, Duration retryAfter) {
        long initial = policy.getInitialBackoff().toMillis();
        long max = policy.getMaxBackoff().toMillis();
        long exponential = (long) (initial * Math.pow(policy.getBackoffMultiplier(), attempt));
        long backoff = Math.min(max, exponential);
        if (retryAfter != null) {
            backoff = Math.max(backoff, retryAfter.toMillis());
        }
        return backoff;
    }

    void sleepForRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("backoff");
        }
    }

    private boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }
}
