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

package me.golemcore.zulipbot.bots.counter;

import me.golemcore.zulipbot.domain.cache.BotStorage;
import me.golemcore.zulipbot.domain.cache.CacheSession;
import me.golemcore.zulipbot.domain.command.CommandContext;
import me.golemcore.zulipbot.domain.command.CommandHandler;
import me.golemcore.zulipbot.domain.command.CommandInvocation;
import me.golemcore.zulipbot.domain.command.CommandRegistry;
import me.golemcore.zulipbot.domain.command.CommandResult;
import me.golemcore.zulipbot.domain.command.CommandSpec;
import me.golemcore.zulipbot.domain.model.ZulipMessage;
import me.golemcore.zulipbot.runtime.ZulipBot;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Counts {@code !count} calls in persistent storage.
 *
 * <ul>
 * <li>{@code !count} - increment and show the counter</li>
 * <li>{@code !reset} - reset the counter to zero (moderators and up)</li>
 * <li>{@code !stats} - show counter, total and stored keys</li>
 * </ul>
 */
@Slf4j
public class CounterBot extends ZulipBot {

    static final String KEY_COUNTER = "counter";
    static final String KEY_TOTAL = "total_messages";
    private static final int DEFAULT_RESET_LEVEL = 50;

    @Override
    protected void registerCommands(CommandRegistry registry) {
        registry.register(CommandSpec.builder()
                .name("count")
                .description("bots.counter.count.description")
                .handler(CommandHandler.sync(this::handleCount))
                .build());
        registry.register(CommandSpec.builder()
                .name("reset")
                .description("bots.counter.reset.description")
                .minLevel(resetLevel())
                .handler(CommandHandler.sync(this::handleReset))
                .build());
        registry.register(CommandSpec.builder()
                .name("stats")
                .description("bots.counter.stats.description")
                .handler(CommandHandler.sync(this::handleStats))
                .build());
    }

    @Override
    protected void onMessage(ZulipMessage message) {
        String content = message.getContent() != null ? message.getContent() : "";
        log.debug("CounterBot received message: {}", content.substring(0, Math.min(50, content.length())));
    }

    private CommandResult handleCount(CommandInvocation invocation, CommandContext context) {
        long counter;
        long total;
        try (CacheSession session = getStorage().session(KEY_COUNTER, KEY_TOTAL)) {
            counter = session.get(KEY_COUNTER, Long.class, 0L) + 1;
            total = session.get(KEY_TOTAL, Long.class, 0L) + 1;
            session.put(KEY_COUNTER, counter);
            session.put(KEY_TOTAL, total);
        }
        return CommandResult.success(msg("bots.counter.count", counter, total));
    }

    private CommandResult handleReset(CommandInvocation invocation, CommandContext context) {
        getStorage().put(KEY_COUNTER, 0L);
        return CommandResult.success(msg("bots.counter.reset"));
    }

    private CommandResult handleStats(CommandInvocation invocation, CommandContext context) {
        BotStorage storage = getStorage();
        long counter;
        long total;
        try (CacheSession session = storage.session(KEY_COUNTER, KEY_TOTAL)) {
            counter = session.get(KEY_COUNTER, Long.class, 0L);
            total = session.get(KEY_TOTAL, Long.class, 0L);
        }
        List<String> keys = storage.keys();
        String keyList = keys.isEmpty() ? msg("bots.counter.stats.no-keys") : String.join(", ", keys);
        return CommandResult.success(msg("bots.counter.stats", counter, total, keyList));
    }

    private int resetLevel() {
        String configured = getContext().getSetting("reset-level", null);
        return configured != null ? Integer.parseInt(configured.trim()) : DEFAULT_RESET_LEVEL;
    }
}
