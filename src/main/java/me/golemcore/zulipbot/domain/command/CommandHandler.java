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

package me.golemcore.zulipbot.domain.command;

import java.util.concurrent.CompletableFuture;

/**
 * Command implementation bound to a {@link CommandSpec} at registration.
 */
@FunctionalInterface
public interface CommandHandler {

    CompletableFuture<CommandResult> handle(CommandInvocation invocation, CommandContext context);

    /**
     * Adapt a synchronous function.
     */
    static CommandHandler sync(SyncCommandHandler handler) {
        return (invocation, context) -> CompletableFuture.completedFuture(handler.handle(invocation, context));
    }

    @FunctionalInterface
    interface SyncCommandHandler {
        CommandResult handle(CommandInvocation invocation, CommandContext context);
    }
}
