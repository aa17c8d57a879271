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

import me.golemcore.zulipbot.domain.model.PermissionContext;
import me.golemcore.zulipbot.infrastructure.i18n.MessageService;
import me.golemcore.zulipbot.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs one command occurrence: lookup, permission gate, argument parsing,
 * handler call, error translation.
 *
 * <p>
 * The permission gate uses the cheap name lookup and runs before any
 * argument parsing, so an unauthorized caller always gets a
 * permission-denied reply no matter how malformed the arguments are.
 *
 * <p>
 * Nothing thrown by parsing or by a handler escapes {@link #dispatch}; every
 * failure becomes a {@link DispatchOutcome} with a translated message.
 */
@Slf4j
public class CommandDispatcher implements CommandPort {

    private final CommandRegistry registry;
    private final MessageService messageService;
    private final String namespace;

    public CommandDispatcher(CommandRegistry registry, MessageService messageService, String namespace) {
        this.registry = registry;
        this.messageService = messageService;
        this.namespace = namespace;
    }

    @Override
    public boolean isCommand(String text) {
        return registry.getGrammar().isCommand(text);
    }

    @Override
    public DispatchOutcome dispatch(String text, PermissionContext permissions, CommandContext context) {
        if (!isCommand(text)) {
            return DispatchOutcome.notACommand();
        }

        Optional<CommandSpec> found = registry.findCommandSpec(text);
        if (found.isEmpty()) {
            return rejected(DispatchOutcome.Status.UNKNOWN_COMMAND, unknownCommand(text));
        }
        CommandSpec spec = found.get();

        if (!permissions.meets(spec.getMinLevel())) {
            log.info("[Commands] Denied '{}' (caller level {}, required {})",
                    spec.getName(), permissions.callerLevel(), spec.getMinLevel());
            return rejected(DispatchOutcome.Status.PERMISSION_DENIED,
                    new PermissionDeniedException(spec.getName(), spec.getMinLevel()));
        }

        CommandInvocation invocation;
        try {
            invocation = registry.parseText(text);
        } catch (CommandException e) {
            log.debug("[Commands] Invalid arguments for '{}': {}", spec.getName(), e.getMessage());
            return rejected(DispatchOutcome.Status.INVALID_ARGUMENTS, e);
        }

        return invoke(spec, invocation, context);
    }

    private DispatchOutcome invoke(CommandSpec spec, CommandInvocation invocation, CommandContext context) {
        log.debug("[Commands] Executing '{}' args={}", spec.getName(), invocation.args());
        try {
            CompletableFuture<CommandResult> future = spec.getHandler().handle(invocation, context);
            CommandResult result = future != null ? future.get() : CommandResult.silent();
            if (result == null) {
                result = CommandResult.silent();
            }
            DispatchOutcome.Status status = result.success()
                    ? DispatchOutcome.Status.COMPLETED
                    : DispatchOutcome.Status.FAILED;
            return new DispatchOutcome(status, result.output(), invocation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Commands] Interrupted while running '{}'", spec.getName());
            return failed(invocation);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Commands] Command '{}' failed: {}", spec.getName(), cause.getMessage(), cause);
            return failed(invocation);
        } catch (RuntimeException e) {
            log.error("[Commands] Command '{}' failed: {}", spec.getName(), e.getMessage(), e);
            return failed(invocation);
        }
    }

    private CommandException unknownCommand(String text) {
        String body = registry.getGrammar().stripTrigger(text).orElse("");
        List<String> tokens = registry.getGrammar().tokenize(body);
        return tokens.isEmpty() ? new EmptyCommandException() : new UnknownCommandException(tokens.get(0));
    }

    private DispatchOutcome rejected(DispatchOutcome.Status status, CommandException e) {
        return DispatchOutcome.of(status, messageService.translate(namespace, e.getMessageKey(), e.getMessageArgs()));
    }

    private DispatchOutcome failed(CommandInvocation invocation) {
        return new DispatchOutcome(DispatchOutcome.Status.FAILED,
                messageService.translate(namespace, "command.error.failed", invocation.name()), invocation);
    }
}
