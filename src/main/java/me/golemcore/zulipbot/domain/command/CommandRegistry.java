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

import me.golemcore.zulipbot.infrastructure.i18n.MessageService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered commands of one bot.
 *
 * <p>
 * Names and aliases share one lowercase index and must be unique across the
 * registry. {@link #findCommandSpec(String)} only resolves the name and never
 * throws, so callers can check permissions before {@link #parseText(String)}
 * evaluates arguments.
 */
@Slf4j
public class CommandRegistry {

    private final CommandGrammar grammar;
    private final MessageService messageService;
    private final String namespace;

    private final Map<String, CommandSpec> commands = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, CommandSpec> aliasIndex = new ConcurrentHashMap<>();

    public CommandRegistry(CommandGrammar grammar, MessageService messageService, String namespace) {
        this.grammar = grammar;
        this.messageService = messageService;
        this.namespace = namespace;
    }

    /**
     * @throws IllegalArgumentException
     *             if the command spec is malformed or its name or an alias is taken
     */
    public synchronized void register(CommandSpec spec) {
        spec.validate();
        List<String> keys = new ArrayList<>();
        keys.add(normalize(spec.getName()));
        for (String alias : spec.getAliases()) {
            keys.add(normalize(alias));
        }
        for (String key : keys) {
            CommandSpec existing = aliasIndex.get(key);
            if (existing != null || Collections.frequency(keys, key) > 1) {
                throw new IllegalArgumentException("Command name or alias '" + key + "' is already registered"
                        + (existing != null ? " by '" + existing.getName() + "'" : ""));
            }
        }
        commands.put(normalize(spec.getName()), spec);
        for (String key : keys) {
            aliasIndex.put(key, spec);
        }
        log.debug("[Commands] Registered '{}' (aliases={}, minLevel={})", spec.getName(), spec.getAliases(),
                spec.getMinLevel());
    }

    public Collection<CommandSpec> getCommands() {
        synchronized (commands) {
            return List.copyOf(commands.values());
        }
    }

    public Optional<CommandSpec> getCommand(String nameOrAlias) {
        if (nameOrAlias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliasIndex.get(normalize(nameOrAlias)));
    }

    public CommandGrammar getGrammar() {
        return grammar;
    }

    /**
     * Resolve the command addressed by {@code text} by name or alias only.
     * Returns empty for non-commands, empty bodies and unknown names.
     */
    public Optional<CommandSpec> findCommandSpec(String text) {
        Optional<String> body = grammar.stripTrigger(text);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        return getCommand(firstToken(body.get()));
    }

    /**
     * Parse and coerce the full command.
     *
     * @throws CommandException
     *             if the text is not a known command or its arguments do not
     *             fit the command spec
     */
    public CommandInvocation parseText(String text) {
        String body = grammar.stripTrigger(text).orElse(text == null ? "" : text.strip());
        List<String> tokens = grammar.tokenize(body);
        if (tokens.isEmpty()) {
            throw new EmptyCommandException();
        }
        String name = tokens.get(0);
        CommandSpec spec = getCommand(name).orElseThrow(() -> new UnknownCommandException(name));
        List<String> argTokens = tokens.subList(1, tokens.size());
        return new CommandInvocation(spec.getName(), parseArgs(spec, argTokens), argTokens, spec);
    }

    /**
     * Listing of visible commands. Commands with {@code showInHelp=false} and,
     * when {@code callerLevel} is given, commands above that level are hidden.
     */
    public String generateHelp(Integer callerLevel) {
        List<String> lines = new ArrayList<>();
        String prefix = grammar.primaryPrefix();
        for (CommandSpec spec : getCommands()) {
            if (!spec.isShowInHelp() || !visibleTo(spec, callerLevel)) {
                continue;
            }
            String line = messageService.translate(namespace, "command.help.entry",
                    spec.usage(prefix), describeText(spec));
            if (!spec.getAliases().isEmpty()) {
                line += " " + messageService.translate(namespace, "command.help.aliases",
                        String.join(", ", spec.getAliases()));
            }
            lines.add(line);
        }
        if (lines.isEmpty()) {
            return messageService.translate(namespace, "command.help.empty");
        }
        return messageService.translate(namespace, "command.help.header") + "\n" + String.join("\n", lines);
    }

    /**
     * Detail view of one command.
     */
    public String describe(CommandSpec spec) {
        StringBuilder sb = new StringBuilder();
        sb.append(spec.usage(grammar.primaryPrefix()));
        String description = describeText(spec);
        if (!description.isEmpty()) {
            sb.append("\n").append(description);
        }
        if (!spec.getAliases().isEmpty()) {
            sb.append("\n").append(messageService.translate(namespace, "command.help.aliases",
                    String.join(", ", spec.getAliases())));
        }
        if (!spec.getArgs().isEmpty()) {
            sb.append("\n").append(messageService.translate(namespace, "command.help.arguments"));
            for (CommandArgument arg : spec.getArgs()) {
                sb.append("\n").append(messageService.translate(namespace, "command.help.argument",
                        arg.name(), arg.type().getLabel(), argumentMode(arg), arg.description()));
            }
        }
        if (spec.getMinLevel() != null) {
            sb.append("\n").append(messageService.translate(namespace, "command.help.min-level",
                    String.valueOf(spec.getMinLevel())));
        }
        return sb.toString();
    }

    public boolean visibleTo(CommandSpec spec, Integer callerLevel) {
        return callerLevel == null || spec.getMinLevel() == null || callerLevel >= spec.getMinLevel();
    }

    private Map<String, Object> parseArgs(CommandSpec spec, List<String> tokens) {
        Map<String, Object> values = new LinkedHashMap<>();
        int index = 0;
        for (CommandArgument arg : spec.getArgs()) {
            if (arg.multiple()) {
                if (index >= tokens.size() && arg.required()) {
                    throw new MissingArgumentException(arg.name());
                }
                List<Object> rest = new ArrayList<>();
                for (String token : tokens.subList(Math.min(index, tokens.size()), tokens.size())) {
                    rest.add(coerce(arg, token));
                }
                values.put(arg.name(), Collections.unmodifiableList(rest));
                index = tokens.size();
                break;
            }
            if (index < tokens.size()) {
                values.put(arg.name(), coerce(arg, tokens.get(index)));
                index++;
            } else if (arg.required()) {
                throw new MissingArgumentException(arg.name());
            } else {
                values.put(arg.name(), null);
            }
        }
        if (index < tokens.size() && !spec.isAllowExtra()) {
            throw new TooManyArgumentsException(spec.getName());
        }
        return values;
    }

    private Object coerce(CommandArgument arg, String token) {
        try {
            return arg.type().coerce(token);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentValueException(arg.name(), arg.type(), token);
        }
    }

    private String describeText(CommandSpec spec) {
        String description = spec.getDescription();
        if (description == null || description.isBlank()) {
            return "";
        }
        // descriptions may be translation keys
        return messageService.translate(namespace, description);
    }

    private String argumentMode(CommandArgument arg) {
        String key;
        if (arg.multiple()) {
            key = "command.help.mode.multiple";
        } else {
            key = arg.required() ? "command.help.mode.required" : "command.help.mode.optional";
        }
        return messageService.translate(namespace, key);
    }

    private static String firstToken(String body) {
        String trimmed = body.strip();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end);
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
