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

import me.golemcore.zulipbot.domain.cache.BotStorage;
import me.golemcore.zulipbot.domain.command.ArgumentType;
import me.golemcore.zulipbot.domain.command.CommandArgument;
import me.golemcore.zulipbot.domain.command.CommandContext;
import me.golemcore.zulipbot.domain.command.CommandGrammar;
import me.golemcore.zulipbot.domain.command.CommandHandler;
import me.golemcore.zulipbot.domain.command.CommandInvocation;
import me.golemcore.zulipbot.domain.command.CommandRegistry;
import me.golemcore.zulipbot.domain.command.CommandResult;
import me.golemcore.zulipbot.domain.command.CommandSpec;
import me.golemcore.zulipbot.domain.command.DispatchOutcome;
import me.golemcore.zulipbot.domain.model.OutgoingMessage;
import me.golemcore.zulipbot.domain.model.PermissionContext;
import me.golemcore.zulipbot.domain.model.UserProfile;
import me.golemcore.zulipbot.domain.model.ZulipEvent;
import me.golemcore.zulipbot.domain.model.ZulipMessage;
import me.golemcore.zulipbot.port.outbound.ZulipTransportException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Base class for bots.
 *
 * <p>
 * Subclasses register their commands in {@link #registerCommands} and may
 * override {@link #onStart()}, {@link #onStop()} and
 * {@link #onMessage(ZulipMessage)} for messages that are not commands. The
 * runtime calls, in order: {@link #init(BotContext)}, {@link #postInit()},
 * {@link #onStart()}, {@link #onEvent(ZulipEvent)} per event, then
 * {@link #onStop()}.
 */
@Slf4j
public abstract class ZulipBot {

    public static final String HELP_COMMAND = "help";
    public static final String HELP_ALIAS = "?";

    private BotContext context;
    private UserProfile profile;

    public final void init(BotContext context) {
        this.context = context;
        if (context.getCommands() == null || context.getCommands().isAutoHelp()) {
            context.getRegistry().register(helpCommand());
        }
        registerCommands(context.getRegistry());
    }

    /**
     * Fetch the bot's own profile, add its identity as mention aliases and
     * mark it present.
     */
    public void postInit() {
        profile = context.getApi().getProfile();
        CommandGrammar grammar = context.getRegistry().getGrammar();
        if (profile.getFullName() != null) {
            grammar.addMentionAliases("@**" + profile.getFullName() + "**", "@" + profile.getFullName());
        }
        if (profile.getEmail() != null) {
            grammar.addMentionAliases("@" + profile.getEmail());
        }
        List<String> extraAliases = context.getInstance() != null
                ? context.getInstance().getExtraAliases()
                : List.of();
        if (extraAliases != null) {
            context.getRegistry().getGrammar().addMentionAliases(extraAliases.toArray(new String[0]));
        }
        try {
            context.getApi().updatePresence("active");
        } catch (ZulipTransportException e) {
            log.warn("[Runner] Failed to set presence: {}", e.getMessage());
        }
        log.info("[Runner] Bot '{}' logged in as {} ({})", context.getName(), profile.getFullName(),
                profile.getEmail());
    }

    protected void registerCommands(CommandRegistry registry) {
    }

    protected void onStart() {
    }

    protected void onStop() {
    }

    /**
     * Called for messages that are not addressed to the bot as a command.
     */
    protected void onMessage(ZulipMessage message) {
    }

    public void onEvent(ZulipEvent event) {
        if (!event.isMessage()) {
            return;
        }
        ZulipMessage message = event.message();
        if (isOwnMessage(message)) {
            return;
        }
        PermissionContext permissions = context.getPermissionResolver().resolve(message);
        DispatchOutcome outcome = context.getDispatcher().dispatch(message.getContent(), permissions,
                new CommandContext(message, permissions, context.getNamespace()));
        if (!outcome.isCommand()) {
            onMessage(message);
            return;
        }
        if (outcome.hasReply()) {
            sendReply(message, outcome.message());
        }
    }

    /**
     * Answer in the conversation {@code message} came from: same stream and
     * topic, or the same private recipients.
     *
     * @return id of the sent message
     */
    public long sendReply(ZulipMessage message, String content) {
        OutgoingMessage reply;
        if (message.isPrivate()) {
            reply = OutgoingMessage.toPrivate(message.getPrivateRecipientIds(), content);
        } else {
            if (message.getStreamId() == null) {
                throw new IllegalArgumentException("Stream message " + message.getId() + " has no stream_id");
            }
            reply = OutgoingMessage.toStream(message.getStreamId(), message.getReplyTopic(), content);
        }
        return context.getApi().sendMessage(reply);
    }

    public String getName() {
        return context.getName();
    }

    public BotStorage getStorage() {
        return context.getStorage();
    }

    public Optional<UserProfile> getProfile() {
        return Optional.ofNullable(profile);
    }

    protected BotContext getContext() {
        return context;
    }

    protected String msg(String key, Object... args) {
        return context.msg(key, args);
    }

    private boolean isOwnMessage(ZulipMessage message) {
        if (profile == null) {
            return false;
        }
        return message.getSenderId() == profile.getUserId()
                || (profile.getEmail() != null && profile.getEmail().equalsIgnoreCase(message.getSenderEmail()));
    }

    private CommandSpec helpCommand() {
        return CommandSpec.builder()
                .name(HELP_COMMAND)
                .alias(HELP_ALIAS)
                .description("command.help.description")
                .arg(CommandArgument.optional("command", ArgumentType.STRING, "command.help.arg.command"))
                .handler(CommandHandler.sync(this::handleHelp))
                .build();
    }

    private CommandResult handleHelp(CommandInvocation invocation, CommandContext commandContext) {
        CommandRegistry registry = context.getRegistry();
        int callerLevel = commandContext.permissions().callerLevel();
        String target = invocation.getString("command");
        if (target == null) {
            return CommandResult.success(registry.generateHelp(callerLevel));
        }
        return registry.getCommand(target)
                .filter(spec -> spec.isShowInHelp() && registry.visibleTo(spec, callerLevel))
                .map(spec -> CommandResult.success(registry.describe(spec)))
                .orElseGet(() -> CommandResult.failure(msg("command.error.unknown", target)));
    }
}
