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

package me.golemcore.zulipbot.bots.echo;

import me.golemcore.zulipbot.domain.command.ArgumentType;
import me.golemcore.zulipbot.domain.command.CommandArgument;
import me.golemcore.zulipbot.domain.command.CommandHandler;
import me.golemcore.zulipbot.domain.command.CommandRegistry;
import me.golemcore.zulipbot.domain.command.CommandResult;
import me.golemcore.zulipbot.domain.command.CommandSpec;
import me.golemcore.zulipbot.domain.model.ZulipMessage;
import me.golemcore.zulipbot.runtime.ZulipBot;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Repeats what it is told. {@code !echo some text} replies with the text;
 * any other message is answered with an {@code Echo:} line.
 */
@Slf4j
public class EchoBot extends ZulipBot {

    @Override
    protected void registerCommands(CommandRegistry registry) {
        registry.register(CommandSpec.builder()
                .name("echo")
                .description("bots.echo.command.description")
                .arg(CommandArgument.multiple("text", ArgumentType.STRING, true, "bots.echo.arg.text"))
                .handler(CommandHandler.sync((invocation, context) -> {
                    List<String> parts = invocation.getList("text");
                    return CommandResult.success(String.join(" ", parts));
                }))
                .build());
    }

    @Override
    protected void onMessage(ZulipMessage message) {
        log.debug("Sending echo reply");
        sendReply(message, msg("bots.echo.reply", message.getContent()));
    }
}
