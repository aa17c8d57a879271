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

package me.golemcore.zulipbot.port.inbound;

import me.golemcore.zulipbot.domain.command.CommandContext;
import me.golemcore.zulipbot.domain.command.DispatchOutcome;
import me.golemcore.zulipbot.domain.model.PermissionContext;

/**
 * Entry point for command text arriving from chat.
 */
public interface CommandPort {

    /**
     * Checks if the text addresses the bot with a prefix or mention.
     */
    boolean isCommand(String text);

    /**
     * Executes the command in {@code text} on behalf of a caller.
     *
     * @param text
     *            raw message content
     * @param permissions
     *            caller permissions for this call only
     * @param context
     *            passed through to the handler
     * @return outcome; never throws for user or handler errors
     */
    DispatchOutcome dispatch(String text, PermissionContext permissions, CommandContext context);
}
