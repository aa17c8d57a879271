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
import me.golemcore.zulipbot.domain.model.ZulipMessage;

/**
 * Per-dispatch context handed to handlers.
 *
 * @param message
 *            the message that carried the command; null for synthetic calls
 * @param permissions
 *            caller permissions for this dispatch
 * @param namespace
 *            storage and translation namespace of the bot
 */
public record CommandContext(ZulipMessage message, PermissionContext permissions, String namespace) {
}
