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
import me.golemcore.zulipbot.domain.command.CommandDispatcher;
import me.golemcore.zulipbot.domain.command.CommandRegistry;
import me.golemcore.zulipbot.domain.service.ZulipApiClient;
import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.infrastructure.i18n.MessageService;
import lombok.Builder;
import lombok.Getter;

/**
 * Collaborators of one running bot, assembled by {@link BotRuntimeManager}.
 */
@Getter
@Builder
public class BotContext {

    private final String name;
    private final String namespace;
    private final BotProperties.InstanceProperties instance;
    private final BotProperties.CommandsProperties commands;
    private final ZulipApiClient api;
    private final CommandRegistry registry;
    private final CommandDispatcher dispatcher;
    private final PermissionResolver permissionResolver;
    private final BotStorage storage;
    private final MessageService messageService;

    /**
     * Free-form instance setting, or {@code defaultValue} when unset.
     */
    public String getSetting(String key, String defaultValue) {
        if (instance == null || instance.getSettings() == null) {
            return defaultValue;
        }
        return instance.getSettings().getOrDefault(key, defaultValue);
    }

    public String msg(String key, Object... args) {
        return messageService.translate(namespace, key, args);
    }
}
