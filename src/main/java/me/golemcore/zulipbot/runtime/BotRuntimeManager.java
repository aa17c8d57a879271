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

import me.golemcore.zulipbot.adapter.outbound.zulip.ZulipCredentials;
import me.golemcore.zulipbot.adapter.outbound.zulip.ZulipTransportFactory;
import me.golemcore.zulipbot.domain.cache.BotStorage;
import me.golemcore.zulipbot.domain.cache.WriteBackCache;
import me.golemcore.zulipbot.domain.command.CommandDispatcher;
import me.golemcore.zulipbot.domain.command.CommandGrammar;
import me.golemcore.zulipbot.domain.command.CommandRegistry;
import me.golemcore.zulipbot.domain.service.ZulipApiClient;
import me.golemcore.zulipbot.domain.service.ZulipEventSource;
import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.infrastructure.i18n.MessageService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds and runs one {@link BotRunner} per enabled
 * {@code bot.instances[*]} entry.
 *
 * <p>
 * Each instance gets its own transport, event source, command registry and
 * storage namespace. A misconfigured instance is logged and skipped; the
 * others still start.
 */
@Component
@Slf4j
public class BotRuntimeManager {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final BotProperties properties;
    private final Map<String, BotFactory> factories = new LinkedHashMap<>();
    private final ZulipTransportFactory transportFactory;
    private final ObjectMapper objectMapper;
    private final WriteBackCache cache;
    private final MessageService messageService;

    private final List<BotRunner> runners = new ArrayList<>();

    public BotRuntimeManager(BotProperties properties, List<BotFactory> botFactories,
            ZulipTransportFactory transportFactory, ObjectMapper objectMapper, WriteBackCache cache,
            MessageService messageService) {
        this.properties = properties;
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
        this.cache = cache;
        this.messageService = messageService;
        for (BotFactory factory : botFactories) {
            factories.put(factory.getType(), factory);
        }
    }

    @PostConstruct
    public void init() {
        Set<String> names = new HashSet<>();
        for (BotProperties.InstanceProperties instance : properties.getInstances()) {
            if (!instance.isEnabled()) {
                log.info("[Runner] Bot '{}' disabled", instance.getName());
                continue;
            }
            if (!names.add(instance.getName())) {
                log.error("[Runner] Duplicate bot name '{}', skipping", instance.getName());
                continue;
            }
            try {
                BotRunner runner = createRunner(instance);
                runners.add(runner);
                runner.start();
            } catch (RuntimeException e) {
                log.error("[Runner] Cannot start bot '{}': {}", instance.getName(), e.getMessage());
            }
        }
        log.info("[Runner] Started {} bot(s), available types: {}", runners.size(), factories.keySet());
    }

    @PreDestroy
    public void shutdown() {
        for (BotRunner runner : runners) {
            runner.stop(STOP_TIMEOUT);
        }
        runners.clear();
    }

    public List<BotRunner> getRunners() {
        return List.copyOf(runners);
    }

    BotRunner createRunner(BotProperties.InstanceProperties instance) {
        if (instance.getName() == null || instance.getName().isBlank()) {
            throw new IllegalArgumentException("Bot instance has no name");
        }
        BotFactory factory = factories.get(instance.getType());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown bot type '" + instance.getType() + "'");
        }

        String namespace = instance.resolveNamespace();
        ZulipApiClient api = new ZulipApiClient(
                transportFactory.create(ZulipCredentials.from(instance)), objectMapper);

        BotProperties.CommandsProperties commands = properties.getCommands();
        CommandGrammar grammar = new CommandGrammar(commands.getPrefixes(), commands.isMentionsEnabled());
        CommandRegistry registry = new CommandRegistry(grammar, messageService, namespace);

        BotContext context = BotContext.builder()
                .name(instance.getName())
                .namespace(namespace)
                .instance(instance)
                .commands(commands)
                .api(api)
                .registry(registry)
                .dispatcher(new CommandDispatcher(registry, messageService, namespace))
                .permissionResolver(new PermissionResolver(properties.getPermissions().getRoleLevels(),
                        properties.getPermissions().getDefaultRole(), instance.getUserRoles()))
                .storage(new BotStorage(cache, namespace))
                .messageService(messageService)
                .build();

        ZulipBot bot = factory.create();
        bot.init(context);
        ZulipEventSource eventSource = new ZulipEventSource(api, properties.getEvents());
        log.info("[Runner] Created bot '{}' of type '{}' (namespace={})", instance.getName(), instance.getType(),
                namespace);
        return new BotRunner(bot, context, eventSource, cache, properties);
    }
}
