package me.golemcore.zulipbot.testsupport.bot;

import me.golemcore.zulipbot.domain.cache.BotStorage;
import me.golemcore.zulipbot.domain.cache.WriteBackCache;
import me.golemcore.zulipbot.domain.command.CommandDispatcher;
import me.golemcore.zulipbot.domain.command.CommandGrammar;
import me.golemcore.zulipbot.domain.command.CommandRegistry;
import me.golemcore.zulipbot.domain.model.UserProfile;
import me.golemcore.zulipbot.domain.model.ZulipEvent;
import me.golemcore.zulipbot.domain.model.ZulipMessage;
import me.golemcore.zulipbot.domain.service.ZulipApiClient;
import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.infrastructure.i18n.MessageService;
import me.golemcore.zulipbot.runtime.BotContext;
import me.golemcore.zulipbot.runtime.PermissionResolver;
import me.golemcore.zulipbot.runtime.ZulipBot;
import me.golemcore.zulipbot.testsupport.storage.InMemoryKeyValueStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires a bot the way the runtime does, but with a mocked API client and an
 * in-memory store.
 */
public final class BotHarness {

    public static final long BOT_USER_ID = 99L;
    public static final String BOT_EMAIL = "helper-bot@zulip.example.com";
    public static final String BOT_NAME = "Helper Bot";
    public static final String MODERATOR_EMAIL = "mod@example.com";

    private final ZulipApiClient api = mock(ZulipApiClient.class);
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    private final WriteBackCache cache;
    private final BotProperties properties = new BotProperties();
    private final BotProperties.InstanceProperties instance = new BotProperties.InstanceProperties();
    private final MessageService messageService = new MessageService();

    public BotHarness(String name) {
        properties.getCache().setRetryDelay(Duration.ZERO);
        instance.setName(name);
        instance.setType(name);
        instance.setUserRoles(Map.of(MODERATOR_EMAIL, "moderator"));
        cache = new WriteBackCache(store, new ObjectMapper(), Clock.systemUTC(), properties);

        UserProfile profile = new UserProfile();
        profile.setUserId(BOT_USER_ID);
        profile.setEmail(BOT_EMAIL);
        profile.setFullName(BOT_NAME);
        when(api.getProfile()).thenReturn(profile);
    }

    public BotContext buildContext() {
        String namespace = instance.resolveNamespace();
        BotProperties.CommandsProperties commands = properties.getCommands();
        CommandRegistry registry = new CommandRegistry(
                new CommandGrammar(commands.getPrefixes(), commands.isMentionsEnabled()), messageService, namespace);
        return BotContext.builder()
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
    }

    public <B extends ZulipBot> B start(B bot) {
        bot.init(buildContext());
        bot.postInit();
        return bot;
    }

    public ZulipApiClient getApi() {
        return api;
    }

    public InMemoryKeyValueStore getStore() {
        return store;
    }

    public WriteBackCache getCache() {
        return cache;
    }

    public BotProperties getProperties() {
        return properties;
    }

    public BotProperties.InstanceProperties getInstance() {
        return instance;
    }

    public static ZulipEvent streamMessage(long id, String senderEmail, String content) {
        ZulipMessage message = ZulipMessage.builder()
                .id(id)
                .type(ZulipMessage.TYPE_STREAM)
                .content(content)
                .senderId(id + 1000)
                .senderEmail(senderEmail)
                .senderFullName("Someone")
                .streamId(7L)
                .subject("chat")
                .build();
        return new ZulipEvent(id, ZulipEvent.TYPE_MESSAGE, JsonNodeFactory.instance.objectNode(), message);
    }

    public static ZulipEvent privateMessage(long id, String senderEmail, String content) {
        JsonNodeFactory json = JsonNodeFactory.instance;
        ZulipMessage message = ZulipMessage.builder()
                .id(id)
                .type(ZulipMessage.TYPE_PRIVATE)
                .content(content)
                .senderId(5L)
                .senderEmail(senderEmail)
                .displayRecipient(json.arrayNode()
                        .add(json.objectNode().put("id", 5L).put("email", senderEmail))
                        .add(json.objectNode().put("id", BOT_USER_ID).put("email", BOT_EMAIL)))
                .build();
        return new ZulipEvent(id, ZulipEvent.TYPE_MESSAGE, json.objectNode(), message);
    }
}
