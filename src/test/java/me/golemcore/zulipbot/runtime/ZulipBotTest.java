package me.golemcore.zulipbot.runtime;

import me.golemcore.zulipbot.domain.command.CommandHandler;
import me.golemcore.zulipbot.domain.command.CommandRegistry;
import me.golemcore.zulipbot.domain.command.CommandResult;
import me.golemcore.zulipbot.domain.command.CommandSpec;
import me.golemcore.zulipbot.domain.model.OutgoingMessage;
import me.golemcore.zulipbot.domain.model.UserProfile;
import me.golemcore.zulipbot.domain.model.ZulipEvent;
import me.golemcore.zulipbot.domain.model.ZulipMessage;
import me.golemcore.zulipbot.port.outbound.FatalNetworkException;
import me.golemcore.zulipbot.testsupport.bot.BotHarness;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ZulipBotTest {

    private BotHarness harness;
    private RecordingBot bot;

    @BeforeEach
    void setUp() {
        harness = new BotHarness("helper");
        bot = harness.start(new RecordingBot());
    }

    @Test
    void shouldRegisterHelpAndBotCommands() {
        CommandRegistry registry = bot.getContext().getRegistry();

        assertTrue(registry.getCommand("help").isPresent());
        assertTrue(registry.getCommand("?").isPresent());
        assertTrue(registry.getCommand("ping").isPresent());
    }

    @Test
    void shouldSkipHelpWhenAutoHelpDisabled() {
        BotHarness other = new BotHarness("quiet");
        other.getProperties().getCommands().setAutoHelp(false);

        RecordingBot quiet = other.start(new RecordingBot());

        assertFalse(quiet.getContext().getRegistry().getCommand("help").isPresent());
    }

    @Test
    void shouldAnswerMentionsUsingProfileIdentity() {
        List<String> aliases = bot.getContext().getRegistry().getGrammar().getMentionAliases();

        assertTrue(aliases.contains("@**Helper Bot**"));
        assertTrue(aliases.contains("@" + BotHarness.BOT_EMAIL));
        verify(harness.getApi()).updatePresence("active");
    }

    @Test
    void shouldSkipEmailAliasWhenProfileHasNoEmail() {
        BotHarness other = new BotHarness("anonymous");
        UserProfile profile = new UserProfile();
        profile.setUserId(BotHarness.BOT_USER_ID);
        profile.setFullName("Helper Bot");
        when(other.getApi().getProfile()).thenReturn(profile);

        RecordingBot anonymous = other.start(new RecordingBot());

        List<String> aliases = anonymous.getContext().getRegistry().getGrammar().getMentionAliases();
        assertTrue(aliases.contains("@**Helper Bot**"));
        assertFalse(aliases.contains("@null"));
    }

    @Test
    void shouldReplyToStreamCommandInSameTopic() {
        bot.onEvent(BotHarness.streamMessage(1, "user@example.com", "@**Helper Bot** ping"));

        OutgoingMessage sent = captureSent();
        assertEquals(ZulipMessage.TYPE_STREAM, sent.type());
        assertEquals(7L, sent.streamId());
        assertEquals("chat", sent.topic());
        assertEquals("pong", sent.content());
    }

    @Test
    void shouldReplyPrivatelyToAllParticipants() {
        bot.onEvent(BotHarness.privateMessage(2, "user@example.com", "!ping"));

        OutgoingMessage sent = captureSent();
        assertTrue(sent.isPrivate());
        assertEquals(List.of(5L, BotHarness.BOT_USER_ID), sent.recipientIds());
    }

    @Test
    void shouldPassPlainMessagesToOnMessage() {
        bot.onEvent(BotHarness.streamMessage(3, "user@example.com", "nice weather"));

        assertEquals(List.of("nice weather"), bot.plainMessages);
        verify(harness.getApi(), never()).sendMessage(any());
    }

    @Test
    void shouldIgnoreOwnMessages() {
        bot.onEvent(BotHarness.streamMessage(4, BotHarness.BOT_EMAIL, "!ping"));
        bot.onEvent(BotHarness.streamMessage(5, BotHarness.BOT_EMAIL, "hello"));

        assertTrue(bot.plainMessages.isEmpty());
        verify(harness.getApi(), never()).sendMessage(any());
    }

    @Test
    void shouldIgnoreNonMessageEvents() {
        bot.onEvent(new ZulipEvent(6, ZulipEvent.TYPE_HEARTBEAT, JsonNodeFactory.instance.objectNode(), null));

        assertTrue(bot.plainMessages.isEmpty());
        verify(harness.getApi(), never()).sendMessage(any());
    }

    @Test
    void shouldListOnlyCommandsVisibleToCaller() {
        bot.onEvent(BotHarness.streamMessage(7, "user@example.com", "!help"));

        String help = captureSent().content();
        assertTrue(help.startsWith("Available commands:"), help);
        assertTrue(help.contains("/ping"), help);
        assertFalse(help.contains("purge"), help);
    }

    @Test
    void shouldShowModeratorCommandsToModerators() {
        bot.onEvent(BotHarness.streamMessage(8, BotHarness.MODERATOR_EMAIL, "!help"));

        assertTrue(captureSent().content().contains("/purge"));
    }

    @Test
    void shouldDescribeSingleCommand() {
        bot.onEvent(BotHarness.streamMessage(9, "user@example.com", "!? ping"));

        String detail = captureSent().content();
        assertTrue(detail.startsWith("/ping"), detail);
        assertTrue(detail.contains("Reply with pong"), detail);
    }

    @Test
    void shouldNotDescribeHiddenCommand() {
        bot.onEvent(BotHarness.streamMessage(10, "user@example.com", "!help purge"));

        assertEquals("Unknown command: purge", captureSent().content());
    }

    @Test
    void shouldReplyWithPermissionError() {
        bot.onEvent(BotHarness.streamMessage(11, "user@example.com", "!purge everything"));

        assertEquals("You don't have permission to use purge (requires level 50)", captureSent().content());
    }

    @Test
    void shouldKeepRunningWhenPresenceFails() {
        BotHarness other = new BotHarness("offline");
        doThrow(new FatalNetworkException("presence disabled", null))
                .when(other.getApi()).updatePresence("active");

        RecordingBot started = other.start(new RecordingBot());

        assertTrue(started.getProfile().isPresent());
    }

    @Test
    void shouldRejectStreamReplyWithoutStreamId() {
        ZulipMessage broken = ZulipMessage.builder().id(12).type(ZulipMessage.TYPE_STREAM).build();

        assertThrows(IllegalArgumentException.class, () -> bot.sendReply(broken, "hi"));
    }

    @Test
    void shouldFallBackToGeneralTopic() {
        ZulipMessage noTopic = ZulipMessage.builder().id(13).type(ZulipMessage.TYPE_STREAM).streamId(3L).build();

        bot.sendReply(noTopic, "hi");

        assertEquals("general", captureSent().topic());
    }

    private OutgoingMessage captureSent() {
        ArgumentCaptor<OutgoingMessage> sent = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(harness.getApi()).sendMessage(sent.capture());
        return sent.getValue();
    }

    private static final class RecordingBot extends ZulipBot {

        private final List<String> plainMessages = new ArrayList<>();

        @Override
        protected void registerCommands(CommandRegistry registry) {
            registry.register(CommandSpec.builder()
                    .name("ping")
                    .description("Reply with pong")
                    .handler(CommandHandler.sync((invocation, context) -> CommandResult.success("pong")))
                    .build());
            registry.register(CommandSpec.builder()
                    .name("purge")
                    .minLevel(50)
                    .handler(CommandHandler.sync((invocation, context) -> CommandResult.success("purged")))
                    .build());
        }

        @Override
        protected void onMessage(ZulipMessage message) {
            plainMessages.add(message.getContent());
        }
    }
}
