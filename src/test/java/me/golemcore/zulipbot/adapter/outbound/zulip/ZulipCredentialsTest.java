package me.golemcore.zulipbot.adapter.outbound.zulip;

import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ZulipCredentialsTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadApiSectionFromZuliprc() throws IOException {
        Path zuliprc = tempDir.resolve("zuliprc");
        Files.writeString(zuliprc, """
                [other]
                key=ignored

                [api]
                email = echo-bot@example.com
                key = abc123
                site = https://chat.example.com/
                """);

        ZulipCredentials credentials = ZulipCredentials.fromZuliprc(zuliprc);

        assertEquals("echo-bot@example.com", credentials.email());
        assertEquals("abc123", credentials.apiKey());
        assertEquals("https://chat.example.com/api/v1/", credentials.apiBaseUrl());
    }

    @Test
    void shouldPreferInlineValuesOverZuliprc() throws IOException {
        Path zuliprc = tempDir.resolve("zuliprc");
        Files.writeString(zuliprc, "[api]\nemail=file@example.com\nkey=file-key\nsite=file.example.com\n");
        BotProperties.InstanceProperties instance = new BotProperties.InstanceProperties();
        instance.setZuliprc(zuliprc.toString());
        instance.setApiKey("inline-key");

        ZulipCredentials credentials = ZulipCredentials.from(instance);

        assertEquals("file@example.com", credentials.email());
        assertEquals("inline-key", credentials.apiKey());
        assertEquals("https://file.example.com/api/v1/", credentials.apiBaseUrl());
    }

    @Test
    void shouldRejectMissingValues() {
        BotProperties.InstanceProperties instance = new BotProperties.InstanceProperties();
        instance.setSite("chat.example.com");
        instance.setEmail("bot@example.com");

        assertThrows(IllegalArgumentException.class, () -> ZulipCredentials.from(instance));
    }

    @Test
    void shouldNotExposeApiKeyInToString() {
        ZulipCredentials credentials = new ZulipCredentials("chat.example.com", "bot@example.com", "top-secret");

        assertFalse(credentials.toString().contains("top-secret"));
    }
}
