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

package me.golemcore.zulipbot.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot runtime, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link HttpProperties} - OkHttp timeouts and pooling</li>
 * <li>{@link EventsProperties} - long-poll retry and backoff policy</li>
 * <li>{@link CommandsProperties} - command prefixes and mention handling</li>
 * <li>{@link CacheProperties} - write-back cache flush schedule</li>
 * <li>{@link StorageProperties} - key/value store location</li>
 * <li>{@link PermissionsProperties} - role to level mapping</li>
 * <li>{@link InstanceProperties} - one entry per running bot identity</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private HttpProperties http = new HttpProperties();
    private EventsProperties events = new EventsProperties();
    private CommandsProperties commands = new CommandsProperties();
    private CacheProperties cache = new CacheProperties();
    private StorageProperties storage = new StorageProperties();
    private PermissionsProperties permissions = new PermissionsProperties();
    private List<InstanceProperties> instances = new ArrayList<>();

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        /** Read timeout for event polls; the server holds the request open. */
        private long longPollReadTimeout = 120000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== EVENTS ====================

    @Data
    public static class EventsProperties {
        private boolean retryEnabled = true;
        /** Max consecutive retries for transient network failures. */
        private int maxRetries = 10;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private List<String> eventTypes = new ArrayList<>(List.of("message"));
    }

    // ==================== COMMANDS ====================

    @Data
    public static class CommandsProperties {
        private List<String> prefixes = new ArrayList<>(List.of("/", "!"));
        private boolean mentionsEnabled = true;
        private boolean autoHelp = true;
    }

    // ==================== CACHE ====================

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private Duration flushInterval = Duration.ofSeconds(5);
        private Duration retryDelay = Duration.ofMillis(200);
        /** Total persist attempts per entry within one flush cycle. */
        private int maxRetries = 5;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/zulip-bot/data";
    }

    // ==================== PERMISSIONS ====================

    @Data
    public static class PermissionsProperties {
        private Map<String, Integer> roleLevels = new LinkedHashMap<>(Map.of(
                "owner", 100,
                "admin", 80,
                "moderator", 50,
                "member", 10,
                "guest", 1));
        private String defaultRole = "member";
    }

    // ==================== BOT INSTANCES ====================

    @Data
    public static class InstanceProperties {
        private String name;
        /** Name of the {@code BotFactory} that builds this bot. */
        private String type;
        private boolean enabled = true;
        private String zuliprc;
        private String site;
        private String email;
        private String apiKey;
        /** Storage namespace; defaults to the instance name. */
        private String namespace;
        private List<String> eventTypes = new ArrayList<>();
        private List<List<String>> narrow = new ArrayList<>();
        private List<String> extraAliases = new ArrayList<>();
        /** Sender email to role name. */
        private Map<String, String> userRoles = new HashMap<>();
        private Map<String, String> settings = new HashMap<>();

        public String resolveNamespace() {
            return namespace != null && !namespace.isBlank() ? namespace : name;
        }
    }
}
