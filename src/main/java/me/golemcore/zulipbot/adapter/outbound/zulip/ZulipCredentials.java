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

package me.golemcore.zulipbot.adapter.outbound.zulip;

import me.golemcore.zulipbot.infrastructure.config.BotProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Account credentials for one bot identity.
 *
 * <p>
 * Sourced either inline from {@code bot.instances[*]} or from a
 * {@code zuliprc} file:
 *
 * <pre>
 * [api]
 * email=echo-bot@example.zulipchat.com
 * key=abcdef0123456789
 * site=https://example.zulipchat.com
 * </pre>
 *
 * Inline values win over values read from the file.
 */
public record ZulipCredentials(String site, String email, String apiKey) {

    private static final String API_SECTION = "api";

    public ZulipCredentials {
        requireValue("site", site);
        requireValue("email", email);
        requireValue("api key", apiKey);
    }

    /**
     * API root, always ending in {@code /api/v1/}.
     */
    public String apiBaseUrl() {
        String base = site.trim();
        if (!base.startsWith("http://") && !base.startsWith("https://")) {
            base = "https://" + base;
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/api/v1/";
    }

    public static ZulipCredentials from(BotProperties.InstanceProperties instance) {
        Map<String, String> fromFile = instance.getZuliprc() != null && !instance.getZuliprc().isBlank()
                ? readApiSection(expandHome(instance.getZuliprc()))
                : Map.of();
        return new ZulipCredentials(
                firstNonBlank(instance.getSite(), fromFile.get("site")),
                firstNonBlank(instance.getEmail(), fromFile.get("email")),
                firstNonBlank(instance.getApiKey(), fromFile.get("key")));
    }

    public static ZulipCredentials fromZuliprc(Path path) {
        Map<String, String> values = readApiSection(path);
        return new ZulipCredentials(values.get("site"), values.get("email"), values.get("key"));
    }

    static Map<String, String> readApiSection(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read zuliprc: " + path, e);
        }
        Map<String, String> values = new HashMap<>();
        String section = null;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = line.substring(1, line.length() - 1).trim();
                continue;
            }
            int separator = line.indexOf('=');
            if (separator < 0 || !API_SECTION.equalsIgnoreCase(section)) {
                continue;
            }
            values.put(line.substring(0, separator).trim().toLowerCase(), line.substring(separator + 1).trim());
        }
        return values;
    }

    private static Path expandHome(String path) {
        if (path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), path.substring(2));
        }
        return Paths.get(path.replace("${user.home}", System.getProperty("user.home")));
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

    private static void requireValue(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing Zulip " + name);
        }
    }

    @Override
    public String toString() {
        return "ZulipCredentials{site=" + site + ", email=" + email + "}";
    }
}
