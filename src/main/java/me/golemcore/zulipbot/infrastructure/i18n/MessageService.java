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

package me.golemcore.zulipbot.infrastructure.i18n;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Translation service for all user-facing bot strings.
 *
 * <p>
 * Lookup is two-tier:
 * <ol>
 * <li>namespace table - per-bot overrides loaded from
 * {@code i18n/<namespace>.properties} or registered via
 * {@link #registerOverrides(String, Map)}</li>
 * <li>default table - the shared {@code messages.properties} bundle</li>
 * </ol>
 * If neither table has the key, the key itself is returned unchanged.
 *
 * <p>
 * Supports parametric messages using {@link MessageFormat} syntax.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    private static final String DEFAULT_BUNDLE = "messages";
    private static final String NAMESPACE_BUNDLE_PREFIX = "i18n.";

    private final ResourceBundle defaults;
    private final Map<String, Map<String, String>> namespaceTables = new ConcurrentHashMap<>();

    public MessageService() {
        this.defaults = loadBundle(DEFAULT_BUNDLE);
        if (defaults == null) {
            log.warn("Default message bundle '{}' not found, keys will be returned as-is", DEFAULT_BUNDLE);
        }
    }

    /**
     * Get message from the shared default table.
     */
    public String getMessage(String key, Object... args) {
        return translate(null, key, args);
    }

    /**
     * Get message for a namespace, falling back to the shared default table and
     * finally to the key.
     */
    public String translate(String namespace, String key, Object... args) {
        String pattern = resolvePattern(namespace, key);
        if (pattern == null) {
            log.debug("Missing message key: {} (namespace={})", key, namespace);
            return key;
        }
        if (args != null && args.length > 0) {
            return MessageFormat.format(pattern, args);
        }
        return pattern;
    }

    /**
     * Register (or extend) namespace-specific overrides programmatically.
     */
    public void registerOverrides(String namespace, Map<String, String> overrides) {
        namespaceTables.compute(namespace, (ns, existing) -> {
            Map<String, String> merged = new HashMap<>(existing != null ? existing : loadNamespaceTable(ns));
            merged.putAll(overrides);
            return Collections.unmodifiableMap(merged);
        });
        log.info("Registered {} message overrides for namespace: {}", overrides.size(), namespace);
    }

    /**
     * Check whether a key resolves in either table.
     */
    public boolean hasMessage(String namespace, String key) {
        return resolvePattern(namespace, key) != null;
    }

    private String resolvePattern(String namespace, String key) {
        if (namespace != null) {
            Map<String, String> table = namespaceTables.computeIfAbsent(namespace, this::loadNamespaceTable);
            String override = table.get(key);
            if (override != null) {
                return override;
            }
        }
        if (defaults != null && defaults.containsKey(key)) {
            return defaults.getString(key);
        }
        return null;
    }

    private Map<String, String> loadNamespaceTable(String namespace) {
        ResourceBundle bundle = loadBundle(NAMESPACE_BUNDLE_PREFIX + namespace);
        if (bundle == null) {
            return Map.of();
        }
        Map<String, String> table = new HashMap<>();
        for (String key : bundle.keySet()) {
            table.put(key, bundle.getString(key));
        }
        log.info("Loaded {} message overrides for namespace: {}", table.size(), namespace);
        return Collections.unmodifiableMap(table);
    }

    private ResourceBundle loadBundle(String baseName) {
        try {
            return ResourceBundle.getBundle(baseName, Locale.ROOT,
                    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
        } catch (MissingResourceException e) {
            return null;
        }
    }
}
