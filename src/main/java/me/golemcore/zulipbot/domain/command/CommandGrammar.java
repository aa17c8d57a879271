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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Lexical rules for commands: trigger detection and tokenization.
 *
 * <p>
 * A message is a command if it starts with one of the prefixes (e.g.
 * {@code !help}) or, when mentions are enabled, with one of the bot's mention
 * aliases followed by whitespace or {@code :,-} (e.g.
 * {@code @**Echo Bot** help}). Alias matching is case-sensitive; longer
 * aliases win over shorter ones that share a start.
 */
public class CommandGrammar {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String MENTION_SEPARATORS = " \t\n:,-";

    private final List<String> prefixes;
    private final boolean mentionsEnabled;
    private final List<String> mentionAliases = new CopyOnWriteArrayList<>();

    public CommandGrammar(List<String> prefixes, boolean mentionsEnabled) {
        this.prefixes = prefixes.stream().filter(p -> p != null && !p.isEmpty()).toList();
        this.mentionsEnabled = mentionsEnabled;
    }

    /**
     * Add aliases the bot answers to when mentioned at the start of a
     * message. Blank and duplicate aliases are ignored.
     */
    public synchronized void addMentionAliases(String... aliases) {
        for (String alias : aliases) {
            if (alias != null && !alias.isBlank() && !mentionAliases.contains(alias)) {
                mentionAliases.add(alias);
            }
        }
        List<String> sorted = new ArrayList<>(mentionAliases);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        mentionAliases.clear();
        mentionAliases.addAll(sorted);
    }

    public List<String> getMentionAliases() {
        return List.copyOf(mentionAliases);
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    /**
     * First configured prefix, used when rendering usage lines.
     */
    public String primaryPrefix() {
        return prefixes.isEmpty() ? "" : prefixes.get(0);
    }

    public boolean isCommand(String text) {
        return stripTrigger(text).isPresent();
    }

    /**
     * Remove the trigger and return the command body, or empty when the text
     * does not address the bot. The body may be blank.
     */
    public Optional<String> stripTrigger(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        for (String prefix : prefixes) {
            if (trimmed.startsWith(prefix)) {
                return Optional.of(trimmed.substring(prefix.length()).strip());
            }
        }
        if (mentionsEnabled) {
            for (String alias : mentionAliases) {
                if (trimmed.startsWith(alias) && endsToken(trimmed, alias.length())) {
                    return Optional.of(stripMentionSeparators(trimmed.substring(alias.length())));
                }
            }
        }
        return Optional.empty();
    }

    public List<String> tokenize(String body) {
        String trimmed = body == null ? "" : body.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(trimmed));
    }

    private static boolean endsToken(String text, int index) {
        return index == text.length() || MENTION_SEPARATORS.indexOf(text.charAt(index)) >= 0
                || Character.isWhitespace(text.charAt(index));
    }

    private static String stripMentionSeparators(String rest) {
        int start = 0;
        while (start < rest.length() && (MENTION_SEPARATORS.indexOf(rest.charAt(start)) >= 0
                || Character.isWhitespace(rest.charAt(start)))) {
            start++;
        }
        return rest.substring(start).strip();
    }
}
