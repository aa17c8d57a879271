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

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Set;

/**
 * Declaration of one command: name, aliases, positional arguments, access
 * level and the handler bound to it.
 */
@Getter
@Builder
public class CommandSpec {

    private final String name;
    private final String description;
    @Singular
    private final Set<String> aliases;
    @Singular
    private final List<CommandArgument> args;
    private final boolean allowExtra;
    /** Minimum caller level; null means everyone. */
    private final Integer minLevel;
    @Builder.Default
    private final boolean showInHelp = true;
    private final CommandHandler handler;

    /**
     * Check the structural rules: non-blank name, a handler, and at most one
     * {@code multiple} argument which must be the last one.
     *
     * @throws IllegalArgumentException
     *             on the first violated rule
     */
    public void validate() {
        if (name == null || name.isBlank() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid command name: '" + name + "'");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Command '" + name + "' has no handler");
        }
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).multiple() && i != args.size() - 1) {
                throw new IllegalArgumentException("Command '" + name + "': multiple argument '"
                        + args.get(i).name() + "' must be last");
            }
        }
        long distinctNames = args.stream().map(CommandArgument::name).distinct().count();
        if (distinctNames != args.size()) {
            throw new IllegalArgumentException("Command '" + name + "' has duplicate argument names");
        }
    }

    public String usage(String prefix) {
        StringBuilder sb = new StringBuilder(prefix).append(name);
        for (CommandArgument arg : args) {
            sb.append(' ').append(arg.usage());
        }
        return sb.toString();
    }
}
