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

/**
 * Positional argument of a command.
 *
 * @param name
 *            key in {@link CommandInvocation#args()}
 * @param type
 *            coercion applied to the token(s)
 * @param required
 *            missing tokens are an error when set
 * @param multiple
 *            consumes all remaining tokens as a list; only allowed last
 * @param description
 *            shown in the help detail view
 */
public record CommandArgument(String name, ArgumentType type, boolean required, boolean multiple,
        String description) {

    public CommandArgument {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Argument name must not be blank");
        }
        if (type == null) {
            type = ArgumentType.STRING;
        }
        if (description == null) {
            description = "";
        }
    }

    public static CommandArgument required(String name, ArgumentType type, String description) {
        return new CommandArgument(name, type, true, false, description);
    }

    public static CommandArgument optional(String name, ArgumentType type, String description) {
        return new CommandArgument(name, type, false, false, description);
    }

    public static CommandArgument multiple(String name, ArgumentType type, boolean required, String description) {
        return new CommandArgument(name, type, required, true, description);
    }

    /**
     * Usage form: {@code <name>}, {@code [name]} or {@code name...}.
     */
    public String usage() {
        if (multiple) {
            return required ? "<" + name + ">..." : "[" + name + "]...";
        }
        return required ? "<" + name + ">" : "[" + name + "]";
    }
}
