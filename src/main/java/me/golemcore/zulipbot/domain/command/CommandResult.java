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
 * What a command handler produced. {@code output} may be null when the
 * handler already replied on its own.
 */
public record CommandResult(boolean success, String output) {

    public static CommandResult success(String output) {
        return new CommandResult(true, output);
    }

    public static CommandResult failure(String error) {
        return new CommandResult(false, error);
    }

    public static CommandResult silent() {
        return new CommandResult(true, null);
    }
}
