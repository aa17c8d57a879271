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

import java.util.Arrays;

/**
 * User-caused command failure. Carries a translation key and its arguments
 * so the dispatcher can render it in the bot's language.
 */
public class CommandException extends RuntimeException {

    private final String messageKey;
    private final transient Object[] messageArgs;

    public CommandException(String messageKey, Object... messageArgs) {
        super(messageKey + describe(messageArgs));
        this.messageKey = messageKey;
        this.messageArgs = messageArgs != null ? messageArgs.clone() : new Object[0];
    }

    public String getMessageKey() {
        return messageKey;
    }

    public Object[] getMessageArgs() {
        return messageArgs.clone();
    }

    private static String describe(Object[] args) {
        return args == null || args.length == 0 ? "" : " " + Arrays.toString(args);
    }
}
