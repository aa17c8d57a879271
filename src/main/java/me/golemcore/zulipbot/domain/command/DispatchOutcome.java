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
 * Result of dispatching one message.
 *
 * @param status
 *            how dispatch ended
 * @param message
 *            user-facing text to reply with; null means no reply
 * @param invocation
 *            the parsed invocation when parsing got that far, otherwise null
 */
public record DispatchOutcome(Status status, String message, CommandInvocation invocation) {

    public enum Status {
        NOT_A_COMMAND, UNKNOWN_COMMAND, PERMISSION_DENIED, INVALID_ARGUMENTS, COMPLETED, FAILED
    }

    public static DispatchOutcome notACommand() {
        return new DispatchOutcome(Status.NOT_A_COMMAND, null, null);
    }

    public static DispatchOutcome of(Status status, String message) {
        return new DispatchOutcome(status, message, null);
    }

    public boolean isCommand() {
        return status != Status.NOT_A_COMMAND;
    }

    public boolean hasReply() {
        return message != null && !message.isBlank();
    }
}
