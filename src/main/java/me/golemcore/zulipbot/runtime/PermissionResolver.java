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

package me.golemcore.zulipbot.runtime;

import me.golemcore.zulipbot.domain.model.PermissionContext;
import me.golemcore.zulipbot.domain.model.ZulipMessage;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a message sender to a {@link PermissionContext}: sender email to role
 * via the instance's {@code user-roles}, unknown senders get the default
 * role, and the role is turned into a level via {@code role-levels}.
 */
public class PermissionResolver {

    private final Map<String, Integer> roleLevels;
    private final String defaultRole;
    private final Map<String, String> userRoles = new HashMap<>();

    public PermissionResolver(Map<String, Integer> roleLevels, String defaultRole, Map<String, String> userRoles) {
        this.roleLevels = Map.copyOf(roleLevels);
        this.defaultRole = defaultRole;
        userRoles.forEach((email, role) -> this.userRoles.put(email.toLowerCase(Locale.ROOT), role));
    }

    public String roleOf(String email) {
        if (email == null) {
            return defaultRole;
        }
        return userRoles.getOrDefault(email.toLowerCase(Locale.ROOT), defaultRole);
    }

    public PermissionContext resolve(ZulipMessage message) {
        return PermissionContext.forRole(roleOf(message.getSenderEmail()), roleLevels);
    }
}
