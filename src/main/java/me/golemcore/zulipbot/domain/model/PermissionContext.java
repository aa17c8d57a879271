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

package me.golemcore.zulipbot.domain.model;

import java.util.Map;

/**
 * Permission data supplied with every dispatch call.
 *
 * @param callerLevel
 *            level of the user who sent the command
 * @param roleLevels
 *            role name to level, as configured
 */
public record PermissionContext(int callerLevel, Map<String, Integer> roleLevels) {

    public PermissionContext {
        roleLevels = roleLevels != null ? Map.copyOf(roleLevels) : Map.of();
    }

    /**
     * Build a context for a caller holding {@code role}; unknown roles get
     * level 0.
     */
    public static PermissionContext forRole(String role, Map<String, Integer> roleLevels) {
        Integer level = roleLevels != null && role != null ? roleLevels.get(role) : null;
        return new PermissionContext(level != null ? level : 0, roleLevels);
    }

    public static PermissionContext ofLevel(int level) {
        return new PermissionContext(level, Map.of());
    }

    public int levelOf(String role) {
        Integer level = roleLevels.get(role);
        return level != null ? level : 0;
    }

    public boolean meets(Integer minLevel) {
        return minLevel == null || callerLevel >= minLevel;
    }
}
