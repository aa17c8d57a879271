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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fully parsed command occurrence. Optional arguments that were not supplied
 * are present with a {@code null} value.
 */
public record CommandInvocation(String name, Map<String, Object> args, List<String> rawTokens, CommandSpec spec) {

    public CommandInvocation {
        args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
        rawTokens = List.copyOf(rawTokens);
    }

    public Object get(String argument) {
        return args.get(argument);
    }

    public boolean has(String argument) {
        return args.get(argument) != null;
    }

    public String getString(String argument) {
        Object value = args.get(argument);
        return value != null ? value.toString() : null;
    }

    public Long getLong(String argument) {
        return (Long) args.get(argument);
    }

    public Double getDouble(String argument) {
        return (Double) args.get(argument);
    }

    public Boolean getBoolean(String argument) {
        return (Boolean) args.get(argument);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> getList(String argument) {
        Object value = args.get(argument);
        return value != null ? (List<T>) value : List.of();
    }
}
