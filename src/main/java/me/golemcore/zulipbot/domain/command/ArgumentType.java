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

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Value kinds a command argument token can be coerced to.
 */
public enum ArgumentType {

    STRING("string") {
        @Override
        public Object coerce(String token) {
            return token;
        }
    },

    INT("int") {
        @Override
        public Object coerce(String token) {
            return Long.parseLong(token.trim());
        }
    },

    FLOAT("float") {
        @Override
        public Object coerce(String token) {
            String trimmed = token.trim();
            if (!DECIMAL.matcher(trimmed).matches()) {
                throw new NumberFormatException("Not a decimal number: " + token);
            }
            double value = Double.parseDouble(trimmed);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new NumberFormatException("Not a finite number: " + token);
            }
            return value;
        }
    },

    BOOL("bool") {
        @Override
        public Object coerce(String token) {
            String normalized = token.trim().toLowerCase(Locale.ROOT);
            if (TRUTHY.contains(normalized)) {
                return Boolean.TRUE;
            }
            if (FALSY.contains(normalized)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("Not a boolean: " + token);
        }
    };

    // plain decimal or scientific notation, no hex or type suffixes
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "y", "on");
    private static final Set<String> FALSY = Set.of("false", "0", "no", "n", "off");

    private final String label;

    ArgumentType(String label) {
        this.label = label;
    }

    /**
     * Convert a raw token.
     *
     * @throws IllegalArgumentException
     *             if the token is not a valid literal of this type
     */
    public abstract Object coerce(String token);

    public String getLabel() {
        return label;
    }
}
