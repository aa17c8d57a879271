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

package me.golemcore.zulipbot.port.outbound;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Port for a single call to the Zulip REST API.
 *
 * <p>
 * Implementations encode {@code params} (collections and maps as JSON), apply
 * authentication, and decode the JSON response. A response whose
 * {@code result} is not {@code success} is raised as a
 * {@link ZulipTransportException} subtype so callers can classify it:
 * <ul>
 * <li>{@link QueueExpiredException} - event queue unknown to the server</li>
 * <li>{@link TransientNetworkException} - retry may succeed</li>
 * <li>{@link FatalNetworkException} - retrying is pointless</li>
 * </ul>
 */
public interface ZulipTransportPort {

    /**
     * Performs one HTTP call.
     *
     * @param method
     *            HTTP method ({@code GET}, {@code POST}, {@code DELETE}, ...)
     * @param path
     *            API path relative to {@code /api/v1/}, e.g. {@code "register"}
     * @param params
     *            request parameters; may be empty
     * @return decoded response body
     */
    JsonNode call(String method, String path, Map<String, ?> params);

    /**
     * Same as {@link #call(String, String, Map)} but allowed to block for a
     * server-side long poll.
     */
    default JsonNode longPoll(String method, String path, Map<String, ?> params) {
        return call(method, path, params);
    }
}
