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

package me.golemcore.zulipbot.adapter.outbound.zulip;

import me.golemcore.zulipbot.port.outbound.FatalNetworkException;
import me.golemcore.zulipbot.port.outbound.QueueExpiredException;
import me.golemcore.zulipbot.port.outbound.TransientNetworkException;
import me.golemcore.zulipbot.port.outbound.ZulipTransportPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * OkHttp implementation of {@link ZulipTransportPort} for one bot account.
 *
 * <p>
 * Parameters travel as query string for {@code GET}/{@code DELETE} and as a
 * form body otherwise. Scalars are sent as text, everything else is
 * JSON-encoded, which is what the server expects for lists such as
 * {@code event_types} and {@code narrow}.
 *
 * <p>
 * Failures are classified here so callers only deal with the transport
 * exception hierarchy:
 * <ul>
 * <li>{@code BAD_EVENT_QUEUE_ID} - {@link QueueExpiredException}</li>
 * <li>I/O errors, timeouts, HTTP 5xx, HTTP 429 -
 * {@link TransientNetworkException}</li>
 * <li>everything else - {@link FatalNetworkException}</li>
 * </ul>
 */
@Slf4j
public class ZulipHttpTransport implements ZulipTransportPort {

    private static final Set<String> QUERY_METHODS = Set.of("GET", "DELETE", "HEAD");
    private static final String RATE_LIMIT_CODE = "RATE_LIMIT_HIT";
    private static final String USER_AGENT = "golemcore-zulip-bot";

    private final OkHttpClient httpClient;
    private final OkHttpClient longPollClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final String authorization;

    public ZulipHttpTransport(ZulipCredentials credentials, OkHttpClient httpClient, OkHttpClient longPollClient,
            ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.longPollClient = longPollClient;
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(credentials.apiBaseUrl());
        this.authorization = Credentials.basic(credentials.email(), credentials.apiKey());
    }

    @Override
    public JsonNode call(String method, String path, Map<String, ?> params) {
        return execute(httpClient, method, path, params);
    }

    @Override
    public JsonNode longPoll(String method, String path, Map<String, ?> params) {
        return execute(longPollClient, method, path, params);
    }

    private JsonNode execute(OkHttpClient client, String method, String path, Map<String, ?> params) {
        Request request = buildRequest(method.toUpperCase(Locale.ROOT), path, params);
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String bodyText = body != null ? body.string() : "";
            return interpret(path, response, bodyText);
        } catch (IOException e) {
            log.debug("[Zulip] {} {} failed: {}", method, path, e.getMessage());
            throw new TransientNetworkException("Request to " + path + " failed: " + e.getMessage(), e);
        }
    }

    private Request buildRequest(String method, String path, Map<String, ?> params) {
        HttpUrl resolved = baseUrl.resolve(stripLeadingSlash(path));
        if (resolved == null) {
            throw new IllegalArgumentException("Invalid API path: " + path);
        }
        Request.Builder builder = new Request.Builder()
                .header("Authorization", authorization)
                .header("User-Agent", USER_AGENT);

        if (QUERY_METHODS.contains(method)) {
            HttpUrl.Builder urlBuilder = resolved.newBuilder();
            if (params != null) {
                params.forEach((name, value) -> {
                    if (value != null) {
                        urlBuilder.addQueryParameter(name, encodeValue(value));
                    }
                });
            }
            return builder.url(urlBuilder.build()).method(method, null).build();
        }

        FormBody.Builder form = new FormBody.Builder();
        if (params != null) {
            params.forEach((name, value) -> {
                if (value != null) {
                    form.add(name, encodeValue(value));
                }
            });
        }
        RequestBody requestBody = form.build();
        return builder.url(resolved).method(method, requestBody).build();
    }

    private JsonNode interpret(String path, Response response, String bodyText) {
        int status = response.code();
        JsonNode node = parseBody(bodyText);

        if (node == null) {
            if (status >= 500) {
                throw new TransientNetworkException("HTTP " + status + " from " + path, null, status, null, null);
            }
            throw new FatalNetworkException("Unreadable response from " + path + " (HTTP " + status + ")",
                    null, status, null);
        }

        String result = node.path("result").asText("");
        if (response.isSuccessful() && !"error".equals(result)) {
            return node;
        }

        String code = node.path("code").asText(null);
        String message = node.path("msg").asText("HTTP " + status);

        if (QueueExpiredException.CODE.equals(code)) {
            throw new QueueExpiredException(node.path("queue_id").asText(null), message, status);
        }
        if (status == 429 || RATE_LIMIT_CODE.equals(code)) {
            throw new TransientNetworkException(message, code, status, retryAfter(response, node), null);
        }
        if (status >= 500) {
            throw new TransientNetworkException(message, code, status, null, null);
        }
        throw new FatalNetworkException(message, code, status, null);
    }

    private JsonNode parseBody(String bodyText) {
        if (bodyText == null || bodyText.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(bodyText);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private Duration retryAfter(Response response, JsonNode node) {
        String header = response.header("Retry-After");
        if (header != null) {
            try {
                return Duration.ofMillis((long) (Double.parseDouble(header.trim()) * 1000));
            } catch (NumberFormatException e) {
                log.debug("[Zulip] Ignoring non-numeric Retry-After header: {}", header);
            }
        }
        JsonNode retryAfter = node.get("retry-after");
        if (retryAfter != null && retryAfter.isNumber()) {
            return Duration.ofMillis((long) (retryAfter.asDouble() * 1000));
        }
        return null;
    }

    private String encodeValue(Object value) {
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode request parameter: " + value, e);
        }
    }

    private static String stripLeadingSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
