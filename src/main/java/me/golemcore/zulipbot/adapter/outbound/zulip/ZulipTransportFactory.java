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

import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.port.outbound.ZulipTransportPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Builds one {@link ZulipHttpTransport} per bot account on top of the shared
 * OkHttp client. The long-poll client only differs in its read timeout.
 */
@Component
@Slf4j
public class ZulipTransportFactory {

    private final OkHttpClient httpClient;
    private final OkHttpClient longPollClient;
    private final ObjectMapper objectMapper;

    public ZulipTransportFactory(OkHttpClient baseHttpClient, ObjectMapper objectMapper, BotProperties properties) {
        this.httpClient = baseHttpClient;
        this.objectMapper = objectMapper;
        this.longPollClient = baseHttpClient.newBuilder()
                .readTimeout(properties.getHttp().getLongPollReadTimeout(), TimeUnit.MILLISECONDS)
                .build();
    }

    public ZulipTransportPort create(ZulipCredentials credentials) {
        log.debug("[Zulip] Creating transport for {}", credentials);
        return new ZulipHttpTransport(credentials, httpClient, longPollClient, objectMapper);
    }
}
