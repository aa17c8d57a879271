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

package me.golemcore.zulipbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore Zulip bot runtime.
 *
 * <p>
 * Runs any number of bots against Zulip servers. Each bot long-polls its own
 * event queue, parses commands addressed to it by prefix or mention, and keeps
 * small amounts of state in a namespaced write-back cache.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → ZulipEventSource, CommandDispatcher
 * Domain Layer       → CommandRegistry, WriteBackCache, ZulipBot
 * Infrastructure     → ZulipHttpTransport, LocalKeyValueStoreAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix; one {@code bot.instances[n]} block per bot.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ZulipBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZulipBotApplication.class, args);
    }

}
