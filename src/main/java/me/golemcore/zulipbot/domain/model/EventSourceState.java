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

/**
 * Lifecycle of an event source.
 *
 * <pre>
 * UNREGISTERED -&gt; REGISTERED -&gt; POLLING -&gt; POLLING | REGISTERED -&gt; CLOSED
 * </pre>
 *
 * {@link #CLOSED} is terminal and only reached through cancellation or a
 * fatal error.
 */
public enum EventSourceState {
    UNREGISTERED, REGISTERED, POLLING, CLOSED
}
