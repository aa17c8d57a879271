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

package me.golemcore.zulipbot.domain.cache;

/**
 * Outcome of one flush of a namespace.
 *
 * @param persisted
 *            entries written and marked clean
 * @param failed
 *            entries that stayed dirty after all attempts
 * @param remainingDirty
 *            dirty entries in the namespace when the flush finished,
 *            including ones written during the flush
 */
public record FlushResult(int persisted, int failed, int remainingDirty) {

    public boolean isClean() {
        return remainingDirty == 0;
    }
}
