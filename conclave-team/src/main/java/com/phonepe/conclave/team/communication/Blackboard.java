/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.conclave.team.communication;

import lombok.NonNull;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared key value scratch space for the agents of a single custom team run. Null values are not stored.
 */
public class Blackboard {
    private final Map<String, Object> entries = new ConcurrentHashMap<>();

    /**
     * Store a value, replacing any existing value. Putting null removes the key.
     *
     * @return Previous value, if any
     */
    public Optional<Object> put(@NonNull String key, Object value) {
        if (null == value) {
            return remove(key);
        }
        return Optional.ofNullable(entries.put(key, value));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Typed read. A value of a different type is treated as absent.
     */
    public <T> Optional<T> get(String key, @NonNull Class<T> type) {
        return get(key)
                .filter(type::isInstance)
                .map(type::cast);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Optional<Object> remove(String key) {
        return Optional.ofNullable(entries.remove(key));
    }

    public Map<String, Object> asMap() {
        return Map.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
