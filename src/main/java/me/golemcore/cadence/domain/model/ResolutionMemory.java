package me.golemcore.cadence.domain.model;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session map of resolved patient names to patient ids. Grows within a
 * session and is only emptied by {@link #clear()}.
 */
public class ResolutionMemory {

    private final Map<String, String> namesToIds = new LinkedHashMap<>();

    public synchronized void remember(String name, String patientId) {
        if (name == null || name.isBlank() || patientId == null || patientId.isBlank()) {
            return;
        }
        namesToIds.put(normalize(name), patientId);
    }

    public synchronized Optional<String> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(namesToIds.get(normalize(name)));
    }

    public synchronized Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(namesToIds));
    }

    public synchronized boolean isEmpty() {
        return namesToIds.isEmpty();
    }

    public synchronized void clear() {
        namesToIds.clear();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
