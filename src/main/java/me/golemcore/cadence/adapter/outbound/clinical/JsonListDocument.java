package me.golemcore.cadence.adapter.outbound.clinical;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.port.outbound.StoragePort;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A JSON array document in the workspace, cached after first read and
 * rewritten atomically on every upsert.
 *
 * @param <T>
 *            record type
 */
@Slf4j
class JsonListDocument<T> {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String file;
    private final TypeReference<List<T>> typeRef;
    private final Function<T, String> idExtractor;

    private List<T> cache;

    JsonListDocument(StoragePort storagePort, ObjectMapper objectMapper, String directory, String file,
            TypeReference<List<T>> typeRef, Function<T, String> idExtractor) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.file = file;
        this.typeRef = typeRef;
        this.idExtractor = idExtractor;
    }

    synchronized List<T> all() {
        if (cache == null) {
            cache = load();
        }
        return List.copyOf(cache);
    }

    synchronized T upsert(T record) {
        String id = idExtractor.apply(record);
        if (id == null) {
            throw new IllegalArgumentException("Record in " + file + " requires an id");
        }
        List<T> records = new ArrayList<>(all());
        records.removeIf(existing -> id.equals(idExtractor.apply(existing)));
        records.add(record);
        try {
            String json = objectMapper.writeValueAsString(records);
            storagePort.putTextAtomic(directory, file, json, false).join();
            cache = records;
        } catch (IOException | RuntimeException e) {
            log.error("[Clinical] Failed to save {}", file, e);
            throw new IllegalStateException("Failed to persist " + file, e);
        }
        return record;
    }

    private List<T> load() {
        try {
            String json = storagePort.getText(directory, file).join();
            if (json != null && !json.isBlank()) {
                List<T> records = new ArrayList<>(objectMapper.readValue(json, typeRef));
                log.debug("[Clinical] Loaded {} records from {}", records.size(), file);
                return records;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - empty document on missing or corrupt file
            log.warn("[Clinical] Failed to load {}: {}", file, e.getMessage());
        }
        return new ArrayList<>();
    }
}
