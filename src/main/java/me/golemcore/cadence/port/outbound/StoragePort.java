package me.golemcore.cadence.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Workspace file persistence. The knowledge and clinical stores keep their
 * JSON documents through it; {@code directory} is a top-level workspace folder
 * such as {@code knowledge} or {@code clinical} and {@code path} is relative
 * to it.
 */
public interface StoragePort {

    /**
     * Completes with {@code null} when the file does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Replaces the file so that readers see either the old or the new content,
     * never a partial write. With {@code backup} the previous content is kept
     * next to it with a {@code .bak} suffix.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    CompletableFuture<Void> ensureDirectory(String directory);
}
