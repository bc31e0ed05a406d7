package me.golemcore.cadence.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Workspace storage on the local filesystem.
 *
 * <p>
 * Layout under the base path ({@code cadence.storage.base-path}):
 * <ul>
 * <li>knowledge/ - knowledge entries and pattern suggestions
 * <li>clinical/ - patients, interventions, tasks, trials and staff
 * </ul>
 *
 * @see me.golemcore.cadence.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final List<String> WORKSPACE_DIRS = List.of("knowledge", "clinical");

    private final CadenceProperties properties;

    private Path workspace;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        workspace = Paths.get(configured).toAbsolutePath().normalize();
        try {
            for (String dir : WORKSPACE_DIRS) {
                Files.createDirectories(workspace.resolve(dir));
            }
            log.info("[Storage] Workspace ready at {}", workspace);
        } catch (IOException e) {
            log.error("[Storage] Cannot create workspace at {}", workspace, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = locate(directory, path);
            if (!Files.exists(file)) {
                return null;
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(locate(directory, path)));
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(locate(directory, "."));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create directory " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = locate(directory, path);
            Path staging = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                Files.createDirectories(target.getParent());
                writeAndSync(staging, content);
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + ".bak"),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                replace(staging, target);
                log.debug("[Storage] Wrote {}/{}", directory, path);
            } catch (IOException e) {
                discard(staging);
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private void writeAndSync(Path file, String content) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Filesystem has no atomic rename, falling back to plain move for {}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discard(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove staging file {}: {}", staging, e.getMessage());
        }
    }

    private Path locate(String directory, String path) {
        Path resolved = workspace.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(workspace)) {
            throw new IllegalArgumentException("Path escapes the workspace: " + directory + "/" + path);
        }
        return resolved;
    }
}
