package me.golemcore.guard.adapter.outbound.storage;

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
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores guard data under one workspace directory:
 * <ul>
 * <li>profiles/ - one JSON document per security profile
 * <li>audit/ - daily moderation audit trails (JSONL)
 * </ul>
 *
 * <p>
 * Base path configured via {@code guard.storage.local.base-path}, defaults to
 * {@code ${user.home}/.golemcore/guard}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final GuardProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
        try {
            Files.createDirectories(basePath.resolve(properties.getStore().getDirectory()));
            Files.createDirectories(basePath.resolve(properties.getAudit().getDirectory()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot prepare guard workspace at " + basePath, e);
        }
        log.info("[Storage] Guard workspace: {}", basePath);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return io("read " + directory + "/" + path, () -> {
            Path file = resolve(directory, path);
            return Files.isRegularFile(file) ? Files.readString(file, StandardCharsets.UTF_8) : null;
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return io("write " + directory + "/" + path, () -> {
            Path target = resolve(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            createParent(target);
            try {
                Files.writeString(temp, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.SYNC);
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + BACKUP_SUFFIX),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                replace(temp, target);
            } catch (IOException e) {
                discard(temp);
                throw e;
            }
            log.debug("[Storage] Wrote {}/{}", directory, path);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return io("append to " + directory + "/" + path, () -> {
            Path file = resolve(directory, path);
            createParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return io("delete " + directory + "/" + path, () -> {
            Files.deleteIfExists(resolve(directory, path));
            return null;
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return io("list " + directory, () -> {
            Path dir = resolve(directory, "");
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            String namePrefix = Objects.requireNonNullElse(prefix, "");
            try (Stream<Path> entries = Files.list(dir)) {
                return entries
                        .filter(Files::isRegularFile)
                        .map(file -> file.getFileName().toString())
                        .filter(name -> name.startsWith(namePrefix))
                        .sorted()
                        .toList();
            }
        });
    }

    private Path resolve(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path escapes the guard workspace: " + directory + "/" + path);
        }
        return resolved;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported for {}, falling back to a plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private static <T> CompletableFuture<T> io(String action, IoCall<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.run();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to " + action, e);
            }
        });
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T run() throws IOException;
    }
}
