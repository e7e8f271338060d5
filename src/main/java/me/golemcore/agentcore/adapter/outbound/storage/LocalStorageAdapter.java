package me.golemcore.agentcore.adapter.outbound.storage;

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
import me.golemcore.agentcore.infrastructure.config.AgentCoreProperties;
import me.golemcore.agentcore.port.outbound.StoragePort;
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
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link StoragePort}.
 *
 * <p>
 * The workspace root comes from {@code agentcore.storage.local.base-path}; the
 * conversation and prompt directories are created on startup. Every path is
 * resolved inside the root, traversal outside it is rejected. I/O failures
 * complete the returned future with an {@link UncheckedIOException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final AgentCoreProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            for (String dir : List.of(properties.getMemory().getDirectory(), properties.getPrompts().getDirectory())) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Workspace initialized at: {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create workspace at " + basePath, e);
        }
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return run("write", directory, path, () -> {
            Path filePath = resolvePath(directory, path);
            createParent(filePath);
            Files.writeString(filePath, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return supply("read", directory, path, () -> {
            Path filePath = resolvePath(directory, path);
            if (!Files.exists(filePath)) {
                return null;
            }
            return Files.readString(filePath, StandardCharsets.UTF_8);
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return run("delete", directory, path, () -> Files.deleteIfExists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return supply("list", directory, prefix, () -> {
            Path dirPath = resolvePath(directory, "");
            Path prefixPath = prefix != null && !prefix.isEmpty() ? resolvePath(directory, prefix) : dirPath;
            if (!Files.exists(prefixPath)) {
                return List.of();
            }
            try (Stream<Path> paths = Files.walk(prefixPath)) {
                return paths
                        .filter(Files::isRegularFile)
                        .map(p -> dirPath.relativize(p).toString())
                        .sorted()
                        .toList();
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return run("append", directory, path, () -> {
            Path filePath = resolvePath(directory, path);
            createParent(filePath);
            Files.writeString(filePath, content, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return run("mkdir", directory, "", () -> Files.createDirectories(resolvePath(directory, "")));
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return run("atomic write", directory, path, () -> {
            Path targetPath = resolvePath(directory, path);
            createParent(targetPath);
            // unique per write
            Path tempPath = Files.createTempFile(targetPath.getParent(), targetPath.getFileName() + ".", ".tmp");
            try {
                writeSynced(tempPath, content.getBytes(StandardCharsets.UTF_8));
                if (backup && Files.exists(targetPath)) {
                    Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");
                    Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[Storage] Created backup: {}", backupPath);
                }
                moveIntoPlace(tempPath, targetPath);
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                Files.deleteIfExists(tempPath);
                throw e;
            }
        });
    }

    private void writeSynced(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        if (Files.size(file) != bytes.length) {
            throw new IOException("Verification failed: size mismatch for " + file);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }

    private static CompletableFuture<Void> run(String operation, String directory, String path, IoAction action) {
        return CompletableFuture.runAsync(() -> {
            try {
                action.run();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to " + operation + ": " + directory + "/" + path, e);
            }
        });
    }

    private static <T> CompletableFuture<T> supply(String operation, String directory, String path,
            IoSupplier<T> supplier) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return supplier.get();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to " + operation + ": " + directory + "/" + path, e);
            }
        });
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }

    @FunctionalInterface
    private interface IoSupplier<T> {
        T get() throws IOException;
    }
}
