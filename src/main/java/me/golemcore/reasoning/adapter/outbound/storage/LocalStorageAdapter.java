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

package me.golemcore.reasoning.adapter.outbound.storage;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.exception.PersistenceException;
import me.golemcore.reasoning.infrastructure.config.ReasoningProperties;
import me.golemcore.reasoning.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link StoragePort} over the local filesystem, rooted at
 * {@code reasoning.storage.local.base-path}.
 *
 * <p>
 * All file work runs on one daemon thread, so writes to the same snapshot never
 * interleave. An atomic write goes to a sibling {@code .tmp} file, is forced to
 * disk and then moved over the target.
 */
@Component
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String USER_HOME = "${user.home}";

    private final ReasoningProperties properties;
    private final ExecutorService io = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "reasoning-storage");
        t.setDaemon(true);
        return t;
    });

    private Path root;

    public LocalStorageAdapter(ReasoningProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        root = Paths.get(configured.replace(USER_HOME, System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
        try {
            Files.createDirectories(root);
            log.info("[Storage] Workspace at {}", root);
        } catch (IOException e) {
            log.error("[Storage] Cannot create workspace {}", root, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        io.shutdown();
    }

    @Override
    public CompletableFuture<Optional<String>> read(String directory, String file) {
        return submit(directory, file, "read", target -> Files.isRegularFile(target)
                ? Optional.of(Files.readString(target, StandardCharsets.UTF_8))
                : Optional.empty());
    }

    @Override
    public CompletableFuture<Void> writeAtomic(String directory, String file, String content) {
        return submit(directory, file, "write", target -> {
            replace(target, content.getBytes(StandardCharsets.UTF_8));
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return submit(directory, ".", "create", target -> {
            Files.createDirectories(target);
            return null;
        });
    }

    private void replace(Path target, byte[] bytes) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = sibling(target, ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            if (Files.exists(target)) {
                Files.copy(target, sibling(target, ".bak"), StandardCopyOption.REPLACE_EXISTING);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("[Storage] Atomic move unsupported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private <T> CompletableFuture<T> submit(String directory, String file, String action, FileTask<T> task) {
        Path target;
        try {
            target = resolve(directory, file);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.run(target);
            } catch (IOException e) {
                throw new CompletionException(
                        new PersistenceException("Failed to " + action + " " + directory + "/" + file, e));
            }
        }, io);
    }

    private Path resolve(String directory, String file) {
        Path resolved = root.resolve(directory).resolve(file).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes workspace: " + directory + "/" + file);
        }
        return resolved;
    }

    private static Path sibling(Path target, String suffix) {
        return target.resolveSibling(target.getFileName() + suffix);
    }

    @FunctionalInterface
    private interface FileTask<T> {
        T run(Path target) throws IOException;
    }
}
