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

package me.golemcore.zulipbot.adapter.outbound.storage;

import me.golemcore.zulipbot.infrastructure.config.BotProperties;
import me.golemcore.zulipbot.port.outbound.KeyValueStorePort;
import me.golemcore.zulipbot.port.outbound.StoreBusyException;
import me.golemcore.zulipbot.port.outbound.StoreException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link KeyValueStorePort}.
 *
 * <p>
 * Layout under {@code bot.storage.local.base-path}:
 *
 * <pre>
 * &lt;namespace&gt;/.lock
 * &lt;namespace&gt;/&lt;base64url(key)&gt;.val
 * </pre>
 *
 * <p>
 * Writes go to a temp file and are renamed into place while holding an
 * exclusive lock on the namespace lock file. If the lock is held elsewhere
 * the write fails fast with {@link StoreBusyException} and the caller decides
 * whether to retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalKeyValueStoreAdapter implements KeyValueStorePort {

    private static final String VALUE_SUFFIX = ".val";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String LOCK_FILE = ".lock";

    private final BotProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(basePath);
            log.info("[Storage] Key/value store initialized at: {}", basePath);
        } catch (IOException e) {
            throw new StoreException("Failed to create storage directory: " + basePath, e);
        }
    }

    @Override
    public Optional<byte[]> get(String namespace, String key) {
        Path filePath = resolveKey(namespace, key);
        if (!Files.exists(filePath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(filePath));
        } catch (IOException e) {
            throw new StoreException("Failed to read key: " + namespace + "/" + key, e);
        }
    }

    @Override
    public void put(String namespace, String key, byte[] value) {
        Path targetPath = resolveKey(namespace, key);
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + TEMP_SUFFIX);

        try (FileChannel lockChannel = openLockChannel(namespace);
                FileLock lock = acquireLock(lockChannel, namespace)) {
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC)) {
                os.write(value);
            }
            moveIntoPlace(tempPath, targetPath);
            log.debug("[Storage] Stored {}/{} ({} bytes)", namespace, key, value.length);
        } catch (IOException e) {
            deleteQuietly(tempPath);
            throw new StoreException("Failed to write key: " + namespace + "/" + key, e);
        }
    }

    @Override
    public void delete(String namespace, String key) {
        Path filePath = resolveKey(namespace, key);
        try (FileChannel lockChannel = openLockChannel(namespace);
                FileLock lock = acquireLock(lockChannel, namespace)) {
            Files.deleteIfExists(filePath);
        } catch (IOException e) {
            throw new StoreException("Failed to delete key: " + namespace + "/" + key, e);
        }
    }

    @Override
    public List<String> keys(String namespace) {
        Path dirPath = resolveNamespace(namespace);
        if (!Files.isDirectory(dirPath)) {
            return Collections.emptyList();
        }
        try (Stream<Path> paths = Files.list(dirPath)) {
            return paths
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(VALUE_SUFFIX))
                    .map(name -> decodeKey(name.substring(0, name.length() - VALUE_SUFFIX.length())))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StoreException("Failed to list keys: " + namespace, e);
        }
    }

    Path getBasePath() {
        return basePath;
    }

    private FileChannel openLockChannel(String namespace) throws IOException {
        Path dirPath = resolveNamespace(namespace);
        Files.createDirectories(dirPath);
        return FileChannel.open(dirPath.resolve(LOCK_FILE),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    }

    private FileLock acquireLock(FileChannel channel, String namespace) throws IOException {
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            throw new StoreBusyException("Namespace is locked by another writer: " + namespace, e);
        }
        if (lock == null) {
            throw new StoreBusyException("Namespace is locked by another process: " + namespace);
        }
        return lock;
    }

    private void moveIntoPlace(Path tempPath, Path targetPath) throws IOException {
        try {
            Files.move(tempPath, targetPath,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
            Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanupEx) {
            log.warn("[Storage] Failed to cleanup temp file: {}", path);
        }
    }

    private Path resolveNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Namespace must not be blank");
        }
        Path resolved = basePath.resolve(namespace).normalize();
        if (!resolved.startsWith(basePath) || resolved.equals(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + namespace);
        }
        return resolved;
    }

    private Path resolveKey(String namespace, String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key must not be empty");
        }
        return resolveNamespace(namespace).resolve(encodeKey(key) + VALUE_SUFFIX);
    }

    private static String encodeKey(String key) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(key.getBytes(StandardCharsets.UTF_8));
    }

    private static String decodeKey(String encoded) {
        return new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
    }
}
