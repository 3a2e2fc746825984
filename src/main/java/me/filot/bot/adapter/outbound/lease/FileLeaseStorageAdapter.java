package me.filot.bot.adapter.outbound.lease;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.filot.bot.domain.model.InstanceLease;
import me.filot.bot.infrastructure.config.BotProperties;
import me.filot.bot.port.outbound.LeaseStoragePort;
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
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local filesystem implementation of {@link LeaseStoragePort}.
 *
 * <p>
 * The lease is a JSON document at {@code bot.instance.lease-path}. Every
 * compare-and-set:
 * <ol>
 * <li>tries an exclusive {@link FileLock} on a sibling {@code .lock} file, so
 * processes on the same host serialize; a lock held elsewhere counts as a lost
 * race and never blocks the caller</li>
 * <li>re-reads the stored lease and compares it with the expected one</li>
 * <li>writes the replacement to a temp file, fsyncs it and atomically renames
 * it over the lease file (or deletes the file when releasing)</li>
 * </ol>
 *
 * <p>
 * An unreadable lease file is treated as "no lease" so that a corrupt record
 * cannot block every process forever.
 *
 * @see me.filot.bot.port.outbound.LeaseStoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileLeaseStorageAdapter implements LeaseStoragePort {

    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    private final ReentrantLock localLock = new ReentrantLock();
    private Path leasePath;
    private Path lockPath;

    @PostConstruct
    public void init() {
        String configured = properties.getInstance().getLeasePath();
        // The BotProperties field default carries an unresolved ${user.home}.
        this.leasePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.lockPath = leasePath.resolveSibling(leasePath.getFileName() + ".lock");

        try {
            Path parent = leasePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            log.info("[Lease] Lease file: {}", leasePath);
        } catch (IOException e) {
            log.error("[Lease] Failed to create lease directory", e);
        }
    }

    @Override
    public CompletableFuture<Optional<InstanceLease>> read() {
        return CompletableFuture.supplyAsync(() -> Optional.ofNullable(readLease()));
    }

    @Override
    public CompletableFuture<Boolean> compareAndSet(InstanceLease expected, InstanceLease replacement) {
        return CompletableFuture.supplyAsync(() -> {
            localLock.lock();
            try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE);
                    FileLock fileLock = channel.tryLock()) {
                if (fileLock == null) {
                    log.debug("[Lease] Lease file locked by another process");
                    return false;
                }
                InstanceLease current = readLease();
                if (!Objects.equals(current, expected)) {
                    return false;
                }
                if (replacement == null) {
                    Files.deleteIfExists(leasePath);
                } else {
                    writeAtomic(replacement);
                }
                return true;
            } catch (OverlappingFileLockException e) {
                log.debug("[Lease] Lease file locked by another channel in this JVM");
                return false;
            } catch (IOException e) {
                throw new LeaseStorageException("Failed to update lease: " + leasePath, e);
            } finally {
                localLock.unlock();
            }
        });
    }

    Path getLeasePath() {
        return leasePath;
    }

    private InstanceLease readLease() {
        if (!Files.exists(leasePath)) {
            return null;
        }
        try {
            String json = Files.readString(leasePath, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return null;
            }
            return objectMapper.readValue(json, InstanceLease.class);
        } catch (JsonProcessingException e) {
            log.warn("[Lease] Unreadable lease file {}, treating as empty: {}", leasePath, e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            throw new LeaseStorageException("Failed to read lease: " + leasePath, e);
        }
    }

    private void writeAtomic(InstanceLease lease) throws IOException {
        Path tempPath = leasePath.resolveSibling(leasePath.getFileName() + ".tmp");
        byte[] bytes = objectMapper.writeValueAsBytes(lease);
        try {
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC)) {
                os.write(bytes);
                os.flush();
            }
            try {
                Files.move(tempPath, leasePath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Lease] Atomic move not supported, using regular move");
                Files.move(tempPath, leasePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Lease] Failed to cleanup temp file: {}", tempPath);
            }
            throw e;
        }
    }
}
