package com.iksanov.checkpoint.node.storage;

import com.iksanov.checkpoint.common.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-based medium: one file per key, crash-resistant writes using fsync.
 * <p>
 * Layout: {@code <dir>/<key>.json}. A write goes to {@code <key>.json.tmp}, is forced to disk and
 * then moved over the target with {@code ATOMIC_MOVE}, so readers never observe a torn value.
 * <p>
 * The optional quota bounds the sum of all value files. Running out of disk space is reported
 * the same way as hitting the quota.
 */
public class FileStorageMedium implements StorageMedium {

    private static final Logger log = LoggerFactory.getLogger(FileStorageMedium.class);
    private static final String SUFFIX = ".json";
    private static final String TMP_SUFFIX = ".tmp";
    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9_.-]{1,128}");
    private final Path directory;
    private final long quotaBytes;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    public FileStorageMedium(Path directory, long quotaBytes) {
        this.directory = Objects.requireNonNull(directory, "directory");
        if (quotaBytes < 0) throw new IllegalArgumentException("quotaBytes must be >= 0");
        this.quotaBytes = quotaBytes;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw PersistenceException.unavailable("Cannot create storage directory " + directory, e);
        }
        log.info("[Storage] Initialized file-based medium at {} (quota={})", directory, quotaBytes == 0 ? "unbounded" : quotaBytes + " bytes");
    }

    @Override
    public Optional<String> get(String key) {
        Path file = fileFor(key);
        ensureOpen();
        lock.readLock().lock();
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw PersistenceException.unavailable("Failed to read key " + key, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(String key, String value) {
        Path file = fileFor(key);
        Objects.requireNonNull(value, "value");
        ensureOpen();
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);

        lock.writeLock().lock();
        try {
            if (quotaBytes > 0) {
                long existing = Files.exists(file) ? Files.size(file) : 0;
                long projected = usedBytesUnlocked() - existing + bytes.length;
                if (projected > quotaBytes) {
                    throw PersistenceException.quotaExceeded(String.format(
                            "Storage quota exceeded writing '%s': projected=%d, quota=%d", key, projected, quotaBytes));
                }
            }

            Path tmp = file.resolveSibling(file.getFileName() + TMP_SUFFIX);
            try {
                try (FileChannel channel = FileChannel.open(tmp,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING)) {
                    ByteBuffer buffer = ByteBuffer.wrap(bytes);
                    while (buffer.hasRemaining()) channel.write(buffer);
                    channel.force(true);
                }
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                discardTemp(tmp);
                throw translate(key, e);
            }
            log.debug("[Storage] Wrote key={} ({} bytes)", key, bytes.length);
        } catch (IOException e) {
            throw translate(key, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void remove(String key) {
        Path file = fileFor(key);
        ensureOpen();
        lock.writeLock().lock();
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw PersistenceException.unavailable("Failed to remove key " + key, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Set<String> keys() {
        ensureOpen();
        lock.readLock().lock();
        try (Stream<Path> files = Files.list(directory)) {
            Set<String> keys = new HashSet<>();
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .forEach(name -> keys.add(name.substring(0, name.length() - SUFFIX.length())));
            return keys;
        } catch (IOException e) {
            throw PersistenceException.unavailable("Failed to list " + directory, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long usedBytes() {
        lock.readLock().lock();
        try {
            return usedBytesUnlocked();
        } catch (IOException e) {
            throw PersistenceException.unavailable("Failed to measure " + directory, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        closed = true;
        log.info("[Storage] Closed file-based medium at {}", directory);
    }

    public Path directory() {
        return directory;
    }

    private long usedBytesUnlocked() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            long total = 0;
            for (Path p : (Iterable<Path>) files::iterator) {
                if (p.getFileName().toString().endsWith(SUFFIX)) total += Files.size(p);
            }
            return total;
        }
    }

    private Path fileFor(String key) {
        Objects.requireNonNull(key, "key");
        if (!KEY_PATTERN.matcher(key).matches()) throw new IllegalArgumentException("Invalid storage key: '" + key + "'");
        return directory.resolve(key + SUFFIX);
    }

    private void ensureOpen() {
        if (closed) throw PersistenceException.unavailable("Storage medium is closed", null);
    }

    private void discardTemp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            log.warn("[Storage] Failed to delete temp file {}: {}", tmp, cleanup.getMessage());
        }
    }

    private static PersistenceException translate(String key, IOException e) {
        String message = e.getMessage();
        if (message != null && message.contains("No space left on device")) {
            return new PersistenceException(PersistenceException.Reason.QUOTA_EXCEEDED, "Disk full writing key " + key, e);
        }
        return PersistenceException.unavailable("Failed to write key " + key, e);
    }
}
