package fr.lapetina.embedding.accelerator.cache;

import fr.lapetina.embedding.accelerator.domain.port.PersistentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Directory-backed persistent store, one {@code <key>.vec} file per entry.
 *
 * Entry metadata (size, last access, insertion sequence) lives in memory and
 * is rebuilt from the directory on startup, ordered by file modification
 * time. {@link #evictOne()} removes the entry with the oldest last access;
 * equal access times fall back to insertion order.
 */
public final class FileSystemStore implements PersistentStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemStore.class);

    static final String EXTENSION = ".vec";
    private static final Pattern VALID_KEY = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path directory;
    private final LongSupplier clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Meta> index = new HashMap<>();
    private long totalBytes;
    private long nextSequence;

    private record Meta(long size, long lastAccess, long sequence) {
        Meta touch(long time) {
            return new Meta(size, time, sequence);
        }
    }

    public FileSystemStore(Path directory) throws IOException {
        this(directory, System::currentTimeMillis);
    }

    public FileSystemStore(Path directory, LongSupplier clock) throws IOException {
        this.directory = directory;
        this.clock = clock;
        Files.createDirectories(directory);
        rebuildIndex();
    }

    private void rebuildIndex() throws IOException {
        record Found(String key, long size, long modified) {
        }
        List<Found> found = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String key = fileName.substring(0, fileName.length() - EXTENSION.length());
                if (!VALID_KEY.matcher(key).matches()) {
                    continue;
                }
                found.add(new Found(key, Files.size(file), Files.getLastModifiedTime(file).toMillis()));
            }
        }
        found.sort(Comparator.comparingLong(Found::modified).thenComparing(Found::key));
        for (Found f : found) {
            index.put(f.key(), new Meta(f.size(), f.modified(), nextSequence++));
            totalBytes += f.size();
        }
        log.info("FileSystemStore opened: directory={}, entries={}, bytes={}", directory, index.size(), totalBytes);
    }

    @Override
    public Optional<byte[]> read(String key) throws IOException {
        Path file = fileFor(key);
        lock.lock();
        try {
            Meta meta = index.get(key);
            if (meta == null) {
                return Optional.empty();
            }
            byte[] blob;
            try {
                blob = Files.readAllBytes(file);
            } catch (NoSuchFileException e) {
                // removed behind our back
                forget(key);
                return Optional.empty();
            }
            index.put(key, meta.touch(clock.getAsLong()));
            return Optional.of(blob);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void write(String key, byte[] blob) throws IOException {
        Path file = fileFor(key);
        Path temp = directory.resolve(key + ".tmp");
        lock.lock();
        try {
            Files.write(temp, blob);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            Meta previous = index.remove(key);
            if (previous != null) {
                totalBytes -= previous.size();
            }
            index.put(key, new Meta(blob.length, clock.getAsLong(), nextSequence++));
            totalBytes += blob.length;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long sizeBytes() {
        lock.lock();
        try {
            return totalBytes;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long sizeOf(String key) {
        lock.lock();
        try {
            Meta meta = index.get(key);
            return meta == null ? 0 : meta.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long evictOne() throws IOException {
        lock.lock();
        try {
            Optional<Map.Entry<String, Meta>> victim = index.entrySet().stream()
                    .min(Comparator.<Map.Entry<String, Meta>>comparingLong(e -> e.getValue().lastAccess())
                            .thenComparingLong(e -> e.getValue().sequence()));
            if (victim.isEmpty()) {
                return 0;
            }
            String key = victim.get().getKey();
            long freed = victim.get().getValue().size();
            Files.deleteIfExists(fileFor(key));
            forget(key);
            log.debug("Evicted entry: key={}, bytes={}", key, freed);
            return freed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) throws IOException {
        Path file = fileFor(key);
        lock.lock();
        try {
            boolean known = forget(key);
            return Files.deleteIfExists(file) || known;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() throws IOException {
        lock.lock();
        try {
            for (String key : new ArrayList<>(index.keySet())) {
                Files.deleteIfExists(fileFor(key));
            }
            index.clear();
            totalBytes = 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int entryCount() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private boolean forget(String key) {
        Meta removed = index.remove(key);
        if (removed == null) {
            return false;
        }
        totalBytes -= removed.size();
        return true;
    }

    private Path fileFor(String key) {
        if (key == null || !VALID_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid store key: " + key);
        }
        return directory.resolve(key + EXTENSION);
    }
}
