package me.golemcore.kernel.testsupport;

import me.golemcore.kernel.port.outbound.StoragePort;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed storage with switchable write failures.
 */
public class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private final AtomicBoolean failAppends = new AtomicBoolean(false);
    private final AtomicBoolean failWrites = new AtomicBoolean(false);
    private final AtomicInteger appendCount = new AtomicInteger();

    public void failAppends(boolean fail) {
        failAppends.set(fail);
    }

    public void failWrites(boolean fail) {
        failWrites.set(fail);
    }

    public int appendCount() {
        return appendCount.get();
    }

    public String read(String directory, String path) {
        return files.get(key(directory, path));
    }

    public void write(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public synchronized CompletableFuture<Void> appendLine(String directory, String path, String line) {
        if (failAppends.get()) {
            return CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full")));
        }
        String normalized = line.endsWith("\n") ? line : line + "\n";
        files.merge(key(directory, path), normalized, String::concat);
        appendCount.incrementAndGet();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        if (failWrites.get()) {
            return CompletableFuture.failedFuture(new UncheckedIOException(new IOException("read-only")));
        }
        String key = key(directory, path);
        String previous = files.put(key, content);
        if (backup && previous != null) {
            files.put(key + ".bak", previous);
        }
        return CompletableFuture.completedFuture(null);
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
