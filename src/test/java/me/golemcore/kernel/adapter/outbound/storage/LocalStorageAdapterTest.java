package me.golemcore.kernel.adapter.outbound.storage;

import me.golemcore.kernel.infrastructure.config.KernelProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String AUDIT_DIR = "audit";
    private static final String LEDGER = "ledger.jsonl";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        KernelProperties properties = new KernelProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesAuditAndTriggerDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("audit")));
        assertTrue(Files.isDirectory(tempDir.resolve("triggers")));
    }

    @Test
    void appendLineAddsNewlineTerminatedLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendLine(AUDIT_DIR, LEDGER, "{\"sequence\":0}").get();
        storageAdapter.appendLine(AUDIT_DIR, LEDGER, "{\"sequence\":1}\n").get();

        String text = storageAdapter.getText(AUDIT_DIR, LEDGER).get();

        assertEquals("{\"sequence\":0}\n{\"sequence\":1}\n", text);
    }

    @Test
    void appendFullyCutsPartialLineWhenWriteFails() throws Exception {
        Path ledger = tempDir.resolve("audit").resolve(LEDGER);
        Files.writeString(ledger, "{\"sequence\":0}\n");

        try (FileChannel real = FileChannel.open(ledger, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            FileChannel failing = new FailAfterFirstWriteChannel(real, 5);
            ByteBuffer line = ByteBuffer.wrap("{\"sequence\":1}\n".getBytes(StandardCharsets.UTF_8));

            IOException ex = assertThrows(IOException.class, () -> LocalStorageAdapter.appendFully(failing, line));
            assertEquals("disk full", ex.getMessage());
        }

        assertEquals("{\"sequence\":0}\n", Files.readString(ledger));
        storageAdapter.appendLine(AUDIT_DIR, LEDGER, "{\"sequence\":1}").get();
        assertEquals("{\"sequence\":0}\n{\"sequence\":1}\n", Files.readString(ledger));
    }

    @Test
    void getTextReturnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(AUDIT_DIR, "missing.jsonl").get());
    }

    @Test
    void putTextAtomicReplacesContentAndKeepsBackup() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("triggers", "triggers.json", "[]", true).get();
        storageAdapter.putTextAtomic("triggers", "triggers.json", "[{\"id\":\"t-1\"}]", true).get();

        assertEquals("[{\"id\":\"t-1\"}]", storageAdapter.getText("triggers", "triggers.json").get());
        assertEquals("[]", storageAdapter.getText("triggers", "triggers.json.bak").get());
        assertFalse(Files.exists(tempDir.resolve("triggers").resolve("triggers.json.tmp")));
    }

    @Test
    void putTextAtomicCreatesMissingParentDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("triggers", "nested/triggers.json", "[]", false).get();

        assertTrue(Files.isRegularFile(tempDir.resolve("triggers").resolve("nested").resolve("triggers.json")));
        assertFalse(Files.exists(tempDir.resolve("triggers").resolve("nested").resolve("triggers.json.bak")));
    }

    @Test
    void pathTraversalIsBlocked() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(AUDIT_DIR, "../../etc/passwd").get());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    /**
     * Writes a few bytes through to the real file, then fails every later write.
     */
    private static final class FailAfterFirstWriteChannel extends FileChannel {

        private final FileChannel delegate;
        private final int firstWriteBytes;
        private boolean written;

        FailAfterFirstWriteChannel(FileChannel delegate, int firstWriteBytes) {
            this.delegate = delegate;
            this.firstWriteBytes = firstWriteBytes;
        }

        @Override
        public int write(ByteBuffer src) throws IOException {
            if (written) {
                throw new IOException("disk full");
            }
            written = true;
            ByteBuffer part = src.slice();
            part.limit(Math.min(firstWriteBytes, part.remaining()));
            int count = delegate.write(part);
            src.position(src.position() + count);
            return count;
        }

        @Override
        public long size() throws IOException {
            return delegate.size();
        }

        @Override
        public FileChannel truncate(long size) throws IOException {
            delegate.truncate(size);
            return this;
        }

        @Override
        public void force(boolean metaData) throws IOException {
            delegate.force(metaData);
        }

        @Override
        public int read(ByteBuffer dst) {
            throw new UnsupportedOperationException();
        }

        @Override
        public long read(ByteBuffer[] dsts, int offset, int length) {
            throw new UnsupportedOperationException();
        }

        @Override
        public long write(ByteBuffer[] srcs, int offset, int length) {
            throw new UnsupportedOperationException();
        }

        @Override
        public long position() throws IOException {
            return delegate.position();
        }

        @Override
        public FileChannel position(long newPosition) {
            throw new UnsupportedOperationException();
        }

        @Override
        public long transferTo(long position, long count, WritableByteChannel target) {
            throw new UnsupportedOperationException();
        }

        @Override
        public long transferFrom(ReadableByteChannel src, long position, long count) {
            throw new UnsupportedOperationException();
        }

        @Override
        public int read(ByteBuffer dst, long position) {
            throw new UnsupportedOperationException();
        }

        @Override
        public int write(ByteBuffer src, long position) {
            throw new UnsupportedOperationException();
        }

        @Override
        public MappedByteBuffer map(MapMode mode, long position, long size) {
            throw new UnsupportedOperationException();
        }

        @Override
        public FileLock lock(long position, long size, boolean shared) {
            throw new UnsupportedOperationException();
        }

        @Override
        public FileLock tryLock(long position, long size, boolean shared) {
            throw new UnsupportedOperationException();
        }

        @Override
        protected void implCloseChannel() {
            // the real channel is closed by its owner
        }
    }
}
