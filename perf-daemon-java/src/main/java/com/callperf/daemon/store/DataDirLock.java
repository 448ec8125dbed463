package com.callperf.daemon.store;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exclusive OS file lock on {@code sampler.lock} in a data directory. The lock dies with the
 * process, so a crashed daemon never leaves the directory locked. The file holds the owner's pid.
 */
public final class DataDirLock implements AutoCloseable {

    public static final String LOCK_FILE = "sampler.lock";

    /**
     * Lock files held by this JVM. Closing any channel on a locked file drops the process's
     * OS lock, so files listed here are never opened by {@link #acquire} or {@link #isHeld}.
     */
    private static final Set<Path> HELD = ConcurrentHashMap.newKeySet();

    private final Path file;
    private final FileChannel channel;
    private final FileLock lock;

    private DataDirLock(Path file, FileChannel channel, FileLock lock) {
        this.file = file;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * Takes the lock or fails immediately.
     *
     * @throws LockHeldException if another daemon (in this or another process) holds it
     */
    public static DataDirLock acquire(Path dataDir) throws IOException {
        Files.createDirectories(dataDir);
        Path file = dataDir.resolve(LOCK_FILE).toAbsolutePath().normalize();
        if (!HELD.add(file)) {
            throw new LockHeldException("Data directory " + dataDir + " is locked by another sampler in this process");
        }
        try {
            return lock(dataDir, file);
        } catch (IOException | RuntimeException e) {
            HELD.remove(file);
            throw e;
        }
    }

    private static DataDirLock lock(Path dataDir, Path file) throws IOException {
        FileChannel channel = FileChannel.open(file,
            StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        if (lock == null) {
            channel.close();
            throw new LockHeldException("Data directory " + dataDir + " is locked by another sampler"
                + readPidFile(file).stream().mapToObj(pid -> " (pid " + pid + ")").findFirst().orElse(""));
        }
        try {
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(Long.toString(ProcessHandle.current().pid()).getBytes(StandardCharsets.UTF_8)));
            channel.force(false);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        return new DataDirLock(file, channel, lock);
    }

    /** Whether some live daemon holds the lock on {@code dataDir}. */
    public static boolean isHeld(Path dataDir) {
        Path file = dataDir.resolve(LOCK_FILE).toAbsolutePath().normalize();
        if (HELD.contains(file)) return true;
        if (!Files.exists(file)) return false;
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            FileLock probe = channel.tryLock();
            if (probe == null) return true;
            probe.release();
            return false;
        } catch (OverlappingFileLockException e) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /** Pid recorded by the last owner, if any. */
    public static OptionalLong readPid(Path dataDir) {
        Path file = dataDir.resolve(LOCK_FILE).toAbsolutePath().normalize();
        if (HELD.contains(file)) return OptionalLong.of(ProcessHandle.current().pid());
        return readPidFile(file);
    }

    private static OptionalLong readPidFile(Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8).trim();
            return text.isEmpty() ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(text));
        } catch (IOException | NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    @Override
    public void close() throws IOException {
        try {
            if (lock.isValid()) lock.release();
        } finally {
            try {
                channel.close();
            } finally {
                HELD.remove(file);
            }
        }
    }

    public static class LockHeldException extends IOException {
        public LockHeldException(String message) { super(message); }
    }
}
