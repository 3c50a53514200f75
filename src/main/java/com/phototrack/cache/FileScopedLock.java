package com.phototrack.cache;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory cross-process lock on a sidecar file, polled until a deadline.
 */
public class FileScopedLock implements ScopedLock {

    private static final Logger log = LoggerFactory.getLogger(FileScopedLock.class);
    private static final long POLL_INTERVAL_MS = 100;

    private final Path lockFile;
    private FileChannel channel;
    private FileLock lock;

    public FileScopedLock(Path lockFile) {
        this.lockFile = lockFile;
    }

    @Override
    public boolean acquire(Duration timeout) {
        if (lock != null) {
            return true;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.warn("Cannot open lock file {}: {}", lockFile, e.getMessage());
            return false;
        }

        while (true) {
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                // another instance inside this JVM holds it; treat like any other contention
                lock = null;
            } catch (IOException e) {
                log.warn("Locking {} failed: {}", lockFile, e.getMessage());
                closeChannel();
                return false;
            }
            if (lock != null) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("Lock timeout after {} ms on {}", timeout.toMillis(), lockFile);
                closeChannel();
                return false;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                closeChannel();
                return false;
            }
        }
    }

    @Override
    public boolean isHeld() {
        return lock != null && lock.isValid();
    }

    @Override
    public void release() {
        if (lock != null) {
            try {
                lock.release();
            } catch (IOException e) {
                log.debug("Releasing lock on {} failed: {}", lockFile, e.getMessage());
            }
            lock = null;
        }
        closeChannel();
    }

    private void closeChannel() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Closing {} failed: {}", lockFile, e.getMessage());
        }
        channel = null;
    }
}
