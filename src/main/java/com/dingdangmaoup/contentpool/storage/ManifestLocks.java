package com.dingdangmaoup.contentpool.storage;

import com.dingdangmaoup.contentpool.model.ManifestId;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keyed locks for the storage layer.
 * Writers of the same manifest id are serialized; different ids never contend.
 * The object-store lock is held shared while objects are written and exclusively
 * while unreferenced objects are deleted, so a new reference cannot be lost to a
 * concurrent collection.
 * Lock order: manifest lock first, object-store lock second.
 */
@Component
public class ManifestLocks {

    private final ConcurrentHashMap<ManifestId, LockEntry> locks = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock objectStoreLock = new ReentrantReadWriteLock();

    /**
     * Entries are counted by the threads holding or waiting for them and dropped
     * once the last one leaves.
     */
    private LockEntry acquire(ManifestId id) {
        return locks.compute(id, (key, entry) -> {
            LockEntry acquired = entry == null ? new LockEntry() : entry;
            acquired.users++;
            return acquired;
        });
    }

    private void release(ManifestId id) {
        locks.computeIfPresent(id, (key, entry) -> --entry.users == 0 ? null : entry);
    }

    public <T> T withRead(ManifestId id, ThrowingSupplier<T> supplier) throws Exception {
        LockEntry entry = acquire(id);
        try {
            var l = entry.lock.readLock();
            l.lock();
            try {
                return supplier.get();
            } finally {
                l.unlock();
            }
        } finally {
            release(id);
        }
    }

    public <T> T withWrite(ManifestId id, ThrowingSupplier<T> supplier) throws Exception {
        LockEntry entry = acquire(id);
        try {
            var l = entry.lock.writeLock();
            l.lock();
            try {
                return supplier.get();
            } finally {
                l.unlock();
            }
        } finally {
            release(id);
        }
    }

    /**
     * Number of ids that currently have a lock held or awaited
     */
    int activeLocks() {
        return locks.size();
    }

    public <T> T withObjectsShared(ThrowingSupplier<T> supplier) throws Exception {
        var l = objectStoreLock.readLock();
        l.lock();
        try {
            return supplier.get();
        } finally {
            l.unlock();
        }
    }

    public <T> T withObjectsExclusive(ThrowingSupplier<T> supplier) throws Exception {
        var l = objectStoreLock.writeLock();
        l.lock();
        try {
            return supplier.get();
        } finally {
            l.unlock();
        }
    }

    private static final class LockEntry {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        // guarded by the map's per-key compute
        private int users;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T> {
        T get() throws Exception;
    }
}
