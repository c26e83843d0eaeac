package com.csvquery.service.table;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per user namespace. Table replacement and reads of the same namespace never
 * overlap; different users proceed in parallel.
 */
@Component
public class UserNamespaceLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String userId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(userId, k -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for namespace of user " + userId, e);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
