package com.example.medialibrary.application.service;

import com.example.medialibrary.domain.model.CollectionScope;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Component;

/**
 * One read/write lock per ordering scope. Mutations of a scope take its write lock, reads its read lock.
 * Entries are never evicted, so every caller of a scope always contends on the same lock.
 */
@Component
public class ScopeLockRegistry {

    private final ConcurrentMap<CollectionScope, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public ReentrantReadWriteLock lockFor(CollectionScope scope) {
        return locks.computeIfAbsent(scope, key -> new ReentrantReadWriteLock(true));
    }
}
