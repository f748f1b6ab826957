package com.example.medialibrary.application.service;

import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.CollectionEntry;
import com.example.medialibrary.domain.model.CollectionScope;
import com.example.medialibrary.domain.model.MediaItem;
import com.example.medialibrary.domain.model.MediaItemRef;
import com.example.medialibrary.domain.model.ResolvedEntry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Position-ordered list of media references within one scope. Positions only grow on append and are
 * renumbered to {@code 0..n-1} by {@link #reorder(List)} and {@link #move(List, int)}.
 *
 * <p>Every mutation holds the scope's write lock for the whole read-then-write sequence and runs in one
 * transaction that commits before the lock is released. Reads hold the read lock.
 */
public abstract class OrderedCollection {

    private static final Logger log = LoggerFactory.getLogger(OrderedCollection.class);

    protected final LibraryStore libraryStore;
    protected final MediaItemResolver mediaItemResolver;
    private final CollectionScope scope;
    private final ScopeLockRegistry scopeLockRegistry;
    private final TransactionOperations transactionOperations;
    private final MeterRegistry meterRegistry;

    protected OrderedCollection(CollectionScope scope,
                                LibraryStore libraryStore,
                                MediaItemResolver mediaItemResolver,
                                ScopeLockRegistry scopeLockRegistry,
                                TransactionOperations transactionOperations,
                                MeterRegistry meterRegistry) {
        this.scope = scope;
        this.libraryStore = libraryStore;
        this.mediaItemResolver = mediaItemResolver;
        this.scopeLockRegistry = scopeLockRegistry;
        this.transactionOperations = transactionOperations == null
                ? TransactionOperations.withoutTransaction()
                : transactionOperations;
        this.meterRegistry = meterRegistry;
    }

    public CollectionScope getScope() {
        return scope;
    }

    /**
     * Appends one item after every existing entry.
     *
     * @return the position assigned to it
     */
    public int append(MediaItemRef ref) {
        List<Integer> positions = appendAll(Collections.singletonList(ref));
        return positions.get(0);
    }

    /**
     * Appends items in the given order; positions are consecutive and start after the current maximum.
     *
     * @throws BusinessException {@code 404} when an item is not in the catalog; nothing is appended then
     */
    public List<Integer> appendAll(List<MediaItemRef> refs) {
        if (refs == null || refs.isEmpty()) {
            throw new BusinessException("400", "No media item to append");
        }
        for (MediaItemRef ref : refs) {
            if (ref == null) {
                throw new BusinessException("400", "Media item reference must not be null");
            }
        }
        return write("append", () -> {
            for (MediaItemRef ref : refs) {
                if (mediaItemResolver.resolve(ref) == null) {
                    log.info("{}_APPEND_REJECTED scope={} ref={}", eventPrefix(), scope, ref);
                    throw new BusinessException("404", "Media item not found: " + ref);
                }
            }
            Integer max = libraryStore.maxPosition(scope);
            int next = (max == null ? -1 : max) + 1;
            List<Integer> assigned = new ArrayList<>(refs.size());
            for (MediaItemRef ref : refs) {
                libraryStore.insertEntry(scope, next, ref);
                assigned.add(next);
                next++;
            }
            log.info("{}_APPEND scope={} count={} firstPosition={}",
                    eventPrefix(), scope, refs.size(), assigned.get(0));
            return assigned;
        });
    }

    /**
     * Deletes every entry pointing at {@code ref}. Remaining positions are left as they are.
     */
    public int remove(MediaItemRef ref) {
        if (ref == null) {
            throw new BusinessException("400", "Media item reference must not be null");
        }
        return write("remove", () -> {
            int removed = libraryStore.deleteEntries(scope, ref);
            log.info("{}_REMOVE scope={} ref={} removed={}", eventPrefix(), scope, ref, removed);
            return removed;
        });
    }

    /**
     * Renumbers entries to match {@code orderedRefs}. The list must hold exactly the references currently in
     * the scope, duplicates included; the k-th occurrence of a reference takes its k-th entry in current order.
     *
     * @throws BusinessException {@code COLLECTION_ORDER_MISMATCH} when the list differs; nothing is written then
     */
    public void reorder(List<MediaItemRef> orderedRefs) {
        List<MediaItemRef> requested = orderedRefs == null ? Collections.<MediaItemRef>emptyList() : orderedRefs;
        write("reorder", () -> {
            List<CollectionEntry> entries = libraryStore.listEntries(scope);
            Map<MediaItemRef, Deque<CollectionEntry>> byRef = new HashMap<>();
            for (CollectionEntry entry : entries) {
                byRef.computeIfAbsent(entry.getRef(), key -> new ArrayDeque<CollectionEntry>()).addLast(entry);
            }
            List<CollectionEntry> target = new ArrayList<>(entries.size());
            for (MediaItemRef ref : requested) {
                Deque<CollectionEntry> candidates = byRef.get(ref);
                CollectionEntry entry = candidates == null ? null : candidates.pollFirst();
                if (entry == null) {
                    throw orderMismatch(requested.size(), entries.size(), "unexpected " + ref);
                }
                target.add(entry);
            }
            if (target.size() != entries.size()) {
                throw orderMismatch(requested.size(), entries.size(), "missing entries");
            }
            int changed = applyOrder(target);
            log.info("{}_REORDER scope={} size={} changed={}", eventPrefix(), scope, target.size(), changed);
            return changed;
        });
    }

    /**
     * Drags the rows at {@code draggedIndices} of the current {@link #list()} onto {@code dropIndex} and
     * persists the result. Entries whose item is gone from the catalog keep their relative order after the
     * displayed ones.
     *
     * @return the list after the move
     */
    public List<ResolvedEntry> move(List<Integer> draggedIndices, int dropIndex) {
        write("move", () -> {
            List<CollectionEntry> entries = libraryStore.listEntries(scope);
            List<CollectionEntry> displayed = new ArrayList<>(entries.size());
            List<CollectionEntry> dangling = new ArrayList<>();
            for (CollectionEntry entry : entries) {
                if (mediaItemResolver.resolve(entry.getRef()) != null) {
                    displayed.add(entry);
                } else {
                    dangling.add(entry);
                }
            }
            List<CollectionEntry> planned;
            try {
                planned = DragReorderPlanner.plan(displayed, draggedIndices, dropIndex);
            } catch (IllegalArgumentException e) {
                throw new BusinessException("400", e.getMessage());
            }
            List<CollectionEntry> target = new ArrayList<>(entries.size());
            target.addAll(planned);
            target.addAll(dangling);
            int changed = applyOrder(target);
            log.info("{}_MOVE scope={} dragged={} dropIndex={} changed={}",
                    eventPrefix(), scope, draggedIndices, dropIndex, changed);
            return changed;
        });
        return list();
    }

    /**
     * Entries ascending by position, each resolved to its catalog item. Entries whose item no longer exists
     * are left out.
     */
    public List<ResolvedEntry> list() {
        return read(() -> resolveAll(libraryStore.listEntries(scope)));
    }

    public int size() {
        return read(() -> libraryStore.countEntries(scope));
    }

    public int clear() {
        return write("clear", () -> {
            int removed = libraryStore.clearEntries(scope);
            log.info("{}_CLEAR scope={} removed={}", eventPrefix(), scope, removed);
            return removed;
        });
    }

    protected List<ResolvedEntry> resolveAll(List<CollectionEntry> entries) {
        List<ResolvedEntry> resolved = new ArrayList<>(entries.size());
        for (CollectionEntry entry : entries) {
            MediaItem item = mediaItemResolver.resolve(entry.getRef());
            if (item == null) {
                log.debug("COLLECTION_ENTRY_DANGLING scope={} entryId={} ref={}", scope, entry.getId(), entry.getRef());
                continue;
            }
            resolved.add(new ResolvedEntry(entry, item));
        }
        return resolved;
    }

    protected <T> T write(String operation, Supplier<T> action) {
        Lock lock = scopeLockRegistry.lockFor(scope).writeLock();
        lock.lock();
        try {
            T result = transactionOperations.execute(status -> action.get());
            recordMutation(operation);
            return result;
        } finally {
            lock.unlock();
        }
    }

    protected <T> T read(Supplier<T> action) {
        Lock lock = scopeLockRegistry.lockFor(scope).readLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    protected abstract String eventPrefix();

    private int applyOrder(List<CollectionEntry> target) {
        int changed = 0;
        for (int i = 0; i < target.size(); i++) {
            CollectionEntry entry = target.get(i);
            if (entry.getPosition() != i) {
                libraryStore.updateEntryPosition(scope, entry.getId(), i);
                changed++;
            }
        }
        return changed;
    }

    private BusinessException orderMismatch(int requested, int current, String detail) {
        log.warn("COLLECTION_ORDER_MISMATCH scope={} requested={} current={} detail={}",
                scope, requested, current, detail);
        return new BusinessException("COLLECTION_ORDER_MISMATCH",
                "Order does not match the current entries of " + scope,
                "Reload the list and try again");
    }

    private void recordMutation(String operation) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("library.collection.mutation",
                    "scope", scope.isQueue() ? "queue" : "playlist",
                    "operation", operation).increment();
        } catch (Exception ex) {
            log.debug("Collection metric counter failed, scope={}", scope, ex);
        }
    }
}
