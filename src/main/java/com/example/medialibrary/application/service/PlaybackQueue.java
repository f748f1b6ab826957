package com.example.medialibrary.application.service;

import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.domain.model.CollectionEntry;
import com.example.medialibrary.domain.model.CollectionScope;
import com.example.medialibrary.domain.model.MediaItem;
import com.example.medialibrary.domain.model.ResolvedEntry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * The playback queue: first in, first out by position.
 */
@Service
public class PlaybackQueue extends OrderedCollection {

    private static final Logger log = LoggerFactory.getLogger(PlaybackQueue.class);

    public PlaybackQueue(LibraryStore libraryStore,
                         MediaItemResolver mediaItemResolver,
                         ScopeLockRegistry scopeLockRegistry,
                         ObjectProvider<TransactionOperations> transactionOperationsProvider,
                         ObjectProvider<MeterRegistry> meterRegistryProvider) {
        super(CollectionScope.QUEUE, libraryStore, mediaItemResolver, scopeLockRegistry,
                transactionOperationsProvider.getIfAvailable(), meterRegistryProvider.getIfAvailable());
    }

    /**
     * Removes the entry with the lowest position and returns it resolved. Entries whose item has left the
     * catalog are discarded on the way. Remaining positions are not renumbered.
     *
     * @return the popped entry, or {@code null} when the queue holds nothing playable
     */
    public ResolvedEntry popFront() {
        return write("pop", () -> {
            while (true) {
                CollectionEntry first = libraryStore.firstEntry(getScope());
                if (first == null) {
                    return null;
                }
                libraryStore.deleteEntry(getScope(), first.getId());
                MediaItem item = mediaItemResolver.resolve(first.getRef());
                if (item != null) {
                    log.info("QUEUE_POP entryId={} position={} ref={}", first.getId(), first.getPosition(), first.getRef());
                    return new ResolvedEntry(first, item);
                }
                log.info("QUEUE_POP_DANGLING entryId={} ref={}", first.getId(), first.getRef());
            }
        });
    }

    @Override
    protected String eventPrefix() {
        return "QUEUE";
    }
}
