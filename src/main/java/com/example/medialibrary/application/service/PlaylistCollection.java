package com.example.medialibrary.application.service;

import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.domain.model.CollectionScope;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Items of one playlist. Obtained from {@link PlaylistService#collection(Long)}.
 */
public class PlaylistCollection extends OrderedCollection {

    public PlaylistCollection(Long playlistId,
                              LibraryStore libraryStore,
                              MediaItemResolver mediaItemResolver,
                              ScopeLockRegistry scopeLockRegistry,
                              TransactionOperations transactionOperations,
                              MeterRegistry meterRegistry) {
        super(CollectionScope.playlist(playlistId), libraryStore, mediaItemResolver, scopeLockRegistry,
                transactionOperations, meterRegistry);
    }

    public Long getPlaylistId() {
        return getScope().getPlaylistId();
    }

    @Override
    protected String eventPrefix() {
        return "PLAYLIST";
    }
}
