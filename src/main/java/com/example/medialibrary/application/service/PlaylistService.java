package com.example.medialibrary.application.service;

import com.example.medialibrary.api.response.PlaylistResponse;
import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.CollectionScope;
import com.example.medialibrary.infrastructure.persistence.entity.PlaylistEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.util.StringUtils;

@Service
public class PlaylistService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistService.class);

    private static final int MAX_NAME_LENGTH = 128;

    private final LibraryStore libraryStore;
    private final MediaItemResolver mediaItemResolver;
    private final ScopeLockRegistry scopeLockRegistry;
    private final TransactionOperations transactionOperations;
    private final MeterRegistry meterRegistry;

    public PlaylistService(LibraryStore libraryStore,
                           MediaItemResolver mediaItemResolver,
                           ScopeLockRegistry scopeLockRegistry,
                           ObjectProvider<TransactionOperations> transactionOperationsProvider,
                           ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.libraryStore = libraryStore;
        this.mediaItemResolver = mediaItemResolver;
        this.scopeLockRegistry = scopeLockRegistry;
        TransactionOperations operations = transactionOperationsProvider.getIfAvailable();
        this.transactionOperations = operations == null ? TransactionOperations.withoutTransaction() : operations;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * Playlists sorted by name.
     */
    public List<PlaylistResponse> listPlaylists() {
        List<PlaylistEntity> entities = new ArrayList<>(libraryStore.listPlaylists());
        entities.sort((a, b) -> {
            int byName = safeName(a).compareTo(safeName(b));
            if (byName != 0) {
                return byName;
            }
            return Long.compare(a.getId() == null ? 0L : a.getId(), b.getId() == null ? 0L : b.getId());
        });
        List<PlaylistResponse> result = new ArrayList<>(entities.size());
        for (PlaylistEntity entity : entities) {
            result.add(toResponse(entity));
        }
        return result;
    }

    public PlaylistResponse getPlaylist(Long playlistId) {
        return toResponse(requirePlaylist(playlistId));
    }

    public PlaylistResponse createPlaylist(String name) {
        String safeName = normalizePlaylistName(name);
        PlaylistEntity entity = new PlaylistEntity();
        entity.setName(safeName);
        libraryStore.insertPlaylist(entity);
        log.info("PLAYLIST_CREATED playlistId={} name={}", entity.getId(), safeName);
        PlaylistEntity created = entity.getId() == null ? null : libraryStore.lookupPlaylistById(entity.getId());
        return toResponse(created == null ? entity : created);
    }

    public PlaylistResponse renamePlaylist(Long playlistId, String name) {
        requirePlaylist(playlistId);
        String safeName = normalizePlaylistName(name);
        int updated = libraryStore.renamePlaylist(playlistId, safeName);
        if (updated <= 0) {
            throw new BusinessException("404", "Playlist not found");
        }
        log.info("PLAYLIST_RENAMED playlistId={} name={}", playlistId, safeName);
        return toResponse(libraryStore.lookupPlaylistById(playlistId));
    }

    /**
     * Deletes the playlist together with its items.
     */
    public void deletePlaylist(Long playlistId) {
        requirePlaylist(playlistId);
        CollectionScope scope = CollectionScope.playlist(playlistId);
        Lock lock = scopeLockRegistry.lockFor(scope).writeLock();
        lock.lock();
        try {
            transactionOperations.executeWithoutResult(status -> {
                int removedItems = libraryStore.clearEntries(scope);
                libraryStore.deletePlaylist(playlistId);
                log.info("PLAYLIST_DELETED playlistId={} removedItems={}", playlistId, removedItems);
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * The ordered items of an existing playlist.
     *
     * @throws BusinessException {@code 404} when the playlist does not exist
     */
    public PlaylistCollection collection(Long playlistId) {
        requirePlaylist(playlistId);
        return new PlaylistCollection(playlistId, libraryStore, mediaItemResolver, scopeLockRegistry,
                transactionOperations, meterRegistry);
    }

    private PlaylistEntity requirePlaylist(Long playlistId) {
        if (playlistId == null) {
            throw new BusinessException("400", "Playlist id must not be null");
        }
        PlaylistEntity playlist = libraryStore.lookupPlaylistById(playlistId);
        if (playlist == null) {
            throw new BusinessException("404", "Playlist not found");
        }
        return playlist;
    }

    private String normalizePlaylistName(String rawName) {
        if (!StringUtils.hasText(rawName)) {
            throw new BusinessException("400", "Playlist name must not be empty");
        }
        String name = rawName.trim();
        if (name.length() > MAX_NAME_LENGTH) {
            throw new BusinessException("400", "Playlist name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return name;
    }

    private String safeName(PlaylistEntity entity) {
        return entity.getName() == null ? "" : entity.getName();
    }

    private PlaylistResponse toResponse(PlaylistEntity entity) {
        int itemCount = entity.getId() == null ? 0 : libraryStore.countEntries(CollectionScope.playlist(entity.getId()));
        return new PlaylistResponse(entity.getId(), entity.getName(), itemCount, entity.getCreatedAt(),
                entity.getUpdatedAt());
    }
}
