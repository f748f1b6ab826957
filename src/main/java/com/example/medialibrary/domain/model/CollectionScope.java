package com.example.medialibrary.domain.model;

import java.util.Objects;

/**
 * One ordering context: the playback queue, or a single playlist.
 */
public final class CollectionScope {

    public static final CollectionScope QUEUE = new CollectionScope(null);

    private final Long playlistId;

    private CollectionScope(Long playlistId) {
        this.playlistId = playlistId;
    }

    public static CollectionScope playlist(Long playlistId) {
        if (playlistId == null) {
            throw new IllegalArgumentException("playlist id must not be null");
        }
        return new CollectionScope(playlistId);
    }

    public boolean isQueue() {
        return playlistId == null;
    }

    public Long getPlaylistId() {
        return playlistId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CollectionScope)) {
            return false;
        }
        return Objects.equals(playlistId, ((CollectionScope) o).playlistId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(playlistId);
    }

    @Override
    public String toString() {
        return isQueue() ? "queue" : "playlist:" + playlistId;
    }
}
