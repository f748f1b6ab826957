package com.example.medialibrary.application.service;

import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.domain.model.MediaItem;
import com.example.medialibrary.domain.model.MediaItemRef;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import org.springframework.stereotype.Component;

@Component
public class MediaItemResolver {

    private final LibraryStore libraryStore;

    public MediaItemResolver(LibraryStore libraryStore) {
        this.libraryStore = libraryStore;
    }

    /**
     * @return the referenced item, or {@code null} when it is no longer in the catalog
     */
    public MediaItem resolve(MediaItemRef ref) {
        if (ref == null) {
            return null;
        }
        if (ref.isTrack()) {
            TrackEntity track = libraryStore.lookupByFilename(ref.getTrackFilename());
            return track == null ? null : MediaItem.ofTrack(track);
        }
        VideoEntity video = libraryStore.lookupVideoById(ref.getVideoId());
        return video == null ? null : MediaItem.ofVideo(video);
    }
}
