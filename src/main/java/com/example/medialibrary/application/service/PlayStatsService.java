package com.example.medialibrary.application.service;

import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.MediaItemRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class PlayStatsService {

    private static final Logger log = LoggerFactory.getLogger(PlayStatsService.class);

    private final LibraryStore libraryStore;

    public PlayStatsService(LibraryStore libraryStore) {
        this.libraryStore = libraryStore;
    }

    /**
     * Counts a play and stamps {@code last_played}.
     */
    public void recordPlay(MediaItemRef ref) {
        apply(ref, true);
    }

    /**
     * Stamps {@code last_played} without counting a play.
     */
    public void markPlayed(MediaItemRef ref) {
        apply(ref, false);
    }

    private void apply(MediaItemRef ref, boolean incrementCount) {
        if (ref == null) {
            throw new BusinessException("400", "Media item reference must not be null");
        }
        int updated = ref.isTrack()
                ? libraryStore.recordTrackPlay(ref.getTrackFilename(), incrementCount)
                : libraryStore.recordVideoPlay(ref.getVideoId(), incrementCount);
        if (updated <= 0) {
            throw new BusinessException("404", "Media item not found: " + ref);
        }
        log.info("MEDIA_PLAYED ref={} counted={}", ref, incrementCount);
    }
}
