package com.example.medialibrary.application.service;

import com.example.medialibrary.api.response.MediaItemResponse;
import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.common.config.AppRecentProperties;
import com.example.medialibrary.domain.model.Facet;
import com.example.medialibrary.domain.model.MediaItem;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Service;

/**
 * Read-only catalog views: tracks by facet, and the merged recently played / recently added lists.
 */
@Service
public class TrackQueryService {

    private final LibraryStore libraryStore;
    private final AppRecentProperties appRecentProperties;

    public TrackQueryService(LibraryStore libraryStore, AppRecentProperties appRecentProperties) {
        this.libraryStore = libraryStore;
        this.appRecentProperties = appRecentProperties;
    }

    /**
     * Tracks matching {@code facet} ({@code null} or the "all" facet returns everything), by filename.
     */
    public List<MediaItemResponse> listTracks(Facet facet) {
        List<MediaItem> items = new ArrayList<>();
        for (TrackEntity track : libraryStore.listAllTracks()) {
            if (FacetBuilder.matches(facet, track)) {
                items.add(MediaItem.ofTrack(track));
            }
        }
        items.sort(Comparator.comparing((MediaItem item) -> item.asTrack().getFilename()));
        return MediaItemViews.toResponses(items);
    }

    /**
     * Tracks and videos played at least once, most recent first.
     */
    public List<MediaItemResponse> recentlyPlayed(Integer limit) {
        List<MediaItem> items = new ArrayList<>();
        for (MediaItem item : allItems()) {
            if (item.getLastPlayed() != null) {
                items.add(item);
            }
        }
        return MediaItemViews.toResponses(newestFirst(items, MediaItem::getLastPlayed, limit));
    }

    /**
     * Tracks and videos by catalog insertion time, newest first.
     */
    public List<MediaItemResponse> recentlyAdded(Integer limit) {
        return MediaItemViews.toResponses(newestFirst(allItems(), MediaItem::getAdded, limit));
    }

    private List<MediaItem> allItems() {
        List<MediaItem> items = new ArrayList<>();
        for (TrackEntity track : libraryStore.listAllTracks()) {
            items.add(MediaItem.ofTrack(track));
        }
        for (VideoEntity video : libraryStore.listAllVideos()) {
            items.add(MediaItem.ofVideo(video));
        }
        return items;
    }

    private List<MediaItem> newestFirst(List<MediaItem> items,
                                        Function<MediaItem, LocalDateTime> timestamp,
                                        Integer limit) {
        items.sort(Comparator.comparing(timestamp, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())));
        int effectiveLimit = limit == null ? appRecentProperties.getDefaultLimit() : limit;
        if (effectiveLimit <= 0 || items.size() <= effectiveLimit) {
            return items;
        }
        return new ArrayList<>(items.subList(0, effectiveLimit));
    }
}
