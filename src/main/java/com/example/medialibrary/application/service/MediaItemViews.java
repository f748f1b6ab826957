package com.example.medialibrary.application.service;

import com.example.medialibrary.api.response.CollectionItemResponse;
import com.example.medialibrary.api.response.MediaItemResponse;
import com.example.medialibrary.domain.model.MediaItem;
import com.example.medialibrary.domain.model.ResolvedEntry;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import java.util.ArrayList;
import java.util.List;

public final class MediaItemViews {

    private MediaItemViews() {
    }

    public static MediaItemResponse toResponse(MediaItem item) {
        MediaItemResponse response = new MediaItemResponse();
        response.setRef(item.getRef().toString());
        response.setKind(item.getKind().getPrefix());
        response.setTitle(item.getTitle());
        response.setArtist(item.getArtist());
        response.setAlbum(item.getAlbum());
        response.setDurationSec(item.getDurationSec());
        response.setDurationText(item.getDurationText());
        response.setPlayCount(item.getPlayCount());
        response.setLastPlayed(item.getLastPlayed());
        response.setAdded(item.getAdded());
        if (item.isTrack()) {
            TrackEntity track = item.asTrack();
            response.setAlbumArtist(track.getAlbumArtist());
            response.setGenre(track.getGenre());
            response.setTrackNumber(track.getTrackNumber());
        } else {
            VideoEntity video = item.asVideo();
            response.setThumbnailUrl(video.getThumbnailUrl());
        }
        return response;
    }

    public static List<MediaItemResponse> toResponses(List<MediaItem> items) {
        List<MediaItemResponse> responses = new ArrayList<>(items.size());
        for (MediaItem item : items) {
            responses.add(toResponse(item));
        }
        return responses;
    }

    public static CollectionItemResponse toResponse(ResolvedEntry entry) {
        if (entry == null) {
            return null;
        }
        return new CollectionItemResponse(
                entry.getEntry().getId(),
                entry.getPosition(),
                entry.getEntry().getAddedAt(),
                toResponse(entry.getItem()));
    }

    public static List<CollectionItemResponse> toEntryResponses(List<ResolvedEntry> entries) {
        List<CollectionItemResponse> responses = new ArrayList<>(entries.size());
        for (ResolvedEntry entry : entries) {
            responses.add(toResponse(entry));
        }
        return responses;
    }
}
