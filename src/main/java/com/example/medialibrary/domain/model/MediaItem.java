package com.example.medialibrary.domain.model;

import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import java.time.LocalDateTime;

/**
 * A playable catalog row: either a local track or a remote video. Queues, playlists and playback only ever
 * handle this type.
 */
public final class MediaItem {

    private static final String UNKNOWN = "Unknown";

    private final TrackEntity track;
    private final VideoEntity video;

    private MediaItem(TrackEntity track, VideoEntity video) {
        this.track = track;
        this.video = video;
    }

    public static MediaItem ofTrack(TrackEntity track) {
        if (track == null || track.getFilename() == null) {
            throw new IllegalArgumentException("track with filename required");
        }
        return new MediaItem(track, null);
    }

    public static MediaItem ofVideo(VideoEntity video) {
        if (video == null || video.getId() == null) {
            throw new IllegalArgumentException("video with id required");
        }
        return new MediaItem(null, video);
    }

    public MediaKind getKind() {
        return track != null ? MediaKind.TRACK : MediaKind.VIDEO;
    }

    public boolean isTrack() {
        return track != null;
    }

    public boolean isVideo() {
        return video != null;
    }

    public TrackEntity asTrack() {
        return track;
    }

    public VideoEntity asVideo() {
        return video;
    }

    public MediaItemRef getRef() {
        return isTrack() ? MediaItemRef.track(track.getFilename()) : MediaItemRef.video(video.getId());
    }

    public String getTitle() {
        if (isTrack()) {
            return track.getTitle() == null ? UNKNOWN : track.getTitle();
        }
        return video.getTitle();
    }

    public String getArtist() {
        if (isTrack()) {
            return track.getArtist() == null ? UNKNOWN : track.getArtist();
        }
        return "YouTube";
    }

    public String getAlbum() {
        if (isTrack()) {
            return track.getAlbum() == null ? UNKNOWN : track.getAlbum();
        }
        return "";
    }

    public Integer getDurationSec() {
        return isTrack() ? track.getDurationSec() : video.getDurationSec();
    }

    /**
     * {@code m:ss}, or {@code ?:??} when the duration is unknown.
     */
    public String getDurationText() {
        Integer seconds = getDurationSec();
        if (seconds == null) {
            return "?:??";
        }
        return String.format("%d:%02d", seconds / 60, seconds % 60);
    }

    public int getPlayCount() {
        Integer count = isTrack() ? track.getPlayCount() : video.getPlayCount();
        return count == null ? 0 : count;
    }

    public LocalDateTime getLastPlayed() {
        return isTrack() ? track.getLastPlayed() : video.getLastPlayed();
    }

    /**
     * Catalog insertion time; videos without one fall back to their fetch time.
     */
    public LocalDateTime getAdded() {
        if (isTrack()) {
            return track.getAdded();
        }
        return video.getAdded() != null ? video.getAdded() : video.getFetchedAt();
    }

    @Override
    public String toString() {
        return getRef().toString();
    }
}
