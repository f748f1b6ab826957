package com.example.medialibrary.domain.model;

import java.util.Objects;

/**
 * Identity of a {@link MediaItem} inside queues and playlists: a track filename or a video surrogate id.
 * Exactly one side is ever set.
 *
 * <p>The string form is {@code track:<absolute filename>} or {@code video:<id>}.
 */
public final class MediaItemRef {

    private static final String SEPARATOR = ":";

    private final MediaKind kind;
    private final String trackFilename;
    private final Long videoId;

    private MediaItemRef(MediaKind kind, String trackFilename, Long videoId) {
        this.kind = kind;
        this.trackFilename = trackFilename;
        this.videoId = videoId;
    }

    public static MediaItemRef track(String filename) {
        if (filename == null || filename.isEmpty()) {
            throw new IllegalArgumentException("track filename must not be empty");
        }
        return new MediaItemRef(MediaKind.TRACK, filename, null);
    }

    public static MediaItemRef video(Long videoId) {
        if (videoId == null) {
            throw new IllegalArgumentException("video id must not be null");
        }
        return new MediaItemRef(MediaKind.VIDEO, null, videoId);
    }

    /**
     * Builds a reference from a nullable column pair, or returns {@code null} when the pair does not hold
     * exactly one value.
     */
    public static MediaItemRef fromColumns(String trackFilename, Long videoId) {
        boolean hasTrack = trackFilename != null && !trackFilename.isEmpty();
        boolean hasVideo = videoId != null;
        if (hasTrack == hasVideo) {
            return null;
        }
        return hasTrack ? track(trackFilename) : video(videoId);
    }

    public static MediaItemRef parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("media reference must not be null");
        }
        int idx = raw.indexOf(SEPARATOR);
        if (idx <= 0) {
            throw new IllegalArgumentException("media reference has no kind prefix: " + raw);
        }
        String prefix = raw.substring(0, idx);
        String value = raw.substring(idx + 1);
        if (MediaKind.TRACK.getPrefix().equals(prefix)) {
            return track(value);
        }
        if (MediaKind.VIDEO.getPrefix().equals(prefix)) {
            try {
                return video(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("video reference is not numeric: " + raw, e);
            }
        }
        throw new IllegalArgumentException("unknown media kind: " + prefix);
    }

    public MediaKind getKind() {
        return kind;
    }

    public boolean isTrack() {
        return kind == MediaKind.TRACK;
    }

    public boolean isVideo() {
        return kind == MediaKind.VIDEO;
    }

    public String getTrackFilename() {
        return trackFilename;
    }

    public Long getVideoId() {
        return videoId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MediaItemRef)) {
            return false;
        }
        MediaItemRef other = (MediaItemRef) o;
        return kind == other.kind
                && Objects.equals(trackFilename, other.trackFilename)
                && Objects.equals(videoId, other.videoId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, trackFilename, videoId);
    }

    @Override
    public String toString() {
        return kind.getPrefix() + SEPARATOR + (isTrack() ? trackFilename : String.valueOf(videoId));
    }
}
