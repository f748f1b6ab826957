package com.example.medialibrary.domain.model;

import lombok.Data;

/**
 * What a probe reads from one audio file. Tag fields are {@code null} when absent; a file without any tag
 * still carries its duration.
 */
@Data
public class AudioMetadata {

    private String title;

    private String artist;

    private String album;

    private String albumArtist;

    private String trackNumber;

    private String genre;

    private Integer durationSec;

    public static AudioMetadata untagged(Integer durationSec) {
        AudioMetadata metadata = new AudioMetadata();
        metadata.setDurationSec(durationSec);
        return metadata;
    }

    public boolean hasTags() {
        return title != null || artist != null || album != null || albumArtist != null
                || trackNumber != null || genre != null;
    }
}
