package com.example.medialibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class TrackEntity {

    private String filename;

    private String title;

    private String artist;

    private String album;

    private String albumArtist;

    private String genre;

    /**
     * Raw tag value, e.g. "3", "03/12" or "A2".
     */
    private String trackNumber;

    private Integer durationSec;

    private Integer playCount;

    private LocalDateTime lastPlayed;

    private LocalDateTime added;
}
