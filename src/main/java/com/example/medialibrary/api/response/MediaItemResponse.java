package com.example.medialibrary.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MediaItemResponse {

    private String ref;
    private String kind;
    private String title;
    private String artist;
    private String album;
    private String albumArtist;
    private String genre;
    private String trackNumber;
    private Integer durationSec;
    private String durationText;
    private String thumbnailUrl;
    private int playCount;
    private LocalDateTime lastPlayed;
    private LocalDateTime added;
}
