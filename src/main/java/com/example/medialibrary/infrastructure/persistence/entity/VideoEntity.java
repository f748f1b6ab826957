package com.example.medialibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class VideoEntity {

    private Long id;

    private String videoId;

    private Long channelId;

    private String title;

    private Integer durationSec;

    private String thumbnailUrl;

    private LocalDateTime publishedAt;

    private LocalDateTime fetchedAt;

    private Integer playCount;

    private LocalDateTime lastPlayed;

    private LocalDateTime added;
}
