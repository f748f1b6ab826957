package com.example.medialibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class PlaylistItemEntity {

    private Long id;

    private Long playlistId;

    private String trackFilename;

    private Long youtubeVideoId;

    private Integer position;

    private LocalDateTime addedAt;
}
