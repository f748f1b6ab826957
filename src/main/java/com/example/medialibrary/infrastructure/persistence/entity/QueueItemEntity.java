package com.example.medialibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class QueueItemEntity {

    private Long id;

    private Integer position;

    private String trackFilename;

    private Long youtubeVideoId;

    private LocalDateTime addedAt;
}
