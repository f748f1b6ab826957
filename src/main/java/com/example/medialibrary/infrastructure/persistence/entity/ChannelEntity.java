package com.example.medialibrary.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ChannelEntity {

    private Long id;

    private String channelId;

    private String name;

    private String handle;

    private String url;

    private String thumbnailUrl;

    private LocalDateTime lastFetched;

    private LocalDateTime createdAt;
}
