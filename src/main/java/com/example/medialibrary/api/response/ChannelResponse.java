package com.example.medialibrary.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelResponse {

    private Long id;
    private String channelId;
    private String name;
    private String handle;
    private String url;
    private String thumbnailUrl;
    private LocalDateTime lastFetched;
    private LocalDateTime createdAt;
}
