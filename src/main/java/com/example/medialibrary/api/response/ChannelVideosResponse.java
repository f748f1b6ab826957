package com.example.medialibrary.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelVideosResponse {

    private Long channelId;
    private int received;
    private int inserted;
    private int ignored;
}
