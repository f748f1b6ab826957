package com.example.medialibrary.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateChannelRequest {

    @NotBlank
    @Size(max = 64)
    private String channelId;

    @NotBlank
    @Size(max = 255)
    private String name;

    @Size(max = 255)
    private String handle;

    @Size(max = 512)
    private String url;

    @Size(max = 1024)
    private String thumbnailUrl;
}
