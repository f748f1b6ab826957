package com.example.medialibrary.api.request;

import java.time.LocalDateTime;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class ChannelVideoRequest {

    @NotBlank
    @Size(max = 32)
    private String videoId;

    @NotBlank
    @Size(max = 512)
    private String title;

    @Min(0)
    private Integer durationSec;

    @Size(max = 1024)
    private String thumbnailUrl;

    private LocalDateTime publishedAt;
}
