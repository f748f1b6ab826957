package com.example.medialibrary.api.request;

import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class AddChannelVideosRequest {

    @NotEmpty
    @Size(max = 1000)
    private List<@Valid ChannelVideoRequest> videos;
}
