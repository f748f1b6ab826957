package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.request.AddChannelVideosRequest;
import com.example.medialibrary.api.request.CreateChannelRequest;
import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.api.response.ChannelResponse;
import com.example.medialibrary.api.response.ChannelVideosResponse;
import com.example.medialibrary.api.response.MediaItemResponse;
import com.example.medialibrary.application.service.ChannelCatalogService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/channels")
public class ChannelController {

    private final ChannelCatalogService channelCatalogService;

    public ChannelController(ChannelCatalogService channelCatalogService) {
        this.channelCatalogService = channelCatalogService;
    }

    @GetMapping
    public ApiResponse<List<ChannelResponse>> listChannels() {
        return ApiResponse.success(channelCatalogService.listChannels());
    }

    @PostMapping
    public ApiResponse<ChannelResponse> addChannel(@Valid @RequestBody CreateChannelRequest request) {
        return ApiResponse.success(channelCatalogService.addChannel(request));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<String> deleteChannel(@PathVariable("id") Long id) {
        channelCatalogService.deleteChannel(id);
        return ApiResponse.success("DELETED");
    }

    @PostMapping("/{id}/videos")
    public ApiResponse<ChannelVideosResponse> addVideos(@PathVariable("id") Long id,
                                                        @Valid @RequestBody AddChannelVideosRequest request) {
        return ApiResponse.success(channelCatalogService.addVideos(id, request.getVideos()));
    }

    @GetMapping("/{id}/videos")
    public ApiResponse<List<MediaItemResponse>> listVideos(@PathVariable("id") Long id) {
        return ApiResponse.success(channelCatalogService.listVideos(id));
    }
}
