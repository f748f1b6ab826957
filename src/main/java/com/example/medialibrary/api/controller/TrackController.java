package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.request.MediaRefRequest;
import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.api.response.MediaItemResponse;
import com.example.medialibrary.application.service.PlayStatsService;
import com.example.medialibrary.application.service.TrackQueryService;
import com.example.medialibrary.domain.model.Facet;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class TrackController {

    private final TrackQueryService trackQueryService;
    private final PlayStatsService playStatsService;

    public TrackController(TrackQueryService trackQueryService, PlayStatsService playStatsService) {
        this.trackQueryService = trackQueryService;
        this.playStatsService = playStatsService;
    }

    /**
     * With {@code facet=true} only tracks of the (artist, album) facet are returned; an omitted artist or
     * album selects the facet whose value is missing.
     */
    @GetMapping("/tracks")
    public ApiResponse<List<MediaItemResponse>> listTracks(
            @RequestParam(value = "facet", defaultValue = "false") boolean facet,
            @RequestParam(value = "artist", required = false) String artist,
            @RequestParam(value = "album", required = false) String album) {
        Facet filter = facet ? Facet.of(artist, album) : Facet.all();
        return ApiResponse.success(trackQueryService.listTracks(filter));
    }

    @GetMapping("/tracks/recent/played")
    public ApiResponse<List<MediaItemResponse>> recentlyPlayed(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ApiResponse.success(trackQueryService.recentlyPlayed(limit));
    }

    @GetMapping("/tracks/recent/added")
    public ApiResponse<List<MediaItemResponse>> recentlyAdded(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ApiResponse.success(trackQueryService.recentlyAdded(limit));
    }

    @PostMapping("/media/played")
    public ApiResponse<String> recordPlayed(@Valid @RequestBody MediaRefRequest request) {
        if (Boolean.FALSE.equals(request.getCountPlay())) {
            playStatsService.markPlayed(MediaRefs.parse(request.getRef()));
        } else {
            playStatsService.recordPlay(MediaRefs.parse(request.getRef()));
        }
        return ApiResponse.success("RECORDED");
    }
}
