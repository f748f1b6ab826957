package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.request.MediaRefRequest;
import com.example.medialibrary.api.request.MediaRefsRequest;
import com.example.medialibrary.api.request.MoveItemsRequest;
import com.example.medialibrary.api.request.ReorderItemsRequest;
import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.api.response.CollectionItemResponse;
import com.example.medialibrary.application.service.MediaItemViews;
import com.example.medialibrary.application.service.PlaybackQueue;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/queue")
public class QueueController {

    private final PlaybackQueue playbackQueue;

    public QueueController(PlaybackQueue playbackQueue) {
        this.playbackQueue = playbackQueue;
    }

    @GetMapping
    public ApiResponse<List<CollectionItemResponse>> listQueue() {
        return ApiResponse.success(MediaItemViews.toEntryResponses(playbackQueue.list()));
    }

    @PostMapping
    public ApiResponse<List<Integer>> append(@Valid @RequestBody MediaRefsRequest request) {
        return ApiResponse.success(playbackQueue.appendAll(MediaRefs.parseAll(request.getRefs())));
    }

    /**
     * Returns {@code null} data when the queue is empty.
     */
    @PostMapping("/pop")
    public ApiResponse<CollectionItemResponse> popFront() {
        return ApiResponse.success(MediaItemViews.toResponse(playbackQueue.popFront()));
    }

    @PostMapping("/remove")
    public ApiResponse<Integer> remove(@Valid @RequestBody MediaRefRequest request) {
        return ApiResponse.success(playbackQueue.remove(MediaRefs.parse(request.getRef())));
    }

    @PutMapping("/order")
    public ApiResponse<List<CollectionItemResponse>> reorder(@Valid @RequestBody ReorderItemsRequest request) {
        playbackQueue.reorder(MediaRefs.parseAll(request.getRefs()));
        return ApiResponse.success(MediaItemViews.toEntryResponses(playbackQueue.list()));
    }

    @PostMapping("/move")
    public ApiResponse<List<CollectionItemResponse>> move(@Valid @RequestBody MoveItemsRequest request) {
        return ApiResponse.success(MediaItemViews.toEntryResponses(
                playbackQueue.move(request.getDraggedIndices(), request.getDropIndex())));
    }

    @GetMapping("/size")
    public ApiResponse<Integer> size() {
        return ApiResponse.success(playbackQueue.size());
    }

    @DeleteMapping
    public ApiResponse<Integer> clear() {
        return ApiResponse.success(playbackQueue.clear());
    }
}
