package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.request.CreatePlaylistRequest;
import com.example.medialibrary.api.request.MediaRefRequest;
import com.example.medialibrary.api.request.MediaRefsRequest;
import com.example.medialibrary.api.request.MoveItemsRequest;
import com.example.medialibrary.api.request.RenamePlaylistRequest;
import com.example.medialibrary.api.request.ReorderItemsRequest;
import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.api.response.CollectionItemResponse;
import com.example.medialibrary.api.response.PlaylistResponse;
import com.example.medialibrary.application.service.MediaItemViews;
import com.example.medialibrary.application.service.PlaylistCollection;
import com.example.medialibrary.application.service.PlaylistService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/playlists")
public class PlaylistController {

    private final PlaylistService playlistService;

    public PlaylistController(PlaylistService playlistService) {
        this.playlistService = playlistService;
    }

    @PostMapping
    public ApiResponse<PlaylistResponse> createPlaylist(@Valid @RequestBody CreatePlaylistRequest request) {
        return ApiResponse.success(playlistService.createPlaylist(request.getName()));
    }

    @GetMapping
    public ApiResponse<List<PlaylistResponse>> listPlaylists() {
        return ApiResponse.success(playlistService.listPlaylists());
    }

    @PatchMapping("/{id}")
    public ApiResponse<PlaylistResponse> renamePlaylist(@PathVariable("id") Long id,
                                                        @Valid @RequestBody RenamePlaylistRequest request) {
        return ApiResponse.success(playlistService.renamePlaylist(id, request.getName()));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<String> deletePlaylist(@PathVariable("id") Long id) {
        playlistService.deletePlaylist(id);
        return ApiResponse.success("DELETED");
    }

    @GetMapping("/{id}/items")
    public ApiResponse<List<CollectionItemResponse>> listItems(@PathVariable("id") Long id) {
        return ApiResponse.success(MediaItemViews.toEntryResponses(playlistService.collection(id).list()));
    }

    @PostMapping("/{id}/items")
    public ApiResponse<List<Integer>> addItems(@PathVariable("id") Long id,
                                               @Valid @RequestBody MediaRefsRequest request) {
        return ApiResponse.success(playlistService.collection(id).appendAll(MediaRefs.parseAll(request.getRefs())));
    }

    @PostMapping("/{id}/items/remove")
    public ApiResponse<Integer> removeItem(@PathVariable("id") Long id,
                                           @Valid @RequestBody MediaRefRequest request) {
        return ApiResponse.success(playlistService.collection(id).remove(MediaRefs.parse(request.getRef())));
    }

    @PutMapping("/{id}/items/order")
    public ApiResponse<List<CollectionItemResponse>> reorderItems(@PathVariable("id") Long id,
                                                                  @Valid @RequestBody ReorderItemsRequest request) {
        PlaylistCollection collection = playlistService.collection(id);
        collection.reorder(MediaRefs.parseAll(request.getRefs()));
        return ApiResponse.success(MediaItemViews.toEntryResponses(collection.list()));
    }

    @PostMapping("/{id}/items/move")
    public ApiResponse<List<CollectionItemResponse>> moveItems(@PathVariable("id") Long id,
                                                               @Valid @RequestBody MoveItemsRequest request) {
        return ApiResponse.success(MediaItemViews.toEntryResponses(
                playlistService.collection(id).move(request.getDraggedIndices(), request.getDropIndex())));
    }
}
