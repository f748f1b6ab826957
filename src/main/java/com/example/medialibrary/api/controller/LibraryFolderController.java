package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.request.LibraryFolderRequest;
import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.application.service.LibrarySettingsService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library/folders")
public class LibraryFolderController {

    private final LibrarySettingsService librarySettingsService;

    public LibraryFolderController(LibrarySettingsService librarySettingsService) {
        this.librarySettingsService = librarySettingsService;
    }

    @GetMapping
    public ApiResponse<List<String>> listFolders() {
        return ApiResponse.success(librarySettingsService.listFolders());
    }

    @PostMapping
    public ApiResponse<List<String>> addFolder(@Valid @RequestBody LibraryFolderRequest request) {
        return ApiResponse.success(librarySettingsService.addFolder(request.getFolder()));
    }

    @DeleteMapping
    public ApiResponse<List<String>> removeFolder(@RequestParam("folder") String folder) {
        return ApiResponse.success(librarySettingsService.removeFolder(folder));
    }
}
