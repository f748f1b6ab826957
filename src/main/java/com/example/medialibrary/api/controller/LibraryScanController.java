package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.request.RemoveStaleRequest;
import com.example.medialibrary.api.request.StartScanRequest;
import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.api.response.ScanEventsResponse;
import com.example.medialibrary.api.response.ScanSessionResponse;
import com.example.medialibrary.api.response.StaleRemovalResponse;
import com.example.medialibrary.application.service.ScanTaskService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library")
public class LibraryScanController {

    private final ScanTaskService scanTaskService;

    public LibraryScanController(ScanTaskService scanTaskService) {
        this.scanTaskService = scanTaskService;
    }

    @PostMapping("/scans")
    public ApiResponse<ScanSessionResponse> startScan(@RequestBody(required = false) StartScanRequest request) {
        return ApiResponse.success(scanTaskService.startScan(request == null ? null : request.getRoots()));
    }

    @GetMapping("/scans/current")
    public ApiResponse<ScanSessionResponse> currentScan() {
        return ApiResponse.success(scanTaskService.getCurrent());
    }

    @GetMapping("/scans/current/events")
    public ApiResponse<ScanEventsResponse> drainEvents(
            @RequestParam(value = "max", required = false) Integer max) {
        return ApiResponse.success(scanTaskService.drainEvents(max));
    }

    @PostMapping("/stale/remove")
    public ApiResponse<StaleRemovalResponse> removeStale(@RequestBody(required = false) RemoveStaleRequest request) {
        return ApiResponse.success(scanTaskService.removeStale(request == null ? null : request.getFilenames()));
    }
}
