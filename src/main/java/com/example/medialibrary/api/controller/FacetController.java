package com.example.medialibrary.api.controller;

import com.example.medialibrary.api.response.ApiResponse;
import com.example.medialibrary.api.response.FacetResponse;
import com.example.medialibrary.application.service.FacetService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/facets")
public class FacetController {

    private final FacetService facetService;

    public FacetController(FacetService facetService) {
        this.facetService = facetService;
    }

    @GetMapping
    public ApiResponse<List<FacetResponse>> listFacets() {
        return ApiResponse.success(facetService.listFacets());
    }
}
