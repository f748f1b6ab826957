package com.example.medialibrary.application.service;

import com.example.medialibrary.api.response.FacetResponse;
import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.domain.model.Facet;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class FacetService {

    private final LibraryStore libraryStore;

    public FacetService(LibraryStore libraryStore) {
        this.libraryStore = libraryStore;
    }

    public List<FacetResponse> listFacets() {
        List<Facet> facets = FacetBuilder.build(libraryStore.listAllTracks());
        List<FacetResponse> result = new ArrayList<>(facets.size());
        for (Facet facet : facets) {
            result.add(new FacetResponse(facet.getAlbumArtistOrArtist(), facet.getAlbum(), facet.isAll()));
        }
        return result;
    }
}
