package com.example.medialibrary.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FacetResponse {

    private String albumArtistOrArtist;
    private String album;
    private boolean all;
}
