package com.example.medialibrary.application.service;

import com.example.medialibrary.domain.model.Facet;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Derives the facet list from a catalog snapshot. Holds no state between calls.
 */
public final class FacetBuilder {

    private FacetBuilder() {
    }

    /**
     * The "all" facet first, then every distinct (album artist or artist, album) pair in natural order.
     */
    public static List<Facet> build(List<TrackEntity> tracks) {
        TreeSet<Facet> distinct = new TreeSet<>();
        if (tracks != null) {
            for (TrackEntity track : tracks) {
                if (track != null) {
                    distinct.add(Facet.of(albumArtistOrArtist(track), track.getAlbum()));
                }
            }
        }
        List<Facet> facets = new ArrayList<>(distinct.size() + 1);
        facets.add(Facet.all());
        facets.addAll(distinct);
        return facets;
    }

    public static boolean matches(Facet facet, TrackEntity track) {
        if (facet == null || facet.isAll()) {
            return true;
        }
        return Objects.equals(facet.getAlbumArtistOrArtist(), albumArtistOrArtist(track))
                && Objects.equals(facet.getAlbum(), track.getAlbum());
    }

    public static String albumArtistOrArtist(TrackEntity track) {
        return track.getAlbumArtist() != null ? track.getAlbumArtist() : track.getArtist();
    }
}
