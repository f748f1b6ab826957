package com.example.medialibrary.domain.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Grouping key for filtering the catalog by (album artist or artist, album). Comparison is case-sensitive
 * and places a missing value before any present one.
 */
public final class Facet implements Comparable<Facet> {

    private static final Comparator<Facet> NATURAL_ORDER = Comparator
            .comparing(Facet::getAlbumArtistOrArtist, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(Facet::getAlbum, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(Facet::isAll);

    private static final Facet ALL = new Facet(null, null, true);

    private final String albumArtistOrArtist;
    private final String album;
    private final boolean all;

    private Facet(String albumArtistOrArtist, String album, boolean all) {
        this.albumArtistOrArtist = albumArtistOrArtist;
        this.album = album;
        this.all = all;
    }

    public static Facet all() {
        return ALL;
    }

    public static Facet of(String albumArtistOrArtist, String album) {
        return new Facet(albumArtistOrArtist, album, false);
    }

    public String getAlbumArtistOrArtist() {
        return albumArtistOrArtist;
    }

    public String getAlbum() {
        return album;
    }

    public boolean isAll() {
        return all;
    }

    @Override
    public int compareTo(Facet other) {
        return NATURAL_ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Facet)) {
            return false;
        }
        Facet other = (Facet) o;
        return all == other.all
                && Objects.equals(albumArtistOrArtist, other.albumArtistOrArtist)
                && Objects.equals(album, other.album);
    }

    @Override
    public int hashCode() {
        return Objects.hash(albumArtistOrArtist, album, all);
    }

    @Override
    public String toString() {
        return all ? "Facet[all]" : "Facet[" + albumArtistOrArtist + " / " + album + "]";
    }
}
