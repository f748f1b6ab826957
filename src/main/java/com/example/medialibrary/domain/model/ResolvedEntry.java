package com.example.medialibrary.domain.model;

/**
 * A collection entry together with the catalog item it points at.
 */
public final class ResolvedEntry {

    private final CollectionEntry entry;
    private final MediaItem item;

    public ResolvedEntry(CollectionEntry entry, MediaItem item) {
        if (entry == null || item == null) {
            throw new IllegalArgumentException("entry and item are required");
        }
        this.entry = entry;
        this.item = item;
    }

    public CollectionEntry getEntry() {
        return entry;
    }

    public MediaItem getItem() {
        return item;
    }

    public int getPosition() {
        return entry.getPosition();
    }

    @Override
    public String toString() {
        return entry.getScope() + "@" + entry.getPosition() + "=" + item;
    }
}
