package com.example.medialibrary.domain.model;

public enum MediaKind {
    TRACK("track"),
    VIDEO("video");

    private final String prefix;

    MediaKind(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
