package com.example.medialibrary.domain.model;

public enum ScanDecision {
    /** Cataloged with complete metadata. */
    SKIP,
    /** Cataloged but missing its duration. */
    REFRESH,
    /** Never seen before. */
    INSERT
}
