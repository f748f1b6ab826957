package com.example.medialibrary.application.service;

import com.example.medialibrary.domain.model.ScanDecision;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides per discovered file whether the catalog already holds it completely, holds it without a duration,
 * or has never seen it. Built once per scan from a catalog snapshot; the two sets are disjoint.
 *
 * <p>Not thread-safe: owned by the scan worker.
 */
public final class ScanClassifier {

    private final Set<String> complete;
    private final Set<String> incomplete;

    public ScanClassifier(Set<String> complete, Set<String> incomplete) {
        this.complete = complete == null ? new HashSet<String>() : new HashSet<>(complete);
        this.incomplete = incomplete == null ? new HashSet<String>() : new HashSet<>(incomplete);
        for (String filename : this.incomplete) {
            if (this.complete.contains(filename)) {
                throw new IllegalArgumentException("filename is both complete and incomplete: " + filename);
            }
        }
    }

    /**
     * Partitions tracks by whether a duration is present.
     */
    public static ScanClassifier fromTracks(List<TrackEntity> tracks) {
        Set<String> complete = new HashSet<>();
        Set<String> incomplete = new HashSet<>();
        if (tracks != null) {
            for (TrackEntity track : tracks) {
                if (track == null || track.getFilename() == null) {
                    continue;
                }
                if (track.getDurationSec() != null) {
                    complete.add(track.getFilename());
                } else {
                    incomplete.add(track.getFilename());
                }
            }
        }
        return new ScanClassifier(complete, incomplete);
    }

    public ScanDecision classify(String filename) {
        if (complete.contains(filename)) {
            return ScanDecision.SKIP;
        }
        if (incomplete.contains(filename)) {
            return ScanDecision.REFRESH;
        }
        return ScanDecision.INSERT;
    }

    /**
     * Reflects a write made during the current scan, so a file reached again through an overlapping root
     * is not inserted twice.
     */
    public void record(String filename, boolean hasDuration) {
        if (hasDuration) {
            incomplete.remove(filename);
            complete.add(filename);
        } else if (!complete.contains(filename)) {
            incomplete.add(filename);
        }
    }

    public int completeCount() {
        return complete.size();
    }

    public int incompleteCount() {
        return incomplete.size();
    }
}
