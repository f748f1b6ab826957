package com.example.medialibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.medialibrary.domain.model.ScanDecision;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import org.junit.jupiter.api.Test;

class ScanClassifierTest {

    @Test
    void shouldClassifyByMembership() {
        ScanClassifier classifier = ScanClassifier.fromTracks(Arrays.asList(
                track("/m/a.mp3", 100),
                track("/m/b.mp3", null)));

        assertEquals(ScanDecision.SKIP, classifier.classify("/m/a.mp3"));
        assertEquals(ScanDecision.REFRESH, classifier.classify("/m/b.mp3"));
        assertEquals(ScanDecision.INSERT, classifier.classify("/m/c.mp3"));
        assertEquals(1, classifier.completeCount());
        assertEquals(1, classifier.incompleteCount());
    }

    @Test
    void shouldRejectOverlappingSets() {
        assertThrows(IllegalArgumentException.class, () -> new ScanClassifier(
                new HashSet<>(Collections.singletonList("/m/a.mp3")),
                new HashSet<>(Collections.singletonList("/m/a.mp3"))));
    }

    @Test
    void shouldReflectWritesMadeDuringScan() {
        ScanClassifier classifier = ScanClassifier.fromTracks(Collections.singletonList(track("/m/b.mp3", null)));

        classifier.record("/m/new.mp3", false);
        classifier.record("/m/b.mp3", true);

        assertEquals(ScanDecision.REFRESH, classifier.classify("/m/new.mp3"));
        assertEquals(ScanDecision.SKIP, classifier.classify("/m/b.mp3"));
    }

    @Test
    void shouldTreatEmptyCatalogAsAllInserts() {
        ScanClassifier classifier = ScanClassifier.fromTracks(null);

        assertEquals(ScanDecision.INSERT, classifier.classify("/m/a.mp3"));
    }

    private TrackEntity track(String filename, Integer durationSec) {
        TrackEntity track = new TrackEntity();
        track.setFilename(filename);
        track.setDurationSec(durationSec);
        return track;
    }
}
