package com.example.medialibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.config.AppScanProperties;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.AudioMetadata;
import com.example.medialibrary.domain.model.ScanProgressEvent;
import com.example.medialibrary.infrastructure.parser.AudioMetadataParser;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.walker.NioDirectoryWalker;
import com.example.medialibrary.support.InMemoryLibraryStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class LibrarySyncServiceTest {

    @TempDir
    Path tempDir;

    private Path root;
    private InMemoryLibraryStore store;
    private AudioMetadataParser parser;
    private SimpleMeterRegistry meterRegistry;
    private LibrarySyncService service;

    @BeforeEach
    void setUp() throws Exception {
        root = tempDir.resolve("music").toAbsolutePath().normalize();
        Files.createDirectories(root);
        store = new InMemoryLibraryStore();
        parser = mock(AudioMetadataParser.class);
        when(parser.parse(any(File.class))).thenReturn(metadata("Song", 180));
        when(parser.parseDuration(any(File.class))).thenReturn(200);
        meterRegistry = new SimpleMeterRegistry();
        service = new LibrarySyncService(store, new NioDirectoryWalker(), parser,
                new AppLibraryProperties(), new AppScanProperties(), beanProvider(meterRegistry));
    }

    @Test
    void shouldSkipCompleteAndRefreshIncompleteTracks() throws Exception {
        String a = touch(root.resolve("A.mp3"));
        String b = touch(root.resolve("B.mp3"));
        store.putTrack(track(a, 120));
        store.putTrack(track(b, null));

        ScanProgressEvent.Complete complete = service.sync(roots(root), new ScanProgressChannel());

        assertEquals(2, complete.getFound());
        assertEquals(1, complete.getSkipped());
        assertEquals(1, complete.getUpdated());
        assertEquals(0, complete.getAdded());
        assertEquals(200, store.lookupByFilename(b).getDurationSec().intValue());
        assertEquals(120, store.lookupByFilename(a).getDurationSec().intValue());
        verify(parser, never()).parse(any(File.class));
        assertEquals(1.0, meterRegistry.counter("library.scan.files", "outcome", "skip").count());
        assertEquals(1.0, meterRegistry.counter("library.scan.files", "outcome", "refresh").count());
    }

    @Test
    void shouldInsertNewFilesWithProbedTags() throws Exception {
        String song = touch(root.resolve("album").resolve("01.flac"));

        ScanProgressEvent.Complete complete = service.sync(roots(root), new ScanProgressChannel());

        assertEquals(1, complete.getAdded());
        TrackEntity inserted = store.lookupByFilename(song);
        assertEquals("Song", inserted.getTitle());
        assertEquals(180, inserted.getDurationSec().intValue());
    }

    @Test
    void shouldBeIdempotentWithoutFilesystemChanges() throws Exception {
        touch(root.resolve("one.mp3"));
        touch(root.resolve("two.ogg"));

        ScanProgressEvent.Complete first = service.sync(roots(root), new ScanProgressChannel());
        ScanProgressEvent.Complete second = service.sync(roots(root), new ScanProgressChannel());

        assertEquals(2, first.getAdded());
        assertEquals(0, second.getAdded());
        assertEquals(0, second.getUpdated());
        assertEquals(2, second.getSkipped());
        assertEquals(first.getStaleFiles(), second.getStaleFiles());
    }

    @Test
    void shouldReportDeletedFileAsStale() throws Exception {
        touch(root.resolve("A.mp3"));
        String c = touch(root.resolve("C.mp3"));
        service.sync(roots(root), new ScanProgressChannel());

        Files.delete(root.resolve("C.mp3"));
        ScanProgressEvent.Complete complete = service.sync(roots(root), new ScanProgressChannel());

        assertEquals(Collections.singletonList(c), complete.getStaleFiles());
        assertEquals(2, store.trackCount());
    }

    @Test
    void shouldNotFlagMissingFilesUnderUnscannedRoots() throws Exception {
        Path other = tempDir.resolve("other").toAbsolutePath().normalize();
        Files.createDirectories(other);
        store.putTrack(track(other.resolve("gone.mp3").toString(), 100));
        store.putTrack(track(tempDir.resolve("music-extra").resolve("gone.mp3").toString(), 100));
        touch(root.resolve("here.mp3"));

        ScanProgressEvent.Complete complete = service.sync(roots(root), new ScanProgressChannel());

        assertTrue(complete.getStaleFiles().isEmpty());
    }

    @Test
    void shouldInsertFilenameOnlyRowWhenProbeFails() throws Exception {
        String broken = touch(root.resolve("broken.mp3"));
        when(parser.parse(any(File.class))).thenThrow(new IOException("corrupt"));

        ScanProgressEvent.Complete complete = service.sync(roots(root), new ScanProgressChannel());

        assertEquals(1, complete.getAdded());
        TrackEntity row = store.lookupByFilename(broken);
        assertEquals(broken, row.getFilename());
        assertNull(row.getTitle());
        assertNull(row.getDurationSec());
    }

    @Test
    void shouldLeaveRowUntouchedWhenDurationProbeFails() throws Exception {
        String b = touch(root.resolve("B.mp3"));
        store.putTrack(track(b, null));
        when(parser.parseDuration(any(File.class))).thenThrow(new IOException("unreadable header"));

        ScanProgressEvent.Complete complete = service.sync(roots(root), new ScanProgressChannel());

        assertEquals(0, complete.getUpdated());
        assertEquals(0, complete.getSkipped());
        assertNull(store.lookupByFilename(b).getDurationSec());
    }

    @Test
    void shouldNotCountFailedStoreWritesAndKeepScanning() throws Exception {
        String bad = touch(root.resolve("a-bad.mp3"));
        String good = touch(root.resolve("b-good.mp3"));
        store.failWritesFor(bad);

        ScanProgressEvent.Complete complete = service.sync(roots(root), new ScanProgressChannel());

        assertEquals(2, complete.getFound());
        assertEquals(1, complete.getAdded());
        assertNull(store.lookupByFilename(bad));
        assertEquals(good, store.lookupByFilename(good).getFilename());
    }

    @Test
    void shouldRejectEmptyRootsBeforeAnyEvent() {
        ScanProgressChannel channel = new ScanProgressChannel();

        BusinessException error = assertThrows(BusinessException.class,
                () -> service.sync(Collections.<String>emptyList(), channel));

        assertEquals("LIBRARY_NO_FOLDERS", error.getCode());
        assertEquals(0, channel.backlog());
    }

    @Test
    void shouldEmitProtocolInOrderAndIgnoreNonAudioFiles() throws Exception {
        String song = touch(root.resolve("Song.MP3"));
        touch(root.resolve("cover.jpg"));
        touch(root.resolve("notes"));
        ScanProgressChannel channel = new ScanProgressChannel();

        service.sync(roots(root), channel);

        List<ScanProgressEvent> events = channel.drain(100);
        assertEquals(4, events.size());
        ScanProgressEvent.StartingFolder starting = (ScanProgressEvent.StartingFolder) events.get(0);
        assertEquals(root.toString(), starting.getFolder());
        ScanProgressEvent.FoundFile found = (ScanProgressEvent.FoundFile) events.get(1);
        assertEquals(1, found.getFound());
        assertEquals(0, found.getSkipped());
        assertEquals(song, found.getPath());
        ScanProgressEvent.ScannedFile scanned = (ScanProgressEvent.ScannedFile) events.get(2);
        assertEquals(1, scanned.getAdded());
        assertTrue(events.get(3).isTerminal());
        assertTrue(channel.isFinished());
    }

    @Test
    void shouldScanRootsInGivenOrderAndSurviveMissingRoot() throws Exception {
        Path second = tempDir.resolve("second").toAbsolutePath().normalize();
        touch(second.resolve("x.wav"));
        Path missing = tempDir.resolve("missing").toAbsolutePath().normalize();
        ScanProgressChannel channel = new ScanProgressChannel();

        ScanProgressEvent.Complete complete = service.sync(roots(missing, second), channel);

        List<String> folders = new ArrayList<>();
        for (ScanProgressEvent event : channel.drain(100)) {
            if (event instanceof ScanProgressEvent.StartingFolder) {
                folders.add(((ScanProgressEvent.StartingFolder) event).getFolder());
            }
        }
        assertEquals(Arrays.asList(missing.toString(), second.toString()), folders);
        assertEquals(1, complete.getAdded());
    }

    private List<String> roots(Path... paths) {
        List<String> result = new ArrayList<>();
        for (Path path : paths) {
            result.add(path.toString());
        }
        return result;
    }

    private String touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[] {1, 2, 3});
        return file.toString();
    }

    private TrackEntity track(String filename, Integer durationSec) {
        TrackEntity track = new TrackEntity();
        track.setFilename(filename);
        track.setDurationSec(durationSec);
        track.setPlayCount(0);
        return track;
    }

    private AudioMetadata metadata(String title, Integer durationSec) {
        AudioMetadata metadata = new AudioMetadata();
        metadata.setTitle(title);
        metadata.setDurationSec(durationSec);
        return metadata;
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
