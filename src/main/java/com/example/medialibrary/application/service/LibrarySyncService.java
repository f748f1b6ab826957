package com.example.medialibrary.application.service;

import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.config.AppScanProperties;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.AudioMetadata;
import com.example.medialibrary.domain.model.ScanDecision;
import com.example.medialibrary.domain.model.ScanProgressEvent;
import com.example.medialibrary.infrastructure.parser.AudioMetadataParser;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.walker.DirectoryWalk;
import com.example.medialibrary.infrastructure.walker.DirectoryWalker;
import com.example.medialibrary.infrastructure.walker.WalkResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Reconciles library folders against the track catalog in one pass, streaming progress to a
 * {@link ScanProgressChannel}. A failing file never aborts the scan: everything written before a crash stays
 * written and the next run picks up where this one stopped.
 */
@Service
public class LibrarySyncService {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncService.class);

    private static final String OUTCOME_SKIP = "skip";
    private static final String OUTCOME_REFRESH = "refresh";
    private static final String OUTCOME_INSERT = "insert";
    private static final String OUTCOME_FAILED = "failed";

    private final LibraryStore libraryStore;
    private final DirectoryWalker directoryWalker;
    private final AudioMetadataParser audioMetadataParser;
    private final AppLibraryProperties appLibraryProperties;
    private final AppScanProperties appScanProperties;
    private final MeterRegistry meterRegistry;

    public LibrarySyncService(LibraryStore libraryStore,
                              DirectoryWalker directoryWalker,
                              AudioMetadataParser audioMetadataParser,
                              AppLibraryProperties appLibraryProperties,
                              AppScanProperties appScanProperties,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.libraryStore = libraryStore;
        this.directoryWalker = directoryWalker;
        this.audioMetadataParser = audioMetadataParser;
        this.appLibraryProperties = appLibraryProperties;
        this.appScanProperties = appScanProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * Scans {@code roots} in order and publishes the full event sequence, ending with exactly one
     * {@link ScanProgressEvent.Complete}, which is also returned.
     *
     * @throws BusinessException {@code LIBRARY_NO_FOLDERS} when no root is given; nothing is published then
     */
    public ScanProgressEvent.Complete sync(List<String> roots, ScanProgressChannel channel) {
        if (roots == null || roots.isEmpty()) {
            throw new BusinessException("LIBRARY_NO_FOLDERS", "No library folder configured",
                    "Add a library folder and start the scan again");
        }
        Set<String> extensions = appLibraryProperties.normalizedAudioExtensions();
        if (extensions.isEmpty()) {
            throw new BusinessException("LIBRARY_NO_EXTENSIONS", "app.library.audio-extensions is empty");
        }
        long startedAtNanos = System.nanoTime();

        List<Path> rootPaths = new ArrayList<>();
        for (String root : roots) {
            rootPaths.add(Paths.get(root).toAbsolutePath().normalize());
        }
        ScanClassifier classifier = ScanClassifier.fromTracks(libraryStore.listAllTracks());
        log.info("LIBRARY_SCAN_START roots={} cataloged={} incomplete={}",
                rootPaths, classifier.completeCount() + classifier.incompleteCount(), classifier.incompleteCount());

        ScanCounters counters = new ScanCounters();
        for (Path root : rootPaths) {
            publish(channel, counters, new ScanProgressEvent.StartingFolder(root.toString()));
            log.info("LIBRARY_SCAN_FOLDER root={}", root);
            scanRoot(root, extensions, classifier, counters, channel);
        }

        List<String> staleFiles = findStale(rootPaths);
        ScanProgressEvent.Complete complete = new ScanProgressEvent.Complete(
                counters.found, counters.skipped, counters.added, counters.updated, staleFiles);
        publish(channel, counters, complete);

        long costNanos = System.nanoTime() - startedAtNanos;
        recordDuration("library.scan.duration", costNanos);
        log.info("LIBRARY_SCAN_FINISH found={} skipped={} added={} updated={} failed={} stale={} staleSample={} costMs={}",
                counters.found, counters.skipped, counters.added, counters.updated, counters.failed,
                staleFiles.size(), preview(staleFiles), TimeUnit.NANOSECONDS.toMillis(costNanos));
        return complete;
    }

    private void scanRoot(Path root,
                          Set<String> extensions,
                          ScanClassifier classifier,
                          ScanCounters counters,
                          ScanProgressChannel channel) {
        try (DirectoryWalk walk = directoryWalker.walk(root)) {
            while (walk.hasNext()) {
                WalkResult result = walk.next();
                if (result.isFailed()) {
                    log.warn("SCAN_WALK_ENTRY_FAILED root={} path={} reason={}",
                            root, result.getPath(), result.getError().toString());
                    continue;
                }
                if (!result.isRegularFile() || !isAudioFile(result.getPath(), extensions)) {
                    continue;
                }
                scanFile(result.getPath().toString(), classifier, counters, channel);
            }
        }
    }

    private void scanFile(String filename,
                          ScanClassifier classifier,
                          ScanCounters counters,
                          ScanProgressChannel channel) {
        counters.found++;
        publish(channel, counters, new ScanProgressEvent.FoundFile(counters.found, counters.skipped, filename));

        ScanDecision decision = classifier.classify(filename);
        switch (decision) {
            case SKIP:
                counters.skipped++;
                recordCounter("library.scan.files", "outcome", OUTCOME_SKIP);
                break;
            case REFRESH:
                refresh(filename, classifier, counters);
                break;
            case INSERT:
            default:
                insert(filename, classifier, counters);
                break;
        }

        publish(channel, counters, new ScanProgressEvent.ScannedFile(
                counters.found, counters.skipped, counters.added, counters.updated, filename));

        int interval = appScanProperties.getProgressLogInterval();
        if (interval > 0 && counters.found % interval == 0) {
            log.info("LIBRARY_SCAN_PROGRESS found={} skipped={} added={} updated={} failed={}",
                    counters.found, counters.skipped, counters.added, counters.updated, counters.failed);
        }
    }

    private void refresh(String filename, ScanClassifier classifier, ScanCounters counters) {
        Integer durationSec;
        try {
            durationSec = audioMetadataParser.parseDuration(Paths.get(filename).toFile());
        } catch (Exception e) {
            counters.failed++;
            recordCounter("library.scan.files", "outcome", OUTCOME_FAILED);
            log.warn("SCAN_PROBE_FAILED mode=duration path={} reason={}", filename, describe(e));
            return;
        }
        if (durationSec == null) {
            log.debug("SCAN_PROBE_NO_DURATION path={}", filename);
            return;
        }
        try {
            libraryStore.updateDuration(filename, durationSec);
        } catch (RuntimeException e) {
            counters.failed++;
            recordCounter("library.scan.files", "outcome", OUTCOME_FAILED);
            log.warn("SCAN_STORE_WRITE_FAILED op=updateDuration path={}", filename, e);
            return;
        }
        classifier.record(filename, true);
        counters.updated++;
        recordCounter("library.scan.files", "outcome", OUTCOME_REFRESH);
    }

    private void insert(String filename, ScanClassifier classifier, ScanCounters counters) {
        AudioMetadata metadata;
        try {
            metadata = audioMetadataParser.parse(Paths.get(filename).toFile());
        } catch (Exception e) {
            metadata = null;
            log.warn("SCAN_PROBE_FAILED mode=full path={} reason={}", filename, describe(e));
        }
        if (metadata != null && !metadata.hasTags()) {
            log.debug("SCAN_FILE_UNTAGGED path={} durationSec={}", filename, metadata.getDurationSec());
        }
        TrackEntity entity = buildTrack(filename, metadata);
        try {
            libraryStore.insertTrack(entity);
        } catch (RuntimeException e) {
            counters.failed++;
            recordCounter("library.scan.files", "outcome", OUTCOME_FAILED);
            log.warn("SCAN_STORE_WRITE_FAILED op=insertTrack path={}", filename, e);
            return;
        }
        classifier.record(filename, entity.getDurationSec() != null);
        counters.added++;
        recordCounter("library.scan.files", "outcome", OUTCOME_INSERT);
    }

    private List<String> findStale(List<Path> rootPaths) {
        List<String> stale = new ArrayList<>();
        List<String> filenames;
        try {
            filenames = libraryStore.listAllFilenames();
        } catch (RuntimeException e) {
            log.error("LIBRARY_SCAN_STALE_CHECK_FAILED roots={}", rootPaths, e);
            return stale;
        }
        if (filenames == null) {
            return stale;
        }
        for (String filename : filenames) {
            if (isUnderAnyRoot(filename, rootPaths) && !Files.exists(Paths.get(filename), LinkOption.NOFOLLOW_LINKS)) {
                stale.add(filename);
            }
        }
        return stale;
    }

    static boolean isUnderAnyRoot(String filename, List<Path> rootPaths) {
        Path path;
        try {
            path = Paths.get(filename).toAbsolutePath().normalize();
        } catch (RuntimeException e) {
            return false;
        }
        for (Path root : rootPaths) {
            if (path.startsWith(root)) {
                return true;
            }
        }
        return false;
    }

    static TrackEntity buildTrack(String filename, AudioMetadata metadata) {
        TrackEntity entity = new TrackEntity();
        entity.setFilename(filename);
        if (metadata != null) {
            entity.setTitle(metadata.getTitle());
            entity.setArtist(metadata.getArtist());
            entity.setAlbum(metadata.getAlbum());
            entity.setAlbumArtist(metadata.getAlbumArtist());
            entity.setGenre(metadata.getGenre());
            entity.setTrackNumber(metadata.getTrackNumber());
            entity.setDurationSec(metadata.getDurationSec());
        }
        return entity;
    }

    private boolean isAudioFile(Path path, Set<String> extensions) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString();
        int idx = fileName.lastIndexOf('.');
        if (idx < 0 || idx == fileName.length() - 1) {
            return false;
        }
        return extensions.contains(fileName.substring(idx + 1).toLowerCase(Locale.ROOT));
    }

    private void publish(ScanProgressChannel channel, ScanCounters counters, ScanProgressEvent event) {
        if (channel == null) {
            return;
        }
        channel.publish(event);
        int threshold = appScanProperties.getEventBacklogWarnThreshold();
        if (!counters.backlogWarned && threshold > 0 && channel.backlog() >= threshold) {
            counters.backlogWarned = true;
            log.warn("LIBRARY_SCAN_EVENT_BACKLOG backlog={} threshold={}", channel.backlog(), threshold);
        }
    }

    private String preview(List<String> staleFiles) {
        int limit = Math.max(0, appLibraryProperties.getStaleLogPreviewLimit());
        if (staleFiles.size() <= limit) {
            return staleFiles.toString();
        }
        return staleFiles.subList(0, limit) + "...";
    }

    private String describe(Exception e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Scan metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Scan metric timer failed, name={}", name, ex);
        }
    }

    private static final class ScanCounters {
        private int found;
        private int skipped;
        private int added;
        private int updated;
        private int failed;
        private boolean backlogWarned;
    }
}
