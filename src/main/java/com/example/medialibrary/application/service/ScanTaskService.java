package com.example.medialibrary.application.service;

import com.example.medialibrary.api.response.ScanEventResponse;
import com.example.medialibrary.api.response.ScanEventsResponse;
import com.example.medialibrary.api.response.ScanSessionResponse;
import com.example.medialibrary.api.response.StaleRemovalResponse;
import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.common.config.AppScanProperties;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.ScanProgressEvent;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs library scans on the scan worker, one at a time, and acts as the single consumer of their progress.
 */
@Service
public class ScanTaskService {

    private static final Logger log = LoggerFactory.getLogger(ScanTaskService.class);

    public static final String STATUS_PENDING = "PENDING";
    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILED = "FAILED";

    private final LibrarySyncService librarySyncService;
    private final LibrarySettingsService librarySettingsService;
    private final LibraryStore libraryStore;
    private final AppScanProperties appScanProperties;
    private final ExecutorService libraryScanExecutor;

    private final AtomicLong sessionSequence = new AtomicLong();
    private final AtomicReference<ScanSession> current = new AtomicReference<>();

    public ScanTaskService(LibrarySyncService librarySyncService,
                           LibrarySettingsService librarySettingsService,
                           LibraryStore libraryStore,
                           AppScanProperties appScanProperties,
                           @Qualifier("libraryScanExecutor") ExecutorService libraryScanExecutor) {
        this.librarySyncService = librarySyncService;
        this.librarySettingsService = librarySettingsService;
        this.libraryStore = libraryStore;
        this.appScanProperties = appScanProperties;
        this.libraryScanExecutor = libraryScanExecutor;
    }

    /**
     * Starts a scan over {@code roots}, or over every configured folder when none are given.
     *
     * @throws BusinessException {@code LIBRARY_NO_FOLDERS} with nothing to scan, {@code 409} while another scan runs
     */
    public ScanSessionResponse startScan(List<String> roots) {
        List<String> effectiveRoots = roots == null || roots.isEmpty()
                ? librarySettingsService.listFolders()
                : dedupe(roots);
        if (effectiveRoots.isEmpty()) {
            throw new BusinessException("LIBRARY_NO_FOLDERS", "No library folder configured",
                    "Add a library folder and start the scan again");
        }

        ScanSession session = new ScanSession(sessionSequence.incrementAndGet(), effectiveRoots);
        ScanSession previous = current.get();
        if (previous != null && previous.isActive()) {
            throw new BusinessException("409", "A library scan is already running", "Wait for it to complete");
        }
        if (!current.compareAndSet(previous, session)) {
            throw new BusinessException("409", "A library scan is already running", "Wait for it to complete");
        }
        log.info("SCAN_TASK_CREATED sessionId={} roots={}", session.id, effectiveRoots);

        try {
            libraryScanExecutor.submit(() -> executeScan(session));
        } catch (RejectedExecutionException e) {
            session.fail("Scan scheduling failed: " + e.getMessage());
            log.warn("SCAN_TASK_REJECTED sessionId={} reason={}", session.id, e.getMessage());
            throw new BusinessException("TASK_EXECUTOR_REJECTED", "Scan scheduling failed", "Retry later");
        }
        return toResponse(session);
    }

    public ScanSessionResponse getCurrent() {
        ScanSession session = current.get();
        if (session == null) {
            throw new BusinessException("404", "No library scan has been started");
        }
        return toResponse(session);
    }

    public boolean isScanRunning() {
        ScanSession session = current.get();
        return session != null && session.isActive();
    }

    /**
     * Hands buffered progress events to the caller in publish order. Each event is delivered once.
     */
    public ScanEventsResponse drainEvents(Integer maxEvents) {
        ScanSession session = current.get();
        if (session == null) {
            throw new BusinessException("404", "No library scan has been started");
        }
        int limit = appScanProperties.getMaxEventsPerDrain();
        if (maxEvents != null && maxEvents > 0) {
            limit = Math.min(limit, maxEvents);
        }
        List<ScanEventResponse> events = new ArrayList<>();
        for (ScanProgressEvent event : session.channel.drain(limit)) {
            events.add(toEventResponse(event));
        }
        return new ScanEventsResponse(session.id, session.status, events, session.channel.isFinished());
    }

    /**
     * Deletes confirmed stale tracks. Only filenames reported stale by the last finished scan, and still
     * missing on disk, are deleted; an empty request confirms the whole stale set.
     */
    public StaleRemovalResponse removeStale(List<String> filenames) {
        ScanSession session = current.get();
        if (session == null || session.complete == null) {
            throw new BusinessException("SCAN_NOT_COMPLETED", "No finished library scan to confirm");
        }
        if (session.isActive()) {
            throw new BusinessException("409", "A library scan is already running", "Wait for it to complete");
        }
        Set<String> staleSet = new LinkedHashSet<>(session.complete.getStaleFiles());
        List<String> requested = filenames == null || filenames.isEmpty()
                ? new ArrayList<>(staleSet)
                : dedupe(filenames);
        List<String> accepted = new ArrayList<>();
        List<String> ignored = new ArrayList<>();
        for (String filename : requested) {
            if (staleSet.contains(filename) && !Files.exists(Paths.get(filename), LinkOption.NOFOLLOW_LINKS)) {
                accepted.add(filename);
            } else {
                ignored.add(filename);
            }
        }
        int deleted = accepted.isEmpty() ? 0 : libraryStore.deleteByFilenames(accepted);
        log.info("LIBRARY_STALE_REMOVED sessionId={} requested={} deleted={} ignored={}",
                session.id, requested.size(), deleted, ignored.size());
        return new StaleRemovalResponse(requested.size(), deleted, ignored);
    }

    private void executeScan(ScanSession session) {
        session.markRunning();
        log.info("SCAN_TASK_RUNNING sessionId={}", session.id);
        try {
            ScanProgressEvent.Complete complete = librarySyncService.sync(session.roots, session.channel);
            session.succeed(complete);
            log.info("SCAN_TASK_RESULT sessionId={} status={} found={} skipped={} added={} updated={} stale={}",
                    session.id, STATUS_SUCCESS, complete.getFound(), complete.getSkipped(), complete.getAdded(),
                    complete.getUpdated(), complete.getStaleFiles().size());
        } catch (Exception e) {
            log.error("Library scan failed, sessionId={}", session.id, e);
            session.fail(truncate(e.getMessage(), 1000));
        }
    }

    private ScanSessionResponse toResponse(ScanSession session) {
        ScanProgressEvent.Complete complete = session.complete;
        return new ScanSessionResponse(
                session.id,
                session.status,
                Collections.unmodifiableList(session.roots),
                session.startTime,
                session.endTime,
                complete == null ? 0 : complete.getFound(),
                complete == null ? 0 : complete.getSkipped(),
                complete == null ? 0 : complete.getAdded(),
                complete == null ? 0 : complete.getUpdated(),
                complete == null ? Collections.<String>emptyList() : complete.getStaleFiles(),
                session.channel.backlog(),
                session.errorSummary);
    }

    static ScanEventResponse toEventResponse(ScanProgressEvent event) {
        ScanEventResponse response = new ScanEventResponse();
        response.setType(event.getType().name());
        if (event instanceof ScanProgressEvent.StartingFolder) {
            response.setFolder(((ScanProgressEvent.StartingFolder) event).getFolder());
        } else if (event instanceof ScanProgressEvent.FoundFile) {
            ScanProgressEvent.FoundFile found = (ScanProgressEvent.FoundFile) event;
            response.setFound(found.getFound());
            response.setSkipped(found.getSkipped());
            response.setPath(found.getPath());
        } else if (event instanceof ScanProgressEvent.ScannedFile) {
            ScanProgressEvent.ScannedFile scanned = (ScanProgressEvent.ScannedFile) event;
            response.setFound(scanned.getFound());
            response.setSkipped(scanned.getSkipped());
            response.setAdded(scanned.getAdded());
            response.setUpdated(scanned.getUpdated());
            response.setPath(scanned.getPath());
        } else if (event instanceof ScanProgressEvent.Complete) {
            ScanProgressEvent.Complete complete = (ScanProgressEvent.Complete) event;
            response.setFound(complete.getFound());
            response.setSkipped(complete.getSkipped());
            response.setAdded(complete.getAdded());
            response.setUpdated(complete.getUpdated());
            response.setStaleFiles(complete.getStaleFiles());
        }
        return response;
    }

    private List<String> dedupe(List<String> values) {
        Set<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                unique.add(value.trim());
            }
        }
        return new ArrayList<>(unique);
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static final class ScanSession {

        private final Long id;
        private final List<String> roots;
        private final ScanProgressChannel channel = new ScanProgressChannel();
        private final LocalDateTime startTime = LocalDateTime.now();
        private volatile String status = STATUS_PENDING;
        private volatile LocalDateTime endTime;
        private volatile ScanProgressEvent.Complete complete;
        private volatile String errorSummary;

        private ScanSession(Long id, List<String> roots) {
            this.id = id;
            this.roots = new ArrayList<>(roots);
        }

        private boolean isActive() {
            return STATUS_PENDING.equals(status) || STATUS_RUNNING.equals(status);
        }

        private void markRunning() {
            status = STATUS_RUNNING;
        }

        private void succeed(ScanProgressEvent.Complete result) {
            complete = result;
            endTime = LocalDateTime.now();
            status = STATUS_SUCCESS;
        }

        private void fail(String message) {
            errorSummary = message;
            endTime = LocalDateTime.now();
            status = STATUS_FAILED;
        }
    }
}
