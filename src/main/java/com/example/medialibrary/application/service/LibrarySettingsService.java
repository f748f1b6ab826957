package com.example.medialibrary.application.service;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.exception.BusinessException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Library roots in scan order. Seeded from {@code app.library.folders} and edited at runtime.
 */
@Service
public class LibrarySettingsService {

    private static final Logger log = LoggerFactory.getLogger(LibrarySettingsService.class);

    private final List<String> folders = new ArrayList<>();

    public LibrarySettingsService(AppLibraryProperties appLibraryProperties) {
        for (String folder : appLibraryProperties.getFolders()) {
            if (!StringUtils.hasText(folder)) {
                continue;
            }
            String normalized = Paths.get(folder.trim()).toAbsolutePath().normalize().toString();
            if (!folders.contains(normalized)) {
                folders.add(normalized);
            }
        }
    }

    public synchronized List<String> listFolders() {
        return new ArrayList<>(folders);
    }

    /**
     * Adds an existing directory, stored as its real path. Adding a folder twice is a no-op.
     */
    public synchronized List<String> addFolder(String folder) {
        String canonical = canonicalize(folder);
        if (!folders.contains(canonical)) {
            folders.add(canonical);
            log.info("LIBRARY_FOLDER_ADDED folder={} total={}", canonical, folders.size());
        }
        return new ArrayList<>(folders);
    }

    public synchronized List<String> removeFolder(String folder) {
        if (!StringUtils.hasText(folder)) {
            throw new BusinessException("400", "Folder must not be empty");
        }
        String trimmed = folder.trim();
        boolean removed = folders.remove(trimmed);
        if (!removed) {
            try {
                removed = folders.remove(Paths.get(trimmed).toAbsolutePath().normalize().toString());
            } catch (InvalidPathException e) {
                throw new BusinessException("400", "Invalid folder path: " + trimmed);
            }
        }
        if (!removed) {
            throw new BusinessException("404", "Library folder not found: " + trimmed);
        }
        log.info("LIBRARY_FOLDER_REMOVED folder={} total={}", trimmed, folders.size());
        return new ArrayList<>(folders);
    }

    private String canonicalize(String folder) {
        if (!StringUtils.hasText(folder)) {
            throw new BusinessException("400", "Folder must not be empty");
        }
        Path path;
        try {
            path = Paths.get(folder.trim());
        } catch (InvalidPathException e) {
            throw new BusinessException("400", "Invalid folder path: " + folder);
        }
        if (!Files.isDirectory(path)) {
            throw new BusinessException("400", "Not a directory: " + folder, "Pick an existing folder");
        }
        try {
            return path.toRealPath().toString();
        } catch (IOException e) {
            throw new BusinessException("400", "Cannot resolve folder: " + folder);
        }
    }
}
