package com.example.medialibrary.infrastructure.walker;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One step of a directory walk: either an entry with its (non-followed) file type, or the error raised while
 * reading it.
 */
public final class WalkResult {

    private final Path path;
    private final boolean regularFile;
    private final boolean directory;
    private final IOException error;

    private WalkResult(Path path, boolean regularFile, boolean directory, IOException error) {
        this.path = path;
        this.regularFile = regularFile;
        this.directory = directory;
        this.error = error;
    }

    public static WalkResult entry(Path path, boolean regularFile, boolean directory) {
        return new WalkResult(path, regularFile, directory, null);
    }

    public static WalkResult failed(Path path, IOException error) {
        return new WalkResult(path, false, false, error);
    }

    public Path getPath() {
        return path;
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isRegularFile() {
        return regularFile;
    }

    public boolean isDirectory() {
        return directory;
    }

    public IOException getError() {
        return error;
    }
}
