package com.example.medialibrary.domain.model;

import java.util.Collections;
import java.util.List;

/**
 * Messages a library scan emits, in order, to its single consumer. {@link Complete} is always the last one.
 */
public abstract class ScanProgressEvent {

    public enum Type {
        STARTING_FOLDER,
        FOUND_FILE,
        SCANNED_FILE,
        COMPLETE
    }

    private final Type type;

    protected ScanProgressEvent(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    public boolean isTerminal() {
        return type == Type.COMPLETE;
    }

    public static final class StartingFolder extends ScanProgressEvent {

        private final String folder;

        public StartingFolder(String folder) {
            super(Type.STARTING_FOLDER);
            this.folder = folder;
        }

        public String getFolder() {
            return folder;
        }
    }

    public static final class FoundFile extends ScanProgressEvent {

        private final int found;
        private final int skipped;
        private final String path;

        public FoundFile(int found, int skipped, String path) {
            super(Type.FOUND_FILE);
            this.found = found;
            this.skipped = skipped;
            this.path = path;
        }

        public int getFound() {
            return found;
        }

        public int getSkipped() {
            return skipped;
        }

        public String getPath() {
            return path;
        }
    }

    public static final class ScannedFile extends ScanProgressEvent {

        private final int found;
        private final int skipped;
        private final int added;
        private final int updated;
        private final String path;

        public ScannedFile(int found, int skipped, int added, int updated, String path) {
            super(Type.SCANNED_FILE);
            this.found = found;
            this.skipped = skipped;
            this.added = added;
            this.updated = updated;
            this.path = path;
        }

        public int getFound() {
            return found;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getAdded() {
            return added;
        }

        public int getUpdated() {
            return updated;
        }

        public String getPath() {
            return path;
        }
    }

    public static final class Complete extends ScanProgressEvent {

        private final int found;
        private final int skipped;
        private final int added;
        private final int updated;
        private final List<String> staleFiles;

        public Complete(int found, int skipped, int added, int updated, List<String> staleFiles) {
            super(Type.COMPLETE);
            this.found = found;
            this.skipped = skipped;
            this.added = added;
            this.updated = updated;
            this.staleFiles = staleFiles == null
                    ? Collections.<String>emptyList()
                    : Collections.unmodifiableList(staleFiles);
        }

        public int getFound() {
            return found;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getAdded() {
            return added;
        }

        public int getUpdated() {
            return updated;
        }

        public List<String> getStaleFiles() {
            return staleFiles;
        }
    }
}
