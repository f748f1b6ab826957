package com.example.medialibrary.infrastructure.walker;

import java.nio.file.Path;

public interface DirectoryWalker {

    /**
     * Starts a depth-first walk below {@code root}. Symbolic links are reported but never followed, and an
     * entry that cannot be read is reported as a failed {@link WalkResult} instead of ending the walk.
     */
    DirectoryWalk walk(Path root);
}
