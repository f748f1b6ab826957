package com.example.medialibrary.infrastructure.walker;

import java.io.Closeable;
import java.util.Iterator;

/**
 * A lazy, single-pass walk over one root. Closing it releases any directory handles still open.
 */
public interface DirectoryWalk extends Iterator<WalkResult>, Closeable {

    @Override
    void close();
}
