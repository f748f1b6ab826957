package com.example.medialibrary.infrastructure.walker;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class NioDirectoryWalker implements DirectoryWalker {

    private static final Logger log = LoggerFactory.getLogger(NioDirectoryWalker.class);

    @Override
    public DirectoryWalk walk(Path root) {
        return new NioDirectoryWalk(root);
    }

    private static final class NioDirectoryWalk implements DirectoryWalk {

        private final Deque<DirectoryFrame> frames = new ArrayDeque<>();
        private final Deque<WalkResult> ready = new ArrayDeque<>();

        private NioDirectoryWalk(Path root) {
            BasicFileAttributes attrs;
            try {
                // the root itself may be a link; only entries below it are never followed
                attrs = Files.readAttributes(root, BasicFileAttributes.class);
            } catch (IOException e) {
                ready.add(WalkResult.failed(root, e));
                return;
            }
            ready.add(WalkResult.entry(root, attrs.isRegularFile(), attrs.isDirectory()));
            if (attrs.isDirectory()) {
                open(root);
            }
        }

        @Override
        public boolean hasNext() {
            fill();
            return !ready.isEmpty();
        }

        @Override
        public WalkResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.poll();
        }

        @Override
        public void close() {
            while (!frames.isEmpty()) {
                frames.pop().close();
            }
            ready.clear();
        }

        private void fill() {
            while (ready.isEmpty() && !frames.isEmpty()) {
                DirectoryFrame frame = frames.peek();
                Path child;
                try {
                    if (!frame.iterator.hasNext()) {
                        frames.pop().close();
                        continue;
                    }
                    child = frame.iterator.next();
                } catch (DirectoryIteratorException e) {
                    ready.add(WalkResult.failed(frame.dir, e.getCause()));
                    frames.pop().close();
                    continue;
                }
                visit(child);
            }
        }

        private void visit(Path child) {
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (IOException e) {
                ready.add(WalkResult.failed(child, e));
                return;
            }
            ready.add(WalkResult.entry(child, attrs.isRegularFile(), attrs.isDirectory()));
            if (attrs.isDirectory()) {
                open(child);
            }
        }

        private void open(Path dir) {
            try {
                DirectoryStream<Path> stream = Files.newDirectoryStream(dir);
                frames.push(new DirectoryFrame(dir, stream));
            } catch (IOException e) {
                ready.add(WalkResult.failed(dir, e));
            }
        }
    }

    private static final class DirectoryFrame {

        private final Path dir;
        private final DirectoryStream<Path> stream;
        private final Iterator<Path> iterator;

        private DirectoryFrame(Path dir, DirectoryStream<Path> stream) {
            this.dir = dir;
            this.stream = stream;
            this.iterator = stream.iterator();
        }

        private void close() {
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("Directory stream close failed, dir={}", dir, e);
            }
        }
    }
}
