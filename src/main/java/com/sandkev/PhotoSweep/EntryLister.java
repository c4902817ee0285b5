package com.sandkev.PhotoSweep;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists every regular file under a root. Symbolic links are not followed and directories that
 * cannot be read are skipped.
 */
@Slf4j
public class EntryLister {

    public List<ScanEntry> list(Path root) throws IOException {
        List<ScanEntry> entries = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    entries.add(new ScanEntry(
                            file.toAbsolutePath(),
                            attrs.size(),
                            attrs.creationTime().toInstant(),
                            attrs.lastModifiedTime().toInstant()));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("skipping unreadable entry {}: {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (exc != null) {
                    log.debug("listing of {} stopped early: {}", dir, exc.toString());
                }
                return FileVisitResult.CONTINUE;
            }
        });
        log.info("found {} files in {}", entries.size(), root);
        return entries;
    }
}
