package com.sandkev.PhotoSweep;

import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A listed file plus the attributes read (without following links) while walking the tree.
 */
@Value
public class ScanEntry {
    Path path;
    long size;
    Instant createdTime;
    Instant modifiedTime;

    public FileKind getKind() {
        return FileKind.of(path);
    }
}
