package com.sandkev.PhotoSweep;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A fingerprinted, non-empty file found by a scan.
 * The path is where the file was at scan time; the sweep itself may move it afterwards.
 */
@Value
@Builder
public class FileRecord {
    Path path;
    long size;
    Instant createdTime;
    Instant modifiedTime;
    String fingerprint;
    FileKind kind;

    public HashKey getHashKey() {
        return new HashKey(kind, fingerprint);
    }

    static FileRecord of(ScanEntry entry, String fingerprint) {
        return FileRecord.builder()
                .path(entry.getPath())
                .size(entry.getSize())
                .createdTime(entry.getCreatedTime())
                .modifiedTime(entry.getModifiedTime())
                .fingerprint(fingerprint)
                .kind(entry.getKind())
                .build();
    }
}
