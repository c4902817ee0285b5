package com.sandkev.PhotoSweep;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Fingerprints a single listed file: exact digest for generic files, perceptual hash for images.
 * Empty files and files that cannot be read or decoded produce no record.
 */
@Slf4j
public class HashEngine {

    private final HashProvider exactDigest;
    private final HashProvider perceptualHash;

    public HashEngine() {
        this(HashType.MD5, new PerceptualHash());
    }

    public HashEngine(HashProvider exactDigest, HashProvider perceptualHash) {
        this.exactDigest = exactDigest;
        this.perceptualHash = perceptualHash;
    }

    public HashProvider providerFor(FileKind kind) {
        return kind == FileKind.IMAGE ? perceptualHash : exactDigest;
    }

    public Optional<FileRecord> fingerprint(ScanEntry entry) {
        if (entry.getSize() == 0) {
            log.debug("skipping empty file {}", entry.getPath());
            return Optional.empty();
        }
        HashProvider provider = providerFor(entry.getKind());
        try {
            String hashHex = provider.getHashHex(entry.getPath());
            if (hashHex == null || hashHex.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(FileRecord.of(entry, hashHex));
        } catch (Exception e) {
            //unreadable, vanished or undecodable files drop out of the scan
            log.debug("failed to {} hash {}: {}", provider.describe(), entry.getPath(), e.toString());
            return Optional.empty();
        }
    }
}
