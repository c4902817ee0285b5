package com.sandkev.PhotoSweep;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import java.util.Collection;
import java.util.Map;

public final class DuplicateGrouper {

    private DuplicateGrouper() {
    }

    public static Duplicates group(ScanResult scan) {
        return new Duplicates(
                duplicatesOnly(scan.getImageFingerprints()),
                duplicatesOnly(scan.getGenericFingerprints()));
    }

    /**
     * keeps only the keys with more than one file, the input is left untouched
     */
    public static <K> ListMultimap<K, FileRecord> duplicatesOnly(ListMultimap<K, FileRecord> byHash) {
        ImmutableListMultimap.Builder<K, FileRecord> duplicates = ImmutableListMultimap.builder();
        for (Map.Entry<K, Collection<FileRecord>> entry : byHash.asMap().entrySet()) {
            if (entry.getValue().size() > 1) {
                duplicates.putAll(entry.getKey(), entry.getValue());
            }
        }
        return duplicates.build();
    }
}
