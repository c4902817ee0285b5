package com.sandkev.PhotoSweep;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import lombok.Value;

import java.util.Collection;
import java.util.Map;

/**
 * Fingerprints shared by two or more files, split by kind.
 */
@Value
public class Duplicates {
    ListMultimap<String, FileRecord> imageDuplicates;
    ListMultimap<String, FileRecord> genericDuplicates;

    public boolean isEmpty() {
        return imageDuplicates.isEmpty() && genericDuplicates.isEmpty();
    }

    public int getDuplicateFileCount() {
        return imageDuplicates.size() + genericDuplicates.size();
    }

    public int getClassCount() {
        return imageDuplicates.keySet().size() + genericDuplicates.keySet().size();
    }

    /**
     * Both kinds merged into one map; retention does not care about kind.
     */
    public ListMultimap<HashKey, FileRecord> combined() {
        ListMultimap<HashKey, FileRecord> combined = ArrayListMultimap.create();
        putAll(combined, FileKind.IMAGE, imageDuplicates);
        putAll(combined, FileKind.GENERIC, genericDuplicates);
        return combined;
    }

    private static void putAll(ListMultimap<HashKey, FileRecord> target, FileKind kind, ListMultimap<String, FileRecord> source) {
        for (Map.Entry<String, Collection<FileRecord>> entry : source.asMap().entrySet()) {
            target.putAll(new HashKey(kind, entry.getKey()), entry.getValue());
        }
    }
}
