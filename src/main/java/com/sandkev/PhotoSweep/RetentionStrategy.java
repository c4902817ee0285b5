package com.sandkev.PhotoSweep;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Picks which file of a duplicate class survives. Members are sorted by the key, descending
 * strategies reverse the order, and the first one after sorting is kept.
 */
@Slf4j
public enum RetentionStrategy {

    OLDEST("oldest", Comparator.comparing(FileRecord::getCreatedTime), false),
    NEWEST("newest", Comparator.comparing(FileRecord::getCreatedTime), true),
    LARGEST("largest", Comparator.comparingLong(FileRecord::getSize), true),
    SMALLEST("smallest", Comparator.comparingLong(FileRecord::getSize), false),
    SHORTEST_PATH("shortest_path", Comparator.comparingInt(RetentionStrategy::pathLength), false),
    LONGEST_PATH("longest_path", Comparator.comparingInt(RetentionStrategy::pathLength), true);

    private final String token;
    private final Comparator<FileRecord> key;
    private final boolean descending;

    RetentionStrategy(String token, Comparator<FileRecord> key, boolean descending) {
        this.token = token;
        this.key = key;
        this.descending = descending;
    }

    public String getToken() {
        return token;
    }

    public boolean isDescending() {
        return descending;
    }

    public Comparator<FileRecord> survivorOrder() {
        return descending ? key.reversed() : key;
    }

    /**
     * @return a sorted copy, the survivor first; ties keep their original order
     */
    public List<FileRecord> sort(Collection<FileRecord> members) {
        List<FileRecord> sorted = new ArrayList<>(members);
        sorted.sort(survivorOrder());
        return sorted;
    }

    public FileRecord survivor(Collection<FileRecord> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("a duplicate class has at least one member");
        }
        return sort(members).get(0);
    }

    /**
     * Unknown or missing names fall back to {@link #OLDEST}.
     */
    public static RetentionStrategy fromName(String name) {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (RetentionStrategy strategy : values()) {
                if (strategy.token.equals(wanted)) {
                    return strategy;
                }
            }
        }
        log.debug("unknown retention strategy '{}', keeping the oldest file", name);
        return OLDEST;
    }

    private static int pathLength(FileRecord record) {
        return record.getPath().toString().length();
    }
}
