package com.sandkev.PhotoSweep;

import lombok.Value;

import java.util.Comparator;

/**
 * Identity of a duplicate class. Image and generic fingerprints never share a class.
 */
@Value
public class HashKey implements Comparable<HashKey> {
    FileKind kind;
    String hashHex;

    @Override
    public int compareTo(HashKey other) {
        return Comparator.comparing(HashKey::getKind)
                .thenComparing(HashKey::getHashHex)
                .compare(this, other);
    }

    @Override
    public String toString() {
        return kind + "_" + hashHex;
    }
}
