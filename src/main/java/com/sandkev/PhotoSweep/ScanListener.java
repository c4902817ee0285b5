package com.sandkev.PhotoSweep;

/**
 * Progress callbacks for a scan. Both are invoked on the coordinating thread.
 */
public interface ScanListener {

    ScanListener NONE = new ScanListener() {
    };

    default void entriesListed(int total) {
    }

    default void fileHashed(int completed, int total) {
    }
}
