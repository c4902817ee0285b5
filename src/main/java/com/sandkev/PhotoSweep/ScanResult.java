package com.sandkev.PhotoSweep;

import com.google.common.collect.ListMultimap;
import lombok.Value;

/**
 * Every fingerprinted file of a scan, keyed by fingerprint, one map per kind.
 */
@Value
public class ScanResult {
    int listedEntries;
    ListMultimap<String, FileRecord> imageFingerprints;
    ListMultimap<String, FileRecord> genericFingerprints;

    public int getRecordCount() {
        return imageFingerprints.size() + genericFingerprints.size();
    }
}
