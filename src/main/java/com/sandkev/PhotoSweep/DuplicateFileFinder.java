package com.sandkev.PhotoSweep;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * finds and hashes files
 * lists the tree, fingerprints every file on a worker pool and keeps the fingerprints shared by more than one file.
 */
@Slf4j
public class DuplicateFileFinder {

    private final EntryLister lister;
    private final HashDispatcher dispatcher;

    public DuplicateFileFinder() {
        this(HashDispatcher.defaultWorkers());
    }

    public DuplicateFileFinder(int workers) {
        this(new EntryLister(), new HashDispatcher(new HashEngine(), workers));
    }

    public DuplicateFileFinder(EntryLister lister, HashDispatcher dispatcher) {
        this.lister = lister;
        this.dispatcher = dispatcher;
    }

    public Duplicates scan(Path directory) throws IOException, InterruptedException {
        return scan(directory, ScanListener.NONE);
    }

    public Duplicates scan(Path directory, ScanListener listener) throws IOException, InterruptedException {
        ScanResult fingerprints = fingerprint(directory, listener);
        Duplicates duplicates = DuplicateGrouper.group(fingerprints);
        log.info("found {} duplicate files in {} groups", duplicates.getDuplicateFileCount(), duplicates.getClassCount());
        return duplicates;
    }

    /**
     * Fingerprints of every file under the directory, duplicated or not.
     */
    public ScanResult fingerprint(Path directory, ScanListener listener) throws IOException, InterruptedException {
        Path root = Directories.requireDirectory(directory);
        log.info("scanning for files in {} with {} workers", root, dispatcher.getWorkers());
        List<ScanEntry> entries = lister.list(root);
        listener.entriesListed(entries.size());
        return dispatcher.dispatch(entries, listener);
    }
}
