package com.sandkev.PhotoSweep;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Hashes listed entries on a bounded worker pool and merges the results on the calling thread.
 * Workers share nothing; each task owns its result until the coordinator takes it.
 */
@Slf4j
public class HashDispatcher {

    public static final int MAX_WORKERS = 8;

    private final HashEngine engine;
    private final int workers;

    public HashDispatcher(HashEngine engine, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1 but was " + workers);
        }
        this.engine = engine;
        this.workers = workers;
    }

    public static int defaultWorkers() {
        return Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors()));
    }

    public int getWorkers() {
        return workers;
    }

    public ScanResult dispatch(List<ScanEntry> entries, ScanListener listener) throws InterruptedException {
        ListMultimap<String, FileRecord> images = ArrayListMultimap.create();
        ListMultimap<String, FileRecord> generic = ArrayListMultimap.create();
        int total = entries.size();

        ExecutorService executorService = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
                .setNameFormat("hasher-%d")
                .setDaemon(true)
                .build());
        try {
            CompletionService<Optional<FileRecord>> completionService = new ExecutorCompletionService<>(executorService);
            for (ScanEntry entry : entries) {
                completionService.submit(() -> engine.fingerprint(entry));
            }

            for (int completed = 1; completed <= total; completed++) {
                Optional<FileRecord> result;
                try {
                    result = completionService.take().get();
                } catch (ExecutionException e) {
                    log.debug("hashing task failed", e.getCause());
                    result = Optional.empty();
                }
                result.ifPresent(record -> (record.getKind() == FileKind.IMAGE ? images : generic)
                        .put(record.getFingerprint(), record));
                listener.fileHashed(completed, total);
                if (completed % 1000 == 0) {
                    log.info("calculating hash {}/{}", completed, total);
                }
            }
        } finally {
            //tasks already running are left to finish
            executorService.shutdown();
        }
        log.info("hashed {} images and {} other files out of {} entries", images.size(), generic.size(), total);
        return new ScanResult(total, images, generic);
    }
}
