package com.sandkev.PhotoSweep;

import com.google.common.collect.ListMultimap;
import com.sandkev.organizer.DateFolderOrganizer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a {@link SweepTask}: deduplicate, organize, or deduplicate then organize.
 * <p>
 * {@link #cancel()} may be called from any thread. It is honoured between phases only;
 * hashing that has already started runs to completion.
 */
@Slf4j
public class SweepRunner {

    private final SweepTask task;
    private final DuplicateFileFinder finder;
    private final RetentionResolver resolver;
    private final DateFolderOrganizer organizer;
    private final AuditLog auditLog;
    private final DuplicateReport report;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private ScanListener listener = ScanListener.NONE;

    public SweepRunner(SweepTask task) {
        this(task,
                new DuplicateFileFinder(task.getWorkers()),
                new RetentionResolver(task.getOutputDirectory()),
                new DateFolderOrganizer(),
                new AuditLog(task.getOutputDirectory()),
                new DuplicateReport());
    }

    SweepRunner(SweepTask task, DuplicateFileFinder finder, RetentionResolver resolver,
                DateFolderOrganizer organizer, AuditLog auditLog, DuplicateReport report) {
        this.task = task;
        this.finder = finder;
        this.resolver = resolver;
        this.organizer = organizer;
        this.auditLog = auditLog;
        this.report = report;
    }

    public SweepRunner withListener(ScanListener listener) {
        this.listener = listener;
        return this;
    }

    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelled() {
        return cancelRequested.get();
    }

    /**
     * @throws java.nio.file.NotDirectoryException when the task directory does not exist
     * @throws SweepCancelledException             when cancelled at a checkpoint
     */
    public SweepSummary run() throws IOException {
        Path directory = Directories.requireDirectory(task.getDirectory());
        SweepSummary.SweepSummaryBuilder summary = SweepSummary.builder()
                .directory(directory)
                .function(task.getFunction());

        if (task.deduplicates()) {
            deduplicate(directory, summary);
        }
        if (task.organizes()) {
            checkpoint("organizing");
            summary.organize(organizer.classify(directory, task.getOrganizeMode()));
        }
        return summary.build();
    }

    private void deduplicate(Path directory, SweepSummary.SweepSummaryBuilder summary) throws IOException {
        checkpoint("finding duplicates");
        Duplicates duplicates;
        try {
            duplicates = finder.scan(directory, listener);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SweepCancelledException("interrupted while finding duplicates");
        }
        checkpoint("moving duplicates");

        summary.duplicateFiles(duplicates.getDuplicateFileCount())
                .duplicateClasses(duplicates.getClassCount());
        if (duplicates.isEmpty()) {
            log.info("no duplicate files found in {}", directory);
            return;
        }

        ListMultimap<HashKey, FileRecord> duplicateClasses = duplicates.combined();
        if (task.getReportFile() != null) {
            report.write(task.getReportFile(), duplicateClasses, task.getStrategy());
            summary.reportFile(task.getReportFile());
        }
        RetentionResult retention = resolver.resolve(duplicateClasses, task.getStrategy());
        summary.retention(retention);
        if (task.isAuditLog() && retention.getMovedCount() > 0) {
            summary.auditLogFile(auditLog.write(directory, retention));
        }
    }

    private void checkpoint(String phase) {
        if (cancelRequested.get()) {
            log.info("sweep cancelled before {}", phase);
            throw new SweepCancelledException("cancelled before " + phase);
        }
    }
}
