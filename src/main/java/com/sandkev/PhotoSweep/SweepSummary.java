package com.sandkev.PhotoSweep;

import com.sandkev.organizer.OrganizeResult;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class SweepSummary {
    Path directory;
    SweepTask.Function function;
    int duplicateFiles;
    int duplicateClasses;
    /** null when deduplication did not run or found nothing */
    RetentionResult retention;
    Path auditLogFile;
    Path reportFile;
    /** null when organizing did not run */
    OrganizeResult organize;

    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        lines.add("=".repeat(50));
        if (function != SweepTask.Function.ORGANIZE) {
            lines.add("Deduplication:");
            lines.add("- scanned directory: " + directory);
            lines.add("- duplicate files found: " + duplicateFiles);
            lines.add("- duplicate groups: " + duplicateClasses);
            lines.add("- files moved: " + (retention == null ? 0 : retention.getMovedCount()));
            lines.add("- size moved: " + AuditLog.megabytes(retention == null ? 0 : retention.getMovedBytes()));
            if (retention != null && retention.getMovedCount() > 0) {
                lines.add("- duplicates folder: " + retention.getQuarantineFolder());
            }
            if (auditLogFile != null) {
                lines.add("- audit log: " + auditLogFile);
            }
            if (reportFile != null) {
                lines.add("- report: " + reportFile);
            }
        }
        if (organize != null) {
            lines.add("Organizing:");
            lines.add("- scanned directory: " + directory);
            lines.add("- images found: " + organize.getTotalImages());
            lines.add("- images organized: " + organize.getOrganizedImages());
            lines.add("- images skipped: " + organize.getSkippedImages());
        }
        lines.add("=".repeat(50));
        return lines;
    }
}
