package com.sandkev.PhotoSweep;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static java.lang.String.format;

/**
 * Plain text record of a retention run: when, where, how much was moved and every moved source path.
 */
@Slf4j
public class AuditLog {

    static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final DateTimeFormatter RUN_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path directory;
    private final Clock clock;

    public AuditLog(Path directory) {
        this(directory, Clock.systemDefaultZone());
    }

    public AuditLog(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public Path write(Path scannedDirectory, RetentionResult result) throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        Path logFile = directory.resolve("duplicate_files_log_" + now.format(FILE_STAMP) + ".txt");
        FileUtils.writeLines(logFile.toFile(), StandardCharsets.UTF_8.name(), lines(now, scannedDirectory, result));
        log.info("wrote audit log {}", logFile);
        return logFile;
    }

    static List<String> lines(LocalDateTime runTime, Path scannedDirectory, RetentionResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("Duplicate files log - " + runTime.format(RUN_STAMP));
        lines.add("Scanned directory: " + scannedDirectory);
        lines.add("Moved files: " + result.getMovedCount());
        lines.add("Moved size: " + megabytes(result.getMovedBytes()));
        lines.add("Quarantine folder: " + result.getQuarantineFolder());
        lines.add("");
        lines.add("Moved files:");
        for (FileRecord record : result.getMovedRecords()) {
            lines.add(record.getPath().toString());
        }
        return lines;
    }

    public static String megabytes(long bytes) {
        return format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
    }
}
