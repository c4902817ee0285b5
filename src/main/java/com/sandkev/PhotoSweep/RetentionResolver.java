package com.sandkev.PhotoSweep;

import com.google.common.collect.ListMultimap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Keeps one file of every duplicate class and moves the rest into a quarantine folder
 * named {@code duplicates_<yyyyMMdd_HHmmss>}. Nothing is ever overwritten: a candidate whose
 * name is already taken in the quarantine folder stays where it is.
 */
@Slf4j
public class RetentionResolver {

    static final DateTimeFormatter FOLDER_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path quarantineBase;
    private final Clock clock;

    public RetentionResolver() {
        this(Paths.get("").toAbsolutePath(), Clock.systemDefaultZone());
    }

    public RetentionResolver(Path quarantineBase) {
        this(quarantineBase, Clock.systemDefaultZone());
    }

    public RetentionResolver(Path quarantineBase, Clock clock) {
        this.quarantineBase = quarantineBase;
        this.clock = clock;
    }

    public Path quarantineFolderFor(LocalDateTime runTime) {
        return quarantineBase.resolve("duplicates_" + runTime.format(FOLDER_STAMP));
    }

    public RetentionResult resolve(ListMultimap<HashKey, FileRecord> duplicateClasses, RetentionStrategy strategy) {
        Path quarantine = quarantineFolderFor(LocalDateTime.now(clock));
        boolean quarantineReady = false;

        int movedCount = 0;
        long movedBytes = 0;
        int collisions = 0;
        int failures = 0;
        List<FileRecord> moved = new ArrayList<>();

        for (Map.Entry<HashKey, Collection<FileRecord>> entry : duplicateClasses.asMap().entrySet()) {
            List<FileRecord> ordered = strategy.sort(entry.getValue());
            log.debug("keeping {} for {}", ordered.get(0).getPath(), entry.getKey());
            for (FileRecord candidate : ordered.subList(1, ordered.size())) {
                Path source = candidate.getPath();
                Path target = quarantine.resolve(source.getFileName().toString());
                try {
                    if (!quarantineReady) {
                        Files.createDirectories(quarantine);
                        quarantineReady = true;
                    }
                    if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                        log.debug("leaving {} in place, {} already exists", source, target);
                        collisions++;
                        continue;
                    }
                    FileUtils.moveFile(source.toFile(), target.toFile());
                    movedCount++;
                    movedBytes += candidate.getSize();
                    moved.add(candidate);
                } catch (IOException e) {
                    log.warn("could not move {} to {}: {}", source, target, e.toString());
                    failures++;
                }
            }
        }

        log.info("moved {} files ({} bytes) to {}", movedCount, movedBytes, quarantine);
        return RetentionResult.builder()
                .movedCount(movedCount)
                .movedBytes(movedBytes)
                .movedRecords(List.copyOf(moved))
                .quarantineFolder(quarantine)
                .collisionCount(collisions)
                .failedCount(failures)
                .build();
    }
}
