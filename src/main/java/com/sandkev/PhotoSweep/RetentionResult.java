package com.sandkev.PhotoSweep;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class RetentionResult {
    int movedCount;
    long movedBytes;
    /** in the order they were moved */
    List<FileRecord> movedRecords;
    Path quarantineFolder;
    /** left in place, the quarantine folder already held a file of that name */
    int collisionCount;
    /** left in place, the move itself failed */
    int failedCount;
}
