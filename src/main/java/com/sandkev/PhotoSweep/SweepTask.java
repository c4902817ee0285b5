package com.sandkev.PhotoSweep;

import com.sandkev.organizer.OrganizeMode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Everything one sweep needs to know. Quarantine folders and audit logs go to the output
 * directory, the working directory unless told otherwise.
 */
@Data
@Builder(builderClassName = "BuilderWithDefaults")
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SweepTask {

    public enum Function {
        DEDUPLICATE, ORGANIZE, BOTH
    }

    Path directory;
    Function function;
    RetentionStrategy strategy;
    OrganizeMode organizeMode;
    int workers;
    Path outputDirectory;
    boolean auditLog;
    Path reportFile;

    public static class BuilderWithDefaults {
        Function function = Function.ORGANIZE;
        RetentionStrategy strategy = RetentionStrategy.OLDEST;
        OrganizeMode organizeMode = OrganizeMode.DATE;
        int workers = HashDispatcher.defaultWorkers();
        Path outputDirectory = Paths.get("").toAbsolutePath();
        boolean auditLog = true;
    }

    public boolean deduplicates() {
        return function == Function.DEDUPLICATE || function == Function.BOTH;
    }

    public boolean organizes() {
        return function == Function.ORGANIZE || function == Function.BOTH;
    }
}
