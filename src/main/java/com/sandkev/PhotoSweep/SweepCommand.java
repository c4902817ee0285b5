package com.sandkev.PhotoSweep;

import com.sandkev.organizer.OrganizeMode;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Command(
        name = "photo-sweep",
        description = "Moves duplicate files to a duplicates_<timestamp> folder and/or sorts images into date folders",
        mixinStandardHelpOptions = true
)
public class SweepCommand implements Callable<Integer> {

    static final int INVALID_DIRECTORY = 1;
    static final int IO_FAILURE = 3;
    /**
     * Same status the JVM reports after SIGINT, so a signalled and an in-process cancel agree.
     */
    static final int CANCELLED = 130;

    @Option(names = {"-d", "--directory"}, description = "Directory to process (default: working directory)", defaultValue = ".")
    private Path directory;

    @Option(names = {"-f", "--function"}, description = "One of ${COMPLETION-CANDIDATES}, any case (default: ${DEFAULT-VALUE})", defaultValue = "ORGANIZE")
    private SweepTask.Function function;

    @Option(names = {"-s", "--strategy"}, description = "File to keep: oldest, newest, largest, smallest, shortest_path, longest_path (default: ${DEFAULT-VALUE})", defaultValue = "oldest")
    private String strategy;

    @Option(names = {"-m", "--mode"}, description = "Folder naming: date or quarter (default: ${DEFAULT-VALUE})", defaultValue = "date")
    private String mode;

    @Option(names = {"-w", "--workers"}, description = "Hashing threads, at most " + HashDispatcher.MAX_WORKERS)
    private Integer workers;

    @Option(names = {"-o", "--output"}, description = "Where duplicates folders and audit logs are written (default: working directory)", defaultValue = ".")
    private Path output;

    @Option(names = "--report", description = "Write a CSV report of every duplicate group before moving anything")
    private Path report;

    @Option(names = "--audit-log", negatable = true, description = "Write a log of moved files (default: true)", defaultValue = "true")
    private boolean auditLog;

    private final PrintStream out;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile SweepRunner runner;

    public SweepCommand() {
        this(System.out);
    }

    SweepCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        SweepTask task = SweepTask.builder()
                .directory(directory)
                .function(function)
                .strategy(RetentionStrategy.fromName(strategy))
                .organizeMode(OrganizeMode.fromName(mode))
                .workers(workers == null ? HashDispatcher.defaultWorkers() : Math.max(1, Math.min(HashDispatcher.MAX_WORKERS, workers)))
                .outputDirectory(output.toAbsolutePath())
                .auditLog(auditLog)
                .reportFile(report)
                .build();
        Thread hook = new Thread(this::cancelAndAwait, "sweep-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            runner = new SweepRunner(task);
            if (cancelRequested.get()) {
                runner.cancel();
            }
            runner.run().describe().forEach(out::println);
            return 0;
        } catch (NotDirectoryException e) {
            log.error("not a directory: {}", e.getFile());
            return INVALID_DIRECTORY;
        } catch (SweepCancelledException e) {
            log.warn("sweep cancelled: {}", e.getMessage());
            return CANCELLED;
        } catch (IOException e) {
            log.error("sweep failed: {}", e.toString());
            return IO_FAILURE;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    /**
     * Asks a running sweep to stop at its next checkpoint; a move in progress completes first.
     */
    public void cancel() {
        cancelRequested.set(true);
        SweepRunner current = runner;
        if (current != null) {
            current.cancel();
        }
    }

    /**
     * Shutdown hook body: the JVM halts once hooks return, so wait for {@link #call()} to unwind.
     */
    void cancelAndAwait() {
        cancel();
        try {
            finished.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            //already shutting down, the hook has run
            log.debug("shutdown in progress", e);
        }
    }

    static CommandLine commandLine(SweepCommand command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine(new SweepCommand()).execute(args));
    }
}
