package io.github.eutro.pathprof.runner;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where a {@link ProfileSession} writes its results, and how long each run may take.
 */
public class RunnerOptions {
    public static final String DUMP_FILE_NAME = "hash_dump.txt";
    public static final String REPORT_FILE_NAME = "path_profile_data.txt";

    private Path dumpFile = Paths.get(DUMP_FILE_NAME);
    private Path reportFile = Paths.get(REPORT_FILE_NAME);
    private long maxSteps = Interpreter.DEFAULT_MAX_STEPS;

    /**
     * Get options that write both files into a directory.
     *
     * @param dir The directory.
     * @return The options.
     */
    public static RunnerOptions inDirectory(Path dir) {
        return new RunnerOptions()
                .setDumpFile(dir.resolve(DUMP_FILE_NAME))
                .setReportFile(dir.resolve(REPORT_FILE_NAME));
    }

    public Path getDumpFile() {
        return dumpFile;
    }

    /**
     * Set the file path counts are written to, as {@code <path id>: <count>} lines.
     *
     * @param dumpFile The file.
     * @return This.
     */
    public RunnerOptions setDumpFile(Path dumpFile) {
        this.dumpFile = dumpFile;
        return this;
    }

    public Path getReportFile() {
        return reportFile;
    }

    /**
     * Set the file decoded path counts are written to, as {@code [<block>, ...]: <count>} lines.
     *
     * @param reportFile The file.
     * @return This.
     */
    public RunnerOptions setReportFile(Path reportFile) {
        this.reportFile = reportFile;
        return this;
    }

    public long getMaxSteps() {
        return maxSteps;
    }

    public RunnerOptions setMaxSteps(long maxSteps) {
        this.maxSteps = maxSteps;
        return this;
    }
}
