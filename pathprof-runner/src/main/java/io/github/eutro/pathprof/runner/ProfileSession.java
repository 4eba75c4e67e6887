package io.github.eutro.pathprof.runner;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.pathprof.ProfilerOptions;
import io.github.eutro.pathprof.cfg.ControlFlowGraph;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.decode.PathDecoder;
import io.github.eutro.pathprof.instrument.InstrumentIR;
import io.github.eutro.pathprof.ir.LinearIR;
import io.github.eutro.pathprof.passes.BuildCfg;
import io.github.eutro.pathprof.passes.Passes;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Profiles the paths a program takes over one or more runs.
 * <p>
 * Opening a session numbers and instruments the program, and empties the dump and report files.
 * Each run then adds its paths to the session's counts, which are written to the dump file
 * after every run. {@link #report()} decodes the dump file into the report file.
 * <p>
 * Sessions are not thread safe, and run strictly one after another.
 */
public class ProfileSession {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final LinearIR original;
    private final ProfileGraph graph;
    private final LinearIR instrumented;
    private final PathDecoder decoder;
    private final Interpreter interpreter;
    private final RunnerOptions runnerOptions;
    private PathCounts counts = PathCounts.empty();
    private int runs;

    private ProfileSession(LinearIR original, ControlFlowGraph cfg, ProfilerOptions options, RunnerOptions runnerOptions) {
        this.original = original;
        this.runnerOptions = runnerOptions;
        graph = Passes.numberPaths(options).run(cfg);
        instrumented = new InstrumentIR(graph, options).run(original);
        decoder = new PathDecoder(graph);
        interpreter = new Interpreter(runnerOptions.getMaxSteps());
    }

    /**
     * Open a session for a program, building its CFG.
     *
     * @param ir            The program.
     * @param options       The profiler options.
     * @param runnerOptions The runner options.
     * @return The session.
     * @throws io.github.eutro.pathprof.ProfilingException If the program cannot be instrumented.
     * @throws IOException                                 If the output files cannot be emptied.
     */
    public static ProfileSession open(LinearIR ir, ProfilerOptions options, RunnerOptions runnerOptions) throws IOException {
        return open(ir, BuildCfg.INSTANCE.run(ir), options, runnerOptions);
    }

    public static ProfileSession open(
            LinearIR ir,
            ControlFlowGraph cfg,
            ProfilerOptions options,
            RunnerOptions runnerOptions
    ) throws IOException {
        ProfileSession session = new ProfileSession(ir, cfg, options, runnerOptions);
        truncate(runnerOptions.getDumpFile());
        truncate(runnerOptions.getReportFile());
        logger.atInfo().log("profiling %d paths", session.decoder.numPaths());
        return session;
    }

    private static void truncate(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.write(file, new byte[0]);
    }

    /**
     * Run the instrumented program once, and write the counts so far to the dump file.
     *
     * @param params The parameters.
     * @return The result of the run.
     * @throws ExecutionException If the program fails.
     * @throws IOException        If the dump file cannot be written.
     */
    public RunResult execute(Map<String, Long> params) throws IOException {
        RunResult result = interpreter.run(instrumented, params, counts);
        counts = result.accumulator;
        runs++;
        counts.write(runnerOptions.getDumpFile());
        logger.atFine().log("run %d took %d steps, recorded %s", runs, result.steps, result.trace);
        return result;
    }

    public List<RunResult> runBatch(List<Map<String, Long>> batch) throws IOException {
        List<RunResult> results = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            logger.atInfo().log("=== run #%d/%d with params %s ===", i + 1, batch.size(), batch.get(i));
            results.add(execute(batch.get(i)));
        }
        return results;
    }

    /**
     * Decode the dump file into the report file, one {@code [<block>, ...]: <count>} line per path.
     *
     * @return The lines of the report.
     * @throws IOException If either file cannot be accessed.
     */
    public List<String> report() throws IOException {
        PathCounts dumped = PathCounts.read(runnerOptions.getDumpFile());
        List<String> lines = new ArrayList<>();
        for (Map.Entry<Long, Long> entry : dumped.asMap().entrySet()) {
            lines.add(decoder.decode(entry.getKey()) + ": " + entry.getValue());
        }
        try (Writer writer = Files.newBufferedWriter(runnerOptions.getReportFile(), StandardCharsets.UTF_8)) {
            for (String line : lines) {
                writer.write(line);
                writer.write('\n');
            }
        }
        return lines;
    }

    /**
     * Get the program as it was before instrumentation.
     *
     * @return The original program.
     */
    public LinearIR restoreOriginal() {
        return original;
    }

    public LinearIR instrumented() {
        return instrumented;
    }

    public ProfileGraph graph() {
        return graph;
    }

    public PathDecoder decoder() {
        return decoder;
    }

    /**
     * Get the counts of every path recorded by this session so far.
     *
     * @return The counts.
     */
    public PathCounts counts() {
        return counts;
    }
}
