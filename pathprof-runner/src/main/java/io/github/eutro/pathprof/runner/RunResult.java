package io.github.eutro.pathprof.runner;

import java.util.List;
import java.util.Map;

/**
 * The outcome of running a program once.
 */
public final class RunResult {
    /**
     * The values of all variables when the program exited.
     */
    public final Map<String, Long> env;
    /**
     * The path ids recorded during the run, in the order they were recorded.
     */
    public final List<Long> trace;
    /**
     * The path ids recorded during the run, counted.
     */
    public final PathCounts runCounts;
    /**
     * The accumulator the run was given, with the counts of every dump during the run merged in.
     */
    public final PathCounts accumulator;
    public final long steps;

    RunResult(Map<String, Long> env, List<Long> trace, PathCounts runCounts, PathCounts accumulator, long steps) {
        this.env = env;
        this.trace = trace;
        this.runCounts = runCounts;
        this.accumulator = accumulator;
        this.steps = steps;
    }

    @Override
    public String toString() {
        return String.format("RunResult{steps=%d, trace=%s, env=%s}", steps, trace, env);
    }
}
