package io.github.eutro.pathprof.runner;

import io.github.eutro.pathprof.ir.*;

import java.util.*;

/**
 * Executes a {@link LinearIR} made of {@link HostInsn host} and {@link ProfileInsn profiling} instructions.
 * <p>
 * Variables hold longs. Parameters are passed in as the initial values of variables, and
 * reading a variable that has neither been passed nor assigned is an error.
 */
public class Interpreter {
    /**
     * The default limit on the number of instructions a single run may execute.
     */
    public static final long DEFAULT_MAX_STEPS = 10_000_000;

    private final long maxSteps;

    public Interpreter() {
        this(DEFAULT_MAX_STEPS);
    }

    public Interpreter(long maxSteps) {
        if (maxSteps <= 0) throw new IllegalArgumentException("maxSteps must be positive");
        this.maxSteps = maxSteps;
    }

    public RunResult run(LinearIR ir, Map<String, Long> params) {
        return run(ir, params, PathCounts.empty());
    }

    /**
     * Run a program to completion.
     *
     * @param ir          The program.
     * @param params      The initial values of variables.
     * @param accumulator The counts that each {@link ProfileInsn.Kind#DUMP dump} merges the paths recorded since the last into.
     * @return The result of the run.
     * @throws ExecutionException If the program fails or runs for too long.
     */
    public RunResult run(LinearIR ir, Map<String, Long> params, PathCounts accumulator) {
        Map<String, Long> env = new HashMap<>(params);
        Expr.Env lookup = name -> {
            Long value = env.get(name);
            if (value == null) throw new ExecutionException("undefined variable: " + name);
            return value;
        };
        List<Long> trace = new ArrayList<>();
        // counted in place, and only frozen into PathCounts at dumps and at the end
        Map<Long, Long> runCounts = new TreeMap<>();
        Map<Long, Long> undumped = new TreeMap<>();

        int pc = 0;
        long steps = 0;
        int exit = ir.exitPosition();
        while (pc != exit) {
            if (pc < 0 || pc > exit) {
                throw new ExecutionException(String.format("jumped to %d, outside [0, %d]", pc, exit));
            }
            if (++steps > maxSteps) {
                throw new ExecutionException("exceeded " + maxSteps + " steps at " + pc);
            }
            IREntry entry = ir.get(pc);
            Insn insn = entry.insn;
            try {
                if (insn instanceof HostInsn.Assign) {
                    HostInsn.Assign assign = (HostInsn.Assign) insn;
                    env.put(assign.var, assign.value.eval(lookup));
                    pc++;
                } else if (insn instanceof HostInsn.Branch) {
                    pc += ((HostInsn.Branch) insn).cond.eval(lookup) != 0 ? 1 : entry.offset;
                } else if (insn instanceof HostInsn.Goto) {
                    pc += entry.offset;
                } else if (insn instanceof ProfileInsn) {
                    ProfileInsn pInsn = (ProfileInsn) insn;
                    switch (pInsn.kind) {
                        case SET:
                            env.put(pInsn.register, pInsn.constant);
                            break;
                        case ADD:
                            env.put(pInsn.register, lookup.lookup(pInsn.register) + pInsn.constant);
                            break;
                        case COUNT: {
                            long pathId = lookup.lookup(pInsn.register);
                            trace.add(pathId);
                            runCounts.merge(pathId, 1L, Long::sum);
                            undumped.merge(pathId, 1L, Long::sum);
                            break;
                        }
                        case DUMP:
                            accumulator = accumulator.merge(PathCounts.copyOf(undumped));
                            undumped.clear();
                            break;
                        case GOTO:
                            pc += entry.offset;
                            continue;
                    }
                    pc++;
                } else {
                    throw new ExecutionException("cannot execute " + insn + " at " + pc);
                }
            } catch (ArithmeticException e) {
                throw new ExecutionException(String.format("%s at %d: %s", insn, pc, e.getMessage()), e);
            }
        }
        return new RunResult(
                Collections.unmodifiableMap(new TreeMap<>(env)),
                Collections.unmodifiableList(trace),
                PathCounts.copyOf(runCounts),
                accumulator,
                steps
        );
    }
}
