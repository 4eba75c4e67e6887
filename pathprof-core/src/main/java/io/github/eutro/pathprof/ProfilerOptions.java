package io.github.eutro.pathprof;

import org.jetbrains.annotations.Nullable;

import java.io.File;

/**
 * Options for numbering paths and instrumenting a program.
 * <p>
 * Defaults can be overridden from the environment: {@code PATHPROF_NO_OPTIMIZE}
 * disables the spanning tree optimisation, and {@code PATHPROF_DEBUG_DIR}
 * sets the directory diagnostic graphs are written to.
 */
public class ProfilerOptions {
    /**
     * The name of the path register if none is set.
     */
    public static final String DEFAULT_REGISTER = ":blPathRegister";

    private String register = DEFAULT_REGISTER;
    private boolean optimizeEventCounting = System.getenv("PATHPROF_NO_OPTIMIZE") == null;
    private boolean elideZeroIncrements = true;
    private boolean verifyOffsets = true;
    @Nullable
    private File debugOutputDirectory = fileFromEnv("PATHPROF_DEBUG_DIR");

    @Nullable
    private static File fileFromEnv(String var) {
        String path = System.getenv(var);
        return path == null ? null : new File(path);
    }

    public String getRegister() {
        return register;
    }

    /**
     * Set the name of the variable that accumulates the path id.
     * <p>
     * It must not clash with any variable of the profiled program.
     *
     * @param register The variable name.
     * @return This.
     */
    public ProfilerOptions setRegister(String register) {
        this.register = register;
        return this;
    }

    public boolean isOptimizeEventCounting() {
        return optimizeEventCounting;
    }

    /**
     * Set whether edge increments are moved onto the chords of a maximum spanning tree,
     * so that fewer edges are instrumented.
     *
     * @param optimizeEventCounting Whether to optimise.
     * @return This.
     */
    public ProfilerOptions setOptimizeEventCounting(boolean optimizeEventCounting) {
        this.optimizeEventCounting = optimizeEventCounting;
        return this;
    }

    public boolean isElideZeroIncrements() {
        return elideZeroIncrements;
    }

    /**
     * Set whether {@code register += 0} updates are left out of the instrumented program.
     *
     * @param elideZeroIncrements Whether to leave them out.
     * @return This.
     */
    public ProfilerOptions setElideZeroIncrements(boolean elideZeroIncrements) {
        this.elideZeroIncrements = elideZeroIncrements;
        return this;
    }

    public boolean isVerifyOffsets() {
        return verifyOffsets;
    }

    /**
     * Set whether every jump target is checked after every single insertion.
     *
     * @param verifyOffsets Whether to check.
     * @return This.
     */
    public ProfilerOptions setVerifyOffsets(boolean verifyOffsets) {
        this.verifyOffsets = verifyOffsets;
        return this;
    }

    @Nullable
    public File getDebugOutputDirectory() {
        return debugOutputDirectory;
    }

    /**
     * Set the directory that diagnostic graph renderings are written to, or null to not write any.
     *
     * @param debugOutputDirectory The directory.
     * @return This.
     */
    public ProfilerOptions setDebugOutputDirectory(@Nullable File debugOutputDirectory) {
        this.debugOutputDirectory = debugOutputDirectory;
        return this;
    }
}
