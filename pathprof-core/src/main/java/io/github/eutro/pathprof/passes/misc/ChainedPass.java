package io.github.eutro.pathprof.passes.misc;

import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 * <p>
 * Nested chains are flattened when the chain is built, so a pipeline runs as one list of passes.
 * A {@link ProfilingException} thrown by any of them is tagged with the name of the failing pass,
 * and any other exception gets a suppressed marker naming it.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<Object, Object>> passes;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    @SuppressWarnings("unchecked")
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        flatten(firstPass, passes);
        flatten(nextPass, passes);
        this.passes = Collections.unmodifiableList((List<IRPass<Object, Object>>) (Object) passes);
    }

    private static void flatten(IRPass<?, ?> pass, List<IRPass<?, ?>> into) {
        if (pass instanceof ChainedPass) {
            into.addAll(((ChainedPass<?, ?, ?>) pass).passes);
        } else {
            into.add(pass);
        }
    }

    /**
     * Get the name a pass is reported under when it fails.
     *
     * @param pass The pass.
     * @return Its class name, or what it prints as if its class has no useful name.
     */
    public static String nameOf(IRPass<?, ?> pass) {
        Class<?> clazz = pass.getClass();
        String name = clazz.getSimpleName();
        return name.isEmpty() || clazz.isSynthetic() ? pass.toString() : name;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (ProfilingException e) {
                throw e.inPass(nameOf(pass));
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException(String.format(
                        "in pass %s (%d of %d)", nameOf(pass), i + 1, passes.size())));
                throw e;
            }
        }
        return (C) acc;
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>(passes.size());
        for (IRPass<?, ?> pass : passes) {
            names.add(nameOf(pass));
        }
        return String.join(" -> ", names);
    }
}
