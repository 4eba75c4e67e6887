package io.github.eutro.pathprof.test;

import io.github.eutro.pathprof.cfg.ControlFlowGraph;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.ir.LinearIR;
import io.github.eutro.pathprof.passes.BuildCfg;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public class Utils {
    public static LinearIR getProgram(String name) {
        try (InputStream is = Utils.class.getResourceAsStream(name)) {
            if (is == null) throw new IllegalArgumentException("no such resource: " + name);
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            byte[] buf = new byte[4096];
            int n;
            while ((n = is.read(buf)) != -1) {
                bytes.write(buf, 0, n);
            }
            return LinearIR.parse(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ControlFlowGraph getCfg(String name) {
        return BuildCfg.INSTANCE.run(getProgram(name));
    }

    /**
     * Call a function for every path from the entry to the exit of an acyclic graph, with the edges of the path.
     */
    public static void forEachPath(ProfileGraph graph, Consumer<List<Edge>> f) {
        forEachPath(graph, graph.entry(), new ArrayList<>(), f);
    }

    private static void forEachPath(ProfileGraph graph, int node, List<Edge> path, Consumer<List<Edge>> f) {
        if (node == graph.exit()) {
            f.accept(new ArrayList<>(path));
            return;
        }
        for (Edge edge : graph.outEdges(node)) {
            path.add(edge);
            forEachPath(graph, edge.to, path, f);
            path.remove(path.size() - 1);
        }
    }

    public static Edge edge(ProfileGraph graph, String from, String to) {
        for (Edge edge : graph.edges()) {
            if (graph.name(edge.from).equals(from) && graph.name(edge.to).equals(to)) return edge;
        }
        throw new AssertionError("no edge " + from + " -> " + to + " in " + graph);
    }
}
