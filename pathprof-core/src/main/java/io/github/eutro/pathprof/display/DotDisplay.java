package io.github.eutro.pathprof.display;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.pathprof.ProfilerOptions;
import io.github.eutro.pathprof.cfg.BasicBlock;
import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.passes.IRPass;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Renders {@link ProfileGraph}s in the Graphviz DOT language, for debugging.
 */
public class DotDisplay {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    public static String toDot(ProfileGraph graph) {
        StringBuilder sb = new StringBuilder("digraph \"profile\" {\n");
        sb.append("  node [shape=box, fontname=monospace];\n");
        for (BasicBlock block : graph.cfg().blocks()) {
            sb.append("  n").append(block.id).append(" [label=\"").append(escape(block.name));
            if (!block.isEmpty()) sb.append(" [").append(block.firstIndex).append("..").append(block.lastIndex).append(']');
            if (graph.hasNumPaths()) sb.append("\\npaths=").append(graph.numPaths(block.id));
            sb.append("\"];\n");
        }
        for (Edge edge : graph.edges()) {
            sb.append("  n").append(edge.from).append(" -> n").append(edge.to)
                    .append(" [label=\"").append(edge.label)
                    .append("\\nw=").append(edge.weight);
            if (edge.weight2 != edge.weight) sb.append(" w2=").append(edge.weight2);
            sb.append('"');
            if (edge.synthetic) sb.append(", style=dashed");
            if (edge.treeEdge) sb.append(", color=green");
            sb.append("];\n");
        }
        for (Edge edge : graph.backEdges()) {
            sb.append("  n").append(edge.from).append(" -> n").append(edge.to)
                    .append(" [label=\"back\", style=dotted, color=red];\n");
        }
        return sb.append("}\n").toString();
    }

    public static void debugDisplayToFile(String dot, File file) {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            writer.write(dot);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Get a pass that writes the graph it is given to {@code <name>.dot} in the debug output directory,
     * and returns it unchanged. Nothing is written if the options have no such directory.
     *
     * @param name    The file name, without extension.
     * @param options The options.
     * @return The pass.
     */
    public static IRPass<ProfileGraph, ProfileGraph> debugDisplay(String name, ProfilerOptions options) {
        return new DebugDisplay(name, options);
    }

    private static final class DebugDisplay implements IRPass<ProfileGraph, ProfileGraph> {
        private final String name;
        private final ProfilerOptions options;

        DebugDisplay(String name, ProfilerOptions options) {
            this.name = name;
            this.options = options;
        }

        @Override
        public ProfileGraph run(ProfileGraph graph) {
            File dir = options.getDebugOutputDirectory();
            if (dir != null) {
                File file = new File(dir, name + ".dot");
                debugDisplayToFile(toDot(graph), file);
                logger.atFine().log("wrote %s", file);
            }
            return graph;
        }

        @Override
        public String toString() {
            return "DebugDisplay(" + name + ")";
        }
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
