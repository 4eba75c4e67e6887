package io.github.eutro.pathprof.test;

import io.github.eutro.pathprof.ProfilerOptions;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.display.DotDisplay;
import io.github.eutro.pathprof.passes.Passes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.*;

public class DotDisplayTest {
    @Test
    void testToDot() {
        ProfileGraph graph = Passes.NUMBER_PATHS.run(Utils.getCfg("/loop.ir"));
        String dot = DotDisplay.toDot(graph);
        assertTrue(dot.startsWith("digraph"));
        assertTrue(dot.contains("START"));
        assertTrue(dot.contains("paths=4"));
        assertTrue(dot.contains("style=dashed"));
        assertTrue(dot.contains("label=\"back\""));
    }

    @Test
    void testDebugDisplay(@TempDir File dir) throws IOException {
        ProfilerOptions options = new ProfilerOptions().setDebugOutputDirectory(new File(dir, "graphs"));
        ProfileGraph graph = Passes.numberPaths(options).run(Utils.getCfg("/diamond.ir"));
        File weighted = new File(dir, "graphs/weighted.dot");
        assertTrue(new File(dir, "graphs/dag.dot").isFile());
        assertEquals(DotDisplay.toDot(graph),
                new String(Files.readAllBytes(weighted.toPath()), StandardCharsets.UTF_8));

        ProfileGraph same = DotDisplay.debugDisplay("unused", new ProfilerOptions().setDebugOutputDirectory(null))
                .run(graph);
        assertSame(graph, same);
    }
}
