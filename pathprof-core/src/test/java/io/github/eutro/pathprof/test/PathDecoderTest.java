package io.github.eutro.pathprof.test;

import io.github.eutro.pathprof.cfg.Edge;
import io.github.eutro.pathprof.cfg.ProfileGraph;
import io.github.eutro.pathprof.decode.PathDecoder;
import io.github.eutro.pathprof.passes.Passes;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PathDecoderTest {
    private static PathDecoder decoder(String program) {
        return new PathDecoder(Passes.NUMBER_PATHS.run(Utils.getCfg(program)));
    }

    @Test
    void testDiamond() {
        PathDecoder decoder = decoder("/diamond.ir");
        assertEquals(2, decoder.numPaths());
        assertEquals(List.of("START", "A", "B", "END"), decoder.decode(0));
        assertEquals(List.of("START", "A", "C", "END"), decoder.decode(1));
    }

    @Test
    void testLoop() {
        PathDecoder decoder = decoder("/loop.ir");
        assertEquals(4, decoder.numPaths());
        assertEquals(List.of("START", "B0", "H", "B2"), decoder.decode(0));
        assertEquals(List.of("START", "B0", "H", "END"), decoder.decode(1));
        assertEquals(List.of("H", "B2"), decoder.decode(2));
        assertEquals(List.of("H", "END"), decoder.decode(3));
    }

    @Test
    void testFallthroughLoop() {
        PathDecoder decoder = decoder("/fallthrough.ir");
        assertEquals(List.of("START", "B0", "check", "B4", "body"), decoder.decode(0));
        assertEquals(List.of("START", "B0", "check", "END"), decoder.decode(1));
        assertEquals(List.of("check", "B4", "body"), decoder.decode(2));
        assertEquals(List.of("check", "END"), decoder.decode(3));
    }

    @Test
    void testConditionalBackEdges() {
        PathDecoder self = decoder("/selfloop.ir");
        assertEquals(4, self.numPaths());
        assertEquals(List.of("START", "B0", "L", "END"), self.decode(0));
        assertEquals(List.of("START", "B0", "L"), self.decode(1));
        assertEquals(List.of("L", "END"), self.decode(2));
        assertEquals(List.of("L"), self.decode(3));

        PathDecoder rotated = decoder("/rotated.ir");
        assertEquals(4, rotated.numPaths());
        assertEquals(List.of("START", "B0", "H", "A", "END"), rotated.decode(0));
        assertEquals(List.of("START", "B0", "H", "A"), rotated.decode(1));
        assertEquals(List.of("H", "A", "END"), rotated.decode(2));
        assertEquals(List.of("H", "A"), rotated.decode(3));
    }

    @Test
    void testEveryIdDecodes() {
        for (String program : new String[]{
                "/diamond.ir", "/loop.ir", "/fallthrough.ir", "/nested.ir", "/selfloop.ir", "/rotated.ir"}) {
            for (boolean optimize : new boolean[]{true, false}) {
                ProfileGraph graph = (optimize ? Passes.NUMBER_PATHS : Passes.NUMBER_PATHS_UNOPTIMIZED)
                        .run(Utils.getCfg(program));
                PathDecoder decoder = new PathDecoder(graph);
                for (long id = 0; id < decoder.numPaths(); id++) {
                    long sum = 0;
                    for (Edge edge : decoder.decodeEdges(id)) sum += edge.weight2;
                    assertEquals(id, sum, program);
                }
            }
        }
    }

    @Test
    void testTrace() {
        PathDecoder decoder = decoder("/loop.ir");
        List<String> blocks = decoder.decodeTrace(Arrays.asList(0L, 2L, 2L, 3L));
        assertEquals(List.of("START", "B0", "H", "B2", "H", "B2", "H", "B2", "H", "END"), blocks);
        assertEquals(4, blocks.stream().filter("H"::equals).count());
    }

    @Test
    void testOutOfRange() {
        PathDecoder decoder = decoder("/diamond.ir");
        assertThrows(IllegalArgumentException.class, () -> decoder.decode(2));
        assertThrows(IllegalArgumentException.class, () -> decoder.decode(-1));
        ProfileGraph unnumbered = ProfileGraph.of(Utils.getCfg("/diamond.ir"));
        assertThrows(IllegalArgumentException.class, () -> new PathDecoder(unnumbered));
    }
}
