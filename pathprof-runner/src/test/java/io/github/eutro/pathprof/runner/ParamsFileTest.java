package io.github.eutro.pathprof.runner;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ParamsFileTest {
    @Test
    void testParseLine() {
        Map<String, Long> params = ParamsFile.parseLine("{\"x\": 3, \":y\": -1, \"flag\": true}");
        assertEquals(3, params.get(":x").longValue());
        assertEquals(-1, params.get(":y").longValue());
        assertEquals(1, params.get(":flag").longValue());
        assertEquals(3, params.size());

        assertThrows(IllegalArgumentException.class, () -> ParamsFile.parseLine("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> ParamsFile.parseLine("{\"x\": 1.5}"));
        assertThrows(IllegalArgumentException.class, () -> ParamsFile.parseLine("{\"x\": {}}"));
        assertThrows(JsonParseException.class, () -> ParamsFile.parseLine("{\"x\": "));
    }

    @Test
    void testRead() throws IOException {
        List<Map<String, Long>> batch = ParamsFile.read(TestPrograms.path("/params.jsonl"));
        assertEquals(3, batch.size());
        assertEquals(1, batch.get(0).get(":x").longValue());
        assertEquals(0, batch.get(1).get(":x").longValue());
        assertEquals(5, batch.get(2).get(":x").longValue());
    }

    @Test
    void testSkipsInvalidLines() {
        List<Map<String, Long>> batch = ParamsFile.parse("{\"n\": 2}\nnot json\n{\"n\": 4}\n");
        assertEquals(2, batch.size());
        assertEquals(4, batch.get(1).get(":n").longValue());
    }
}
