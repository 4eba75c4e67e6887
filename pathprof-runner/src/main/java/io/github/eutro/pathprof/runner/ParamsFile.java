package io.github.eutro.pathprof.runner;

import com.google.common.flogger.GoogleLogger;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads batches of program parameters, one JSON object per line, such as {@code {"x": 3, ":y": -1}}.
 * <p>
 * Parameters are variables whose names start with {@code :}, which is added to keys that lack it.
 * Blank lines and lines starting with {@code #} are ignored, and lines that are not a JSON object
 * of integers are skipped with a warning.
 */
public class ParamsFile {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    public static List<Map<String, Long>> read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<Map<String, Long>> parse(String text) {
        try {
            return read(new BufferedReader(new StringReader(text)));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static List<Map<String, Long>> read(BufferedReader reader) throws IOException {
        List<Map<String, Long>> batch = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            try {
                batch.add(parseLine(line));
            } catch (JsonParseException | IllegalArgumentException e) {
                logger.atWarning().log("skipping invalid line %d: %s\n  %s", lineNo, line, e.getMessage());
            }
        }
        return batch;
    }

    /**
     * Parse one set of parameters.
     *
     * @param line The JSON object.
     * @return The parameters, keyed by variable name.
     * @throws JsonParseException       If the line is not JSON.
     * @throws IllegalArgumentException If it is not an object of integers.
     */
    public static Map<String, Long> parseLine(String line) {
        JsonElement element = JsonParser.parseString(line);
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }
        JsonObject object = element.getAsJsonObject();
        Map<String, Long> params = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            params.put(paramName(entry.getKey()), integer(entry.getKey(), entry.getValue()));
        }
        return params;
    }

    static String paramName(String key) {
        return key.startsWith(":") ? key : ":" + key;
    }

    private static long integer(String key, JsonElement value) {
        if (value.isJsonPrimitive()) {
            JsonPrimitive primitive = value.getAsJsonPrimitive();
            if (primitive.isBoolean()) return primitive.getAsBoolean() ? 1 : 0;
            if (primitive.isNumber()) {
                try {
                    return primitive.getAsBigDecimal().longValueExact();
                } catch (ArithmeticException e) {
                    throw new IllegalArgumentException(key + ": not an integer: " + value, e);
                }
            }
        }
        throw new IllegalArgumentException(key + ": not an integer: " + value);
    }
}
