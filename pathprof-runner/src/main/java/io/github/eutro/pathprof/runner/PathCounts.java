package io.github.eutro.pathprof.runner;

import org.jetbrains.annotations.Contract;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * An immutable count of how many times each path id was recorded.
 * <p>
 * In text form, each line holds {@code <path id>: <count>}, in ascending order of id.
 */
public final class PathCounts {
    private static final PathCounts EMPTY = new PathCounts(new TreeMap<>());

    private final SortedMap<Long, Long> counts;

    private PathCounts(TreeMap<Long, Long> counts) {
        this.counts = Collections.unmodifiableSortedMap(counts);
    }

    public static PathCounts empty() {
        return EMPTY;
    }

    /**
     * Get counts holding a snapshot of a map from path id to count.
     *
     * @param counts The counts, which later changes to the map do not affect.
     * @return The counts.
     */
    public static PathCounts copyOf(Map<Long, Long> counts) {
        return counts.isEmpty() ? EMPTY : new PathCounts(new TreeMap<>(counts));
    }

    /**
     * Get counts with one more recording of a path.
     *
     * @param pathId The path id.
     * @return The new counts.
     */
    @Contract(pure = true)
    public PathCounts plus(long pathId) {
        TreeMap<Long, Long> copy = new TreeMap<>(counts);
        copy.merge(pathId, 1L, Long::sum);
        return new PathCounts(copy);
    }

    /**
     * Get the sum of these counts and some others.
     *
     * @param other The other counts.
     * @return The new counts.
     */
    @Contract(pure = true)
    public PathCounts merge(PathCounts other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        TreeMap<Long, Long> copy = new TreeMap<>(counts);
        other.counts.forEach((id, count) -> copy.merge(id, count, Long::sum));
        return new PathCounts(copy);
    }

    public long get(long pathId) {
        return counts.getOrDefault(pathId, 0L);
    }

    public SortedMap<Long, Long> asMap() {
        return counts;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Get the sum of all counts.
     *
     * @return The number of recordings.
     */
    public long total() {
        long total = 0;
        for (long count : counts.values()) {
            total += count;
        }
        return total;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Long, Long> entry : counts.entrySet()) {
            sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Parse counts in text form. Blank lines are ignored, and repeated ids are summed.
     *
     * @param text The text.
     * @return The counts.
     * @throws IllegalArgumentException If a line is malformed.
     */
    public static PathCounts parse(String text) {
        TreeMap<Long, Long> counts = new TreeMap<>();
        String[] lines = text.split("\r?\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) continue;
            int colon = line.indexOf(':');
            if (colon < 0) {
                throw new IllegalArgumentException(String.format("line %d: expected '<path>: <count>', got \"%s\"", i + 1, line));
            }
            try {
                long id = Long.parseLong(line.substring(0, colon).trim());
                long count = Long.parseLong(line.substring(colon + 1).trim());
                counts.merge(id, count, Long::sum);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("line %d: %s", i + 1, e.getMessage()), e);
            }
        }
        return new PathCounts(counts);
    }

    public static PathCounts read(Path file) throws IOException {
        StringBuilder sb = new StringBuilder();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                sb.append(line).append('\n');
            }
        }
        return parse(sb.toString());
    }

    public void write(Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(format());
        }
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof PathCounts && counts.equals(((PathCounts) o).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
