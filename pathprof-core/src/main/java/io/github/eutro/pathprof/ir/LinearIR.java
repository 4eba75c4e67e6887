package io.github.eutro.pathprof.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An immutable sequence of instructions, each paired with a relative jump offset.
 * <p>
 * Every jump's target, {@code index + offset}, lies in {@code [0, size()]}, where
 * {@link #size()} is the exit position: jumping to it ends the program. Non-jump
 * instructions always have an offset of 1.
 * <p>
 * A program may also name some of its positions with labels. Labels are kept for
 * display and block naming, and do not take part in {@link #equals(Object)}.
 */
public final class LinearIR implements Iterable<IREntry> {
    private final List<IREntry> entries;
    private final SortedMap<Integer, String> labels;

    private LinearIR(List<IREntry> entries, SortedMap<Integer, String> labels) {
        this.entries = entries;
        this.labels = labels;
        for (int i = 0; i < entries.size(); i++) {
            IREntry entry = entries.get(i);
            if (entry.isJump()) {
                int target = entry.targetFrom(i);
                if (target < 0 || target > entries.size()) {
                    throw new IllegalArgumentException(String.format(
                            "jump at %d targets %d, outside [0, %d]", i, target, entries.size()));
                }
            } else if (entry.offset != 1) {
                throw new IllegalArgumentException(String.format(
                        "non-jump at %d has offset %d", i, entry.offset));
            }
        }
        for (Integer position : labels.keySet()) {
            if (position < 0 || position > entries.size()) {
                throw new IllegalArgumentException("label " + labels.get(position) + " at " + position + " is out of range");
            }
        }
    }

    public static LinearIR of(List<IREntry> entries) {
        return of(entries, Collections.emptyMap());
    }

    /**
     * Create a program from its entries and labels.
     *
     * @param entries The entries.
     * @param labels  The labels, keyed by the position they name.
     * @return The program.
     * @throws IllegalArgumentException If a jump targets a position outside the program.
     */
    public static LinearIR of(List<IREntry> entries, Map<Integer, String> labels) {
        return new LinearIR(
                Collections.unmodifiableList(new ArrayList<>(entries)),
                Collections.unmodifiableSortedMap(new TreeMap<>(labels))
        );
    }

    /**
     * Parse a program in the assembler text format.
     * <p>
     * Each line holds one of: {@code label:}, {@code var = expr}, {@code if expr else label},
     * or {@code goto label}. Everything after a {@code #} is a comment, and blank lines are ignored.
     *
     * @param text The program text.
     * @return The program.
     * @throws IllegalArgumentException If the text is malformed.
     */
    public static LinearIR parse(String text) {
        return new IRParser(text).parseProgram();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<IREntry> entries() {
        return entries;
    }

    public IREntry get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Get the position jumped to in order to end the program, which is one past the last instruction.
     *
     * @return The exit position.
     */
    public int exitPosition() {
        return entries.size();
    }

    public SortedMap<Integer, String> labels() {
        return labels;
    }

    @Nullable
    public String label(int position) {
        return labels.get(position);
    }

    @NotNull
    @Override
    public Iterator<IREntry> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearIR)) return false;
        return entries.equals(((LinearIR) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= entries.size(); i++) {
            String label = labels.get(i);
            if (label != null) sb.append(label).append(":\n");
            if (i < entries.size()) {
                sb.append(String.format("%4d  %s%n", i, entries.get(i)));
            }
        }
        return sb.toString();
    }

    /**
     * Assembles a {@link LinearIR}, resolving jumps to labels once every label is known.
     */
    public static class Builder {
        private final List<Insn> insns = new ArrayList<>();
        private final Map<Integer, String> jumpLabels = new HashMap<>();
        private final Map<String, Integer> labelPositions = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Name the position of the next instruction added.
         *
         * @param name The label.
         * @return This.
         */
        public Builder label(String name) {
            if (labelPositions.putIfAbsent(name, insns.size()) != null) {
                throw new IllegalArgumentException("duplicate label: " + name);
            }
            return this;
        }

        public Builder assign(String var, Expr value) {
            return add(HostInsn.assign(var, value));
        }

        /**
         * Add a conditional branch, which continues if {@code cond} is nonzero and jumps to {@code elseLabel} otherwise.
         *
         * @param cond      The condition.
         * @param elseLabel The label to jump to if the condition is zero.
         * @return This.
         */
        public Builder branch(Expr cond, String elseLabel) {
            return add(HostInsn.branch(cond), elseLabel);
        }

        public Builder jump(String label) {
            return add(HostInsn.jump(), label);
        }

        /**
         * Add an instruction that is not a jump.
         *
         * @param insn The instruction.
         * @return This.
         */
        public Builder add(Insn insn) {
            if (insn.jumpKind().isJump()) {
                throw new IllegalArgumentException("jump " + insn + " needs a target");
            }
            insns.add(insn);
            return this;
        }

        public Builder add(Insn insn, String target) {
            if (!insn.jumpKind().isJump()) {
                throw new IllegalArgumentException(insn + " is not a jump");
            }
            jumpLabels.put(insns.size(), target);
            insns.add(insn);
            return this;
        }

        public LinearIR build() {
            List<IREntry> entries = new ArrayList<>(insns.size());
            for (int i = 0; i < insns.size(); i++) {
                String target = jumpLabels.get(i);
                if (target == null) {
                    entries.add(IREntry.next(insns.get(i)));
                } else {
                    Integer position = labelPositions.get(target);
                    if (position == null) {
                        throw new IllegalArgumentException("undefined label: " + target);
                    }
                    entries.add(new IREntry(insns.get(i), position - i));
                }
            }
            Map<Integer, String> labels = new HashMap<>();
            labelPositions.forEach(($, pos) -> labels.putIfAbsent(pos, $));
            return of(entries, labels);
        }
    }
}
