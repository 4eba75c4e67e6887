package io.github.eutro.pathprof.ir;

import java.util.Objects;

/**
 * An instruction paired with its offset, relative to its own index.
 */
public final class IREntry {
    public final Insn insn;
    public final int offset;

    public IREntry(Insn insn, int offset) {
        this.insn = Objects.requireNonNull(insn);
        this.offset = offset;
    }

    /**
     * Create an entry for an instruction that is not a jump.
     *
     * @param insn The instruction.
     * @return The entry, with an offset of 1.
     */
    public static IREntry next(Insn insn) {
        return new IREntry(insn, 1);
    }

    public IREntry withOffset(int offset) {
        return new IREntry(insn, offset);
    }

    /**
     * Get the absolute index this entry's jump lands on.
     *
     * @param index The index of this entry.
     * @return The target index.
     */
    public int targetFrom(int index) {
        return index + offset;
    }

    public boolean isJump() {
        return insn.jumpKind().isJump();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IREntry entry = (IREntry) o;
        return offset == entry.offset && insn.equals(entry.insn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(insn, offset);
    }

    @Override
    public String toString() {
        return insn + (isJump() ? " (" + (offset >= 0 ? "+" : "") + offset + ")" : "");
    }
}
