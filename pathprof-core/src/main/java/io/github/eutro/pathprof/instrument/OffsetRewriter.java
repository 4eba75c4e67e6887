package io.github.eutro.pathprof.instrument;

import io.github.eutro.pathprof.ProfilingException;
import io.github.eutro.pathprof.ir.IREntry;
import io.github.eutro.pathprof.ir.Insn;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts single instructions into a list of {@link IREntry entries}, re-threading the
 * relative offsets of every jump so that each still lands on the instruction it did before.
 * <p>
 * Each old position {@code j} moves to {@code j} if it is before the insertion point and
 * {@code j + 1} otherwise. A jump to the insertion point itself either skips the new
 * instruction or lands on it, depending on the {@link Binding}.
 */
public final class OffsetRewriter {
    private OffsetRewriter() {
    }

    /**
     * What jumps to the insertion point land on afterwards.
     */
    public enum Binding {
        /**
         * Jumps to the insertion point skip the new instruction, landing on the instruction
         * that was there before. The new instruction is only reached by falling into it.
         */
        BEFORE_TARGETS,
        /**
         * Jumps to the insertion point land on the new instruction.
         */
        AT_TARGET,
    }

    public static int mapPosition(int position, int at) {
        return position < at ? position : position + 1;
    }

    public static int mapTarget(int target, int at, Binding binding) {
        return target < at || (binding == Binding.AT_TARGET && target == at) ? target : target + 1;
    }

    /**
     * Insert an instruction that is not a jump.
     *
     * @param entries The entries to insert into, which are not modified.
     * @param at      The index to insert at, in {@code [0, entries.size()]}.
     * @param insn    The instruction to insert.
     * @param binding What jumps to {@code at} land on afterwards.
     * @return The new entries.
     */
    public static List<IREntry> insert(List<IREntry> entries, int at, Insn insn, Binding binding) {
        if (insn.jumpKind().isJump()) {
            throw new IllegalArgumentException("jump " + insn + " needs a target");
        }
        return insert(entries, at, insn, -1, binding);
    }

    /**
     * Insert an instruction.
     *
     * @param entries      The entries to insert into, which are not modified.
     * @param at           The index to insert at, in {@code [0, entries.size()]}.
     * @param insn         The instruction to insert.
     * @param targetBefore If the instruction is a jump, its target, as an index into the entries
     *                     before insertion. Mapped like any other jump target.
     * @param binding      What jumps to {@code at} land on afterwards.
     * @return The new entries, which may be {@link #validate(List) validated} afterwards.
     */
    public static List<IREntry> insert(List<IREntry> entries, int at, Insn insn, int targetBefore, Binding binding) {
        if (at < 0 || at > entries.size()) {
            throw new IndexOutOfBoundsException("insertion point " + at + " outside [0, " + entries.size() + "]");
        }
        List<IREntry> result = new ArrayList<>(entries.size() + 1);
        for (int j = 0; j < entries.size(); j++) {
            if (j == at) result.add(newEntry(at, insn, targetBefore, binding));
            IREntry entry = entries.get(j);
            if (entry.isJump()) {
                int target = mapTarget(entry.targetFrom(j), at, binding);
                result.add(entry.withOffset(target - mapPosition(j, at)));
            } else {
                result.add(entry);
            }
        }
        if (at == entries.size()) result.add(newEntry(at, insn, targetBefore, binding));
        return result;
    }

    private static IREntry newEntry(int at, Insn insn, int targetBefore, Binding binding) {
        return insn.jumpKind().isJump()
                ? new IREntry(insn, mapTarget(targetBefore, at, binding) - at)
                : IREntry.next(insn);
    }

    /**
     * Point the jump at some index to a new target.
     *
     * @param entries The entries, which are not modified.
     * @param index   The index of the jump.
     * @param target  The new target index.
     * @return The new entries.
     * @throws ProfilingException If the entry at that index is not a jump.
     */
    public static List<IREntry> retarget(List<IREntry> entries, int index, int target) {
        IREntry entry = entries.get(index);
        if (!entry.isJump()) {
            throw new ProfilingException(ProfilingException.Kind.INVALID_OFFSET_STATE,
                    String.format("cannot retarget %s at %d, it is not a jump", entry.insn, index));
        }
        List<IREntry> result = new ArrayList<>(entries);
        result.set(index, entry.withOffset(target - index));
        return result;
    }

    /**
     * Check that every jump lands in {@code [0, entries.size()]} and that every other entry has an offset of 1.
     *
     * @param entries The entries.
     * @throws ProfilingException If any does not.
     */
    public static void validate(List<IREntry> entries) {
        for (int i = 0; i < entries.size(); i++) {
            IREntry entry = entries.get(i);
            if (entry.isJump()) {
                int target = entry.targetFrom(i);
                if (target < 0 || target > entries.size()) {
                    throw new ProfilingException(ProfilingException.Kind.INVALID_OFFSET_STATE,
                            String.format("%s at %d targets %d, outside [0, %d]", entry.insn, i, target, entries.size()));
                }
            } else if (entry.offset != 1) {
                throw new ProfilingException(ProfilingException.Kind.INVALID_OFFSET_STATE,
                        String.format("%s at %d has offset %d", entry.insn, i, entry.offset));
            }
        }
    }
}
