package io.github.eutro.pathprof.ir;

import java.util.Objects;

/**
 * Instructions inserted by the instrumenter. Each names the path register it works on.
 */
public final class ProfileInsn implements Insn {
    public enum Kind {
        /**
         * {@code register = constant}
         */
        SET,
        /**
         * {@code register += constant}
         */
        ADD,
        /**
         * {@code count[register]++}, recording the path that just finished.
         */
        COUNT,
        /**
         * An unconditional jump.
         */
        GOTO,
        /**
         * Flushes the path counts recorded so far.
         */
        DUMP,
    }

    public final Kind kind;
    public final String register;
    public final long constant;

    private ProfileInsn(Kind kind, String register, long constant) {
        this.kind = kind;
        this.register = Objects.requireNonNull(register);
        this.constant = constant;
    }

    public static ProfileInsn set(String register, long value) {
        return new ProfileInsn(Kind.SET, register, value);
    }

    public static ProfileInsn add(String register, long value) {
        return new ProfileInsn(Kind.ADD, register, value);
    }

    public static ProfileInsn count(String register) {
        return new ProfileInsn(Kind.COUNT, register, 0);
    }

    public static ProfileInsn jump(String register) {
        return new ProfileInsn(Kind.GOTO, register, 0);
    }

    public static ProfileInsn dump(String register) {
        return new ProfileInsn(Kind.DUMP, register, 0);
    }

    @Override
    public JumpKind jumpKind() {
        return kind == Kind.GOTO ? JumpKind.ALWAYS : JumpKind.NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProfileInsn)) return false;
        ProfileInsn that = (ProfileInsn) o;
        return kind == that.kind && constant == that.constant && register.equals(that.register);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, register, constant);
    }

    @Override
    public String toString() {
        switch (kind) {
            case SET:
                return register + " = " + constant;
            case ADD:
                return register + " += " + constant;
            case COUNT:
                return "count[" + register + "]++";
            case GOTO:
                return "goto";
            case DUMP:
                return "dump " + register;
            default:
                throw new IllegalStateException();
        }
    }
}
