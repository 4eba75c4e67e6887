package io.github.eutro.pathprof.ir;

import java.util.Objects;

/**
 * Instructions of the program being profiled.
 * <p>
 * The profiler never looks past their {@link #jumpKind()}; only the interpreter
 * executes them.
 */
public abstract class HostInsn implements Insn {
    private HostInsn() {
    }

    public static Assign assign(String var, Expr value) {
        return new Assign(var, value);
    }

    public static Branch branch(Expr cond) {
        return new Branch(cond);
    }

    public static Goto jump() {
        return Goto.INSTANCE;
    }

    /**
     * Stores the value of an expression in a variable.
     */
    public static final class Assign extends HostInsn {
        public final String var;
        public final Expr value;

        private Assign(String var, Expr value) {
            this.var = Objects.requireNonNull(var);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public JumpKind jumpKind() {
            return JumpKind.NONE;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Assign)) return false;
            Assign assign = (Assign) o;
            return var.equals(assign.var) && value.equals(assign.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(var, value);
        }

        @Override
        public String toString() {
            return var + " = " + value;
        }
    }

    /**
     * Continues to the next instruction if the condition is nonzero, and jumps otherwise.
     */
    public static final class Branch extends HostInsn {
        public final Expr cond;

        private Branch(Expr cond) {
            this.cond = Objects.requireNonNull(cond);
        }

        @Override
        public JumpKind jumpKind() {
            return JumpKind.CONDITIONAL;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Branch && ((Branch) o).cond.equals(cond);
        }

        @Override
        public int hashCode() {
            return cond.hashCode();
        }

        @Override
        public String toString() {
            return "if " + cond;
        }
    }

    public static final class Goto extends HostInsn {
        static final Goto INSTANCE = new Goto();

        private Goto() {
        }

        @Override
        public JumpKind jumpKind() {
            return JumpKind.ALWAYS;
        }

        @Override
        public String toString() {
            return "goto";
        }
    }
}
