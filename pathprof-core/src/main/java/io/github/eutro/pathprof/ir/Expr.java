package io.github.eutro.pathprof.ir;

import java.util.Objects;

/**
 * An integer expression of the reference host instruction set.
 * <p>
 * Booleans are integers: comparisons yield 0 or 1, and any nonzero value is true.
 */
public abstract class Expr {
    /**
     * Looks up the values of variables while evaluating.
     */
    @FunctionalInterface
    public interface Env {
        /**
         * Get the value of a variable.
         *
         * @param name The name of the variable.
         * @return Its value.
         */
        long lookup(String name);
    }

    private Expr() {
    }

    public abstract long eval(Env env);

    public static Expr num(long value) {
        return new Const(value);
    }

    public static Expr var(String name) {
        return new Ref(name);
    }

    public static Expr unary(UnaryOp op, Expr operand) {
        return new Unary(op, operand);
    }

    public static Expr binary(BinaryOp op, Expr lhs, Expr rhs) {
        return new Binary(op, lhs, rhs);
    }

    public enum UnaryOp {
        NEG("-"),
        NOT("!");

        public final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum BinaryOp {
        OR("||", 1),
        AND("&&", 2),
        EQ("==", 3),
        NE("!=", 3),
        LT("<", 4),
        LE("<=", 4),
        GT(">", 4),
        GE(">=", 4),
        ADD("+", 5),
        SUB("-", 5),
        MUL("*", 6),
        DIV("/", 6),
        REM("%", 6);

        public final String symbol;
        /**
         * How tightly this operator binds, higher binding tighter.
         */
        public final int precedence;

        BinaryOp(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        long apply(long lhs, long rhs) {
            switch (this) {
                case OR:
                    return lhs != 0 || rhs != 0 ? 1 : 0;
                case AND:
                    return lhs != 0 && rhs != 0 ? 1 : 0;
                case EQ:
                    return lhs == rhs ? 1 : 0;
                case NE:
                    return lhs != rhs ? 1 : 0;
                case LT:
                    return lhs < rhs ? 1 : 0;
                case LE:
                    return lhs <= rhs ? 1 : 0;
                case GT:
                    return lhs > rhs ? 1 : 0;
                case GE:
                    return lhs >= rhs ? 1 : 0;
                case ADD:
                    return lhs + rhs;
                case SUB:
                    return lhs - rhs;
                case MUL:
                    return lhs * rhs;
                case DIV:
                    return lhs / rhs;
                case REM:
                    return lhs % rhs;
                default:
                    throw new IllegalStateException();
            }
        }
    }

    public static final class Const extends Expr {
        public final long value;

        private Const(long value) {
            this.value = value;
        }

        @Override
        public long eval(Env env) {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Const && ((Const) o).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    public static final class Ref extends Expr {
        public final String name;

        private Ref(String name) {
            this.name = name;
        }

        @Override
        public long eval(Env env) {
            return env.lookup(name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ref && ((Ref) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Unary extends Expr {
        public final UnaryOp op;
        public final Expr operand;

        private Unary(UnaryOp op, Expr operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public long eval(Env env) {
            long value = operand.eval(env);
            return op == UnaryOp.NEG ? -value : value == 0 ? 1 : 0;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unary)) return false;
            Unary unary = (Unary) o;
            return op == unary.op && operand.equals(unary.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }

        @Override
        public String toString() {
            return op.symbol + operand;
        }
    }

    public static final class Binary extends Expr {
        public final BinaryOp op;
        public final Expr lhs;
        public final Expr rhs;

        private Binary(BinaryOp op, Expr lhs, Expr rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public long eval(Env env) {
            long l = lhs.eval(env);
            // short circuit, so guards like "y != 0 && x / y > 1" work
            if (op == BinaryOp.AND && l == 0) return 0;
            if (op == BinaryOp.OR && l != 0) return 1;
            return op.apply(l, rhs.eval(env));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary binary = (Binary) o;
            return op == binary.op && lhs.equals(binary.lhs) && rhs.equals(binary.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, lhs, rhs);
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + op.symbol + " " + rhs + ")";
        }
    }
}
