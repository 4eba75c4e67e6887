package io.github.eutro.pathprof.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Parses the assembler text format of {@link LinearIR#parse(String)}.
 */
final class IRParser {
    private final String[] lines;
    private int lineNo;
    private String line = "";
    private int pos;

    IRParser(String text) {
        lines = text.split("\r?\n", -1);
    }

    LinearIR parseProgram() {
        LinearIR.Builder builder = LinearIR.builder();
        for (lineNo = 1; lineNo <= lines.length; lineNo++) {
            String raw = lines[lineNo - 1];
            int comment = raw.indexOf('#');
            line = (comment < 0 ? raw : raw.substring(0, comment)).trim();
            pos = 0;
            if (line.isEmpty()) continue;
            parseLine(builder);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid program: " + e.getMessage(), e);
        }
    }

    private void parseLine(LinearIR.Builder builder) {
        if (line.endsWith(":")) {
            String label = line.substring(0, line.length() - 1).trim();
            pos = 0;
            line = label;
            String name = identifier();
            expectEnd();
            try {
                builder.label(name);
            } catch (IllegalArgumentException e) {
                throw error(e.getMessage());
            }
            return;
        }
        String first = identifier();
        switch (first) {
            case "goto": {
                String target = identifier();
                expectEnd();
                builder.jump(target);
                return;
            }
            case "if": {
                Expr cond = expr(0);
                String keyword = identifier();
                if (!keyword.equals("else")) throw error("expected 'else', got '" + keyword + "'");
                String target = identifier();
                expectEnd();
                builder.branch(cond, target);
                return;
            }
            default: {
                skipSpace();
                if (!eat("=")) throw error("expected '='");
                Expr value = expr(0);
                expectEnd();
                builder.assign(first, value);
            }
        }
    }

    private Expr expr(int minPrecedence) {
        Expr lhs = unary();
        while (true) {
            skipSpace();
            Expr.BinaryOp op = peekBinaryOp();
            if (op == null || op.precedence < minPrecedence) return lhs;
            pos += op.symbol.length();
            Expr rhs = expr(op.precedence + 1);
            lhs = Expr.binary(op, lhs, rhs);
        }
    }

    @Nullable
    private Expr.BinaryOp peekBinaryOp() {
        Expr.BinaryOp best = null;
        for (Expr.BinaryOp op : Expr.BinaryOp.values()) {
            if (line.startsWith(op.symbol, pos) && (best == null || op.symbol.length() > best.symbol.length())) {
                best = op;
            }
        }
        return best;
    }

    private Expr unary() {
        skipSpace();
        if (eat("-")) return Expr.unary(Expr.UnaryOp.NEG, unary());
        if (line.startsWith("!", pos) && !line.startsWith("!=", pos)) {
            pos++;
            return Expr.unary(Expr.UnaryOp.NOT, unary());
        }
        if (eat("(")) {
            Expr inner = expr(0);
            skipSpace();
            if (!eat(")")) throw error("expected ')'");
            return inner;
        }
        if (pos < line.length() && Character.isDigit(line.charAt(pos))) {
            int start = pos;
            while (pos < line.length() && Character.isDigit(line.charAt(pos))) pos++;
            try {
                return Expr.num(Long.parseLong(line.substring(start, pos)));
            } catch (NumberFormatException e) {
                throw error("number out of range: " + line.substring(start, pos));
            }
        }
        return Expr.var(identifier());
    }

    private String identifier() {
        skipSpace();
        int start = pos;
        if (pos < line.length() && line.charAt(pos) == ':') pos++;
        int nameStart = pos;
        while (pos < line.length() && (Character.isLetterOrDigit(line.charAt(pos)) || line.charAt(pos) == '_')) {
            pos++;
        }
        if (pos == nameStart || Character.isDigit(line.charAt(nameStart))) {
            throw error("expected an identifier");
        }
        return line.substring(start, pos);
    }

    private boolean eat(String s) {
        if (line.startsWith(s, pos)) {
            pos += s.length();
            return true;
        }
        return false;
    }

    private void skipSpace() {
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) pos++;
    }

    private void expectEnd() {
        skipSpace();
        if (pos != line.length()) throw error("unexpected '" + line.substring(pos) + "'");
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(String.format("line %d: %s", lineNo, message));
    }
}
