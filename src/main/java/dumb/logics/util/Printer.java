package dumb.logics.util;

import dumb.logics.Formalism;
import dumb.logics.Formula;
import dumb.logics.Formula.*;
import dumb.logics.UnsupportedFormulaException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders formulas in the notation their formalism's parser reads back. Every operand of an
 * infix operator is parenthesized, so no precedence knowledge is needed on either side.
 */
public enum Printer {
    ;

    public static String toString(Formula f) {
        if (f instanceof Bool b) return bool(b);
        if (f instanceof Atomic a) return a.name;
        if (f instanceof Predicate p) return p.toString();
        if (f instanceof Unary u) return unary(u);
        if (f instanceof Nary n) return nary(n);
        if (f instanceof Quantified q) return q.op.symbol + " " + q.variable.name() + ".(" + toString(q.body) + ")";
        if (f instanceof Modal m) return switch (m.op) {
            case DIAMOND -> "<(" + toString(m.regex) + ")>(" + toString(m.tail) + ")";
            case BOX -> "[(" + toString(m.regex) + ")](" + toString(m.tail) + ")";
            default -> throw UnsupportedFormulaException.of(f, "toString");
        };
        throw UnsupportedFormulaException.of(f, "toString");
    }

    private static String bool(Bool b) {
        if (b.formalism() == Formalism.LDL) return b.value ? "tt" : "ff";
        return b.value ? "true" : "false";
    }

    private static String unary(Unary u) {
        var arg = toString(u.argument);
        return switch (u.op) {
            case NOT -> "~(" + arg + ")";
            case NEXT -> "X(" + arg + ")";
            case WEAK_NEXT -> "N(" + arg + ")";
            case EVENTUALLY -> "F(" + arg + ")";
            case ALWAYS -> "G(" + arg + ")";
            case BEFORE -> "Y(" + arg + ")";
            case ONCE -> "O(" + arg + ")";
            case HISTORICALLY -> "H(" + arg + ")";
            case STAR -> "(" + arg + ")*";
            case TEST -> "?(" + arg + ")";
            case PROP -> "(" + arg + ")";
            default -> throw UnsupportedFormulaException.of(u, "toString");
        };
    }

    private static String nary(Nary n) {
        var separator = switch (n.op) {
            case AND -> " & ";
            case OR -> " | ";
            case IMPLIES -> " -> ";
            case EQUIVALENCE -> " <-> ";
            case UNTIL -> " U ";
            case WEAK_UNTIL -> " W ";
            case RELEASE -> " R ";
            case STRONG_RELEASE -> " M ";
            case SINCE -> " S ";
            case SEQ -> ";";
            case UNION -> "+";
            default -> throw UnsupportedFormulaException.of(n, "toString");
        };
        return wrapped(n.operands, separator);
    }

    private static String wrapped(List<Formula> operands, String separator) {
        return operands.stream().map(x -> "(" + toString(x) + ")").collect(Collectors.joining(separator));
    }
}
