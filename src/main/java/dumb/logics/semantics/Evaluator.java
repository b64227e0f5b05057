package dumb.logics.semantics;

import dumb.logics.Formula;
import dumb.logics.Formula.*;
import dumb.logics.Operator;
import dumb.logics.UnsupportedFormulaException;

/**
 * Truth value of a propositional formula under an interpretation. Temporal, dynamic and
 * first-order nodes are not evaluated.
 */
public enum Evaluator {
    ;

    public static boolean evaluate(Formula f, Interpretation i) {
        if (f instanceof Bool b) return b.value;
        if (f instanceof Atomic a) return i.holds(a.name);
        if (f instanceof Unary u) {
            if (u.op == Operator.NOT) return !evaluate(u.argument, i);
            throw UnsupportedFormulaException.of(f, "evaluate");
        }
        if (f instanceof Nary n) return switch (n.op) {
            case AND -> n.operands.stream().allMatch(x -> evaluate(x, i));
            case OR -> n.operands.stream().anyMatch(x -> evaluate(x, i));
            case IMPLIES -> implies(n, i);
            case EQUIVALENCE -> equivalence(n, i);
            default -> throw UnsupportedFormulaException.of(f, "evaluate");
        };
        throw UnsupportedFormulaException.of(f, "evaluate");
    }

    /**
     * {@code a -> b -> c} is {@code ~a | ~b | c}.
     */
    private static boolean implies(Nary n, Interpretation i) {
        var last = n.size() - 1;
        for (var k = 0; k < last; k++)
            if (!evaluate(n.get(k), i)) return true;
        return evaluate(n.get(last), i);
    }

    /**
     * Each operand is compared with the result accumulated so far.
     */
    private static boolean equivalence(Nary n, Interpretation i) {
        var result = evaluate(n.get(0), i);
        for (var k = 1; k < n.size(); k++) result = evaluate(n.get(k), i) == result;
        return result;
    }
}
