package dumb.logics.deduction;

import dumb.logics.Formula;
import dumb.logics.Formula.*;
import dumb.logics.Formulas;
import dumb.logics.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * First-order term replacement and the structural queries natural deduction needs around it.
 * Terms are compared by kind and name.
 */
public final class Substitution {

    /**
     * A pair of corresponding positions where two trees differ. Either side is a {@link Formula} or a {@link Term}.
     */
    public record Diff(Object left, Object right) {
    }

    private final Formulas formulas;

    public Substitution(Formulas formulas) {
        this.formulas = requireNonNull(formulas);
    }

    /**
     * {@code f[from := to]}: every occurrence of {@code from}, except inside quantifiers that bind it.
     */
    public Formula replace(Formula f, Term from, Term to) {
        if (f instanceof Predicate p)
            return formulas.apply(p, p.operands.stream().map(t -> replace(t, from, to)).toList());
        if (f instanceof Quantified q)
            return q.variable.equals(from) ? q : formulas.quantifier(q.op, q.variable, replace(q.body, from, to));
        if (f instanceof Unary u)
            return formulas.make(u.op, List.of(replace(u.argument, from, to)));
        if (f instanceof Nary n)
            return formulas.make(n.op, n.operands.stream().map(o -> replace(o, from, to)).toList());
        if (f instanceof Modal m)
            return formulas.make(m.op, List.of(replace(m.regex, from, to), replace(m.tail, from, to)));
        return f;
    }

    public static Term replace(Term t, Term from, Term to) {
        if (t.equals(from)) return to;
        if (t instanceof Term.Fn fn) return fn.apply(fn.operands().stream().map(o -> replace(o, from, to)).toList());
        return t;
    }

    /**
     * The outermost positions where {@code x} and {@code y} differ, walking both trees in step.
     * Commutative operands present on both sides are matched first.
     */
    public static Set<Diff> diff(Object x, Object y) {
        var out = new LinkedHashSet<Diff>();
        diff(x, y, out);
        return out;
    }

    private static void diff(Object x, Object y, Set<Diff> out) {
        if (x.equals(y)) return;
        if (x instanceof Term.Fn a && y instanceof Term.Fn b && a.name().equals(b.name()) && a.arity() == b.arity()) {
            zip(a.operands(), b.operands(), out);
        } else if (x instanceof Predicate a && y instanceof Predicate b && a.name.equals(b.name) && a.arity() == b.arity()) {
            zip(a.operands, b.operands, out);
        } else if (x instanceof Unary a && y instanceof Unary b && a.op == b.op) {
            diff(a.argument, b.argument, out);
        } else if (x instanceof Nary a && y instanceof Nary b && a.op == b.op && a.size() == b.size()) {
            if (a.op.commutative()) {
                var left = new ArrayList<>(a.operands);
                var right = new ArrayList<>(b.operands);
                left.removeAll(b.operandSet());
                right.removeAll(a.operandSet());
                zip(left, alongside(left, right), out);
            } else {
                zip(a.operands, b.operands, out);
            }
        } else if (x instanceof Quantified a && y instanceof Quantified b && a.op == b.op && a.variable.equals(b.variable)) {
            diff(a.body, b.body, out);
        } else if (x instanceof Modal a && y instanceof Modal b && a.op == b.op) {
            diff(a.regex, b.regex, out);
            diff(a.tail, b.tail, out);
        } else {
            out.add(new Diff(x, y));
        }
    }

    /**
     * Reorders {@code right} so each operand faces a {@code left} operand of the same shape where one exists.
     */
    private static List<Formula> alongside(List<Formula> left, List<Formula> right) {
        if (left.size() != right.size()) return right;
        var rest = new ArrayList<>(right);
        var paired = new ArrayList<Formula>(right.size());
        for (var l : left) {
            var match = rest.stream().filter(r -> sameShape(l, r)).findFirst().orElse(null);
            paired.add(match);
            if (match != null) rest.remove(match);
        }
        for (var i = 0; i < paired.size(); i++)
            if (paired.get(i) == null) paired.set(i, rest.remove(0));
        return paired;
    }

    private static boolean sameShape(Formula x, Formula y) {
        if (x instanceof Predicate a && y instanceof Predicate b) return a.name.equals(b.name) && a.arity() == b.arity();
        if (x instanceof Atomic a && y instanceof Atomic b) return a.name.equals(b.name);
        if (x instanceof Unary a && y instanceof Unary b) return a.op == b.op;
        if (x instanceof Nary a && y instanceof Nary b) return a.op == b.op && a.size() == b.size();
        if (x instanceof Quantified a && y instanceof Quantified b) return a.op == b.op && a.variable.equals(b.variable);
        if (x instanceof Modal a && y instanceof Modal b) return a.op == b.op;
        return false;
    }

    private static void zip(List<?> xs, List<?> ys, Set<Diff> out) {
        if (xs.size() != ys.size()) {
            out.add(new Diff(xs, ys));
            return;
        }
        for (var i = 0; i < xs.size(); i++) diff(xs.get(i), ys.get(i), out);
    }

    /**
     * Whether {@code t} occurs in any of the formulas, bound variables included.
     */
    public static boolean occurs(Term t, Iterable<? extends Formula> formulas) {
        for (var f : formulas) if (occurs(t, f)) return true;
        return false;
    }

    public static boolean occurs(Term t, Formula f) {
        if (f instanceof Predicate p) return p.operands.stream().anyMatch(o -> o.contains(t));
        if (f instanceof Quantified q) return q.variable.equals(t) || occurs(t, q.body);
        if (f instanceof Unary u) return occurs(t, u.argument);
        if (f instanceof Nary n) return n.operands.stream().anyMatch(o -> occurs(t, o));
        if (f instanceof Modal m) return occurs(t, m.regex) || occurs(t, m.tail);
        return false;
    }

    /**
     * Whether substituting {@code t} for the free occurrences of {@code x} in {@code f} captures none
     * of the variables of {@code t}.
     */
    public static boolean isFreeFor(Term t, Term.Var x, Formula f) {
        return freeFor(f, x, t.vars(), Set.of());
    }

    private static boolean freeFor(Formula f, Term.Var x, Set<Term.Var> vars, Set<Term.Var> bound) {
        if (f instanceof Predicate p)
            return p.operands.stream().noneMatch(o -> o.contains(x)) || Collections.disjoint(vars, bound);
        if (f instanceof Quantified q) {
            if (q.variable.equals(x)) return true;
            var b = new HashSet<>(bound);
            b.add(q.variable);
            return freeFor(q.body, x, vars, b);
        }
        if (f instanceof Unary u) return freeFor(u.argument, x, vars, bound);
        if (f instanceof Nary n) return n.operands.stream().allMatch(o -> freeFor(o, x, vars, bound));
        if (f instanceof Modal m) return freeFor(m.regex, x, vars, bound) && freeFor(m.tail, x, vars, bound);
        return true;
    }
}
