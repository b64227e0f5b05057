package dumb.logics.deduction;

import dumb.logics.Formula;
import dumb.logics.Formula.*;
import dumb.logics.Formulas;
import dumb.logics.Logics;
import dumb.logics.LogicsException;
import dumb.logics.Term;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static dumb.logics.Operator.*;
import static java.util.Objects.requireNonNull;

/**
 * Checks natural deduction proofs row by row.
 * <p>
 * Rows are proven in order. A formula row must follow by its cited rule from the cited rows that
 * are in scope; citations of rows out of scope are ignored, so the rule sees fewer premises and
 * usually fails. A box is checked against a copy of the enclosing scope and, once closed, is
 * visible only as a whole. A box opened by a witness term requires the term to be fresh: it may
 * occur in no formula proven so far. The first unjustified row makes the whole proof fail.
 * <p>
 * Formulas are compared structurally.
 */
public final class NaturalDeduction {

    private static final Logger logger = LoggerFactory.getLogger(NaturalDeduction.class);

    @FunctionalInterface
    interface Validator {
        /**
         * @param args proven contents of the cited rows: formulas, or proofs for cited boxes
         */
        boolean check(Formula formula, List<Object> args);
    }

    private final Formulas formulas;
    private final Substitution substitution;
    private final Logics.Configuration configuration;
    private final Map<Rule, Validator> validators = new EnumMap<>(Rule.class);

    public NaturalDeduction() {
        this(Formulas.the, Logics.configuration());
    }

    public NaturalDeduction(Formulas formulas, Logics.Configuration configuration) {
        this.formulas = requireNonNull(formulas);
        this.configuration = requireNonNull(configuration);
        this.substitution = new Substitution(formulas);

        validators.put(Rule.PREMISE, (f, args) -> true);
        validators.put(Rule.ASSUMPTION, (f, args) -> true);
        validators.put(Rule.COPY, (f, args) -> f.equals(formula(args, 0)));
        validators.put(Rule.AND_E1, this::andE1);
        validators.put(Rule.AND_E2, this::andE2);
        validators.put(Rule.AND_I, this::andI);
        validators.put(Rule.OR_I1, (f, args) -> orI(f, formula(args, 0), true));
        validators.put(Rule.OR_I2, (f, args) -> orI(f, formula(args, 0), false));
        validators.put(Rule.OR_E, this::orE);
        validators.put(Rule.IMPL_E, (f, args) -> implication(formula(args, 1), formula(args, 0), f));
        validators.put(Rule.IMPL_I, this::implI);
        validators.put(Rule.MT, this::modusTollens);
        validators.put(Rule.NEG_E, this::negE);
        validators.put(Rule.NEG_I, this::negI);
        validators.put(Rule.BOT_E, (f, args) -> args.size() > 0 && isFalse(args.get(0)));
        validators.put(Rule.DNEG_E, (f, args) -> formulas.not(formulas.not(f)).equals(formula(args, 0)));
        validators.put(Rule.DNEG_I, (f, args) -> {
            var a = formula(args, 0);
            return a != null && f.equals(formulas.not(formulas.not(a)));
        });
        validators.put(Rule.FORALL_E, this::forallE);
        validators.put(Rule.FORALL_I, this::forallI);
        validators.put(Rule.EXISTS_E, this::existsE);
        validators.put(Rule.EXISTS_I, this::existsI);
    }

    public boolean check(Proof proof) {
        return check(proof, new HashMap<>(), 0);
    }

    private boolean check(Proof proof, Map<Integer, Object> sound, int depth) {
        if (depth > configuration.maxProofDepth()) {
            logger.debug("boxes nested deeper than {}", configuration.maxProofDepth());
            return false;
        }
        for (var row : proof) {
            if (row instanceof Proof.Step s) {
                if (configuration.traceProofs()) logger.debug("{}{}\t{}\t{}", "| ".repeat(depth), s.id(), s.formula(), s.by());
                if (!justified(s, sound)) return false;
                sound.put(s.id(), s.formula());
            } else if (row instanceof Proof.Box b) {
                if (b.proof().first() instanceof Term t && Substitution.occurs(t, proven(sound))) {
                    logger.debug("box {}: witness {} is not fresh", b.id(), t);
                    return false;
                }
                if (!check(b.proof(), new HashMap<>(sound), depth + 1)) return false;
                sound.put(b.id(), b.proof());
            }
        }
        return true;
    }

    private boolean justified(Proof.Step s, Map<Integer, Object> sound) {
        var rule = Rule.of(s.by().rule());
        if (rule == null) {
            logger.debug("row {}: unknown rule {}", s.id(), s.by().rule());
            return false;
        }
        var args = s.by().refs().stream().filter(sound::containsKey).map(sound::get).toList();
        boolean ok;
        try {
            ok = validators.get(rule).check(s.formula(), args);
        } catch (LogicsException e) {
            logger.debug("row {}: {} does not apply: {}", s.id(), rule, e.getMessage());
            ok = false;
        }
        if (!ok) logger.debug("row {}: {} is not justified by {}", s.id(), s.formula(), s.by());
        return ok;
    }

    private static List<Formula> proven(Map<Integer, Object> sound) {
        return sound.values().stream().filter(Formula.class::isInstance).map(Formula.class::cast).toList();
    }

    private boolean andE1(Formula f, List<Object> args) {
        return formula(args, 0) instanceof Nary n && n.op == AND && f.equals(n.get(0));
    }

    /**
     * The conjunction of every conjunct but the first.
     */
    private boolean andE2(Formula f, List<Object> args) {
        if (!(formula(args, 0) instanceof Nary n) || n.op != AND) return false;
        return f.equals(n.size() == 2 ? n.get(1) : formulas.and(n.operands.subList(1, n.size())));
    }

    private boolean andI(Formula f, List<Object> args) {
        var a = formula(args, 0);
        var b = formula(args, 1);
        return a != null && b != null && f.equals(formulas.and(a, b));
    }

    /**
     * The disjuncts of {@code a} lead (or trail) the disjunction {@code f}.
     */
    private static boolean orI(Formula f, @Nullable Formula a, boolean leading) {
        if (a == null || !(f instanceof Nary n) || n.op != OR) return false;
        var disjuncts = a instanceof Nary m && m.op == OR ? m.operands : List.of(a);
        var k = disjuncts.size();
        if (k >= n.size()) return false;
        return (leading ? n.operands.subList(0, k) : n.operands.subList(n.size() - k, n.size())).equals(disjuncts);
    }

    private boolean orE(Formula f, List<Object> args) {
        var disjunction = formula(args, 0);
        var left = box(args, 1);
        var right = box(args, 2);
        if (disjunction == null || left == null || right == null) return false;
        if (!(left.first() instanceof Formula phi) || !(right.first() instanceof Formula psi)) return false;
        return disjunction.equals(formulas.or(phi, psi)) && f.equals(left.last()) && f.equals(right.last());
    }

    private boolean implI(Formula f, List<Object> args) {
        var box = box(args, 0);
        return box != null && box.first() instanceof Formula phi && box.last() instanceof Formula psi
                && implication(f, phi, psi);
    }

    private boolean modusTollens(Formula f, List<Object> args) {
        return f instanceof Unary notPhi && notPhi.op == NOT
                && formula(args, 1) instanceof Unary notPsi && notPsi.op == NOT
                && implication(formula(args, 0), notPhi.argument, notPsi.argument);
    }

    private boolean negE(Formula f, List<Object> args) {
        var a = formula(args, 0);
        return a != null && isFalse(f) && formulas.not(a).equals(formula(args, 1));
    }

    private boolean negI(Formula f, List<Object> args) {
        var box = box(args, 0);
        return box != null && box.first() instanceof Formula phi && isFalse(box.last()) && f.equals(formulas.not(phi));
    }

    private boolean forallE(Formula f, List<Object> args) {
        if (!(formula(args, 0) instanceof Quantified q) || q.op != FORALL) return false;
        return instance(q, f);
    }

    private boolean existsI(Formula f, List<Object> args) {
        if (!(f instanceof Quantified q) || q.op != EXISTS) return false;
        var a = formula(args, 0);
        return a != null && instance(q, a);
    }

    /**
     * Whether {@code f} is the body of {@code q} with a single term, free for the variable,
     * in place of the variable. Candidate terms are read off where the body and {@code f} differ.
     */
    private boolean instance(Quantified q, Formula f) {
        return Substitution.diff(q.body, f).stream()
                .filter(d -> d.left().equals(q.variable))
                .map(Substitution.Diff::right)
                .filter(Term.class::isInstance)
                .map(Term.class::cast)
                .distinct()
                .anyMatch(a -> Substitution.isFreeFor(a, q.variable, q.body)
                        && substitution.replace(q.body, q.variable, a).equals(f));
    }

    private boolean forallI(Formula f, List<Object> args) {
        if (!(f instanceof Quantified q) || q.op != FORALL) return false;
        var box = box(args, 0);
        return box != null && box.first() instanceof Term a && box.last() instanceof Formula instance
                && substitution.replace(q.body, q.variable, a).equals(instance);
    }

    /**
     * The box opens with a witness {@code a} and {@code phi[x := a]}, and closes with a formula free of {@code a}.
     */
    private boolean existsE(Formula f, List<Object> args) {
        if (!(formula(args, 0) instanceof Quantified q) || q.op != EXISTS) return false;
        var box = box(args, 1);
        if (box == null || box.size() < 2 || !(box.first() instanceof Term a)) return false;
        if (!Objects.equals(box.content(1), substitution.replace(q.body, q.variable, a))) return false;
        return box.last() instanceof Formula chi && !Substitution.occurs(a, chi) && f.equals(chi);
    }

    /**
     * Whether {@code imp} is {@code phi -> psi}: directly, as the head of an implication chain whose
     * remainder is {@code psi}, or, with material implication enabled, as {@code ~phi | psi}.
     */
    private boolean implication(@Nullable Formula imp, @Nullable Formula phi, Formula psi) {
        if (imp == null || phi == null) return false;
        if (imp instanceof Nary n && n.op == IMPLIES && n.get(0).equals(phi)) {
            var rest = n.size() == 2 ? n.get(1) : formulas.implies(n.operands.subList(1, n.size()));
            if (rest.equals(psi)) return true;
        }
        if (imp.equals(formulas.implies(phi, psi))) return true;
        return configuration.materialImplication() && imp.equals(formulas.or(formulas.not(phi), psi));
    }

    private static boolean isFalse(Object o) {
        return o instanceof Bool b && !b.value;
    }

    @Nullable
    private static Formula formula(List<Object> args, int i) {
        return i < args.size() && args.get(i) instanceof Formula f ? f : null;
    }

    @Nullable
    private static Proof box(List<Object> args, int i) {
        return i < args.size() && args.get(i) instanceof Proof p ? p : null;
    }
}
