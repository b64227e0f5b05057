package dumb.logics;

import dumb.logics.Formula.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static dumb.logics.Operator.*;
import static dumb.logics.ValidationException.enforce;
import static java.util.Objects.requireNonNull;

/**
 * Smart constructors for every formula node: each validates its operands, applies the operator's
 * simplifications, and interns the result in its {@link InternTable}.
 */
public final class Formulas {

    /**
     * Symbols start with {@code [a-z_]} and may continue with {@code [a-zA-Z0-9_-]} (no trailing hyphen),
     * or are any printable ASCII between double quotes.
     */
    public static final Pattern ATOM_NAME = Pattern.compile("[a-z_]([a-zA-Z0-9_-]+[a-zA-Z0-9_])|[a-z_][a-zA-Z0-9_]*|\"[ -!#-~]+?\"");
    public static final Pattern PREDICATE_NAME = Pattern.compile("[A-Z][a-zA-Z0-9_]*");

    private static final Set<Formalism> ATOMIC_FORMALISMS = EnumSet.of(Formalism.PL, Formalism.LTL, Formalism.PLTL);

    /**
     * Process-wide factory used by the parsers and the {@link Logics} facade.
     */
    public static final Formulas the = new Formulas(new InternTable());

    private final InternTable table;

    public Formulas(InternTable table) {
        this.table = requireNonNull(table);
    }

    public InternTable table() {
        return table;
    }

    public static void resetCache() {
        the.table.reset();
    }

    public static Map<Formalism, Set<Formula>> cacheContext() {
        return the.table.context();
    }

    public Formula bool(boolean value, Formalism formalism) {
        return table.intern(new Bool(value, formalism));
    }

    public Formula top(Formalism formalism) {
        return bool(true, formalism);
    }

    public Formula bottom(Formalism formalism) {
        return bool(false, formalism);
    }

    public Formula atomic(String name) {
        return atomic(name, Formalism.PL);
    }

    public Formula atomic(String name, Formalism formalism) {
        requireNonNull(name);
        enforce(ATOM_NAME.matcher(name).matches(), "Value '" + name + "' does not match the regular expression " + ATOM_NAME);
        enforce(ATOMIC_FORMALISMS.contains(formalism), "atomic propositions do not belong to " + formalism);
        return table.intern(new Atomic(name, formalism));
    }

    /* boolean connectives */

    public Formula not(Formula f) {
        requireNonNull(f);
        if (f instanceof Unary u && u.op == NOT) return u.argument;
        if (f instanceof Bool b) return bool(!b.value, b.formalism());
        return unary(NOT, f);
    }

    public Formula and(Formula... operands) {
        return and(List.of(operands));
    }

    public Formula and(List<Formula> operands) {
        return monotone(AND, operands);
    }

    public Formula or(Formula... operands) {
        return or(List.of(operands));
    }

    public Formula or(List<Formula> operands) {
        return monotone(OR, operands);
    }

    public Formula implies(Formula... operands) {
        return implies(List.of(operands));
    }

    /**
     * Right-associative implication. A false antecedent makes the whole chain true; repeated
     * antecedents are dropped.
     */
    public Formula implies(List<Formula> operands) {
        enforce(!operands.isEmpty(), "cannot accept zero arguments");
        var logic = common(operands);
        permit(IMPLIES, logic);
        if (operands.size() == 1) return operands.get(0);
        var last = operands.size() - 1;
        for (var i = 0; i < last; i++)
            if (operands.get(i) instanceof Bool b && !b.value) return bool(true, logic);
        var simplified = new ArrayList<Formula>(new LinkedHashSet<>(retag(operands.subList(0, last), logic)));
        simplified.add(retag(operands.get(last), logic));
        return table.intern(new Nary(IMPLIES, simplified, logic));
    }

    public Formula equivalence(Formula... operands) {
        return equivalence(List.of(operands));
    }

    public Formula equivalence(List<Formula> operands) {
        enforce(!operands.isEmpty(), "cannot accept zero arguments");
        var logic = common(operands);
        permit(EQUIVALENCE, logic);
        var unique = List.copyOf(new LinkedHashSet<>(retag(operands, logic)));
        if (unique.size() == 1) return unique.get(0);
        return table.intern(new Nary(EQUIVALENCE, unique, logic));
    }

    /* linear temporal logic */

    public Formula next(Formula f) {
        return unary(NEXT, f);
    }

    public Formula weakNext(Formula f) {
        return unary(WEAK_NEXT, f);
    }

    public Formula eventually(Formula f) {
        return unary(EVENTUALLY, f);
    }

    public Formula always(Formula f) {
        return unary(ALWAYS, f);
    }

    public Formula until(Formula... operands) {
        return nary(UNTIL, List.of(operands));
    }

    public Formula release(Formula... operands) {
        return nary(RELEASE, List.of(operands));
    }

    public Formula weakUntil(Formula... operands) {
        return nary(WEAK_UNTIL, List.of(operands));
    }

    public Formula strongRelease(Formula... operands) {
        return nary(STRONG_RELEASE, List.of(operands));
    }

    /**
     * LTL {@code last}.
     */
    public Formula last() {
        return always(bottom(Formalism.LTL));
    }

    /* past linear temporal logic */

    public Formula before(Formula f) {
        return unary(BEFORE, f);
    }

    public Formula once(Formula f) {
        return unary(ONCE, f);
    }

    public Formula historically(Formula f) {
        return unary(HISTORICALLY, f);
    }

    public Formula since(Formula... operands) {
        return nary(SINCE, List.of(operands));
    }

    public Formula start() {
        return historically(bottom(Formalism.PLTL));
    }

    public Formula first() {
        return not(before(top(Formalism.PLTL)));
    }

    /* linear dynamic logic */

    public Formula seq(Formula... operands) {
        return nary(SEQ, List.of(operands));
    }

    public Formula union(Formula... operands) {
        return nary(UNION, List.of(operands));
    }

    public Formula star(Formula regex) {
        return unary(STAR, regex);
    }

    /**
     * Regular expression testing an LDL formula.
     */
    public Formula test(Formula f) {
        return unary(TEST, f);
    }

    /**
     * Regular expression reading one symbol that satisfies a propositional formula.
     */
    public Formula prop(Formula f) {
        return unary(PROP, f);
    }

    public Formula diamond(Formula regex, Formula tail) {
        return modal(DIAMOND, regex, tail);
    }

    public Formula box(Formula regex, Formula tail) {
        return modal(BOX, regex, tail);
    }

    public Formula end() {
        return box(prop(top(Formalism.PL)), bottom(Formalism.LDL));
    }

    public Formula ldlLast() {
        return diamond(prop(top(Formalism.PL)), end());
    }

    /* first-order logic */

    public Predicate predicate(String name, Term... operands) {
        return predicate(name, List.of(operands));
    }

    public Predicate predicate(String name, List<?> operands) {
        requireNonNull(name);
        enforce(PREDICATE_NAME.matcher(name).matches(), "invalid predicate name: '" + name + "'");
        return table.intern(new Predicate(name, Term.terms(operands)));
    }

    /**
     * The predicate symbol of {@code p} applied to new arguments of the same arity.
     */
    public Predicate apply(Predicate p, List<?> arguments) {
        enforce(arguments.size() == p.arity(), p + ": expected " + p.arity() + " operands, got " + arguments.size() + ".");
        return predicate(p.name, arguments);
    }

    public Formula forAll(Term variable, Formula body) {
        return quantifier(FORALL, variable, body);
    }

    public Formula exists(Term variable, Formula body) {
        return quantifier(EXISTS, variable, body);
    }

    public Formula quantifier(Operator op, Term variable, Formula body) {
        enforce(op.arity == Arity.QUANTIFIER, op + " is not a quantifier");
        requireNonNull(body);
        enforce(variable instanceof Term.Var, op.symbol + ": expected a variable, got " + variable);
        var tail = retag(body, Formalism.FOL);
        enforce(tail.formalism() == Formalism.FOL, "tail formula not valid");
        return table.intern(new Quantified(op, (Term.Var) variable, tail));
    }

    /* generic construction */

    /**
     * Builds a node for any operator, dispatching to the operator's own constructor.
     */
    public Formula make(Operator op, List<Formula> operands) {
        return switch (op) {
            case NOT -> not(single(op, operands));
            case AND -> and(operands);
            case OR -> or(operands);
            case IMPLIES -> implies(operands);
            case EQUIVALENCE -> equivalence(operands);
            case DIAMOND, BOX -> {
                enforce(operands.size() == 2, op.symbol + ": expected a regular expression and a tail formula");
                yield modal(op, operands.get(0), operands.get(1));
            }
            case FORALL, EXISTS -> throw new ValidationException(op.symbol + " binds a variable, use quantifier()");
            default -> op.arity == Arity.UNARY ? unary(op, single(op, operands)) : nary(op, operands);
        };
    }

    private static Formula single(Operator op, List<Formula> operands) {
        enforce(operands.size() == 1, op.symbol + ": expected exactly one operand, found " + operands.size());
        return operands.get(0);
    }

    private Formula unary(Operator op, Formula argument) {
        requireNonNull(argument);
        var pinned = op.pinned();
        var logic = pinned != null && argument instanceof Bool ? pinned : argument.formalism();
        permit(op, logic);
        return table.intern(new Unary(op, retag(argument, logic), op.resultOf(logic)));
    }

    private Formula nary(Operator op, List<Formula> operands) {
        enforce(operands.size() >= 2, "expected at least 2 operands, found " + operands.size() + " operands");
        var logic = common(operands);
        var pinned = op.pinned();
        if (pinned != null && operands.stream().allMatch(Bool.class::isInstance)) logic = pinned;
        permit(op, logic);
        return table.intern(new Nary(op, retag(operands, logic), op.resultOf(logic)));
    }

    private Formula modal(Operator op, Formula regex, Formula tail) {
        requireNonNull(regex);
        requireNonNull(tail);
        enforce(regex.formalism() == Formalism.RE, "regular expression not valid");
        var t = retag(tail, Formalism.LDL);
        enforce(t.formalism() == Formalism.LDL, "tail formula not valid");
        return table.intern(new Modal(op, regex, t));
    }

    /**
     * And/Or: idempotence, identity and absorbing elements, complementary operands, flattening of
     * nested same-operator subformulas, and elision of single operands.
     */
    private Formula monotone(Operator op, List<Formula> args) {
        enforce(!args.isEmpty(), "cannot accept zero arguments");
        var logic = common(args);
        permit(op, logic);
        var absorbing = op == OR;
        var operands = new LinkedHashSet<>(retag(args, logic)).stream()
                .filter(x -> !(x instanceof Bool b && b.value != absorbing))
                .toList();
        if (operands.isEmpty()) return bool(!absorbing, logic);
        if (operands.size() == 1) return operands.get(0);
        if (operands.stream().anyMatch(x -> x instanceof Bool)) return bool(absorbing, logic);

        var flat = new ArrayList<Formula>();
        var seen = new HashSet<Formula>();
        var negated = new HashSet<Formula>();
        var stack = new ArrayDeque<Formula>();
        for (var i = operands.size() - 1; i >= 0; i--) stack.push(operands.get(i));
        while (!stack.isEmpty()) {
            var e = stack.pop();
            if (e instanceof Nary n && n.op == op) {
                for (var i = n.size() - 1; i >= 0; i--) stack.push(n.get(i));
                continue;
            }
            if (negated.contains(e) || (e instanceof Unary u && u.op == NOT && seen.contains(u.argument)))
                return bool(absorbing, logic);
            if (seen.add(e)) {
                flat.add(e);
                if (e instanceof Unary u && u.op == NOT) negated.add(u.argument);
            }
        }
        if (flat.size() == 1) return flat.get(0);
        return table.intern(new Nary(op, flat, logic));
    }

    /**
     * The formalism shared by all operands, ignoring boolean constants.
     */
    private static Formalism common(List<Formula> operands) {
        Formalism logic = null;
        for (var f : operands) {
            requireNonNull(f, "some argument is not an instance of 'Formula'");
            if (f instanceof Bool) continue;
            if (logic == null) logic = f.formalism();
            else enforce(logic == f.formalism(), "operands do not belong to the same logic");
        }
        return logic != null ? logic : operands.get(0).formalism();
    }

    private static void permit(Operator op, Formalism logic) {
        enforce(op.permits(logic), "error during instantiation of " + op.symbol + ": found operand belonging to logic " + logic + ", which is forbidden");
    }

    private Formula retag(Formula f, Formalism logic) {
        return f instanceof Bool b && b.formalism() != logic ? bool(b.value, logic) : f;
    }

    private List<Formula> retag(List<Formula> fs, @Nullable Formalism logic) {
        return logic == null ? fs : fs.stream().map(f -> retag(f, logic)).toList();
    }
}
