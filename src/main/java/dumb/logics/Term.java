package dumb.logics;

import org.jetbrains.annotations.Nullable;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * First-order terms. Terms are not formulas: they only occur as arguments of predicates and
 * functions, and as the bound variable of a quantifier.
 * <p>
 * Equality is structural: two variables (or two constants) are equal when their names are, a
 * function application when its name and arguments are. Substitution relies on this.
 */
sealed public interface Term extends Serializable permits Term.Var, Term.Const, Term.Fn {

    Pattern NAME_PATTERN = Pattern.compile("[a-z_][a-zA-Z0-9_]*");

    String name();

    Set<Var> vars();

    /**
     * Whether {@code t} occurs in this term (including the term itself).
     */
    boolean contains(Term t);

    private static String validName(String name) {
        requireNonNull(name);
        ValidationException.enforce(NAME_PATTERN.matcher(name).matches(), "invalid term name: '" + name + "'");
        return name;
    }

    record Var(String name) implements Term {
        public Var {
            validName(name);
        }

        @Override
        public Set<Var> vars() {
            return Set.of(this);
        }

        @Override
        public boolean contains(Term t) {
            return equals(t);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A constant, optionally carrying the domain value it denotes. The value takes no part in equality.
     */
    record Const(String name, @Nullable Object value) implements Term {
        public Const {
            validName(name);
        }

        public Const(String name) {
            this(name, null);
        }

        @Override
        public Set<Var> vars() {
            return Set.of();
        }

        @Override
        public boolean contains(Term t) {
            return equals(t);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Const c && name.equals(c.name));
        }

        @Override
        public int hashCode() {
            return Objects.hash(Const.class, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Fn(String name, List<Term> operands) implements Term {
        public Fn {
            validName(name);
            operands = List.copyOf(requireNonNull(operands));
            ValidationException.enforce(!operands.isEmpty(), name + ": a function takes at least one operand.");
        }

        public Fn(String name, Term... operands) {
            this(name, List.of(operands));
        }

        public int arity() {
            return operands.size();
        }

        /**
         * The same function symbol applied to other arguments.
         */
        public Fn apply(List<?> arguments) {
            ValidationException.enforce(arguments.size() == operands.size(),
                    name + ": expected " + operands.size() + " operands, got " + arguments.size() + ".");
            return new Fn(name, terms(arguments));
        }

        public Fn apply(Term... arguments) {
            return apply(List.of(arguments));
        }

        @Override
        public Set<Var> vars() {
            return operands.stream().flatMap(t -> t.vars().stream()).collect(Collectors.toUnmodifiableSet());
        }

        @Override
        public boolean contains(Term t) {
            return equals(t) || operands.stream().anyMatch(o -> o.contains(t));
        }

        @Override
        public String toString() {
            return operands.stream().map(Term::toString).collect(Collectors.joining(", ", name + "(", ")"));
        }
    }

    /**
     * Checks every argument is a term.
     */
    static List<Term> terms(List<?> arguments) {
        for (var a : arguments)
            ValidationException.enforce(a instanceof Term, "all operands must be terms, found: " + a);
        return arguments.stream().map(Term.class::cast).toList();
    }
}
