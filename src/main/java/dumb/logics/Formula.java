package dumb.logics;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An immutable formula node.
 * <p>
 * Nodes are only built by {@link Formulas}, which validates, normalizes and interns them, so two
 * structurally equal formulas built through the same table are the same instance. {@link #toString()}
 * gives an s-expression for debugging; {@link dumb.logics.util.Printer} gives parsable text.
 */
sealed public interface Formula permits Formula.Bool, Formula.Atomic, Formula.Unary, Formula.Nary,
        Formula.Quantified, Formula.Modal, Formula.Predicate {

    Formalism formalism();

    /**
     * The constants true and false. Equality ignores everything but value and formalism.
     */
    final class Bool extends Hashed implements Formula {
        private static final long serialVersionUID = 1L;

        public final boolean value;
        private final Formalism formalism;

        Bool(boolean value, Formalism formalism) {
            this.value = value;
            this.formalism = requireNonNull(formalism);
        }

        @Override
        public Formalism formalism() {
            return formalism;
        }

        @Override
        protected int computeHash() {
            return Objects.hash(Bool.class, value, formalism);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Bool b && value == b.value && formalism == b.formalism);
        }

        @Override
        public String toString() {
            return value ? "true" : "false";
        }
    }

    /**
     * An atomic proposition of a propositional or temporal formalism.
     */
    final class Atomic extends Hashed implements Formula {
        private static final long serialVersionUID = 1L;

        public final String name;
        private final Formalism formalism;

        Atomic(String name, Formalism formalism) {
            this.name = requireNonNull(name);
            this.formalism = requireNonNull(formalism);
        }

        @Override
        public Formalism formalism() {
            return formalism;
        }

        @Override
        protected int computeHash() {
            return Objects.hash(Atomic.class, formalism, name);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Atomic a && formalism == a.formalism && name.equals(a.name));
        }

        @Override
        public String toString() {
            return name;
        }
    }

    final class Unary extends Hashed implements Formula {
        private static final long serialVersionUID = 1L;

        public final Operator op;
        public final Formula argument;
        private final Formalism formalism;

        Unary(Operator op, Formula argument, Formalism formalism) {
            this.op = op;
            this.argument = argument;
            this.formalism = formalism;
        }

        @Override
        public Formalism formalism() {
            return formalism;
        }

        @Override
        protected int computeHash() {
            return Objects.hash(op, formalism, argument);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Unary u && op == u.op && formalism == u.formalism && argument.equals(u.argument));
        }

        @Override
        public String toString() {
            return "(" + op.symbol + " " + argument + ")";
        }
    }

    /**
     * An operator over two or more operands. Commutative operators compare and hash their operands as a set.
     */
    final class Nary extends Hashed implements Formula {
        private static final long serialVersionUID = 1L;

        public final Operator op;
        public final List<Formula> operands;
        private final Formalism formalism;
        private transient volatile Set<Formula> operandSetCache;

        Nary(Operator op, List<Formula> operands, Formalism formalism) {
            this.op = op;
            this.operands = List.copyOf(operands);
            this.formalism = formalism;
        }

        @Override
        public Formalism formalism() {
            return formalism;
        }

        public Formula get(int i) {
            return operands.get(i);
        }

        public int size() {
            return operands.size();
        }

        public Set<Formula> operandSet() {
            if (operandSetCache == null) operandSetCache = Set.copyOf(operands);
            return operandSetCache;
        }

        @Override
        protected int computeHash() {
            return op.commutative() ? Objects.hash(op, formalism, operandSet()) : Objects.hash(op, formalism, operands);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Nary n) || op != n.op || formalism != n.formalism) return false;
            return op.commutative() ? operandSet().equals(n.operandSet()) : operands.equals(n.operands);
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" ", "(" + op.symbol + " ", ")"));
        }
    }

    /**
     * A first-order quantifier. No alpha-renaming: {@code forall x.P(x)} and {@code forall y.P(y)} differ.
     */
    final class Quantified extends Hashed implements Formula {
        private static final long serialVersionUID = 1L;

        public final Operator op;
        public final Term.Var variable;
        public final Formula body;

        Quantified(Operator op, Term.Var variable, Formula body) {
            this.op = op;
            this.variable = variable;
            this.body = body;
        }

        @Override
        public Formalism formalism() {
            return Formalism.FOL;
        }

        @Override
        protected int computeHash() {
            return Objects.hash(op, variable, body);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Quantified q && op == q.op && variable.equals(q.variable) && body.equals(q.body));
        }

        @Override
        public String toString() {
            return "(" + op.symbol + " " + variable + " " + body + ")";
        }
    }

    /**
     * The LDL diamond and box: a regular expression followed by a tail formula.
     */
    final class Modal extends Hashed implements Formula {
        private static final long serialVersionUID = 1L;

        public final Operator op;
        public final Formula regex;
        public final Formula tail;

        Modal(Operator op, Formula regex, Formula tail) {
            this.op = op;
            this.regex = regex;
            this.tail = tail;
        }

        @Override
        public Formalism formalism() {
            return Formalism.LDL;
        }

        @Override
        protected int computeHash() {
            return Objects.hash(op, regex, tail);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Modal m && op == m.op && regex.equals(m.regex) && tail.equals(m.tail));
        }

        @Override
        public String toString() {
            return "(" + op.symbol + " " + regex + " " + tail + ")";
        }
    }

    /**
     * A first-order predicate applied to terms; zero-ary predicates are propositions.
     */
    final class Predicate extends Hashed implements Formula {
        private static final long serialVersionUID = 1L;

        public final String name;
        public final List<Term> operands;

        Predicate(String name, List<Term> operands) {
            this.name = name;
            this.operands = List.copyOf(operands);
        }

        @Override
        public Formalism formalism() {
            return Formalism.FOL;
        }

        public int arity() {
            return operands.size();
        }

        @Override
        protected int computeHash() {
            return Objects.hash(Predicate.class, name, operands);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Predicate p && name.equals(p.name) && operands.equals(p.operands));
        }

        @Override
        public String toString() {
            return operands.isEmpty() ? name : operands.stream().map(Term::toString).collect(Collectors.joining(", ", name + "(", ")"));
        }
    }
}
