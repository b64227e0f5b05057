package dumb.logics;

import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.Set;

import static dumb.logics.Formalism.*;

/**
 * Discriminant of the operator nodes. Each constant carries the formalism rules its operands obey:
 * an {@code allowed} set (operands must belong to it), otherwise a {@code forbidden} set.
 */
public enum Operator {
    NOT("not", Arity.UNARY, null, EnumSet.of(RE), null),
    AND("and", Arity.NARY, null, EnumSet.of(RE), null),
    OR("or", Arity.NARY, null, EnumSet.of(RE), null),
    IMPLIES("implies", Arity.NARY, null, EnumSet.of(RE), null),
    EQUIVALENCE("equivalence", Arity.NARY, null, EnumSet.of(RE), null),

    NEXT("next", Arity.UNARY, EnumSet.of(LTL), null, null),
    WEAK_NEXT("weak_next", Arity.UNARY, EnumSet.of(LTL), null, null),
    EVENTUALLY("eventually", Arity.UNARY, EnumSet.of(LTL), null, null),
    ALWAYS("always", Arity.UNARY, EnumSet.of(LTL), null, null),
    UNTIL("until", Arity.NARY, EnumSet.of(LTL), null, null),
    RELEASE("release", Arity.NARY, EnumSet.of(LTL), null, null),
    WEAK_UNTIL("weak_until", Arity.NARY, EnumSet.of(LTL), null, null),
    STRONG_RELEASE("strong_release", Arity.NARY, EnumSet.of(LTL), null, null),

    BEFORE("before", Arity.UNARY, EnumSet.of(PLTL), null, null),
    ONCE("once", Arity.UNARY, EnumSet.of(PLTL), null, null),
    HISTORICALLY("historically", Arity.UNARY, EnumSet.of(PLTL), null, null),
    SINCE("since", Arity.NARY, EnumSet.of(PLTL), null, null),

    SEQ("seq", Arity.NARY, EnumSet.of(RE), null, null),
    UNION("union", Arity.NARY, EnumSet.of(RE), null, null),
    STAR("star", Arity.UNARY, EnumSet.of(RE), null, null),
    TEST("test", Arity.UNARY, EnumSet.of(LDL), null, RE),
    PROP("prop", Arity.UNARY, EnumSet.of(PL), null, RE),

    DIAMOND("diamond", Arity.MODAL, EnumSet.of(LDL), null, LDL),
    BOX("box", Arity.MODAL, EnumSet.of(LDL), null, LDL),

    FORALL("forall", Arity.QUANTIFIER, EnumSet.of(FOL), null, null),
    EXISTS("exists", Arity.QUANTIFIER, EnumSet.of(FOL), null, null);

    public final String symbol;
    public final Arity arity;
    @Nullable
    private final Set<Formalism> allowed;
    @Nullable
    private final Set<Formalism> forbidden;
    @Nullable
    private final Formalism result;

    Operator(String symbol, Arity arity, @Nullable Set<Formalism> allowed, @Nullable Set<Formalism> forbidden, @Nullable Formalism result) {
        this.symbol = symbol;
        this.arity = arity;
        this.allowed = allowed;
        this.forbidden = forbidden;
        this.result = result;
    }

    /**
     * Whether operand order is irrelevant for equality and hashing.
     */
    public boolean commutative() {
        return this == AND || this == OR || this == EQUIVALENCE || this == UNION;
    }

    /**
     * Whether operands of the given formalism may appear under this operator.
     * When an allowed set is declared, the forbidden set is ignored.
     */
    public boolean permits(Formalism operands) {
        if (allowed != null) return allowed.contains(operands);
        return forbidden == null || !forbidden.contains(operands);
    }

    /**
     * The single formalism the operands must have, if the operator pins one.
     */
    @Nullable
    public Formalism pinned() {
        return allowed != null && allowed.size() == 1 ? allowed.iterator().next() : null;
    }

    /**
     * Formalism of a node built by this operator over operands of the given formalism.
     */
    public Formalism resultOf(Formalism operands) {
        return result != null ? result : operands;
    }

    public enum Arity {UNARY, NARY, QUANTIFIER, MODAL}
}
