package dumb.logics.parse;

import dumb.logics.Formula;
import dumb.logics.Formulas;
import dumb.logics.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * Builds formulas from a parse tree, bottom-up: the children of a node are transformed first, then
 * the action registered for the node's rule receives them. Tokens are passed through unchanged.
 */
public abstract class Transformer {

    @FunctionalInterface
    public interface Action {
        Object apply(List<Object> args) throws Parser.ParseException;
    }

    protected final Formulas formulas;
    private final Map<String, Action> actions = new HashMap<>();

    protected Transformer(Formulas formulas) {
        this.formulas = requireNonNull(formulas);
        on("start", args -> single("start", args));
    }

    protected final void on(String rule, Action action) {
        actions.put(rule, action);
    }

    protected final boolean handles(String rule) {
        return actions.containsKey(rule);
    }

    /**
     * The action for a rule name.
     */
    protected Action action(String rule) throws Parser.ParseException {
        var a = actions.get(rule);
        if (a == null) throw new Parser.ParseException("No transformation exists for rule: " + rule);
        return a;
    }

    public Object transform(Object node) throws Parser.ParseException {
        if (!(node instanceof Tree t)) return node;
        var args = new ArrayList<Object>(t.children().size());
        for (var c : t.children()) args.add(transform(c));
        var action = action(t.rule());
        try {
            return action.apply(args);
        } catch (ValidationException e) {
            throw new Parser.ParseException(message(t.rule(), args) + ": " + e.getMessage(), t.rule(), args, e);
        }
    }

    /**
     * {@code a (OP b)*}: the first operand alone, or one node over the even-indexed operands.
     */
    protected Object starredBinaryOp(List<Object> args, Function<List<Formula>, Formula> op, String rule) throws Parser.ParseException {
        if (args.size() == 1) return args.get(0);
        if ((args.size() - 1) % 2 != 0) throw error(rule, args);
        var operands = new ArrayList<Formula>();
        for (var i = 0; i < args.size(); i += 2) operands.add(formula(args.get(i), rule, args));
        return op.apply(operands);
    }

    /**
     * {@code OP* a}: the operators applied right to left onto the operand.
     */
    protected Object processUnaryOp(List<Object> args, UnaryOperator<Formula> op, String rule) throws Parser.ParseException {
        if (args.size() == 1) return args.get(0);
        var f = formula(args.get(args.size() - 1), rule, args);
        for (var i = 0; i < args.size() - 1; i++) f = op.apply(f);
        return f;
    }

    protected static Object single(String rule, List<Object> args) throws Parser.ParseException {
        if (args.size() != 1) throw error(rule, args);
        return args.get(0);
    }

    /**
     * {@code a} or {@code "(" a ")"}.
     */
    protected static Object wrapped(String rule, List<Object> args) throws Parser.ParseException {
        if (args.size() == 1) return args.get(0);
        if (args.size() == 3) return args.get(1);
        throw error(rule, args);
    }

    protected static Formula formula(Object arg, String rule, List<Object> args) throws Parser.ParseException {
        if (arg instanceof Formula f) return f;
        throw error(rule, args);
    }

    protected static String text(Object arg, String rule, List<Object> args) throws Parser.ParseException {
        if (arg instanceof Token t) return t.text();
        throw error(rule, args);
    }

    protected static Parser.ParseException error(String rule, List<Object> args) {
        return new Parser.ParseException(message(rule, args), rule, args);
    }

    private static String message(String rule, List<Object> args) {
        return "error while parsing a '" + rule + "' with tokens: " + args;
    }
}
