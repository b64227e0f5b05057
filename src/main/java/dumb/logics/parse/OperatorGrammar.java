package dumb.logics.parse;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static dumb.logics.parse.Token.Type.NAME;

/**
 * Grammar of the propositional and linear temporal formalisms: a ladder of infix levels, loosest
 * first, over prefix operators, parenthesized formulas, keywords and symbols.
 * <pre>
 * level_i   : level_i+1 (OP_i level_i+1)*
 * unary     : OP+ unary | wrapped
 * wrapped   : "(" level_0 ")" | keyword | symbol
 * </pre>
 * Repeated occurrences of the same prefix operator become one node, e.g. {@code (always G G a)}.
 */
class OperatorGrammar extends Grammar {

    record Level(String rule, Set<String> ops) {
        Level(String rule, String... ops) {
            this(rule, Set.of(ops));
        }
    }

    private final List<Level> levels;
    private final Map<String, String> prefixes;
    private final Map<String, String> keywords;
    private final String wrapped;
    @Nullable
    private final String symbol;

    protected OperatorGrammar(boolean shiftImplication, List<Level> levels, Map<String, String> prefixes,
                              Map<String, String> keywords, String wrapped, @Nullable String symbol) {
        super(shiftImplication, letters(levels, prefixes));
        this.levels = List.copyOf(levels);
        this.prefixes = Map.copyOf(prefixes);
        this.keywords = Map.copyOf(keywords);
        this.wrapped = wrapped;
        this.symbol = symbol;
    }

    /**
     * @param prefix prepended to every rule name, so that the grammar can be embedded in another one
     */
    static OperatorGrammar pl(String prefix, boolean shiftImplication) {
        return new OperatorGrammar(shiftImplication,
                booleanLevels(prefix + "prop_", shiftImplication),
                Map.of("!", prefix + "prop_not", "~", prefix + "prop_not"),
                Map.of("true", prefix + "prop_true", "false", prefix + "prop_false"),
                prefix + "prop_wrapped", prefix + "atom");
    }

    static OperatorGrammar pl() {
        return pl("", true);
    }

    static OperatorGrammar ltl() {
        var levels = new ArrayList<>(booleanLevels("ltlf_", true));
        levels.add(new Level("ltlf_weak_until", "W"));
        levels.add(new Level("ltlf_until", "U"));
        levels.add(new Level("ltlf_release", "R"));
        levels.add(new Level("ltlf_strong_release", "M"));
        return new OperatorGrammar(true, levels,
                Map.of("G", "ltlf_always", "F", "ltlf_eventually", "X", "ltlf_next", "N", "ltlf_weak_next",
                        "!", "ltlf_not", "~", "ltlf_not"),
                Map.of("true", "ltlf_true", "false", "ltlf_false", "last", "ltlf_last"),
                "ltlf_wrapped", "ltlf_symbol");
    }

    static OperatorGrammar pltl() {
        var levels = new ArrayList<>(booleanLevels("pltlf_", true));
        levels.add(new Level("pltlf_since", "S"));
        return new OperatorGrammar(true, levels,
                Map.of("Y", "pltlf_before", "O", "pltlf_once", "H", "pltlf_historically",
                        "!", "pltlf_not", "~", "pltlf_not"),
                Map.of("true", "pltlf_true", "false", "pltlf_false", "start", "pltlf_start"),
                "pltlf_wrapped", "pltlf_symbol");
    }

    private static Set<String> letters(List<Level> levels, Map<String, String> prefixes) {
        return Stream.concat(levels.stream().flatMap(l -> l.ops.stream()), prefixes.keySet().stream())
                .filter(op -> op.length() == 1 && Character.isUpperCase(op.charAt(0)))
                .collect(Collectors.toSet());
    }

    static List<Level> booleanLevels(String prefix, boolean shiftImplication) {
        return List.of(
                new Level(prefix + "equivalence", "<->"),
                shiftImplication ? new Level(prefix + "implication", "->", ">>") : new Level(prefix + "implication", "->"),
                new Level(prefix + "or", "|", "||"),
                new Level(prefix + "and", "&", "&&"));
    }

    @Override
    protected Object start() throws Parser.ParseException {
        return formula();
    }

    protected Object formula() throws Parser.ParseException {
        return level(0);
    }

    private Object level(int i) throws Parser.ParseException {
        if (i == levels.size()) return unary();
        var l = levels.get(i);
        return binary(l.rule, () -> level(i + 1), l.ops);
    }

    protected Object unary() throws Parser.ParseException {
        var rule = prefixRule(peek());
        if (rule == null) return wrapped();
        var children = new ArrayList<Object>();
        while (rule.equals(prefixRule(peek()))) children.add(next());
        children.add(unary());
        return new Tree(rule, children);
    }

    @Nullable
    private String prefixRule(Token t) {
        return t.type() == NAME || t.type() == Token.Type.EOF ? null : prefixes.get(t.text());
    }

    protected Object wrapped() throws Parser.ParseException {
        if (at("(")) {
            var open = next();
            var f = formula();
            return node(wrapped, open, f, expect(")"));
        }
        return atom();
    }

    protected Object atom() throws Parser.ParseException {
        var t = peek();
        if (t.type() != NAME) throw error("Expected a formula");
        var rule = keywords.getOrDefault(t.text(), symbol);
        if (rule == null) throw error("Unexpected symbol");
        return node(rule, next());
    }
}
