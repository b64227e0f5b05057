package dumb.logics.parse;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.logics.parse.Token.Type.NAME;

/**
 * Linear dynamic logic, with the propositional grammar embedded under the {@code pl__} rule prefix
 * for the formulas that label regular expression steps.
 * <pre>
 * ldlf      : boolean levels over ldlf_unary
 * ldlf_unary: "[" regex "]" ldlf_unary | "&lt;" regex "&gt;" ldlf_unary | NOT ldlf_unary | "(" ldlf ")" | atom
 * regex     : seq ("+" seq)*
 * seq       : star (";" star)*
 * star      : test "*"?
 * test      : "?" ldlf_unary | wrapped
 * wrapped   : propositional | "(" regex ")"
 * </pre>
 * A parenthesized regular expression is first read as a propositional formula; the parser
 * backtracks when that fails.
 */
final class LdlGrammar extends OperatorGrammar {

    private static final List<Level> LEVELS = booleanLevels("ldlf_", false);
    private static final Map<String, String> ATOMS = Map.of(
            "tt", "ldlf_tt", "ff", "ldlf_ff", "last", "ldlf_last", "end", "ldlf_end",
            "true", "ldlf_prop_true", "false", "ldlf_prop_false");

    LdlGrammar() {
        super(false, booleanLevels("pl__prop_", false),
                Map.of("!", "pl__prop_not", "~", "pl__prop_not"),
                Map.of("true", "pl__prop_true", "false", "pl__prop_false"),
                "pl__prop_wrapped", "pl__atom");
    }

    @Override
    protected Object start() throws Parser.ParseException {
        return ldlf(0);
    }

    private Object ldlf(int i) throws Parser.ParseException {
        if (i == LEVELS.size()) return ldlfUnary();
        var l = LEVELS.get(i);
        return binary(l.rule(), () -> ldlf(i + 1), l.ops());
    }

    private Object ldlfUnary() throws Parser.ParseException {
        if (at("[")) {
            var open = next();
            var regex = regex();
            var close = expect("]");
            return node("ldlf_box", open, regex, close, ldlfUnary());
        }
        if (at("<")) {
            var open = next();
            var regex = regex();
            var close = expect(">");
            return node("ldlf_diamond", open, regex, close, ldlfUnary());
        }
        if (at("!", "~")) {
            var op = next();
            return node("ldlf_not", op, ldlfUnary());
        }
        if (at("(")) {
            var open = next();
            var f = ldlf(0);
            return node("ldlf_wrapped", open, f, expect(")"));
        }
        var t = peek();
        if (t.type() != NAME) throw error("Expected a formula");
        return node(ATOMS.getOrDefault(t.text(), "ldlf_prop_atom"), next());
    }

    private Object regex() throws Parser.ParseException {
        return binary("re_union", this::sequence, Set.of("+"));
    }

    private Object sequence() throws Parser.ParseException {
        return binary("re_sequence", this::star, Set.of(";"));
    }

    private Object star() throws Parser.ParseException {
        var re = test();
        return at("*") ? node("re_star", re, next()) : re;
    }

    private Object test() throws Parser.ParseException {
        if (at("?")) {
            var op = next();
            return node("re_test", op, ldlfUnary());
        }
        return regexWrapped();
    }

    private Object regexWrapped() throws Parser.ParseException {
        var mark = mark();
        try {
            return node("re_propositional", formula());
        } catch (Parser.ParseException e) {
            reset(mark);
        }
        if (!at("(")) throw error("Expected a regular expression");
        var open = next();
        var re = regex();
        return node("re_wrapped", open, re, expect(")"));
    }
}
