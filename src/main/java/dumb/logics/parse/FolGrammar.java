package dumb.logics.parse;

import java.util.ArrayList;
import java.util.Map;

import static dumb.logics.parse.Token.Type.NAME;
import static dumb.logics.parse.Token.Type.UPPER;

/**
 * First-order formulas.
 * <pre>
 * unary     : ("forall" | "exists") NAME "." unary | NOT+ unary | "(" formula ")" | atom
 * atom      : "true" | "false" | PREDICATE ("(" term ("," term)* ")")?
 * term      : NAME "(" term ("," term)* ")" | NAME
 * </pre>
 */
final class FolGrammar extends OperatorGrammar {

    FolGrammar() {
        super(true, booleanLevels("fol_", true),
                Map.of("!", "fol_not", "~", "fol_not"),
                Map.of("true", "fol_true", "false", "fol_false"),
                "fol_wrapped", null);
    }

    Tree parseTerm(String text) throws Parser.ParseException {
        return parse(text, this::term);
    }

    @Override
    protected Object unary() throws Parser.ParseException {
        if (at("forall", "exists") && peek().type() == NAME) {
            var q = next();
            var variable = expect(NAME, "a variable");
            var dot = expect(".");
            return node(q.text().equals("forall") ? "fol_forall" : "fol_exists", q, variable, dot, unary());
        }
        return super.unary();
    }

    @Override
    protected Object atom() throws Parser.ParseException {
        if (peek().type() != UPPER) return super.atom();
        var name = next();
        if (!at("(")) return node("fol_predicate", name);
        return new Tree("fol_predicate", arguments(name));
    }

    private Object term() throws Parser.ParseException {
        var name = expect(NAME, "a term");
        if (!at("(")) return node("fol_symbol", name);
        return new Tree("fol_function", arguments(name));
    }

    private ArrayList<Object> arguments(Token name) throws Parser.ParseException {
        var children = new ArrayList<Object>();
        children.add(name);
        children.add(expect("("));
        children.add(term());
        while (at(",")) {
            children.add(next());
            children.add(term());
        }
        children.add(expect(")"));
        return children;
    }
}
