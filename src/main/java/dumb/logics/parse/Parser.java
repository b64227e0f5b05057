package dumb.logics.parse;

import dumb.logics.Formula;
import dumb.logics.Formulas;
import dumb.logics.Term;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Text to formula: a grammar produces a parse tree, a transformer turns it into formulas.
 * Parsers are stateless and may be shared between threads.
 */
public final class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Parser PL = pl(Formulas.the);
    private static final Parser LTL = ltl(Formulas.the);
    private static final Parser PLTL = pltl(Formulas.the);
    private static final Parser LDL = ldl(Formulas.the);
    private static final Parser FOL = fol(Formulas.the);

    private final String name;
    private final Supplier<? extends Grammar> grammar;
    private final Transformer transformer;

    private Parser(String name, Supplier<? extends Grammar> grammar, Transformer transformer) {
        this.name = name;
        this.grammar = grammar;
        this.transformer = transformer;
    }

    public static Parser pl(Formulas formulas) {
        return new Parser("pl", OperatorGrammar::pl, new PlTransformer(formulas));
    }

    public static Parser ltl(Formulas formulas) {
        return new Parser("ltl", OperatorGrammar::ltl, new LtlTransformer(formulas));
    }

    public static Parser pltl(Formulas formulas) {
        return new Parser("pltl", OperatorGrammar::pltl, new PltlTransformer(formulas));
    }

    public static Parser ldl(Formulas formulas) {
        return new Parser("ldl", LdlGrammar::new, new LdlTransformer(formulas));
    }

    public static Parser fol(Formulas formulas) {
        return new Parser("fol", FolGrammar::new, new FolTransformer(formulas));
    }

    public static Formula parsePl(String text) throws ParseException {
        return PL.parse(text);
    }

    public static Formula parseLtl(String text) throws ParseException {
        return LTL.parse(text);
    }

    public static Formula parsePltl(String text) throws ParseException {
        return PLTL.parse(text);
    }

    public static Formula parseLdl(String text) throws ParseException {
        return LDL.parse(text);
    }

    public static Formula parseFol(String text) throws ParseException {
        return FOL.parse(text);
    }

    public static Term parseTerm(String text) throws ParseException {
        return FOL.term(text);
    }

    public Formula parse(String text) throws ParseException {
        requireNonNull(text);
        var tree = grammar.get().parse(text);
        if (logger.isTraceEnabled()) logger.trace("{} parse tree of '{}': {}", name, text, tree);
        if (transformer.transform(tree) instanceof Formula f) return f;
        throw new ParseException("Expected a formula: " + text);
    }

    /**
     * A single first-order term; only meaningful for the first-order parser.
     */
    public Term term(String text) throws ParseException {
        requireNonNull(text);
        if (!(grammar.get() instanceof FolGrammar g)) throw new ParseException(name + " has no terms");
        if (transformer.transform(g.parseTerm(text)) instanceof Term t) return t;
        throw new ParseException("Expected a term: " + text);
    }

    /**
     * Syntax errors carry a position and the input read so far; errors raised while building a
     * formula carry the rule and its transformed arguments instead.
     */
    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;
        @Nullable
        private final String rule;
        private final List<Object> args;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
            this.rule = null;
            this.args = List.of();
        }

        public ParseException(String message, String rule, List<Object> args) {
            this(message, rule, args, null);
        }

        public ParseException(String message, String rule, List<Object> args, @Nullable Throwable cause) {
            super(message, cause);
            this.line = -1;
            this.col = -1;
            this.context = "";
            this.rule = rule;
            this.args = List.copyOf(args);
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Nullable
        public String rule() {
            return rule;
        }

        public List<Object> args() {
            return args;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
