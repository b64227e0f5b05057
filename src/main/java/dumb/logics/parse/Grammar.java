package dumb.logics.parse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static dumb.logics.parse.Token.Type.EOF;

/**
 * Recursive-descent parser producing rule-labelled {@link Tree}s.
 * <p>
 * Productions follow two conventions: a rule whose result has a single child is inlined (the
 * child takes its place), and a node keeps every token it matched, operators and parentheses
 * included, so that transformers see the full shape. Instances hold the cursor of one parse and
 * are not reused.
 */
abstract class Grammar {

    @FunctionalInterface
    interface Production {
        Object parse() throws Parser.ParseException;
    }

    private final boolean shiftImplication;
    private final Set<String> letters;
    private Lexer lexer;
    private List<Token> tokens;
    private int pos;

    protected Grammar(boolean shiftImplication) {
        this(shiftImplication, Set.of());
    }

    /**
     * @param letters uppercase operators lexed as single characters, so that {@code GFa} reads as {@code G F a}
     */
    protected Grammar(boolean shiftImplication, Set<String> letters) {
        this.shiftImplication = shiftImplication;
        this.letters = Set.copyOf(letters);
    }

    protected abstract Object start() throws Parser.ParseException;

    final Tree parse(String text) throws Parser.ParseException {
        return parse(text, this::start);
    }

    final Tree parse(String text, Production root) throws Parser.ParseException {
        lexer = new Lexer(text, shiftImplication, letters);
        tokens = lexer.tokenize();
        pos = 0;
        var result = root.parse();
        if (peek().type() != EOF) throw error("Unexpected '" + peek() + "'");
        return new Tree("start", List.of(result));
    }

    protected Token peek() {
        return tokens.get(pos);
    }

    protected Token next() {
        var t = tokens.get(pos);
        if (t.type() != EOF) pos++;
        return t;
    }

    protected boolean at(String... texts) {
        var t = peek();
        for (var s : texts) if (t.is(s)) return true;
        return false;
    }

    protected Token expect(String text) throws Parser.ParseException {
        if (!at(text)) throw error("Expected '" + text + "'");
        return next();
    }

    protected Token expect(Token.Type type, String what) throws Parser.ParseException {
        if (peek().type() != type) throw error("Expected " + what);
        return next();
    }

    protected int mark() {
        return pos;
    }

    protected void reset(int mark) {
        pos = mark;
    }

    /**
     * {@code rule: operand (OP operand)*}
     */
    protected Object binary(String rule, Production operand, Set<String> ops) throws Parser.ParseException {
        var children = new ArrayList<Object>();
        children.add(operand.parse());
        while (isOneOf(peek(), ops)) {
            children.add(next());
            children.add(operand.parse());
        }
        return inline(rule, children);
    }

    protected static Object inline(String rule, List<Object> children) {
        return children.size() == 1 ? children.get(0) : new Tree(rule, children);
    }

    protected static Tree node(String rule, Object... children) {
        return new Tree(rule, Arrays.asList(children));
    }

    protected static boolean isOneOf(Token t, Set<String> texts) {
        return t.type() != EOF && texts.contains(t.text());
    }

    protected Parser.ParseException error(String message) {
        var t = peek();
        var found = t.type() == EOF ? "EOF" : "'" + t.text() + "'";
        return new Parser.ParseException(message + " found " + found, t.line(), t.col(), lexer.context(t.offset()));
    }
}
