package dumb.logics.parse;

import dumb.logics.Formulas;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static dumb.logics.parse.Token.Type.*;

/**
 * Splits formula text into tokens. Symbols are matched longest first.
 */
final class Lexer {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private static final Pattern UPPER_NAME = Pattern.compile("[A-Z][a-zA-Z0-9_]*");
    private static final List<String> SYMBOLS = List.of(
            "<->", "->", ">>", "&&", "||",
            "(", ")", "[", "]", "<", ">", "&", "|", "!", "~", ";", "+", "*", "?", ",", ".");

    private final String text;
    private final boolean shiftImplication;
    private final Set<String> letters;
    private int pos = 0;
    private int line = 1;
    private int col = 0;

    /**
     * @param shiftImplication whether {@code >>} is read as implication; LDL disables it so that a
     *                         closing diamond cannot merge with the next symbol
     * @param letters          uppercase operators that always form a token of their own
     */
    Lexer(String text, boolean shiftImplication, Set<String> letters) {
        this.text = text;
        this.shiftImplication = shiftImplication;
        this.letters = letters;
    }

    List<Token> tokenize() throws Parser.ParseException {
        var tokens = new ArrayList<Token>();
        Token t;
        do {
            t = next();
            tokens.add(t);
        } while (t.type() != EOF);
        return tokens;
    }

    /**
     * Input preceding (and including) the given offset, for error messages.
     */
    String context(int offset) {
        var end = Math.min(text.length(), offset + 1);
        return text.substring(Math.max(0, end - CONTEXT_BUFFER_SIZE), end);
    }

    private Token next() throws Parser.ParseException {
        skipWhitespace();
        if (pos >= text.length()) return new Token(EOF, "", pos, line, col);
        var c = text.charAt(pos);

        if (c == '"' || c == '_' || (c >= 'a' && c <= 'z')) {
            var m = Formulas.ATOM_NAME.matcher(text).region(pos, text.length());
            if (!m.lookingAt())
                throw createParseException(c == '"' ? "Unterminated or empty quoted symbol" : "Invalid symbol");
            return consume(NAME, m.end() - pos);
        }
        if (c >= 'A' && c <= 'Z') {
            if (letters.contains(String.valueOf(c))) return consume(UPPER, 1);
            var m = UPPER_NAME.matcher(text).region(pos, text.length());
            m.lookingAt();
            return consume(UPPER, m.end() - pos);
        }
        for (var s : SYMBOLS) {
            if (text.startsWith(s, pos) && (shiftImplication || !s.equals(">>")))
                return consume(SYMBOL, s.length());
        }
        throw createParseException("Unexpected character '" + c + "'");
    }

    private Token consume(Token.Type type, int length) {
        var t = new Token(type, text.substring(pos, pos + length), pos, line, col);
        for (var i = 0; i < length; i++) advance();
        return t;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) advance();
    }

    private void advance() {
        if (text.charAt(pos++) == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
    }

    private Parser.ParseException createParseException(String message) {
        return new Parser.ParseException(message, line, col, context(pos));
    }
}
