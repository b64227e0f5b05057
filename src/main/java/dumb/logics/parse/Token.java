package dumb.logics.parse;

/**
 * A lexeme with its position in the input.
 */
public record Token(Type type, String text, int offset, int line, int col) {

    public enum Type {
        /** Lowercase symbol, keyword or quoted symbol. */
        NAME,
        /** Capitalized identifier: temporal operator letters and predicate names. */
        UPPER,
        SYMBOL,
        EOF
    }

    public boolean is(String s) {
        return type != Type.EOF && text.equals(s);
    }

    @Override
    public String toString() {
        return type == Type.EOF ? "<EOF>" : text;
    }
}
