package software.amazon.regex.fsm.input;

/**
 * A RuntimeException that indicates a pattern could not be compiled. Compiling the same pattern again always fails the
 * same way.
 */
public class ParseException extends RuntimeException {

    public enum Kind {
        LEADING_QUANTIFIER,  // '*' or '+' with no atom in front of it
        UNSUPPORTED_TOKEN    // non-ASCII, or a metacharacter of an unimplemented feature
    }

    private final Kind kind;
    private final int position;
    private final char token;

    public ParseException(Kind kind, int position, char token, String msg) {
        super(msg);
        this.kind = kind;
        this.position = position;
        this.token = token;
    }

    public static ParseException leadingQuantifier(int position, char quantifier) {
        return new ParseException(Kind.LEADING_QUANTIFIER, position, quantifier,
                "Quantifier '" + quantifier + "' has no preceding atom at pos " + position);
    }

    public static ParseException unsupportedToken(int position, char token) {
        return new ParseException(Kind.UNSUPPORTED_TOKEN, position, token,
                "Unsupported token '" + token + "' at pos " + position);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return zero-based index of the offending character in the pattern
     */
    public int getPosition() {
        return position;
    }

    public char getToken() {
        return token;
    }
}
