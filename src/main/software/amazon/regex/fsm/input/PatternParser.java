package software.amazon.regex.fsm.input;

/**
 * Parses a pattern into InputCharacters, one per pattern character, so the index of a token is also its position in
 * the pattern. Characters with a special meaning become wildcards or quantifiers; every other ASCII character is a
 * literal. Metacharacters of features that are not implemented (groups, alternation, classes, anchors, escapes and
 * bounded repeats) are rejected rather than silently taken literally.
 */
public class PatternParser {

    static final char DOLLAR_SIGN = '$';
    static final char LEFT_PARENTHESIS = '(';
    static final char RIGHT_PARENTHESIS = ')';
    static final char ASTERISK = '*';
    static final char PLUS_SIGN = '+';
    static final char PERIOD = '.';
    static final char QUESTION_MARK = '?';
    static final char LEFT_SQUARE_BRACKET = '[';
    static final char BACKSLASH = '\\';
    static final char RIGHT_SQUARE_BRACKET = ']';
    static final char CARET = '^';
    static final char LEFT_CURLY_BRACKET = '{';
    static final char VERTICAL_LINE = '|';
    static final char RIGHT_CURLY_BRACKET = '}';
    static final char MAX_ASCII = 0x7F;

    private static final PatternParser SINGLETON = new PatternParser();

    PatternParser() { }

    public static PatternParser getParser() {
        return SINGLETON;
    }

    public InputCharacter[] parse(final String pattern) {
        final InputCharacter[] result = new InputCharacter[pattern.length()];
        for (int i = 0; i < pattern.length(); i++) {
            result[i] = parse(pattern.charAt(i), i);
        }
        return result;
    }

    InputCharacter parse(final char c, final int position) {
        switch (c) {
            case PERIOD:
                return new InputWildcard();
            case ASTERISK:
                return InputQuantifier.ZERO_OR_MORE;
            case PLUS_SIGN:
                return InputQuantifier.ONE_OR_MORE;
            default:
                if (isReserved(c) || c > MAX_ASCII) {
                    throw ParseException.unsupportedToken(position, c);
                }
                return new InputLiteral(c);
        }
    }

    static boolean isReserved(final char c) {
        switch (c) {
            case DOLLAR_SIGN:
            case LEFT_PARENTHESIS:
            case RIGHT_PARENTHESIS:
            case QUESTION_MARK:
            case LEFT_SQUARE_BRACKET:
            case BACKSLASH:
            case RIGHT_SQUARE_BRACKET:
            case CARET:
            case LEFT_CURLY_BRACKET:
            case VERTICAL_LINE:
            case RIGHT_CURLY_BRACKET:
                return true;
            default:
                return false;
        }
    }
}
