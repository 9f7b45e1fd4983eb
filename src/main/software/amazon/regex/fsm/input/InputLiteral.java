package software.amazon.regex.fsm.input;

import static software.amazon.regex.fsm.input.InputCharacterType.LITERAL;

/**
 * An InputCharacter that represents a single ASCII character to be matched exactly.
 */
public class InputLiteral extends InputCharacter {

    private final char c;

    InputLiteral(final char c) {
        this.c = c;
    }

    public static InputLiteral cast(InputCharacter character) {
        return (InputLiteral) character;
    }

    public char getChar() {
        return c;
    }

    @Override
    public InputCharacterType getType() {
        return LITERAL;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o.getClass() == getClass())) {
            return false;
        }
        return ((InputLiteral) o).getChar() == getChar();
    }

    @Override
    public int hashCode() {
        return Character.valueOf(c).hashCode();
    }

    @Override
    public String toString() {
        return String.valueOf(c);
    }
}
