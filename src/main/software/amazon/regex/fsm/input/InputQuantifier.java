package software.amazon.regex.fsm.input;

import static software.amazon.regex.fsm.input.InputCharacterType.QUANTIFIER;

/**
 * An InputCharacter that represents a postfix quantifier applying to the atom just before it.
 */
public class InputQuantifier extends InputCharacter {

    static final InputQuantifier ZERO_OR_MORE = new InputQuantifier('*', 0);
    static final InputQuantifier ONE_OR_MORE = new InputQuantifier('+', 1);

    private final char symbol;
    private final int minCount;

    private InputQuantifier(final char symbol, final int minCount) {
        this.symbol = symbol;
        this.minCount = minCount;
    }

    public static InputQuantifier cast(InputCharacter character) {
        return (InputQuantifier) character;
    }

    /**
     * @return '*' or '+'
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * @return the least number of times the quantified atom has to match
     */
    public int getMinCount() {
        return minCount;
    }

    @Override
    public InputCharacterType getType() {
        return QUANTIFIER;
    }

    @Override
    public String toString() {
        return "Quantifier(" + symbol + ")";
    }
}
