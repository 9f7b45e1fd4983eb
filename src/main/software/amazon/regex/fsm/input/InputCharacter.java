package software.amazon.regex.fsm.input;

/**
 * One token of a parsed pattern.
 */
public abstract class InputCharacter {

    public abstract InputCharacterType getType();
}
