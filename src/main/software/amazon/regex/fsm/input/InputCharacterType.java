package software.amazon.regex.fsm.input;

/**
 * The different types of InputCharacters, parsed from a pattern, that the PatternCompiler turns into states.
 */
public enum InputCharacterType {
    LITERAL,
    WILDCARD,
    QUANTIFIER
}
