package software.amazon.regex.fsm;

/**
 * The kinds of states an Automaton can contain.
 */
public enum StateType {
    START,      // entry point, accepts nothing
    TERMINAL,   // reaching it with no input left is a match, accepts nothing
    LITERAL,    // accepts exactly one character
    WILDCARD,   // '.', accepts any single character
    REPEAT,     // '*' or '+', accepts whatever its wrapped state accepts
}
