package software.amazon.regex.fsm;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Matching a string against a pattern is done in two stages: compiling the pattern into an Automaton, then running the
 * Automaton over the string. Callers who test many strings against one pattern should keep the Automaton around and
 * call {@link Matcher#matches} directly. This class is for the one-off case.
 */
@ThreadSafe
@Immutable
public final class Regex {

    private Regex() { }

    /**
     * Return true if the whole input matches the pattern. This is a thin wrapper around PatternCompiler and Matcher.
     *
     * @param pattern The pattern, see PatternParser for the syntax
     * @param input The string to test
     * @return true or false depending on whether the pattern matches the input
     * @throws software.amazon.regex.fsm.input.ParseException if the pattern doesn't compile
     */
    public static boolean matches(final String pattern, final String input) {
        return Matcher.matches(PatternCompiler.compilePattern(pattern), input);
    }
}
