package software.amazon.regex.fsm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * Decides whether an Automaton accepts an entire input string. This is an NFA simulation: every (state, position)
 * pair the automaton could be in is explored breadth-first, with no backtracking, and each pair at most once.
 *
 * A step (s, i) means state s has been reached after consuming i characters. From there, for every successor n of s:
 *  - if n accepts input[i], the step (n, i + 1) is queued;
 *  - if n is a repeat, the step (n, i) is queued as well. This is the epsilon move: standing on a repeat without
 *    consuming anything. For a '*' repeat it exposes the exits, that is zero repetitions; for a '+' repeat it exposes
 *    only the wrapped atom, which must still consume.
 * A step (s, length) where s has an edge to the terminal state is a match.
 */
@Immutable
@ThreadSafe
public final class Matcher {

    private static final Logger logger = LoggerFactory.getLogger(Matcher.class);

    private Matcher() { }

    /**
     * Return true if the automaton matches the whole input. Never throws for an automaton built by PatternCompiler;
     * an input that doesn't match simply yields false.
     *
     * @param automaton the compiled pattern, which is not modified
     * @param input the candidate string
     * @return true if the input is in the automaton's language
     */
    public static boolean matches(@Nonnull final Automaton automaton, @Nonnull final CharSequence input) {
        Objects.requireNonNull(automaton, "automaton");
        Objects.requireNonNull(input, "input");

        final MatchTask task = new MatchTask(input, automaton);
        final int terminalId = automaton.getTerminal().getId();
        final boolean useClosures = automaton.hasEpsilonClosures();
        task.addStep(automaton.getStart().getId(), 0);

        while (task.stepsRemain()) {
            final Step step = task.nextStep();
            final boolean matched = useClosures
                    ? tryStepWithClosure(task, step, terminalId)
                    : tryStep(task, step, terminalId);
            if (matched) {
                if (logger.isTraceEnabled()) {
                    logger.trace("'{}' matched '{}' at step {} after {} steps", automaton.getPattern(), input, step,
                            task.stepsSeen());
                }
                return true;
            }
        }

        if (logger.isTraceEnabled()) {
            logger.trace("'{}' did not match '{}' after {} steps", automaton.getPattern(), input, task.stepsSeen());
        }
        return false;
    }

    private static boolean tryStep(final MatchTask task, final Step step, final int terminalId) {
        final State state = task.automaton.getState(step.stateId);
        final boolean atEnd = task.isAtEnd(step);
        if (atEnd && state.hasEdgeTo(terminalId)) {
            return true;
        }

        final char c = atEnd ? 0 : task.charAt(step);
        for (int i = 0; i < state.getEdgeCount(); i++) {
            final State next = task.automaton.getState(state.getEdge(i));
            if (!atEnd && next.accepts(c)) {
                task.addStep(next.getId(), step.position + 1);
            }
            if (next.isRepeat()) {
                task.addStep(next.getId(), step.position);
            }
        }
        return false;
    }

    // Same as tryStep, except that every repeat reachable by epsilon moves is treated as a source right away instead
    // of being queued at the same position.
    private static boolean tryStepWithClosure(final MatchTask task, final Step step, final int terminalId) {
        if (consumeFrom(task, task.automaton.getState(step.stateId), step, terminalId)) {
            return true;
        }
        for (int repeatId : task.automaton.getEpsilonClosure(step.stateId)) {
            if (consumeFrom(task, task.automaton.getState(repeatId), step, terminalId)) {
                return true;
            }
        }
        return false;
    }

    private static boolean consumeFrom(final MatchTask task, final State source, final Step step,
                                       final int terminalId) {
        if (task.isAtEnd(step)) {
            return source.hasEdgeTo(terminalId);
        }
        final char c = task.charAt(step);
        for (int i = 0; i < source.getEdgeCount(); i++) {
            final State next = task.automaton.getState(source.getEdge(i));
            if (next.accepts(c)) {
                task.addStep(next.getId(), step.position + 1);
            }
        }
        return false;
    }
}
