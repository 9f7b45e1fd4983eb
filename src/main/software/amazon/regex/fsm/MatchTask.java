package software.amazon.regex.fsm;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Represents the state of one match attempt. Confined to the thread running the match.
 */
@NotThreadSafe
class MatchTask {

    // What we're trying to match
    final CharSequence input;

    // the compiled pattern
    final Automaton automaton;

    // Steps queued up for processing
    private final Queue<Step> stepQueue = new ArrayDeque<>();

    // Visiting the same Step twice gives the same outcome both times, as nothing is mutated by a visit. Epsilon moves
    // don't advance the position, so without this set a chain of repeats would queue the same steps forever. Holds at
    // most (number of states) * (input length + 1) entries.
    private final Set<Step> seenSteps = new HashSet<>();

    MatchTask(final CharSequence input, final Automaton automaton) {
        this.input = input;
        this.automaton = automaton;
    }

    boolean isAtEnd(final Step step) {
        return step.position == input.length();
    }

    char charAt(final Step step) {
        return input.charAt(step.position);
    }

    Step nextStep() {
        return stepQueue.remove();
    }

    void addStep(final int stateId, final int position) {
        final Step step = new Step(stateId, position);
        // queue it up only if it's the first time we're trying to queue it up
        if (seenSteps.add(step)) {
            stepQueue.add(step);
        }
    }

    boolean stepsRemain() {
        return !stepQueue.isEmpty();
    }

    int stepsSeen() {
        return seenSteps.size();
    }
}
