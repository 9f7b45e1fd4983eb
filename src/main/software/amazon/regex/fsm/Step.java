package software.amazon.regex.fsm;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Represents a point a match attempt has reached: a state, and the number of input characters consumed to get there.
 */
@Immutable
@ThreadSafe
final class Step {
    final int stateId;
    final int position;

    Step(final int stateId, final int position) {
        this.stateId = stateId;
        this.position = position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Step step = (Step) o;
        return stateId == step.stateId && position == step.position;
    }

    @Override
    public int hashCode() {
        return 31 * stateId + position;
    }

    @Override
    public String toString() {
        return "(" + stateId + ", " + position + ")";
    }
}
