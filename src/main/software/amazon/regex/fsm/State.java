package software.amazon.regex.fsm;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.Objects;

/**
 * Represents a state in an Automaton. Edges are stored as indices into the owning Automaton's arena of states, so a
 * repeat can list itself as a successor without any reference cycle between objects. The wrapped state of a REPEAT is
 * held directly, as it is always created (and frozen) before the repeat wrapping it.
 */
@Immutable
@ThreadSafe
public final class State {

    private final int id;
    private final StateType type;
    private final char symbol;
    private final State inner;
    private final int minCount;
    private final int[] next;

    private State(int id, StateType type, char symbol, @Nullable State inner, int minCount, int[] next) {
        this.id = id;
        this.type = Objects.requireNonNull(type);
        this.symbol = symbol;
        this.inner = inner;
        this.minCount = minCount;
        this.next = next;
    }

    static State start(int id, int[] next) {
        return new State(id, StateType.START, '\0', null, 0, next);
    }

    static State terminal(int id, int[] next) {
        return new State(id, StateType.TERMINAL, '\0', null, 0, next);
    }

    static State literal(int id, char symbol, int[] next) {
        return new State(id, StateType.LITERAL, symbol, null, 0, next);
    }

    static State wildcard(int id, int[] next) {
        return new State(id, StateType.WILDCARD, '\0', null, 0, next);
    }

    static State repeat(int id, int minCount, State inner, int[] next) {
        return new State(id, StateType.REPEAT, '\0', Objects.requireNonNull(inner), minCount, next);
    }

    /**
     * Returns true if this state consumes the given character when it is entered. A REPEAT answers for its wrapped
     * state.
     *
     * @param c the next input character
     * @return true if entering this state on c is allowed
     */
    public boolean accepts(char c) {
        switch (type) {
            case LITERAL:
                return symbol == c;
            case WILDCARD:
                return true;
            case REPEAT:
                return inner.accepts(c);
            case START:
            case TERMINAL:
            default:
                return false;
        }
    }

    public int getId() {
        return id;
    }

    public StateType getType() {
        return type;
    }

    /**
     * @return the character a LITERAL accepts; meaningless for any other type
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * @return the wrapped state of a REPEAT, {@code null} otherwise
     */
    @Nullable
    public State getInner() {
        return inner;
    }

    /**
     * Descriptive only: 0 for '*' and 1 for '+'. Matching never looks at it, the difference between the two lies in
     * how the repeat is wired.
     *
     * @return the minimum number of repetitions of a REPEAT, 0 for any other type
     */
    public int getMinCount() {
        return minCount;
    }

    public int getEdgeCount() {
        return next.length;
    }

    public int getEdge(int index) {
        return next[index];
    }

    public int[] getEdges() {
        return next.clone();
    }

    boolean hasEdgeTo(int stateId) {
        for (int target : next) {
            if (target == stateId) {
                return true;
            }
        }
        return false;
    }

    boolean isRepeat() {
        return type == StateType.REPEAT;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(id).append(':').append(type);
        if (type == StateType.LITERAL) {
            sb.append('(').append(symbol).append(')');
        } else if (type == StateType.REPEAT) {
            sb.append('(').append(minCount).append(", ").append(inner.getId()).append(')');
        }
        return sb.append(" -> ").append(Arrays.toString(next)).toString();
    }
}
