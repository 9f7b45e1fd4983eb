package software.amazon.regex.fsm;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The compiled form of a pattern: an arena of States plus the designated start and terminal states. All states are
 * created by one Builder and belong to this Automaton only. Once built, nothing in it changes, so one instance can be
 * shared by any number of threads running matches.
 */
@Immutable
@ThreadSafe
public final class Automaton {

    private final String pattern;
    private final List<State> states;
    private final State start;
    private final State terminal;

    // For each state, the repeats reachable from it by epsilon moves alone. Null unless precomputed.
    private final int[][] epsilonClosures;

    private Automaton(String pattern, List<State> states, int startId, int terminalId, boolean withClosures) {
        this.pattern = pattern;
        this.states = Collections.unmodifiableList(states);
        this.start = states.get(startId);
        this.terminal = states.get(terminalId);
        this.epsilonClosures = withClosures ? computeEpsilonClosures(states) : null;
    }

    /**
     * @return the pattern this automaton was compiled from
     */
    public String getPattern() {
        return pattern;
    }

    public State getStart() {
        return start;
    }

    public State getTerminal() {
        return terminal;
    }

    public State getState(int id) {
        return states.get(id);
    }

    public List<State> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    boolean hasEpsilonClosures() {
        return epsilonClosures != null;
    }

    int[] getEpsilonClosure(int stateId) {
        return epsilonClosures[stateId];
    }

    // Breadth-first from each state across edges that lead to a repeat; those are the only epsilon moves.
    private static int[][] computeEpsilonClosures(List<State> states) {
        int[][] closures = new int[states.size()][];
        for (State state : states) {
            IntOpenHashSet seen = new IntOpenHashSet();
            IntArrayList closure = new IntArrayList();
            IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
            queue.enqueue(state.getId());
            while (!queue.isEmpty()) {
                State current = states.get(queue.dequeueInt());
                for (int i = 0; i < current.getEdgeCount(); i++) {
                    int target = current.getEdge(i);
                    if (states.get(target).isRepeat() && seen.add(target)) {
                        closure.add(target);
                        queue.enqueue(target);
                    }
                }
            }
            closures[state.getId()] = closure.toIntArray();
        }
        return closures;
    }

    @Override
    public String toString() {
        return "Automaton{" +
                "pattern='" + pattern + '\'' +
                ", start=" + start.getId() +
                ", terminal=" + terminal.getId() +
                ", states=" + states +
                '}';
    }

    /**
     * Collects states and edges while a pattern is being compiled. Edges may be appended and individual edge slots
     * overwritten until {@link #build} freezes everything into an Automaton.
     */
    @NotThreadSafe
    static final class Builder {

        private final String pattern;
        private final List<StateType> types = new ArrayList<>();
        private final List<Character> symbols = new ArrayList<>();
        private final IntArrayList inners = new IntArrayList();
        private final IntArrayList minCounts = new IntArrayList();
        private final List<IntArrayList> edges = new ArrayList<>();
        private final int startId;
        private final int terminalId;

        Builder(@Nonnull String pattern) {
            this.pattern = pattern;
            this.startId = addState(StateType.START, '\0', -1, 0);
            this.terminalId = addState(StateType.TERMINAL, '\0', -1, 0);
        }

        int getStartId() {
            return startId;
        }

        int getTerminalId() {
            return terminalId;
        }

        int addLiteral(char symbol) {
            return addState(StateType.LITERAL, symbol, -1, 0);
        }

        int addWildcard() {
            return addState(StateType.WILDCARD, '\0', -1, 0);
        }

        int addRepeat(int minCount, int innerId) {
            return addState(StateType.REPEAT, '\0', innerId, minCount);
        }

        boolean isRepeat(int stateId) {
            return types.get(stateId) == StateType.REPEAT;
        }

        /**
         * Appends an edge and returns the slot it occupies in the owner's edge list.
         */
        int addEdge(int from, int to) {
            IntArrayList list = edges.get(from);
            list.add(to);
            return list.size() - 1;
        }

        /**
         * Overwrites one edge slot, returning the state it used to point to.
         */
        int setEdge(int from, int slot, int to) {
            return edges.get(from).set(slot, to);
        }

        Automaton build(boolean withEpsilonClosures) {
            List<State> states = new ArrayList<>(types.size());
            for (int id = 0; id < types.size(); id++) {
                states.add(freeze(id, states));
            }
            return new Automaton(pattern, states, startId, terminalId, withEpsilonClosures);
        }

        private State freeze(int id, List<State> frozen) {
            int[] next = edges.get(id).toIntArray();
            switch (types.get(id)) {
                case START:
                    return State.start(id, next);
                case TERMINAL:
                    return State.terminal(id, next);
                case LITERAL:
                    return State.literal(id, symbols.get(id), next);
                case WILDCARD:
                    return State.wildcard(id, next);
                case REPEAT:
                    return State.repeat(id, minCounts.getInt(id), getFrozen(frozen, inners.getInt(id)), next);
                default:
                    throw new IllegalStateException("Unknown state type " + types.get(id));
            }
        }

        // Wrapped states always have a lower id than the repeat that wraps them.
        private static State getFrozen(List<State> frozen, int id) {
            if (id < 0 || id >= frozen.size()) {
                throw new IllegalStateException("Repeat wraps state " + id + " which is not built yet");
            }
            return frozen.get(id);
        }

        private int addState(StateType type, char symbol, int innerId, int minCount) {
            types.add(type);
            symbols.add(symbol);
            inners.add(innerId);
            minCounts.add(minCount);
            edges.add(new IntArrayList());
            return types.size() - 1;
        }
    }
}
