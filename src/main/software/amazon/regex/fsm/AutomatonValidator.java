package software.amazon.regex.fsm;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.Stack;

/**
 * Checks the structural invariants every compiled Automaton must satisfy:
 *  - start has no incoming edges and is never wrapped by a repeat;
 *  - terminal has no outgoing edges;
 *  - every state is reachable from start, and so is terminal;
 *  - the only cycles are self-loops.
 * PatternCompiler asserts these after each compilation, so a wiring mistake shows up there rather than as a wrong
 * match result much later.
 */
public final class AutomatonValidator {

    private AutomatonValidator() { }

    /**
     * Returns a description of each invariant the automaton breaks.
     *
     * @param automaton the automaton to check
     * @return the violations found, empty if the automaton is well formed
     */
    public static List<String> validate(Automaton automaton) {
        final List<String> violations = new ArrayList<>();
        final State start = automaton.getStart();
        final State terminal = automaton.getTerminal();

        if (start.getType() != StateType.START) {
            violations.add("start state " + start + " is not of type START");
        }
        if (terminal.getType() != StateType.TERMINAL) {
            violations.add("terminal state " + terminal + " is not of type TERMINAL");
        }
        if (terminal.getEdgeCount() != 0) {
            violations.add("terminal state " + terminal + " has outgoing edges");
        }

        for (State state : automaton.getStates()) {
            for (int i = 0; i < state.getEdgeCount(); i++) {
                int target = state.getEdge(i);
                if (target < 0 || target >= automaton.size()) {
                    violations.add("state " + state + " has an edge to unknown state " + target);
                } else if (target == start.getId()) {
                    violations.add("state " + state + " has an edge to the start state");
                }
            }
            State inner = state.getInner();
            if (inner != null && (inner == start || inner == terminal)) {
                violations.add("repeat " + state + " wraps " + inner);
            }
        }
        if (!violations.isEmpty()) {
            // Edges can't be trusted for the graph walks below.
            return violations;
        }

        final Set<Integer> reachable = reachableFrom(automaton, start);
        for (State state : automaton.getStates()) {
            if (state != start && !reachable.contains(state.getId())) {
                violations.add("state " + state + " is not reachable from the start state");
            }
        }

        final State onCycle = findCycle(automaton, start);
        if (onCycle != null) {
            violations.add("state " + onCycle + " is on a cycle that is not a self-loop");
        }
        return violations;
    }

    // We'll do a breadth-first-search but it shouldn't matter.
    private static Set<Integer> reachableFrom(Automaton automaton, State from) {
        final Set<Integer> visited = new HashSet<>();
        final Queue<State> states = new LinkedList<>();
        visited.add(from.getId());
        states.add(from);
        while (!states.isEmpty()) {
            State state = states.remove();
            for (int i = 0; i < state.getEdgeCount(); i++) {
                int target = state.getEdge(i);
                if (visited.add(target)) {
                    states.add(automaton.getState(target));
                }
            }
        }
        return visited;
    }

    /**
     * Depth-first search for a back edge, ignoring self-loops. Avoids recursion, which is prone to stack overflow on
     * long patterns.
     *
     * @return a state on a cycle, or null if there is none
     */
    private static State findCycle(Automaton automaton, State from) {
        final Set<Integer> done = new HashSet<>();
        final Set<Integer> onPath = new HashSet<>();
        final Stack<State> stack = new Stack<>();
        stack.push(from);

        while (!stack.isEmpty()) {
            // Peek instead of pop. The state stays on the stack, and on the current path, until all deeper states
            // are done.
            State state = stack.peek();
            if (done.contains(state.getId())) {
                // pushed by more than one parent
                stack.pop();
                continue;
            }
            if (onPath.contains(state.getId())) {
                onPath.remove(state.getId());
                done.add(state.getId());
                stack.pop();
                continue;
            }
            onPath.add(state.getId());

            for (int i = 0; i < state.getEdgeCount(); i++) {
                int target = state.getEdge(i);
                if (target == state.getId() || done.contains(target)) {
                    continue;
                }
                if (onPath.contains(target)) {
                    return automaton.getState(target);
                }
                stack.push(automaton.getState(target));
            }
        }
        return null;
    }
}
