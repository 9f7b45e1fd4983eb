package software.amazon.regex.fsm;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class StateTest {

    @Test
    public void testStartAndTerminalAcceptNothing() {
        State start = State.start(0, new int[] { 1 });
        State terminal = State.terminal(1, new int[0]);
        for (char c : "a.*\0 ".toCharArray()) {
            assertFalse(start.accepts(c));
            assertFalse(terminal.accepts(c));
        }
    }

    @Test
    public void testLiteral() {
        State literal = State.literal(2, 'x', new int[0]);
        assertTrue(literal.accepts('x'));
        assertFalse(literal.accepts('X'));
        assertFalse(literal.accepts('.'));
        assertEquals('x', literal.getSymbol());
        assertNull(literal.getInner());
    }

    @Test
    public void testWildcard() {
        State wildcard = State.wildcard(2, new int[0]);
        assertTrue(wildcard.accepts('x'));
        assertTrue(wildcard.accepts('\n'));
        assertTrue(wildcard.accepts('é'));
    }

    @Test
    public void testRepeatDelegatesToWrappedState() {
        State literal = State.literal(2, 'q', new int[0]);
        State repeat = State.repeat(3, 1, literal, new int[] { 2 });
        assertTrue(repeat.accepts('q'));
        assertFalse(repeat.accepts('r'));
        assertSame(literal, repeat.getInner());
        assertEquals(1, repeat.getMinCount());
        assertEquals(StateType.REPEAT, repeat.getType());
    }

    @Test
    public void testEdgesAreCopiedOut() {
        State state = State.literal(2, 'a', new int[] { 3, 4 });
        int[] edges = state.getEdges();
        edges[0] = 99;
        assertNotSame(edges, state.getEdges());
        assertArrayEquals(new int[] { 3, 4 }, state.getEdges());
        assertEquals(2, state.getEdgeCount());
        assertEquals(4, state.getEdge(1));
        assertTrue(state.hasEdgeTo(3));
        assertFalse(state.hasEdgeTo(99));
    }

    @Test
    public void testToString() {
        State literal = State.literal(2, 'a', new int[] { 4 });
        State repeat = State.repeat(4, 0, literal, new int[] { 2, 4, 1 });
        assertEquals("2:LITERAL(a) -> [4]", literal.toString());
        assertEquals("4:REPEAT(0, 2) -> [2, 4, 1]", repeat.toString());
    }
}
