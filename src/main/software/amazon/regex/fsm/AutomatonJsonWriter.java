package software.amazon.regex.fsm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Renders an Automaton as JSON, for looking at what a pattern compiled into. For example "ab*" gives
 * <pre>
 * { "pattern" : "ab*", "start" : 0, "terminal" : 1, "states" : [
 *   { "id" : 0, "type" : "START", "edges" : [ 2 ] },
 *   { "id" : 1, "type" : "TERMINAL", "edges" : [ ] },
 *   { "id" : 2, "type" : "LITERAL", "symbol" : "a", "edges" : [ 4 ] },
 *   { "id" : 3, "type" : "LITERAL", "symbol" : "b", "edges" : [ ] },
 *   { "id" : 4, "type" : "REPEAT", "minCount" : 0, "inner" : 3, "edges" : [ 3, 4, 1 ] } ] }
 * </pre>
 */
@ThreadSafe
public final class AutomatonJsonWriter {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private AutomatonJsonWriter() { }

    public static ObjectNode toJsonNode(final Automaton automaton) {
        final ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("pattern", automaton.getPattern());
        root.put("start", automaton.getStart().getId());
        root.put("terminal", automaton.getTerminal().getId());
        final ArrayNode states = root.putArray("states");
        for (State state : automaton.getStates()) {
            final ObjectNode node = states.addObject();
            node.put("id", state.getId());
            node.put("type", state.getType().name());
            switch (state.getType()) {
                case LITERAL:
                    node.put("symbol", String.valueOf(state.getSymbol()));
                    break;
                case REPEAT:
                    node.put("minCount", state.getMinCount());
                    node.put("inner", state.getInner().getId());
                    break;
                default:
                    break;
            }
            final ArrayNode edges = node.putArray("edges");
            for (int i = 0; i < state.getEdgeCount(); i++) {
                edges.add(state.getEdge(i));
            }
        }
        return root;
    }

    public static String toJson(final Automaton automaton) {
        try {
            return OBJECT_MAPPER.writeValueAsString(toJsonNode(automaton));
        } catch (JsonProcessingException e) {
            // A tree of plain ObjectNodes always serializes.
            throw new IllegalStateException("Cannot render automaton for pattern " + automaton.getPattern(), e);
        }
    }
}
