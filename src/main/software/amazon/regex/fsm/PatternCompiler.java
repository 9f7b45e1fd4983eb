package software.amazon.regex.fsm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.regex.fsm.input.InputCharacter;
import software.amazon.regex.fsm.input.InputLiteral;
import software.amazon.regex.fsm.input.InputQuantifier;
import software.amazon.regex.fsm.input.ParseException;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Objects;

import static software.amazon.regex.fsm.input.PatternParser.getParser;

/**
 * Compiles a pattern into an Automaton in a single left-to-right pass over the parsed pattern.
 *
 * The compiler keeps three things between tokens:
 *  - the tail, the state to which the next successor gets appended (start, before any token);
 *  - the last atom, the most recently created literal, wildcard or repeat;
 *  - the edge slot, as (owner, index), through which the chain currently reaches the last atom.
 * A quantifier splices its repeat into exactly that slot, which belongs to the atom's true predecessor.
 *
 * How the two repeats are wired:
 *  - "a*": the slot is pointed at R, and R's edges are [a, R]. R is the tail, so the rest of the pattern hangs off R.
 *    Standing on R without consuming exposes its exits, which is how zero repetitions are matched.
 *  - "a+": the slot is pointed at P, and P's edges are [a]. The atom gets the self-loop and stays the tail. Standing
 *    on P without consuming exposes only the atom, which still has to consume a character.
 */
@Immutable
@ThreadSafe
public class PatternCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PatternCompiler.class);

    private static final int NONE = -1;

    private final Configuration configuration;

    public PatternCompiler() {
        this(Configuration.defaults());
    }

    public PatternCompiler(@Nonnull Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    /**
     * Compiles a pattern using the default configuration.
     *
     * @param pattern the pattern
     * @return the compiled automaton
     * @throws ParseException if the pattern has a leading quantifier or an unsupported token
     */
    public static Automaton compilePattern(@Nonnull String pattern) {
        return new PatternCompiler().compile(pattern);
    }

    /**
     * Compiles a pattern.
     *
     * @param pattern the pattern
     * @return the compiled automaton, ready to be handed to any number of concurrent matches
     * @throws ParseException if the pattern has a leading quantifier or an unsupported token
     */
    public Automaton compile(@Nonnull String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        final InputCharacter[] characters = getParser().parse(pattern);
        final Automaton.Builder builder = new Automaton.Builder(pattern);

        int tail = builder.getStartId();
        int lastAtom = NONE;
        int slotOwner = NONE;
        int slotIndex = NONE;

        for (int i = 0; i < characters.length; i++) {
            final InputCharacter character = characters[i];
            switch (character.getType()) {
                case LITERAL:
                case WILDCARD: {
                    int state = character instanceof InputLiteral
                            ? builder.addLiteral(InputLiteral.cast(character).getChar())
                            : builder.addWildcard();
                    slotOwner = tail;
                    slotIndex = builder.addEdge(tail, state);
                    tail = state;
                    lastAtom = state;
                    break;
                }
                case QUANTIFIER: {
                    InputQuantifier quantifier = InputQuantifier.cast(character);

                    // Nothing to repeat: either the pattern starts here, or the previous token was a quantifier too.
                    if (lastAtom == NONE || builder.isRepeat(lastAtom)) {
                        throw ParseException.leadingQuantifier(i, quantifier.getSymbol());
                    }

                    int repeat = builder.addRepeat(quantifier.getMinCount(), lastAtom);
                    int replaced = builder.setEdge(slotOwner, slotIndex, repeat);
                    assert replaced == lastAtom : "slot " + slotOwner + "[" + slotIndex + "] pointed at " + replaced;

                    builder.addEdge(repeat, lastAtom);
                    if (quantifier.getMinCount() == 0) {
                        builder.addEdge(repeat, repeat);
                        tail = repeat;
                    } else {
                        builder.addEdge(lastAtom, lastAtom);
                        tail = lastAtom;
                    }

                    // The slot now reaches the repeat, which takes the atom's place in the chain.
                    lastAtom = repeat;
                    break;
                }
                default:
                    throw new IllegalStateException("Unexpected input character " + character);
            }
        }

        builder.addEdge(tail, builder.getTerminalId());

        final Automaton automaton = builder.build(configuration.isPrecomputedEpsilonClosures());
        assert isValid(automaton);
        if (logger.isDebugEnabled()) {
            logger.debug("Compiled pattern '{}' into {} states", pattern, automaton.size());
        }
        return automaton;
    }

    private static boolean isValid(Automaton automaton) {
        List<String> violations = AutomatonValidator.validate(automaton);
        if (!violations.isEmpty()) {
            logger.error("Pattern '{}' compiled into a malformed automaton: {}", automaton.getPattern(), violations);
            return false;
        }
        return true;
    }
}
