package software.amazon.regex.fsm;

import javax.annotation.concurrent.Immutable;

/**
 * Configuration for a PatternCompiler.
 */
@Immutable
public class Configuration {

    /**
     * Normally, the matcher discovers the repeats it may stand on without consuming input one epsilon move at a time,
     * queueing each as its own step. By setting this flag to true, the compiler computes, for every state, the full
     * set of repeats reachable through epsilon moves and stores it in the Automaton, and the matcher consults that set
     * instead. This costs memory proportional to the square of the number of repeats in the pattern in the worst case,
     * and saves queue traffic on long inputs. Match results are identical either way.
     */
    private final boolean precomputedEpsilonClosures;

    private Configuration(boolean precomputedEpsilonClosures) {
        this.precomputedEpsilonClosures = precomputedEpsilonClosures;
    }

    public static Configuration defaults() {
        return new Builder().build();
    }

    public boolean isPrecomputedEpsilonClosures() {
        return precomputedEpsilonClosures;
    }

    @Override
    public String toString() {
        return "Configuration{precomputedEpsilonClosures=" + precomputedEpsilonClosures + '}';
    }

    public static class Builder {

        private boolean precomputedEpsilonClosures = false;

        public Builder withPrecomputedEpsilonClosures(boolean precomputedEpsilonClosures) {
            this.precomputedEpsilonClosures = precomputedEpsilonClosures;
            return this;
        }

        public Configuration build() {
            return new Configuration(precomputedEpsilonClosures);
        }
    }
}
