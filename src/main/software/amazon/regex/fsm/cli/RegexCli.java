package software.amazon.regex.fsm.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.regex.fsm.Automaton;
import software.amazon.regex.fsm.AutomatonJsonWriter;
import software.amazon.regex.fsm.Configuration;
import software.amazon.regex.fsm.Matcher;
import software.amazon.regex.fsm.PatternCompiler;
import software.amazon.regex.fsm.input.ParseException;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line front end: {@code regex-fsm [options] <pattern> <input>}.
 * Exits 0 if the input matches, 1 if it doesn't, 2 if the pattern doesn't compile or the arguments are wrong.
 */
public class RegexCli {

    private static final Logger logger = LoggerFactory.getLogger(RegexCli.class);

    static final int EXIT_MATCH = 0;
    static final int EXIT_NO_MATCH = 1;
    static final int EXIT_ERROR = 2;

    static final String DEMO_PATTERN = "a*4.+hi";
    static final String[] DEMO_INPUTS = { "aaaaaa4uhi", "4uhi", "meow" };

    @Parameter(description = "<pattern> <input>")
    private List<String> arguments = new ArrayList<>();

    @Parameter(names = "--dump", description = "Print the compiled automaton as JSON before matching")
    private boolean dump = false;

    @Parameter(names = "--demo", description = "Match the sample pattern " + DEMO_PATTERN + " against a few inputs")
    private boolean demo = false;

    @Parameter(names = "--precompute-closures", description = "Precompute epsilon closures when compiling")
    private boolean precomputeClosures = false;

    @Parameter(names = { "-h", "--help" }, help = true, description = "Show this message")
    private boolean help = false;

    public static void main(String[] args) {
        System.exit(new RegexCli().run(args, System.out, System.err));
    }

    int run(final String[] args, final PrintStream out, final PrintStream err) {
        final JCommander commander = JCommander.newBuilder()
                .addObject(this)
                .programName("regex-fsm")
                .build();
        try {
            commander.parse(args);
        } catch (ParameterException e) {
            err.println(e.getMessage());
            printUsage(commander, err);
            return EXIT_ERROR;
        }

        if (help) {
            printUsage(commander, out);
            return EXIT_MATCH;
        }

        final PatternCompiler compiler = new PatternCompiler(new Configuration.Builder()
                .withPrecomputedEpsilonClosures(precomputeClosures)
                .build());

        if (demo) {
            if (!arguments.isEmpty()) {
                err.println("--demo takes no pattern or input");
                return EXIT_ERROR;
            }
            return runDemo(compiler, out);
        }

        if (arguments.size() != 2) {
            err.println("Expected a pattern and an input, got " + arguments.size() + " argument(s)");
            printUsage(commander, err);
            return EXIT_ERROR;
        }

        final String pattern = arguments.get(0);
        final String input = arguments.get(1);
        final Automaton automaton;
        try {
            automaton = compiler.compile(pattern);
        } catch (ParseException e) {
            logger.debug("Pattern '{}' rejected ({})", pattern, e.getKind(), e);
            err.println("Invalid pattern: " + e.getMessage());
            return EXIT_ERROR;
        }

        if (dump) {
            out.println(AutomatonJsonWriter.toJson(automaton));
        }
        final boolean matched = Matcher.matches(automaton, input);
        out.println(matched);
        return matched ? EXIT_MATCH : EXIT_NO_MATCH;
    }

    private int runDemo(final PatternCompiler compiler, final PrintStream out) {
        final Automaton automaton = compiler.compile(DEMO_PATTERN);
        if (dump) {
            out.println(AutomatonJsonWriter.toJson(automaton));
        }
        for (String input : DEMO_INPUTS) {
            out.println(input + ": " + Matcher.matches(automaton, input));
        }
        return EXIT_MATCH;
    }

    private static void printUsage(final JCommander commander, final PrintStream stream) {
        final StringBuilder sb = new StringBuilder();
        commander.getUsageFormatter().usage(sb);
        stream.print(sb);
    }
}
