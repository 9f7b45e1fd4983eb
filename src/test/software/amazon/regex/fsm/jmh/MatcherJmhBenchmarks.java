package software.amazon.regex.fsm.jmh;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Timeout;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import software.amazon.regex.fsm.Automaton;
import software.amazon.regex.fsm.Matcher;
import software.amazon.regex.fsm.PatternCompiler;

import java.util.Objects;

import static java.util.concurrent.TimeUnit.SECONDS;

@BenchmarkMode(Mode.Throughput)
@Fork(value = 2, jvmArgsAppend = {
        "-Xmx1g", "-Xms1g", "-XX:+AlwaysPreTouch", "-XX:+UseSerialGC",
})
@Timeout(time = 60, timeUnit = SECONDS)
public class MatcherJmhBenchmarks {

    @Benchmark
    @Warmup(iterations = 3, batchSize = 1, time = 5, timeUnit = SECONDS)
    @Measurement(iterations = 5, batchSize = 1, time = 5, timeUnit = SECONDS)
    @OperationsPerInvocation(InputState.DATASET_SIZE)
    public void group01Match(AutomatonState automatonState, InputState inputState, Blackhole blackhole) {
        Automaton automaton = Objects.requireNonNull(automatonState.automaton);

        for (String input : inputState.getInputs()) {
            blackhole.consume(Matcher.matches(automaton, input));
        }
    }

    @Benchmark
    @Warmup(iterations = 3, batchSize = 1, time = 5, timeUnit = SECONDS)
    @Measurement(iterations = 5, batchSize = 1, time = 5, timeUnit = SECONDS)
    public void group02Compile(AutomatonState automatonState, Blackhole blackhole) {
        blackhole.consume(PatternCompiler.compilePattern(automatonState.pattern));
    }
}
