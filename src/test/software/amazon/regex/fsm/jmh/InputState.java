package software.amazon.regex.fsm.jmh;

import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@State(Scope.Benchmark)
public class InputState {

    public static final int DATASET_SIZE = 1000;

    private static final String ALPHABET = "abcdefhiwxy4 ";
    private static final List<String> inputs = new ArrayList<>();

    static {
        Random random = new Random(42L);
        for (int i = 0; i < DATASET_SIZE; i++) {
            int length = random.nextInt(64);
            StringBuilder sb = new StringBuilder(length);
            for (int j = 0; j < length; j++) {
                sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
            }
            inputs.add(sb.toString());
        }
    }

    public Iterable<String> getInputs() {
        return inputs;
    }
}
