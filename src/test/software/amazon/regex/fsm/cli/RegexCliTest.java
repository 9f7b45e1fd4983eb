package software.amazon.regex.fsm.cli;

import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;

public class RegexCliTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setup() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    public void testMatch() {
        assertEquals(RegexCli.EXIT_MATCH, run("a*4.+hi", "aaaaaa4uhi"));
        assertEquals("true", stdout().trim());
    }

    @Test
    public void testNoMatch() {
        assertEquals(RegexCli.EXIT_NO_MATCH, run("a*4.+hi", "meow"));
        assertEquals("false", stdout().trim());
    }

    @Test
    public void testLeadingPlusIsAPatternNotAnOption() {
        assertEquals(RegexCli.EXIT_ERROR, run("+x", "x"));
        assertThat(stderr(), containsString("Quantifier '+' has no preceding atom at pos 0"));
    }

    @Test
    public void testCompileError() {
        assertEquals(RegexCli.EXIT_ERROR, run("*abc", "abc"));
        assertThat(stderr(), containsString("Quantifier '*' has no preceding atom at pos 0"));
        assertEquals("", stdout());
    }

    @Test
    public void testUnsupportedToken() {
        assertEquals(RegexCli.EXIT_ERROR, run("a|b", "a"));
        assertThat(stderr(), containsString("Unsupported token '|' at pos 1"));
    }

    @Test
    public void testWrongArgumentCount() {
        assertEquals(RegexCli.EXIT_ERROR, run("abc"));
        assertThat(stderr(), containsString("Expected a pattern and an input, got 1 argument(s)"));
    }

    @Test
    public void testUnknownOption() {
        assertEquals(RegexCli.EXIT_ERROR, run("--frobnicate", "a", "a"));
    }

    @Test
    public void testDump() {
        assertEquals(RegexCli.EXIT_MATCH, run("--dump", "ab*", "abb"));
        assertThat(stdout(), containsString("\"type\" : \"REPEAT\""));
        assertThat(stdout(), containsString("\"pattern\" : \"ab*\""));
    }

    @Test
    public void testPrecomputedClosures() {
        assertEquals(RegexCli.EXIT_MATCH, run("--precompute-closures", "a*b*c", "c"));
        assertEquals(RegexCli.EXIT_NO_MATCH, run("--precompute-closures", "a*b*c", "ca"));
    }

    @Test
    public void testDemo() {
        assertEquals(RegexCli.EXIT_MATCH, run("--demo"));
        String lineSeparator = System.lineSeparator();
        assertEquals("aaaaaa4uhi: true" + lineSeparator + "4uhi: true" + lineSeparator + "meow: false" + lineSeparator,
                stdout());
    }

    @Test
    public void testDemoRejectsArguments() {
        assertEquals(RegexCli.EXIT_ERROR, run("--demo", "a", "a"));
    }

    @Test
    public void testHelp() {
        assertEquals(RegexCli.EXIT_MATCH, run("--help"));
        assertThat(stdout(), containsString("--dump"));
    }

    private int run(String ... args) {
        return new RegexCli().run(args,
                new PrintStream(out, true),
                new PrintStream(err, true));
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }
}
