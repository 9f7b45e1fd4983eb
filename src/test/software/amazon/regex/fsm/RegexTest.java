package software.amazon.regex.fsm;

import org.junit.Test;
import software.amazon.regex.fsm.input.ParseException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RegexTest {

    @Test
    public void testSample() {
        assertTrue(Regex.matches("a*4.+hi", "aaaaaa4uhi"));
        assertTrue(Regex.matches("a*4.+hi", "4uhi"));
        assertFalse(Regex.matches("a*4.+hi", "meow"));
    }

    @Test
    public void testBadPattern() {
        try {
            Regex.matches("+x", "x");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals(ParseException.Kind.LEADING_QUANTIFIER, e.getKind());
        }
    }
}
