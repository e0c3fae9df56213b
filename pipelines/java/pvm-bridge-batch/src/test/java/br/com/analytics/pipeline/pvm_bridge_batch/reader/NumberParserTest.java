package br.com.analytics.pipeline.pvm_bridge_batch.reader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class NumberParserTest {

    @Test
    void parsesPlainDecimal() {
        assertEquals(1234.56, NumberParser.parse("1234.56").getAsDouble(), 1e-9);
    }

    @Test
    void stripsCurrencyAndThousandsSeparators() {
        assertEquals(1234.5, NumberParser.parse("$1,234.50").getAsDouble(), 1e-9);
        assertEquals(99.0, NumberParser.parse("€99").getAsDouble(), 1e-9);
    }

    @Test
    void parenthesesAndMinusAreNegative() {
        assertEquals(-500.0, NumberParser.parse("(500)").getAsDouble(), 1e-9);
        assertEquals(-12.5, NumberParser.parse("-12.5").getAsDouble(), 1e-9);
        assertEquals(-1000.0, NumberParser.parse("($1,000)").getAsDouble(), 1e-9);
    }

    @Test
    void acceptsExponentAndLeadingDot() {
        assertEquals(1500.0, NumberParser.parse("1.5e3").getAsDouble(), 1e-9);
        assertEquals(0.25, NumberParser.parse(".25").getAsDouble(), 1e-9);
    }

    @Test
    void rejectsBlankAndText() {
        assertTrue(NumberParser.parse(null).isEmpty());
        assertTrue(NumberParser.parse("   ").isEmpty());
        assertTrue(NumberParser.parse("n/a").isEmpty());
        assertTrue(NumberParser.parse("12abc").isEmpty());
        assertTrue(NumberParser.parse("--5").isEmpty());
    }
}
