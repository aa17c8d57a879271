package me.golemcore.zulipbot.domain.command;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArgumentTypeTest {

    @Test
    void shouldKeepStringTokensUnchanged() {
        assertEquals("Hello", ArgumentType.STRING.coerce("Hello"));
    }

    @Test
    void shouldParseIntAsLong() {
        assertEquals(-7L, ArgumentType.INT.coerce("-7"));
        assertEquals(9_000_000_000L, ArgumentType.INT.coerce("9000000000"));
    }

    @Test
    void shouldRejectFractionalInt() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentType.INT.coerce("1.5"));
    }

    @Test
    void shouldParseFloat() {
        assertEquals(2.5, ArgumentType.FLOAT.coerce("2.5"));
        assertEquals(3.0, ArgumentType.FLOAT.coerce("3"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "NaN", "Infinity", "-Infinity", "abc" })
    void shouldRejectNonFiniteFloat(String token) {
        assertThrows(IllegalArgumentException.class, () -> ArgumentType.FLOAT.coerce(token));
    }

    @ParameterizedTest
    @ValueSource(strings = { "1d", "2f", "0x1p3", "1.5D", "1_000", "." })
    void shouldRejectJavaOnlyFloatSyntax(String token) {
        assertThrows(IllegalArgumentException.class, () -> ArgumentType.FLOAT.coerce(token));
    }

    @Test
    void shouldParseScientificAndBareFractionFloats() {
        assertEquals(1000.0, ArgumentType.FLOAT.coerce("1e3"));
        assertEquals(-0.5, ArgumentType.FLOAT.coerce("-.5"));
        assertEquals(4.0, ArgumentType.FLOAT.coerce(" 4. "));
        assertEquals(250.0, ArgumentType.FLOAT.coerce("+2.5E2"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "true", "TRUE", "1", "yes", "y", "On" })
    void shouldParseTruthyBool(String token) {
        assertEquals(Boolean.TRUE, ArgumentType.BOOL.coerce(token));
    }

    @ParameterizedTest
    @ValueSource(strings = { "false", "0", "No", "n", "off" })
    void shouldParseFalsyBool(String token) {
        assertEquals(Boolean.FALSE, ArgumentType.BOOL.coerce(token));
    }

    @Test
    void shouldRejectUnknownBool() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentType.BOOL.coerce("maybe"));
    }
}
