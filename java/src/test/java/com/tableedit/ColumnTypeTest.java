package com.tableedit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColumnTypeTest {

    @Test
    @DisplayName("integer")
    void integer() {
        assertTrue(ColumnType.INTEGER.accepts("42"));
        assertTrue(ColumnType.INTEGER.accepts("-7"));
        assertFalse(ColumnType.INTEGER.accepts("4.2"));
        assertFalse(ColumnType.INTEGER.accepts("abc"));
        assertEquals(42L, ColumnType.INTEGER.parse("42"));
    }

    @Test
    @DisplayName("float accepts a comma decimal separator")
    void floats() {
        assertTrue(ColumnType.FLOAT.accepts("1.5"));
        assertTrue(ColumnType.FLOAT.accepts("1,5"));
        assertEquals(1.5, ColumnType.FLOAT.parse("1,5"));
        assertFalse(ColumnType.FLOAT.accepts("abc"));
    }

    @Test
    @DisplayName("boolean tokens in English and German, any case")
    void booleans() {
        for (String v : new String[] { "true", "1", "yes", "ja", "TRUE", " Yes " }) {
            assertEquals(Boolean.TRUE, ColumnType.BOOLEAN.parse(v), v);
        }
        for (String v : new String[] { "false", "0", "no", "nein", "Nein" }) {
            assertEquals(Boolean.FALSE, ColumnType.BOOLEAN.parse(v), v);
        }
        assertFalse(ColumnType.BOOLEAN.accepts("maybe"));
    }

    @Test
    @DisplayName("string accepts anything")
    void strings() {
        assertTrue(ColumnType.STRING.accepts(""));
        assertTrue(ColumnType.STRING.isText());
        assertFalse(ColumnType.INTEGER.isText());
    }

    @Test
    @DisplayName("type names from profiles")
    void named() {
        assertSame(ColumnType.INTEGER, ColumnType.named("int"));
        assertSame(ColumnType.INTEGER, ColumnType.named("Integer"));
        assertSame(ColumnType.FLOAT, ColumnType.named("double"));
        assertSame(ColumnType.BOOLEAN, ColumnType.named("bool"));
        assertSame(ColumnType.STRING, ColumnType.named(" text "));
        assertThrows(IllegalArgumentException.class, () -> ColumnType.named("date"));
    }

    @Test
    @DisplayName("integer takes ASCII digits only")
    void integerAsciiOnly() {
        assertTrue(ColumnType.INTEGER.accepts("+5"));
        assertFalse(ColumnType.INTEGER.accepts("\uFF11\uFF12"));
        assertFalse(ColumnType.INTEGER.accepts("\u0661\u0662"));
        assertFalse(ColumnType.INTEGER.accepts("12L"));
        assertFalse(ColumnType.INTEGER.accepts(""));
    }

    @Test
    @DisplayName("float rejects Java literal suffixes and hex notation")
    void floatStrict() {
        for (String v : new String[] { "3d", "1f", "2D", "1.5F", "0x1p3", "1e", "\uFF11.5", "." }) {
            assertFalse(ColumnType.FLOAT.accepts(v), v);
        }
        for (String v : new String[] { "-2.5e3", ".5", "5.", "+1E-2", "3" }) {
            assertTrue(ColumnType.FLOAT.accepts(v), v);
        }
        assertEquals(Double.POSITIVE_INFINITY, ColumnType.FLOAT.parse("Inf"));
        assertEquals(Double.NEGATIVE_INFINITY, ColumnType.FLOAT.parse("-inf"));
        assertTrue(Double.isNaN((Double) ColumnType.FLOAT.parse("NaN")));
    }
}
