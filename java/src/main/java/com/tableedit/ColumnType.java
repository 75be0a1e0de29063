package com.tableedit;

import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declared type of a column, checked by {@link TableValidator}.
 * <p>
 * Built in: {@link #INTEGER}, {@link #FLOAT}, {@link #BOOLEAN}, {@link #STRING}. Anything
 * else comes through {@link #custom(String, Function)} with a caller-supplied parser
 * that throws on bad input.
 */
public final class ColumnType {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "1", "yes", "ja");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "0", "no", "nein");

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern DECIMAL_PATTERN =
            Pattern.compile("[+-]?([0-9]+([.,][0-9]*)?|[.,][0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern SPECIAL_PATTERN =
            Pattern.compile("([+-]?)(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    /** ASCII digits with an optional sign, 64-bit range. */
    public static final ColumnType INTEGER = new ColumnType("Integer", false, ColumnType::parseInteger);

    /** Plain decimal or exponent notation; accepts a comma as decimal separator, and {@code Inf}/{@code NaN}. */
    public static final ColumnType FLOAT = new ColumnType("Float", false, ColumnType::parseFloat);

    /** {@code true/1/yes/ja} and {@code false/0/no/nein}, any case. */
    public static final ColumnType BOOLEAN = new ColumnType("Boolean", false, ColumnType::parseBoolean);

    /** Always valid, empty included. */
    public static final ColumnType STRING = new ColumnType("String", true, s -> s);

    private final String name;
    private final boolean text;
    private final Function<String, ?> parser;

    private ColumnType(String name, boolean text, Function<String, ?> parser) {
        this.name = name;
        this.text = text;
        this.parser = parser;
    }

    public static ColumnType custom(String name, Function<String, ?> parser) {
        return new ColumnType(name, false, parser);
    }

    /**
     * Resolves a type name as written in an edit profile.
     */
    public static ColumnType named(String typeName) {
        switch (typeName.trim().toLowerCase(Locale.ROOT)) {
            case "integer":
            case "int":
            case "long":
                return INTEGER;
            case "float":
            case "double":
                return FLOAT;
            case "boolean":
            case "bool":
                return BOOLEAN;
            case "string":
            case "text":
                return STRING;
            default:
                throw new IllegalArgumentException("Unknown column type: " + typeName);
        }
    }

    public String name() {
        return name;
    }

    /**
     * Text types accept the empty string as a value; others treat it as absent.
     */
    public boolean isText() {
        return text;
    }

    /**
     * Parses {@code value}, throwing a {@link RuntimeException} if it is not of this type.
     */
    public Object parse(String value) {
        return parser.apply(value);
    }

    public boolean accepts(String value) {
        try {
            parse(value);
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return name;
    }

    private static Long parseInteger(String value) {
        String v = value.strip();
        if (!INTEGER_PATTERN.matcher(v).matches()) {
            throw new NumberFormatException("Not an integer: " + value);
        }
        return Long.parseLong(v);
    }

    private static Double parseFloat(String value) {
        String v = value.strip();
        if (DECIMAL_PATTERN.matcher(v).matches()) {
            return Double.parseDouble(v.replace(',', '.'));
        }
        Matcher special = SPECIAL_PATTERN.matcher(v);
        if (special.matches()) {
            if (special.group(2).equalsIgnoreCase("nan")) {
                return Double.NaN;
            }
            return special.group(1).equals("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        throw new NumberFormatException("Not a float: " + value);
    }

    private static Boolean parseBoolean(String value) {
        String v = value.strip().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(v)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(v)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + value);
    }
}
