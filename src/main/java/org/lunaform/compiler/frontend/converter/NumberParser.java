package org.lunaform.compiler.frontend.converter;

import org.lunaform.compiler.api.ConversionException;
import org.lunaform.compiler.nodes.expressions.BinaryNumber;
import org.lunaform.compiler.nodes.expressions.DecimalNumber;
import org.lunaform.compiler.nodes.expressions.HexNumber;
import org.lunaform.compiler.nodes.expressions.NumberExpression;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses numeric literals with one sub-parser per base. Digit separators ({@code _}) are ignored.
 */
final class NumberParser {

    private static final Pattern DECIMAL = Pattern.compile("(\\d*\\.?\\d*)(?:([eE])([+-]?\\d+))?");
    private static final Pattern HEX = Pattern.compile("0([xX])([0-9a-fA-F]+)(?:[pP]([+-]?\\d+))?");
    private static final Pattern BINARY = Pattern.compile("0([bB])([01]+)");

    private NumberParser() {
    }

    /**
     * @param literal The literal as written in the source.
     * @return the number node, without token.
     * @throws ConversionException if no sub-parser accepts the literal.
     */
    static NumberExpression parse(String literal) throws ConversionException {
        String digits = literal.replace("_", "");
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            char base = Character.toLowerCase(digits.charAt(1));
            if (base == 'x') {
                return parseHex(literal, digits);
            }
            if (base == 'b') {
                return parseBinary(literal, digits);
            }
        }
        return parseDecimal(literal, digits);
    }

    private static NumberExpression parseDecimal(String literal, String digits) throws ConversionException {
        Matcher matcher = DECIMAL.matcher(digits);
        if (!matcher.matches() || matcher.group(1).replace(".", "").isEmpty()) {
            throw ConversionException.number(literal, "invalid decimal number");
        }
        double value;
        try {
            value = Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            throw ConversionException.number(literal, e.getMessage());
        }
        DecimalNumber number = new DecimalNumber(value);
        if (matcher.group(2) != null) {
            number.withExponent(parseExponent(literal, matcher.group(3)), matcher.group(2).equals("E"));
        }
        return number;
    }

    private static NumberExpression parseHex(String literal, String digits) throws ConversionException {
        Matcher matcher = HEX.matcher(digits);
        if (!matcher.matches()) {
            throw ConversionException.number(literal, "invalid hexadecimal number");
        }
        long value;
        try {
            value = Long.parseUnsignedLong(matcher.group(2), 16);
        } catch (NumberFormatException e) {
            throw ConversionException.number(literal, e.getMessage());
        }
        HexNumber number = new HexNumber(value, matcher.group(1).equals("X"));
        if (matcher.group(3) != null) {
            number.withExponent(parseExponent(literal, matcher.group(3)));
        }
        return number;
    }

    private static NumberExpression parseBinary(String literal, String digits) throws ConversionException {
        Matcher matcher = BINARY.matcher(digits);
        if (!matcher.matches()) {
            throw ConversionException.number(literal, "invalid binary number");
        }
        try {
            return new BinaryNumber(Long.parseUnsignedLong(matcher.group(2), 2), matcher.group(1).equals("B"));
        } catch (NumberFormatException e) {
            throw ConversionException.number(literal, e.getMessage());
        }
    }

    private static int parseExponent(String literal, String exponent) throws ConversionException {
        try {
            return Integer.parseInt(exponent);
        } catch (NumberFormatException e) {
            throw ConversionException.number(literal, e.getMessage());
        }
    }
}
