package org.lunaform.compiler.frontend.converter;

import org.lunaform.compiler.api.ConversionErrorKind;
import org.lunaform.compiler.api.ConversionException;
import org.lunaform.compiler.nodes.expressions.BinaryNumber;
import org.lunaform.compiler.nodes.expressions.DecimalNumber;
import org.lunaform.compiler.nodes.expressions.HexNumber;
import org.lunaform.compiler.nodes.expressions.NumberExpression;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class NumberParserTest {

    @Test
    void parsesDecimalNumbers() throws Exception {
        assertThat(((DecimalNumber) NumberParser.parse("42")).getValue()).isEqualTo(42.0);
        assertThat(((DecimalNumber) NumberParser.parse(".5")).getValue()).isEqualTo(0.5);
        assertThat(((DecimalNumber) NumberParser.parse("3.")).getValue()).isEqualTo(3.0);
        assertThat(((DecimalNumber) NumberParser.parse("1_000_000")).getValue()).isEqualTo(1_000_000.0);
    }

    /**
     * The exponent is recorded next to the full value so the literal can be written back.
     */
    @Test
    void keepsTheExponentOfDecimalNumbers() throws Exception {
        // Act
        DecimalNumber number = (DecimalNumber) NumberParser.parse("2.5e-3");

        // Assert
        assertThat(number.getValue()).isEqualTo(0.0025);
        assertThat(number.getExponent()).hasValue(-3);
        assertThat(number.isUppercaseExponent()).isFalse();
    }

    @Test
    void parsesHexadecimalNumbers() throws Exception {
        // Act
        HexNumber lower = (HexNumber) NumberParser.parse("0xff");
        HexNumber upper = (HexNumber) NumberParser.parse("0XA_Bp2");

        // Assert
        assertThat(lower.getValue()).isEqualTo(255L);
        assertThat(lower.isUppercase()).isFalse();
        assertThat(lower.getExponent()).isEmpty();
        assertThat(upper.getValue()).isEqualTo(0xABL);
        assertThat(upper.isUppercase()).isTrue();
        assertThat(upper.getExponent()).hasValue(2);
        assertThat(upper.computeValue()).isEqualTo(0xAB * 4.0);
    }

    @Test
    void parsesBinaryNumbers() throws Exception {
        // Act
        NumberExpression number = NumberParser.parse("0b1111_0000");

        // Assert
        assertThat(number).isInstanceOf(BinaryNumber.class);
        assertThat(((BinaryNumber) number).getValue()).isEqualTo(0xF0L);
    }

    @Test
    void rejectsMalformedLiterals() {
        assertThatThrownBy(() -> NumberParser.parse("0b102"))
                .isInstanceOf(ConversionException.class)
                .hasMessage("unable to convert number from `0b102` (invalid binary number)");
        assertThatThrownBy(() -> NumberParser.parse("0xZZ"))
                .isInstanceOf(ConversionException.class)
                .extracting(e -> ((ConversionException) e).getKind())
                .isEqualTo(ConversionErrorKind.NUMBER);
        assertThatThrownBy(() -> NumberParser.parse("1e"))
                .isInstanceOf(ConversionException.class);
    }
}
