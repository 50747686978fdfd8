package org.lunaform.compiler.frontend.converter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StringDecoderTest {

    @Test
    void decodesQuotedStrings() {
        assertThat(StringDecoder.decodeLiteral("'it\\'s'")).isEqualTo("it's");
        assertThat(StringDecoder.decodeLiteral("\"a\\\\b\"")).isEqualTo("a\\b");
        assertThat(StringDecoder.decodeLiteral("\"\\a\\b\\f\\v\"")).isEqualTo("\u0007\b\f\u000B");
    }

    @Test
    void decodesNumericEscapes() {
        assertThat(StringDecoder.decodeLiteral("'\\0491'")).isEqualTo("11");
        assertThat(StringDecoder.decodeLiteral("'\\x41\\u{1F600}'")).isEqualTo("A😀");
    }

    @Test
    void decodesEscapedLineBreaksAndSkippedWhitespace() {
        assertThat(StringDecoder.decodeLiteral("'a\\\nb'")).isEqualTo("a\nb");
        assertThat(StringDecoder.decodeLiteral("'a\\z \n\t b'")).isEqualTo("ab");
    }

    /**
     * Long strings are taken verbatim except for a first line break directly after the opening.
     */
    @Test
    void decodesLongStrings() {
        assertThat(StringDecoder.decodeLiteral("[[\nline\\n]]")).isEqualTo("line\\n");
        assertThat(StringDecoder.decodeLiteral("[==[a]]b]==]")).isEqualTo("a]]b");
    }

    @Test
    void rejectsMalformedEscapes() {
        assertThatThrownBy(() -> StringDecoder.decodeLiteral("'\\q'"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("invalid escape sequence \\q");
        assertThatThrownBy(() -> StringDecoder.decodeLiteral("'\\300'"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("decimal escape is too large");
        assertThatThrownBy(() -> StringDecoder.decodeEscapes("\\u0041"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
