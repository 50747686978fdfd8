package org.lunaform.compiler.frontend.converter;

/**
 * Decodes the content of string literals: quoted strings with their escape sequences and long
 * bracket strings.
 * <p>
 * Numeric escapes ({@code \ddd}, {@code \xXX}) produce the character with that code, and
 * <code>&#92;u{XXXX}</code> produces the code point.
 */
final class StringDecoder {

    private StringDecoder() {
    }

    /**
     * @param literal The literal as written, delimiters included.
     * @return the decoded value.
     * @throws IllegalArgumentException if the literal is malformed.
     */
    static String decodeLiteral(String literal) {
        if (literal.length() >= 2 && literal.charAt(0) == '[') {
            return decodeLongString(literal);
        }
        if (literal.length() < 2) {
            throw new IllegalArgumentException("string literal is too short");
        }
        char quote = literal.charAt(0);
        if ((quote != '"' && quote != '\'') || literal.charAt(literal.length() - 1) != quote) {
            throw new IllegalArgumentException("string literal is not quoted");
        }
        return decodeEscapes(literal.substring(1, literal.length() - 1));
    }

    private static String decodeLongString(String literal) {
        int level = 0;
        int index = 1;
        while (index < literal.length() && literal.charAt(index) == '=') {
            level++;
            index++;
        }
        if (index >= literal.length() || literal.charAt(index) != '[') {
            throw new IllegalArgumentException("invalid long string opening");
        }
        int contentStart = index + 1;
        int contentEnd = literal.length() - level - 2;
        if (contentEnd < contentStart) {
            throw new IllegalArgumentException("invalid long string closing");
        }
        String content = literal.substring(contentStart, contentEnd);
        if (content.startsWith("\r\n")) {
            return content.substring(2);
        }
        if (content.startsWith("\n")) {
            return content.substring(1);
        }
        return content;
    }

    /**
     * @param content Raw content between the delimiters.
     * @return the content with every escape sequence resolved.
     */
    static String decodeEscapes(String content) {
        StringBuilder value = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c != '\\') {
                value.append(c);
                i++;
                continue;
            }
            if (i + 1 >= content.length()) {
                throw new IllegalArgumentException("unfinished escape sequence");
            }
            char escaped = content.charAt(i + 1);
            i += 2;
            switch (escaped) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                case 'a' -> value.append('\u0007');
                case 'b' -> value.append('\b');
                case 'f' -> value.append('\f');
                case 'v' -> value.append('\u000B');
                case '\\', '"', '\'', '`', '{', '}' -> value.append(escaped);
                case '\n' -> {
                    value.append('\n');
                    if (i < content.length() && content.charAt(i) == '\r') {
                        i++;
                    }
                }
                case '\r' -> {
                    value.append('\n');
                    if (i < content.length() && content.charAt(i) == '\n') {
                        i++;
                    }
                }
                case 'z' -> {
                    while (i < content.length() && Character.isWhitespace(content.charAt(i))) {
                        i++;
                    }
                }
                case 'x' -> {
                    if (i + 2 > content.length()) {
                        throw new IllegalArgumentException("hexadecimal escape needs two digits");
                    }
                    value.append((char) Integer.parseInt(content.substring(i, i + 2), 16));
                    i += 2;
                }
                case 'u' -> {
                    int close = content.indexOf('}', i);
                    if (i >= content.length() || content.charAt(i) != '{' || close < 0) {
                        throw new IllegalArgumentException("unicode escape must be written \\u{XXXX}");
                    }
                    int codePoint = Integer.parseInt(content.substring(i + 1, close), 16);
                    if (!Character.isValidCodePoint(codePoint)) {
                        throw new IllegalArgumentException("unicode escape is out of range");
                    }
                    value.appendCodePoint(codePoint);
                    i = close + 1;
                }
                default -> {
                    if (!Character.isDigit(escaped)) {
                        throw new IllegalArgumentException("invalid escape sequence \\" + escaped);
                    }
                    int end = i - 1;
                    while (end < content.length() && end < i + 2 && Character.isDigit(content.charAt(end))) {
                        end++;
                    }
                    int code = Integer.parseInt(content.substring(i - 1, end));
                    if (code > 255) {
                        throw new IllegalArgumentException("decimal escape is too large");
                    }
                    value.append((char) code);
                    i = end;
                }
            }
        }
        return value.toString();
    }
}
