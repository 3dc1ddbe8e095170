package com.challenges.jtree.text;

/**
 * Strips whitespace and comments from JSON text without parsing it.
 * <p>
 * Spaces, tabs, CRs and LFs outside string literals are dropped, as are
 * {@code //} comments up to the end of the line and {@code /* *}{@code /}
 * comments. String literals are copied verbatim, escapes included.
 * An unterminated comment or string simply runs to the end of the input.
 */
public final class JsonMinifier {

    private JsonMinifier() {
    }

    public static String minify(CharSequence json) {
        char[] buffer = json.toString().toCharArray();
        int length = minify(buffer);
        return new String(buffer, 0, length);
    }

    /**
     * Minifies {@code buffer} in place. Input ends at the first NUL char or at
     * the end of the array. A NUL terminator is written after the output if
     * there is room for it.
     *
     * @return the length of the minified text
     */
    public static int minify(char[] buffer) {
        int end = 0;
        while (end < buffer.length && buffer[end] != '\0') {
            end++;
        }

        int in = 0;
        int out = 0;
        while (in < end) {
            char c = buffer[in];
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                in++;
            } else if (c == '/' && in + 1 < end && buffer[in + 1] == '/') {
                while (in < end && buffer[in] != '\n') {
                    in++;
                }
            } else if (c == '/' && in + 1 < end && buffer[in + 1] == '*') {
                in += 2;
                while (in < end && !(buffer[in] == '*' && in + 1 < end && buffer[in + 1] == '/')) {
                    in++;
                }
                in = Math.min(in + 2, end);
            } else if (c == '"') {
                buffer[out++] = buffer[in++];
                while (in < end && buffer[in] != '"') {
                    if (buffer[in] == '\\' && in + 1 < end) {
                        buffer[out++] = buffer[in++];
                    }
                    buffer[out++] = buffer[in++];
                }
                if (in < end) {
                    buffer[out++] = buffer[in++];
                }
            } else {
                buffer[out++] = buffer[in++];
            }
        }

        if (out < buffer.length) {
            buffer[out] = '\0';
        }
        return out;
    }
}
