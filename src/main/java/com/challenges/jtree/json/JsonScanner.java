package com.challenges.jtree.json;

/**
 * Low-level token recognizers over in-memory JSON text.
 * <p>
 * The scanner is a cursor: each recognizer starts at {@link #position()} and
 * leaves the cursor just past what it consumed. Reading past the end of the
 * text yields {@link #END}, so recognizers never fail with an index error.
 */
public final class JsonScanner {
    public static final int END = -1;

    private final CharSequence text;
    private int pos;

    public JsonScanner(CharSequence text) {
        this.text = text;
    }

    public int position() {
        return pos;
    }

    public void position(int pos) {
        this.pos = Math.min(pos, text.length());
    }

    public boolean atEnd() {
        return pos >= text.length();
    }

    /**
     * @return NOT a code point!
     */
    public int peek() {
        return charAt(pos);
    }

    int charAt(int index) {
        return index < text.length() ? text.charAt(index) : END;
    }

    public boolean startsWith(String literal) {
        return pos + literal.length() <= text.length()
            && text.subSequence(pos, pos + literal.length()).toString().equals(literal);
    }

    public void advance(int count) {
        position(pos + count);
    }

    /**
     * Skips every char up to and including 0x20, which covers space, tab, CR and LF.
     */
    public void skipWhitespace() {
        while (pos < text.length() && text.charAt(pos) <= ' ') {
            pos++;
        }
    }

    /**
     * Scans a number: optional minus, digits, optional fraction, optional exponent.
     * A single leading zero is skipped; digit runs are not otherwise checked.
     * The value is accumulated in floating point and scaled once at the end.
     */
    public double scanNumber() {
        double n = 0;
        double sign = 1;
        int scale = 0;
        int subscale = 0;
        int signSubscale = 1;

        if (peek() == '-') {
            sign = -1;
            pos++;
        }
        if (peek() == '0') {
            pos++;
        }
        if (peek() >= '1' && peek() <= '9') {
            do {
                n = (n * 10.0) + (text.charAt(pos++) - '0');
            } while (isDigit(peek()));
        }
        if (peek() == '.' && isDigit(charAt(pos + 1))) {
            pos++;
            do {
                n = (n * 10.0) + (text.charAt(pos++) - '0');
                scale--;
            } while (isDigit(peek()));
        }
        if (peek() == 'e' || peek() == 'E') {
            pos++;
            if (peek() == '+') {
                pos++;
            } else if (peek() == '-') {
                signSubscale = -1;
                pos++;
            }
            while (isDigit(peek())) {
                subscale = (subscale * 10) + (text.charAt(pos++) - '0');
            }
        }
        return sign * n * Math.pow(10.0, scale + subscale * signSubscale);
    }

    /**
     * Scans a quoted string and returns its decoded contents, or null if the
     * cursor is not on a quote.
     * <p>
     * Unrecognized escapes yield the escaped char itself. {@code \}{@code u}
     * escapes that name a lone low surrogate, U+0000, or a high surrogate
     * without a following low surrogate escape are dropped. A string with no
     * closing quote ends at the end of the text.
     */
    public String scanString() {
        if (peek() != '"') {
            return null;
        }
        pos++;
        StringBuilder out = new StringBuilder();
        int length = text.length();
        while (pos < length && text.charAt(pos) != '"') {
            char c = text.charAt(pos);
            if (c != '\\') {
                out.append(c);
                pos++;
                continue;
            }
            pos++;
            int escaped = peek();
            switch (escaped) {
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'u' -> appendUnicodeEscape(out);
                case END -> { }
                default -> out.append((char) escaped);
            }
            pos++;
        }
        pos = Math.min(pos, length);
        if (pos < length) {
            pos++; // closing quote
        }
        return out.toString();
    }

    // Cursor is on the 'u'; leaves it on the last char consumed.
    private void appendUnicodeEscape(StringBuilder out) {
        int uc = scanHex4(pos + 1);
        pos += 4;
        if ((uc >= 0xDC00 && uc <= 0xDFFF) || uc == 0) {
            return;
        }
        if (uc >= 0xD800 && uc <= 0xDBFF) {
            if (charAt(pos + 1) != '\\' || charAt(pos + 2) != 'u') {
                return;
            }
            int low = scanHex4(pos + 3);
            pos += 6;
            if (low < 0xDC00 || low > 0xDFFF) {
                return;
            }
            uc = 0x10000 + (((uc & 0x3FF) << 10) | (low & 0x3FF));
        }
        out.appendCodePoint(uc);
    }

    /**
     * Decodes the 4 hex digits starting at {@code index}.
     *
     * @return the value, or 0 if any of the 4 chars is not a hex digit
     */
    public int scanHex4(int index) {
        int h = 0;
        for (int i = index; i < index + 4; i++) {
            int digit = hexValue(charAt(i));
            if (digit < 0) {
                return 0;
            }
            h = (h << 4) + digit;
        }
        return h;
    }

    private static int hexValue(int c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        } else if (c >= 'A' && c <= 'F') {
            return 10 + c - 'A';
        } else if (c >= 'a' && c <= 'f') {
            return 10 + c - 'a';
        } else {
            return -1;
        }
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
