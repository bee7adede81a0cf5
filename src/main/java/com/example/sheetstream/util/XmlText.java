package com.example.sheetstream.util;

/**
 * Escaping of character data and attribute values for hand-written markup.
 */
public final class XmlText {

    private static final char REPLACEMENT_CHAR = '\uFFFD';

    private XmlText() {
    }

    /**
     * Append {@code text} to {@code out} as XML character data. Markup
     * characters are escaped, carriage returns are written as a character
     * reference so they survive end-of-line normalization, and characters
     * that XML 1.0 does not allow are replaced by U+FFFD.
     */
    public static void appendEscaped(CharSequence text, StringBuilder out) {
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '&':
                    out.append("&amp;");
                    break;
                case '"':
                    out.append("&quot;");
                    break;
                case '\r':
                    out.append("&#xD;");
                    break;
                case '\t':
                case '\n':
                    out.append(c);
                    break;
                default:
                    if (Character.isHighSurrogate(c)) {
                        if (i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1))) {
                            out.append(c).append(text.charAt(++i));
                        } else {
                            out.append(REPLACEMENT_CHAR);
                        }
                    } else if (c < ' ' || Character.isLowSurrogate(c) || c == '\uFFFE' || c == '\uFFFF') {
                        out.append(REPLACEMENT_CHAR);
                    } else {
                        out.append(c);
                    }
                    break;
            }
        }
    }

    public static String escape(CharSequence text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        appendEscaped(text, out);
        return out.toString();
    }
}
