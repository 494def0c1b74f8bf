// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone.util;

/**
 * Utility methods for rendering arbitrary text in diagnostics.
 * <p>
 * Output is always printable ASCII, so rejected input containing control
 * characters or non-Latin text can't garble a log line or terminal.
 */
public final class ZoneTextUtils
{
    private final static String[] ZERO_PADDING =
    {
        "",
        "0",
        "00",
        "000",
        "0000",
        "00000",
        "000000",
        "0000000",
    };


    private ZoneTextUtils() { }


    /**
     * Builds an ASCII-safe, double-quoted rendering of the given text.
     * If the {@code text} is null, this returns {@code "null"}.
     * <p>
     * Unlike a strict string printer, unmatched UTF-16 surrogates are escaped
     * rather than rejected, since this is used while reporting other errors.
     *
     * @param text the text to print; may be {@code null}.
     */
    public static String printString(CharSequence text)
    {
        if (text == null)
        {
            return "null";
        }
        if (text.length() == 0)
        {
            return "\"\"";
        }

        StringBuilder builder = new StringBuilder(text.length() + 2);
        builder.append('"');
        printCodePoints(builder, text);
        builder.append('"');
        return builder.toString();
    }


    /**
     * Builds an ASCII-safe string with double-quotes surrounding a single
     * Unicode code point.
     *
     * @param codePoint a Unicode code point.
     */
    public static String printCodePointAsString(int codePoint)
    {
        StringBuilder builder = new StringBuilder(12);
        builder.append('"');
        printCodePoint(builder, codePoint);
        builder.append('"');
        return builder.toString();
    }


    private static void printCodePoints(StringBuilder out, CharSequence text)
    {
        int len = text.length();
        for (int i = 0; i < len; i++)
        {
            int c = text.charAt(i);

            if (Character.isHighSurrogate((char) c)
                && i + 1 < len
                && Character.isLowSurrogate(text.charAt(i + 1)))
            {
                c = Character.toCodePoint((char) c, text.charAt(i + 1));
                i++;
            }

            // Unmatched surrogates fall through and print as \\uHHHH.
            printCodePoint(out, c);
        }
    }

    private static void printCodePoint(StringBuilder out, int c)
    {
        switch (c) {
            case 0:
                out.append("\\0");
                return;
            case '\t':
                out.append("\\t");
                return;
            case '\n':
                out.append("\\n");
                return;
            case '\r':
                out.append("\\r");
                return;
            case '\f':
                out.append("\\f");
                return;
            case '\u0008':
                out.append("\\b");
                return;
            case '\"':
                out.append("\\\"");
                return;
            case '\\':
                out.append("\\\\");
                return;
            default:
                break;
        }

        if (c < 32) {
            printCodePointAsHexDigits(out, "\\x", 2, c);
        }
        else if (c < 0x7F) {  // Printable ASCII
            out.append((char)c);
        }
        else if (c <= 0xFF) {
            printCodePointAsHexDigits(out, "\\x", 2, c);
        }
        else if (c <= 0xFFFF) {
            printCodePointAsHexDigits(out, "\\u", 4, c);
        }
        else {
            printCodePointAsHexDigits(out, "\\U", 8, c);
        }
    }

    /**
     * Generates a hex escape sequence using lower-case for alphabetics.
     */
    private static void printCodePointAsHexDigits(StringBuilder out,
                                                  String prefix,
                                                  int digits,
                                                  int c)
    {
        String s = Integer.toHexString(c);
        out.append(prefix);
        if (s.length() < digits) {
            out.append(ZERO_PADDING[digits - s.length()]);
        }
        out.append(s);
    }
}
