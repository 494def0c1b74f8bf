// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone.impl;

import static com.amazon.timezone.util.ZoneTextUtils.printCodePointAsString;

import com.amazon.timezone.UnrecognizedTimeZoneException;

/**
 * Recognizes the text form of a fixed-offset time zone.
 * <p>
 * The accepted forms, tried in this order against the whole input:
 * <ul>
 *   <li>{@code Z}</li>
 *   <li>{@code UTC}, optionally followed by a sign and a one- or two-digit
 *       hour: {@code UTC+6}, {@code UTC-12}</li>
 *   <li>a sign and a two-digit hour: {@code +05}</li>
 *   <li>an optional {@code UTC} (only when a sign follows), an optional sign,
 *       a two-digit hour and either {@code :MM} with an optional {@code :SS},
 *       or {@code MM} with no seconds: {@code 15:45:21}, {@code -1330},
 *       {@code UTC+05:30}</li>
 * </ul>
 * Digits are ASCII only and matching is case-sensitive.
 * <p>
 * <b>This class is not for public use.</b>
 */
public final class _Private_FixedOffsetParser
{
    static final String ZULU_IMAGE       = "Z";
    static final String UTC_IMAGE        = "UTC";
    static final int    LEN_OF_UTC_IMAGE = UTC_IMAGE.length();


    private _Private_FixedOffsetParser() { }


    /**
     * Parses a fixed-offset designator.
     *
     * @param text the designator; must not be null.
     *
     * @return the sign, fields, canonical name and total offset of the
     *          designator.
     *
     * @throws UnrecognizedTimeZoneException
     *          if {@code text} is not one of the accepted forms.
     * @throws NullPointerException if {@code text} is null.
     */
    public static ParsedOffset parse(CharSequence text)
    {
        final CharSequence in = text;
        final int length = in.length();

        if (length == 0)
        {
            throw fail(in, "empty designator");
        }

        if (ZULU_IMAGE.contentEquals(in))
        {
            return ParsedOffset.ZULU;
        }

        if (startsWithUtc(in))
        {
            if (length == LEN_OF_UTC_IMAGE)
            {
                return new ParsedOffset(ParsedOffset.Form.UTC, '+', 0, 0, 0);
            }

            char sign = in.charAt(LEN_OF_UTC_IMAGE);
            if (!isSign(sign))
            {
                throw fail(in,
                           "expected \"+\" or \"-\" after \"UTC\", found "
                               + printCodePointAsString(sign));
            }

            // UTC+H and UTC+HH end right after the hour.
            int pos = LEN_OF_UTC_IMAGE + 1;
            int digits = countDigits(in, pos);
            if ((digits == 1 || digits == 2) && pos + digits == length)
            {
                int hour = read_digits(in, pos, digits, "hour");
                return new ParsedOffset(ParsedOffset.Form.UTC_HOUR, sign, hour, 0, 0);
            }

            return readClock(in, pos, sign);
        }

        char first = in.charAt(0);
        if (isSign(first))
        {
            // +HH
            if (length == 3)
            {
                int hour = read_digits(in, 1, 2, "hour");
                return new ParsedOffset(ParsedOffset.Form.SIGNED_HOUR, first, hour, 0, 0);
            }
            return readClock(in, 1, first);
        }

        return readClock(in, 0, '+');
    }


    /**
     * Reads {@code HH:MM}, {@code HH:MM:SS} or {@code HHMM} starting at
     * {@code start}, through the end of the input.
     */
    private static ParsedOffset readClock(CharSequence in, int start, char sign)
    {
        final int length = in.length();
        int pos = start;

        int hour = read_digits(in, pos, 2, "hour");
        pos += 2;

        if (pos >= length)
        {
            throw fail(in, "hour must be followed by minutes");
        }

        if (in.charAt(pos) == ':')
        {
            int minute = read_digits(in, pos + 1, 2, "minutes");
            pos += 3;
            if (pos == length)
            {
                return new ParsedOffset(ParsedOffset.Form.EXTENDED, sign, hour, minute, 0);
            }

            char c = in.charAt(pos);
            if (c != ':')
            {
                throw fail(in,
                           "expected \":\" between minutes and seconds, found "
                               + printCodePointAsString(c));
            }
            int second = read_digits(in, pos + 1, 2, "seconds");
            pos += 3;
            if (pos != length)
            {
                throw fail(in, "invalid excess characters after seconds");
            }
            return new ParsedOffset(ParsedOffset.Form.EXTENDED, sign, hour, minute, second);
        }

        // HHMM never carries seconds.
        int minute = read_digits(in, pos, 2, "minutes");
        pos += 2;
        if (pos != length)
        {
            throw fail(in, "invalid excess characters after minutes");
        }
        return new ParsedOffset(ParsedOffset.Form.BASIC, sign, hour, minute, 0);
    }


    private static int read_digits(CharSequence in, int start, int length,
                                   String field)
    {
        int ii, value = 0;
        int end = start + length;

        if (in.length() < end) {
            throw fail(in,
                       field + " requires " + length + " digits");
        }

        for (ii = start; ii < end; ii++) {
            char c = in.charAt(ii);
            if (!isDigit(c)) {
                throw fail(in,
                           field + " has non-digit character "
                               + printCodePointAsString(c));
            }
            value *= 10;
            value += c - '0';
        }
        return value;
    }

    private static int countDigits(CharSequence in, int start)
    {
        int pos = start;
        while (pos < in.length() && isDigit(in.charAt(pos))) {
            pos++;
        }
        return pos - start;
    }

    private static boolean startsWithUtc(CharSequence in)
    {
        return in.length() >= LEN_OF_UTC_IMAGE
            && UTC_IMAGE.contentEquals(in.subSequence(0, LEN_OF_UTC_IMAGE));
    }

    private static boolean isSign(char c)
    {
        return c == '+' || c == '-';
    }

    // Character.isDigit would admit non-ASCII digits.
    private static boolean isDigit(char c)
    {
        return c >= '0' && c <= '9';
    }

    private static UnrecognizedTimeZoneException fail(CharSequence input,
                                                      String reason)
    {
        return new UnrecognizedTimeZoneException(input, reason);
    }
}
