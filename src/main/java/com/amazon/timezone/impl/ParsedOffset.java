// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone.impl;

import java.util.Locale;

/**
 * The fields recognized by {@link _Private_FixedOffsetParser}, with the
 * canonical name and total offset derived from them.
 * <p>
 * <b>This class is not for public use.</b>
 */
public final class ParsedOffset
{
    /**
     * Which alternative of the grammar matched.
     */
    public enum Form
    {
        /** {@code Z} */
        ZULU,
        /** {@code UTC} */
        UTC,
        /** {@code UTC+H} or {@code UTC+HH} */
        UTC_HOUR,
        /** {@code +HH} */
        SIGNED_HOUR,
        /** {@code [UTC][+]HH:MM} or {@code [UTC][+]HH:MM:SS} */
        EXTENDED,
        /** {@code [UTC][+]HHMM} */
        BASIC
    }

    static final ParsedOffset ZULU =
        new ParsedOffset(Form.ZULU, '+', 0, 0, 0);

    private static final int SECONDS_PER_MINUTE = 60;
    private static final int SECONDS_PER_HOUR   = 3600;

    private final Form   _form;
    private final char   _sign;
    private final int    _hour;
    private final int    _minute;
    private final int    _second;
    private final String _name;


    ParsedOffset(Form form, char sign, int hour, int minute, int second)
    {
        _form   = form;
        _sign   = sign;
        _hour   = hour;
        _minute = minute;
        _second = second;
        _name   = canonicalName(form, sign, hour, minute, second);
    }

    private static String canonicalName(Form form, char sign,
                                        int hour, int minute, int second)
    {
        if (form == Form.ZULU) {
            return _Private_FixedOffsetParser.ZULU_IMAGE;
        }
        if (hour == 0 && minute == 0 && second == 0) {
            return _Private_FixedOffsetParser.UTC_IMAGE;
        }
        if (second == 0) {
            return String.format(Locale.ROOT, "UTC%c%02d:%02d", sign, hour, minute);
        }
        return String.format(Locale.ROOT, "UTC%c%02d:%02d:%02d", sign, hour, minute, second);
    }


    public Form getForm()
    {
        return _form;
    }

    /**
     * @return {@code '+'} or {@code '-'}; {@code '+'} when the text had
     *          no sign.
     */
    public char getSign()
    {
        return _sign;
    }

    public int getHour()
    {
        return _hour;
    }

    public int getMinute()
    {
        return _minute;
    }

    public int getSecond()
    {
        return _second;
    }

    /**
     * Gets the signed offset from UTC, in seconds.
     */
    public int getTotalSeconds()
    {
        int coefficient = (_sign == '-') ? -1 : 1;
        return coefficient
            * (_hour * SECONDS_PER_HOUR + _minute * SECONDS_PER_MINUTE + _second);
    }

    /**
     * Gets the canonical name: {@code "Z"} for the {@link Form#ZULU} form,
     * {@code "UTC"} for any other zero offset, otherwise
     * {@code UTC±HH:MM} or {@code UTC±HH:MM:SS}.
     */
    public String getName()
    {
        return _name;
    }

    @Override
    public String toString()
    {
        return _form + ":" + _name;
    }
}
